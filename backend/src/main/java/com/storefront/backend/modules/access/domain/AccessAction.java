package com.storefront.backend.modules.access.domain;

public enum AccessAction {
    READ,
    CREATE,
    UPDATE,
    DELETE
}
