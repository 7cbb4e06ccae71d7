package com.storefront.backend.modules.access.domain;

public enum DenyReason {
    NOT_AUTHENTICATED,
    NOT_OWNER,
    NOT_SELLER,
    UNSUPPORTED
}
