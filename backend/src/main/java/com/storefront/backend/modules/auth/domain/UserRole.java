package com.storefront.backend.modules.auth.domain;

public enum UserRole {
    BUYER,
    SELLER;

    public boolean isSeller() {
        return this == SELLER;
    }
}
