package com.storefront.backend.modules.access.domain;

/**
 * What a caller must satisfy for one (resource type, action) pair.
 */
public enum AccessRequirement {

    /** Anyone, including anonymous callers. */
    PUBLIC(false, false, false),

    /** Any authenticated caller acting on their own resource, when one is given. */
    SELF(true, false, false),

    /** An authenticated caller holding the seller capability. */
    SELLER(true, true, false),

    /** A seller who owns the given resource. */
    OWNING_SELLER(true, true, true);

    private final boolean authenticationRequired;
    private final boolean sellerRequired;
    private final boolean ownershipRequired;

    AccessRequirement(boolean authenticationRequired, boolean sellerRequired, boolean ownershipRequired) {
        this.authenticationRequired = authenticationRequired;
        this.sellerRequired = sellerRequired;
        this.ownershipRequired = ownershipRequired;
    }

    public boolean authenticationRequired() {
        return authenticationRequired;
    }

    public boolean sellerRequired() {
        return sellerRequired;
    }

    public boolean ownershipRequired() {
        return ownershipRequired;
    }
}
