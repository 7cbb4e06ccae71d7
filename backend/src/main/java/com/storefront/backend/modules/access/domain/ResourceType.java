package com.storefront.backend.modules.access.domain;

/**
 * Resource kinds guarded by the access policy.
 */
public enum ResourceType {
    CATEGORY,
    CATEGORY_PRODUCTS,
    PRODUCT,
    PRODUCT_REVIEWS,
    USER,
    SESSION
}
