package com.storefront.backend.modules.catalog.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

public record ProductResponse(
        UUID id,
        String name,
        String description,
        BigDecimal price,
        String imageUrl,
        int stock,
        boolean active,
        double rating,
        UUID sellerId,
        CategoryResponse category,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
