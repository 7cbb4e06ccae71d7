package com.storefront.backend.modules.catalog.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record ReviewResponse(
        UUID id,
        UUID productId,
        UUID reviewerId,
        String comment,
        int grade,
        OffsetDateTime createdAt
) {
}
