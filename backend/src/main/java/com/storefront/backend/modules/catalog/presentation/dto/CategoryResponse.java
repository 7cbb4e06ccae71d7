package com.storefront.backend.modules.catalog.presentation.dto;

import java.util.UUID;

public record CategoryResponse(
        UUID id,
        String name,
        UUID parentId,
        boolean active
) {
}
