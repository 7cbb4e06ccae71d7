package com.storefront.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.storefront.backend.modules.auth.domain.StoreUser;
import com.storefront.backend.modules.auth.domain.UserRole;

public record UserProfileResponse(
        UUID id,
        String username,
        String email,
        UserRole role,
        boolean seller,
        boolean active,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public static UserProfileResponse from(StoreUser user) {
        return new UserProfileResponse(
                user.getId(),
                user.getUsername(),
                user.getEmail(),
                user.getRole(),
                user.isSeller(),
                user.isActive(),
                user.getCreatedAt(),
                user.getUpdatedAt()
        );
    }
}
