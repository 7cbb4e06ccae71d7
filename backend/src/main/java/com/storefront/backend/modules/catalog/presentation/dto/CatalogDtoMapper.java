package com.storefront.backend.modules.catalog.presentation.dto;

import com.storefront.backend.modules.catalog.domain.Category;
import com.storefront.backend.modules.catalog.domain.Product;
import com.storefront.backend.modules.catalog.domain.Review;

public final class CatalogDtoMapper {

    private CatalogDtoMapper() {
    }

    public static CategoryResponse toResponse(Category category) {
        return new CategoryResponse(
                category.getId(),
                category.getName(),
                category.getParentId(),
                category.isActive()
        );
    }

    public static ProductResponse toResponse(Product product) {
        return new ProductResponse(
                product.getId(),
                product.getName(),
                product.getDescription(),
                product.getPrice(),
                product.getImageUrl(),
                product.getStock(),
                product.isActive(),
                product.getRating(),
                product.ownerId(),
                toResponse(product.getCategory()),
                product.getCreatedAt(),
                product.getUpdatedAt()
        );
    }

    public static ReviewResponse toResponse(Review review) {
        return new ReviewResponse(
                review.getId(),
                review.getProduct().getId(),
                review.getReviewer().getId(),
                review.getComment(),
                review.getGrade(),
                review.getCreatedAt()
        );
    }
}
