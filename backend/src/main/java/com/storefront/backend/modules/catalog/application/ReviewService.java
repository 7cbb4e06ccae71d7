package com.storefront.backend.modules.catalog.application;

import java.util.UUID;

import com.storefront.backend.global.common.PageRequests;
import com.storefront.backend.global.common.PageResponse;
import com.storefront.backend.global.error.ProblemException;
import com.storefront.backend.modules.access.application.AccessGuard;
import com.storefront.backend.modules.access.domain.AccessAction;
import com.storefront.backend.modules.access.domain.ResourceType;
import com.storefront.backend.modules.catalog.infrastructure.persistence.ProductRepository;
import com.storefront.backend.modules.catalog.infrastructure.persistence.ReviewRepository;
import com.storefront.backend.modules.catalog.presentation.dto.CatalogDtoMapper;
import com.storefront.backend.modules.catalog.presentation.dto.ReviewResponse;

import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class ReviewService {

    private final ReviewRepository reviewRepository;
    private final ProductRepository productRepository;
    private final AccessGuard accessGuard;

    public ReviewService(
            ReviewRepository reviewRepository,
            ProductRepository productRepository,
            AccessGuard accessGuard
    ) {
        this.reviewRepository = reviewRepository;
        this.productRepository = productRepository;
        this.accessGuard = accessGuard;
    }

    public PageResponse<ReviewResponse> listProductReviews(UUID productId, Integer page, Integer size) {
        accessGuard.require(AccessAction.READ, ResourceType.PRODUCT_REVIEWS);

        if (!productRepository.existsActiveById(productId)) {
            throw new ProblemException(HttpStatus.NOT_FOUND, "PRODUCT_NOT_FOUND");
        }
        return PageResponse.of(
                reviewRepository.findActiveByProductId(
                        productId,
                        PageRequests.of(page, size, Sort.by(Sort.Direction.DESC, "createdAt"))
                ),
                CatalogDtoMapper::toResponse
        );
    }
}
