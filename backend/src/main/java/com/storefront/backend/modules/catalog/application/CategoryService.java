package com.storefront.backend.modules.catalog.application;

import java.util.UUID;

import com.storefront.backend.global.common.PageRequests;
import com.storefront.backend.global.common.PageResponse;
import com.storefront.backend.global.error.ProblemException;
import com.storefront.backend.modules.access.application.AccessGuard;
import com.storefront.backend.modules.access.domain.AccessAction;
import com.storefront.backend.modules.access.domain.ResourceType;
import com.storefront.backend.modules.catalog.domain.Product;
import com.storefront.backend.modules.catalog.infrastructure.persistence.CategoryRepository;
import com.storefront.backend.modules.catalog.infrastructure.persistence.ProductRepository;
import com.storefront.backend.modules.catalog.presentation.dto.CatalogDtoMapper;
import com.storefront.backend.modules.catalog.presentation.dto.CategoryResponse;
import com.storefront.backend.modules.catalog.presentation.dto.ProductResponse;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class CategoryService {

    private final CategoryRepository categoryRepository;
    private final ProductRepository productRepository;
    private final AccessGuard accessGuard;

    public CategoryService(
            CategoryRepository categoryRepository,
            ProductRepository productRepository,
            AccessGuard accessGuard
    ) {
        this.categoryRepository = categoryRepository;
        this.productRepository = productRepository;
        this.accessGuard = accessGuard;
    }

    public PageResponse<CategoryResponse> listCategories(Integer page, Integer size) {
        accessGuard.require(AccessAction.READ, ResourceType.CATEGORY);
        return PageResponse.of(
                categoryRepository.findActive(PageRequests.of(page, size, Sort.by("name"))),
                CatalogDtoMapper::toResponse
        );
    }

    public PageResponse<ProductResponse> listCategoryProducts(UUID categoryId, Integer page, Integer size) {
        accessGuard.require(AccessAction.READ, ResourceType.CATEGORY_PRODUCTS);

        Page<Product> products = productRepository.findListedByCategory(
                categoryId,
                PageRequests.of(page, size, Sort.by("name"))
        );
        // An empty page is ambiguous: distinguish a missing category from one without listings
        if (products.isEmpty() && categoryRepository.findActiveById(categoryId).isEmpty()) {
            throw new ProblemException(HttpStatus.NOT_FOUND, "CATEGORY_NOT_FOUND");
        }
        return PageResponse.of(products, CatalogDtoMapper::toResponse);
    }
}
