package com.storefront.backend.modules.catalog.application;

import java.util.UUID;

import com.storefront.backend.global.common.PageRequests;
import com.storefront.backend.global.common.PageResponse;
import com.storefront.backend.global.error.ProblemException;
import com.storefront.backend.modules.access.application.AccessGuard;
import com.storefront.backend.modules.access.domain.AccessAction;
import com.storefront.backend.modules.access.domain.ResourceType;
import com.storefront.backend.modules.auth.application.CurrentUserService;
import com.storefront.backend.modules.auth.domain.StoreUser;
import com.storefront.backend.modules.catalog.domain.Category;
import com.storefront.backend.modules.catalog.domain.Product;
import com.storefront.backend.modules.catalog.infrastructure.persistence.CategoryRepository;
import com.storefront.backend.modules.catalog.infrastructure.persistence.ProductRepository;
import com.storefront.backend.modules.catalog.presentation.dto.CatalogDtoMapper;
import com.storefront.backend.modules.catalog.presentation.dto.CreateProductRequest;
import com.storefront.backend.modules.catalog.presentation.dto.ProductResponse;
import com.storefront.backend.modules.catalog.presentation.dto.UpdateProductRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Product listing for everyone, product writes for sellers.
 *
 * <p>Updates are checked twice: the caller's tier before the product is looked up, and
 * ownership once it is loaded. A buyer or anonymous caller therefore learns nothing about
 * which product ids exist.
 */
@Service
@Transactional
public class ProductService {

    private static final Logger log = LoggerFactory.getLogger(ProductService.class);

    private final ProductRepository productRepository;
    private final CategoryRepository categoryRepository;
    private final CurrentUserService currentUserService;
    private final AccessGuard accessGuard;

    public ProductService(
            ProductRepository productRepository,
            CategoryRepository categoryRepository,
            CurrentUserService currentUserService,
            AccessGuard accessGuard
    ) {
        this.productRepository = productRepository;
        this.categoryRepository = categoryRepository;
        this.currentUserService = currentUserService;
        this.accessGuard = accessGuard;
    }

    @Transactional(readOnly = true)
    public PageResponse<ProductResponse> listProducts(Integer page, Integer size) {
        accessGuard.require(AccessAction.READ, ResourceType.PRODUCT);
        return PageResponse.of(
                productRepository.findListed(PageRequests.of(page, size, Sort.by("name"))),
                CatalogDtoMapper::toResponse
        );
    }

    @Transactional(readOnly = true)
    public ProductResponse getProduct(UUID productId) {
        accessGuard.require(AccessAction.READ, ResourceType.PRODUCT);
        return productRepository.findListedById(productId)
                .map(CatalogDtoMapper::toResponse)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "PRODUCT_NOT_FOUND"));
    }

    public ProductResponse createProduct(CreateProductRequest request) {
        accessGuard.require(AccessAction.CREATE, ResourceType.PRODUCT);

        StoreUser seller = currentUserService.loadActiveUser();
        Category category = loadActiveCategory(request.categoryId());

        Product product = new Product();
        product.setName(request.name().trim());
        product.setDescription(request.description());
        product.setPrice(request.price());
        product.setImageUrl(request.imageUrl());
        product.setStock(request.stock());
        product.setCategory(category);
        product.assignSeller(seller);

        Product saved = productRepository.saveAndFlush(product);
        log.info("Seller {} listed product {}", seller.getId(), saved.getId());
        return CatalogDtoMapper.toResponse(saved);
    }

    public ProductResponse updateProduct(UUID productId, UpdateProductRequest request) {
        accessGuard.requireTier(AccessAction.UPDATE, ResourceType.PRODUCT);
        currentUserService.loadActiveUser();

        Product product = productRepository.findWithCategoryById(productId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "PRODUCT_NOT_FOUND"));
        accessGuard.require(AccessAction.UPDATE, ResourceType.PRODUCT, product);

        if (request.name() != null) {
            product.setName(request.name().trim());
        }
        if (request.description() != null) {
            product.setDescription(request.description());
        }
        if (request.price() != null) {
            product.setPrice(request.price());
        }
        if (request.imageUrl() != null) {
            product.setImageUrl(request.imageUrl());
        }
        if (request.stock() != null) {
            product.setStock(request.stock());
        }
        if (request.active() != null) {
            product.setActive(request.active());
        }
        if (request.categoryId() != null && !request.categoryId().equals(product.getCategory().getId())) {
            product.setCategory(loadActiveCategory(request.categoryId()));
        }

        Product saved = productRepository.saveAndFlush(product);
        log.info("Product {} updated by its seller", saved.getId());
        return CatalogDtoMapper.toResponse(saved);
    }

    private Category loadActiveCategory(UUID categoryId) {
        return categoryRepository.findActiveById(categoryId)
                .orElseThrow(() -> new ProblemException(HttpStatus.NOT_FOUND, "CATEGORY_NOT_FOUND"));
    }
}
