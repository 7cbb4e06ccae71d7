package com.storefront.backend.modules.catalog.presentation;

import java.util.UUID;

import com.storefront.backend.global.common.PageResponse;
import com.storefront.backend.modules.catalog.application.ProductService;
import com.storefront.backend.modules.catalog.application.ReviewService;
import com.storefront.backend.modules.catalog.presentation.dto.CreateProductRequest;
import com.storefront.backend.modules.catalog.presentation.dto.ProductResponse;
import com.storefront.backend.modules.catalog.presentation.dto.ReviewResponse;
import com.storefront.backend.modules.catalog.presentation.dto.UpdateProductRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/products")
public class ProductController {

    private final ProductService productService;
    private final ReviewService reviewService;

    public ProductController(ProductService productService, ReviewService reviewService) {
        this.productService = productService;
        this.reviewService = reviewService;
    }

    @Operation(summary = "List active products")
    @GetMapping
    public ResponseEntity<PageResponse<ProductResponse>> listProducts(
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "size", required = false) Integer size
    ) {
        return ResponseEntity.ok(productService.listProducts(page, size));
    }

    @Operation(summary = "Read one active product")
    @GetMapping("/{productId}")
    public ResponseEntity<ProductResponse> getProduct(@PathVariable UUID productId) {
        return ResponseEntity.ok(productService.getProduct(productId));
    }

    @Operation(summary = "List a seller product")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Product created"),
            @ApiResponse(responseCode = "401", description = "`NOT_AUTHENTICATED`"),
            @ApiResponse(responseCode = "403", description = "`NOT_SELLER`")
    })
    @PostMapping
    public ResponseEntity<ProductResponse> createProduct(@Valid @RequestBody CreateProductRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(productService.createProduct(request));
    }

    @Operation(summary = "Update a product owned by the caller")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Product updated"),
            @ApiResponse(responseCode = "403", description = "`NOT_SELLER` or `NOT_OWNER`"),
            @ApiResponse(responseCode = "404", description = "`PRODUCT_NOT_FOUND`")
    })
    @RequestMapping(value = "/{productId}", method = {RequestMethod.PUT, RequestMethod.PATCH})
    public ResponseEntity<ProductResponse> updateProduct(
            @PathVariable UUID productId,
            @Valid @RequestBody UpdateProductRequest request
    ) {
        return ResponseEntity.ok(productService.updateProduct(productId, request));
    }

    @Operation(summary = "List active reviews of a product, newest first")
    @GetMapping("/{productId}/reviews")
    public ResponseEntity<PageResponse<ReviewResponse>> listProductReviews(
            @PathVariable UUID productId,
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "size", required = false) Integer size
    ) {
        return ResponseEntity.ok(reviewService.listProductReviews(productId, page, size));
    }
}
