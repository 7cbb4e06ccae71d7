package com.storefront.backend.modules.catalog.presentation;

import java.util.UUID;

import com.storefront.backend.global.common.PageResponse;
import com.storefront.backend.modules.catalog.application.CategoryService;
import com.storefront.backend.modules.catalog.presentation.dto.CategoryResponse;
import com.storefront.backend.modules.catalog.presentation.dto.ProductResponse;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/categories")
public class CategoryController {

    private final CategoryService categoryService;

    public CategoryController(CategoryService categoryService) {
        this.categoryService = categoryService;
    }

    @Operation(summary = "List active categories")
    @GetMapping
    public ResponseEntity<PageResponse<CategoryResponse>> listCategories(
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "size", required = false) Integer size
    ) {
        return ResponseEntity.ok(categoryService.listCategories(page, size));
    }

    @Operation(summary = "List active products in a category")
    @GetMapping("/{categoryId}/products")
    public ResponseEntity<PageResponse<ProductResponse>> listCategoryProducts(
            @PathVariable UUID categoryId,
            @RequestParam(name = "page", required = false) Integer page,
            @RequestParam(name = "size", required = false) Integer size
    ) {
        return ResponseEntity.ok(categoryService.listCategoryProducts(categoryId, page, size));
    }
}
