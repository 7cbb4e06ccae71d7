package com.storefront.backend.modules.catalog.presentation.dto;

import java.math.BigDecimal;
import java.util.UUID;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Partial update; {@code null} leaves a field unchanged. The seller cannot be changed.
 */
public record UpdateProductRequest(
        @Size(max = 100) @Pattern(regexp = "(?s).*\\S.*", message = "must not be blank") String name,
        @Size(max = 500) String description,
        @DecimalMin(value = "0.00", inclusive = false) @Digits(integer = 8, fraction = 2) BigDecimal price,
        @Size(max = 200) String imageUrl,
        @Min(0) Integer stock,
        Boolean active,
        UUID categoryId
) {
}
