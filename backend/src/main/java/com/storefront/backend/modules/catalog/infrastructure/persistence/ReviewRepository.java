package com.storefront.backend.modules.catalog.infrastructure.persistence;

import java.util.UUID;

import com.storefront.backend.modules.catalog.domain.Review;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ReviewRepository extends JpaRepository<Review, UUID> {

    @Query("select r from Review r where r.product.id = :productId and r.active = true")
    Page<Review> findActiveByProductId(@Param("productId") UUID productId, Pageable pageable);
}
