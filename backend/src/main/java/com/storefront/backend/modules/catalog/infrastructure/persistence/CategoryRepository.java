package com.storefront.backend.modules.catalog.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.storefront.backend.modules.catalog.domain.Category;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CategoryRepository extends JpaRepository<Category, UUID> {

    @Query(value = "select c from Category c left join fetch c.parent where c.active = true",
            countQuery = "select count(c) from Category c where c.active = true")
    Page<Category> findActive(Pageable pageable);

    @Query("select c from Category c where c.id = :id and c.active = true")
    Optional<Category> findActiveById(@Param("id") UUID id);
}
