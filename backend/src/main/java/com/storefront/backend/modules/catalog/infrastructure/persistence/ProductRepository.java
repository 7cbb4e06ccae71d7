package com.storefront.backend.modules.catalog.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.storefront.backend.modules.catalog.domain.Product;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ProductRepository extends JpaRepository<Product, UUID> {

    @Query(value = """
            select p
              from Product p
              join fetch p.category c
             where p.active = true
               and c.active = true
            """,
            countQuery = """
            select count(p)
              from Product p
              join p.category c
             where p.active = true
               and c.active = true
            """)
    Page<Product> findListed(Pageable pageable);

    @Query(value = """
            select p
              from Product p
              join fetch p.category c
             where c.id = :categoryId
               and p.active = true
               and c.active = true
            """,
            countQuery = """
            select count(p)
              from Product p
              join p.category c
             where c.id = :categoryId
               and p.active = true
               and c.active = true
            """)
    Page<Product> findListedByCategory(@Param("categoryId") UUID categoryId, Pageable pageable);

    @Query("""
            select p
              from Product p
              join fetch p.category c
             where p.id = :id
               and p.active = true
               and c.active = true
            """)
    Optional<Product> findListedById(@Param("id") UUID id);

    @Query("select p from Product p join fetch p.category where p.id = :id")
    Optional<Product> findWithCategoryById(@Param("id") UUID id);

    @Query("select case when count(p) > 0 then true else false end from Product p where p.id = :id and p.active = true")
    boolean existsActiveById(@Param("id") UUID id);
}
