package com.storefront.backend.modules.catalog.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.storefront.backend.modules.auth.domain.StoreUser;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "review")
public class Review {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "product_id", nullable = false)
    private Product product;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private StoreUser reviewer;

    @Column(name = "comment", length = 500)
    private String comment;

    @Column(name = "grade", nullable = false)
    private int grade;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    public UUID getId() {
        return id;
    }

    public Product getProduct() {
        return product;
    }

    public StoreUser getReviewer() {
        return reviewer;
    }

    public String getComment() {
        return comment;
    }

    public int getGrade() {
        return grade;
    }

    public boolean isActive() {
        return active;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
