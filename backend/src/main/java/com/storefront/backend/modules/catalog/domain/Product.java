package com.storefront.backend.modules.catalog.domain;

import java.math.BigDecimal;
import java.util.UUID;

import com.storefront.backend.global.jpa.AbstractTimestampedEntity;
import com.storefront.backend.modules.access.domain.OwnedResource;
import com.storefront.backend.modules.auth.domain.StoreUser;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * A product listed by one seller in one category. The seller is fixed once assigned.
 */
@Entity
@Table(name = "product")
public class Product extends AbstractTimestampedEntity implements OwnedResource {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "description", length = 500)
    private String description;

    @Column(name = "price", nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Column(name = "image_url", length = 200)
    private String imageUrl;

    @Column(name = "stock", nullable = false)
    private int stock;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Column(name = "rating", nullable = false)
    private double rating;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "category_id", nullable = false)
    private Category category;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "seller_id", nullable = false, updatable = false)
    private StoreUser seller;

    public UUID getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public void setPrice(BigDecimal price) {
        this.price = price;
    }

    public String getImageUrl() {
        return imageUrl;
    }

    public void setImageUrl(String imageUrl) {
        this.imageUrl = imageUrl;
    }

    public int getStock() {
        return stock;
    }

    public void setStock(int stock) {
        this.stock = stock;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public double getRating() {
        return rating;
    }

    public Category getCategory() {
        return category;
    }

    public void setCategory(Category category) {
        this.category = category;
    }

    public StoreUser getSeller() {
        return seller;
    }

    /**
     * Assigns the owning seller. Ownership never moves to another seller afterwards.
     */
    public void assignSeller(StoreUser seller) {
        if (this.seller != null && !this.seller.getId().equals(seller.getId())) {
            throw new IllegalStateException("product seller is immutable");
        }
        this.seller = seller;
    }

    @Override
    public UUID ownerId() {
        return seller != null ? seller.getId() : null;
    }
}
