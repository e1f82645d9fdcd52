package com.hydromat.tooling.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * Finished product dimensions a profile can be run at.
 */
@Setter
@Getter
@Entity
@Table(
        name = "product_size_variants",
        indexes = {
                @Index(name = "idx_product_size_variants_profile", columnList = "profile_id")
        }
)
public class ProductSizeVariant {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(updatable = false, nullable = false)
    private Long id;

    @Column(name = "profile_id", nullable = false)
    private Long profileId;

    @Column(name = "width", nullable = false)
    private Double width;

    @Column(name = "thickness")
    private Double thickness;

    @Column(name = "tolerance", nullable = false)
    private Double tolerance;

    @Column(name = "material_size_id")
    private Long materialSizeId;

    @Column(name = "is_default", nullable = false)
    private boolean defaultVariant;

    @Column(name = "notes", length = 4000)
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = OffsetDateTime.now();
        if (tolerance == null) tolerance = 0.5;
    }
}
