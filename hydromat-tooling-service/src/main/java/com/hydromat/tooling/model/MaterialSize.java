package com.hydromat.tooling.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * Blank (raw stock) cross-section catalog entry.
 */
@Setter
@Getter
@Entity
@Table(
        name = "material_sizes",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_material_sizes_dimensions", columnNames = {"width", "thickness"})
        }
)
public class MaterialSize {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(updatable = false, nullable = false)
    private Long id;

    @Column(name = "width", nullable = false)
    private Double width;

    @Column(name = "thickness", nullable = false)
    private Double thickness;

    @Column(name = "name", length = 255)
    private String name;

    @Column(name = "description", length = 4000)
    private String description;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = OffsetDateTime.now();
    }
}
