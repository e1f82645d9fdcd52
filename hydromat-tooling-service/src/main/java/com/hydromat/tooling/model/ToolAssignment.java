package com.hydromat.tooling.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * Binds a tool to one spindle head of a profile, with the machining parameters for that head.
 */
@Setter
@Getter
@Entity
@Table(
        name = "tool_assignments",
        uniqueConstraints = {
                @UniqueConstraint(
                        name = "uk_tool_assignments_profile_head",
                        columnNames = {"profile_id", "head_number"}
                )
        },
        indexes = {
                @Index(name = "idx_tool_assignments_profile", columnList = "profile_id"),
                @Index(name = "idx_tool_assignments_tool", columnList = "tool_id")
        }
)
public class ToolAssignment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(updatable = false, nullable = false)
    private Long id;

    @Column(name = "profile_id", nullable = false)
    private Long profileId;

    @Column(name = "tool_id", nullable = false)
    private Long toolId;

    @Column(name = "head_number", nullable = false)
    private Integer headNumber;

    @Column(name = "rpm")
    private Integer rpm;

    @Column(name = "pass_depth")
    private Double passDepth;

    @Column(name = "work_material", length = 255)
    private String workMaterial;

    @Column(name = "remarks", length = 4000)
    private String remarks;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) createdAt = OffsetDateTime.now();
    }
}
