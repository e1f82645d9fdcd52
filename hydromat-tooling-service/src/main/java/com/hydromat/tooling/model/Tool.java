package com.hydromat.tooling.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * A cutter block registered under a profile. The id doubles as creation order inside a tool set.
 */
@Setter
@Getter
@Entity
@Table(
        name = "tools",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_tools_code", columnNames = {"code"})
        },
        indexes = {
                @Index(name = "idx_tools_profile", columnList = "profile_id"),
                @Index(name = "idx_tools_profile_code", columnList = "profile_id,code"),
                @Index(name = "idx_tools_position", columnList = "position"),
                @Index(name = "idx_tools_type", columnList = "tool_type")
        }
)
public class Tool {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(updatable = false, nullable = false)
    private Long id;

    @Column(name = "profile_id", nullable = false)
    private Long profileId;

    @Enumerated(EnumType.STRING)
    @Column(name = "position", nullable = false, length = 16)
    private ToolPosition position;

    @Enumerated(EnumType.STRING)
    @Column(name = "tool_type", nullable = false, length = 16)
    private ToolType toolType;

    @Column(name = "set_number", nullable = false)
    private Integer setNumber;

    @Column(name = "code", nullable = false, length = 6)
    private String code;

    @Column(name = "knives_count", nullable = false)
    private Integer knivesCount;

    @Column(name = "template_id", length = 128)
    private String templateId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ToolStatus status;

    @Column(name = "notes", length = 4000)
    private String notes;

    @Lob
    @Column(name = "photo")
    private byte[] photo;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    @PrePersist
    void onCreate() {
        OffsetDateTime now = OffsetDateTime.now();
        if (createdAt == null) createdAt = now;
        updatedAt = now;
        if (status == null) status = ToolStatus.READY;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = OffsetDateTime.now();
    }
}
