package com.hydromat.tooling.dto;

import lombok.Getter;
import lombok.Setter;

/**
 * Partial tool update; null fields are left unchanged.
 * A photo change is a non-null {@code photo} or {@code clearPhoto = true}.
 */
@Getter
@Setter
public class ToolChanges {
    private Long profileId;
    private String position;
    private String toolType;
    private Integer setNumber;
    private Integer knivesCount;
    private String templateId;
    private String status;
    private String notes;
    private byte[] photo;
    private Boolean clearPhoto;
}
