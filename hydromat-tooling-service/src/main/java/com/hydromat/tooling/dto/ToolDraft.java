package com.hydromat.tooling.dto;

import lombok.Getter;
import lombok.Setter;

/**
 * New tool as entered by the operator. Position and type use the labels
 * ("Bottom", "Straight", ...); the photo travels base64-encoded in JSON.
 */
@Getter
@Setter
public class ToolDraft {
    private Long profileId;
    private String position;
    private String toolType;
    private Integer setNumber = 1;
    private Integer knivesCount;
    private String templateId;
    private String status;
    private String notes;
    private byte[] photo;
}
