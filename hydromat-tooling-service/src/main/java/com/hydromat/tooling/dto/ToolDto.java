package com.hydromat.tooling.dto;

import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

@Getter
@Setter
public class ToolDto {
    private Long id;
    private Long profileId;
    private String code;
    private String position;
    private String toolType;
    private Integer setNumber;
    private Integer knivesCount;
    private String templateId;
    private String status;
    private String notes;
    private boolean hasPhoto;
    private boolean firstInSet;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
}
