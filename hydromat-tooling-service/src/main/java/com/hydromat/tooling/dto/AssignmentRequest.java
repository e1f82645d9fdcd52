package com.hydromat.tooling.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class AssignmentRequest {
    @NotNull
    private Long toolId;
    private Integer rpm;
    private Double passDepth;
    private String workMaterial;
    private String remarks;
}
