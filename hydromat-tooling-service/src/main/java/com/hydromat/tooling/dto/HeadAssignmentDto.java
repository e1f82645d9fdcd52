package com.hydromat.tooling.dto;

import lombok.Getter;
import lombok.Setter;

import java.util.List;

/**
 * One head of a profile as shown in the heads grid.
 * {@code positionMismatch} is advisory: the assignment is stored regardless.
 */
@Getter
@Setter
public class HeadAssignmentDto {
    private Long id;
    private Long profileId;
    private Integer headNumber;
    private String headName;
    private String requiredPosition;
    private Long toolId;
    private String toolCode;
    private String toolPosition;
    private boolean positionMismatch;
    private Integer rpm;
    private Double passDepth;
    private String workMaterial;
    private String remarks;
    private List<Integer> alsoAssignedToHeads = List.of();
}
