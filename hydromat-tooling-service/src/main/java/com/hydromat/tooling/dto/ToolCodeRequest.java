package com.hydromat.tooling.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

/**
 * Inputs for generating a tool code. Range checks are left to the generator so the
 * operator sees its exact messages.
 */
@Getter
@Setter
public class ToolCodeRequest {
    @NotNull
    private Integer profileId;
    private String position;
    private String toolType;
    @NotNull
    private Integer setNumber;
}
