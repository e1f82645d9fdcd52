package com.hydromat.tooling.dto;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class AccessModeDto {
    private String mode;
    private String label;
    private boolean canEdit;
}
