package com.hydromat.tooling.dto;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class ToolCodeResponse {
    private String code;
    private boolean valid;
    private String position;
    private String toolType;
    private Integer profileId;
    private Integer setNumber;
    private String setPrefix;
}
