package com.hydromat.tooling.dto;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class MaterialSizeDto {
    private Long id;
    private Double width;
    private Double thickness;
    private String name;
    private String description;
    private String displayName;
}
