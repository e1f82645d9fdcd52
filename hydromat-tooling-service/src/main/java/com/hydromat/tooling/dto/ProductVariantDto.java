package com.hydromat.tooling.dto;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class ProductVariantDto {
    private Long id;
    private Long profileId;
    private Double width;
    private Double thickness;
    private Double tolerance;
    private Long materialSizeId;
    private boolean defaultVariant;
    private String notes;
    private String displayName;
}
