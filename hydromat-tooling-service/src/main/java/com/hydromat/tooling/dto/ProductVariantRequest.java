package com.hydromat.tooling.dto;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class ProductVariantRequest {
    private Double width;
    private Double thickness;
    private Double tolerance;
    private Long materialSizeId;
    private Boolean defaultVariant;
    private String notes;
}
