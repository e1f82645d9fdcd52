package com.hydromat.tooling.dto;

import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

@Getter
@Setter
public class ProfileDto {
    private Long id;
    private String name;
    private String description;
    private Double feedRate;
    private Long materialSizeId;
    private String materialSizeDisplay;
    private String productSizesDisplay;
    private boolean hasPdf;
    private boolean hasPreview;
    private String pdfFileName;
    private OffsetDateTime createdAt;
}
