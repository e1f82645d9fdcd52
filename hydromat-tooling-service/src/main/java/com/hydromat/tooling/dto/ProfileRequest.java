package com.hydromat.tooling.dto;

import lombok.Getter;
import lombok.Setter;

/**
 * Create/update payload for a profile; on update null fields are left unchanged.
 */
@Getter
@Setter
public class ProfileRequest {
    private String name;
    private String description;
    private Double feedRate;
    private Long materialSizeId;
    private byte[] previewImage;
}
