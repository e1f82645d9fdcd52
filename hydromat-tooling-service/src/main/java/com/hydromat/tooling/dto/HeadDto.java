package com.hydromat.tooling.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class HeadDto {
    private final int headNumber;
    private final String name;
    private final String requiredPosition;
}
