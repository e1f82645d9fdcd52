package com.hydromat.tooling.dto;

import lombok.Getter;
import lombok.Setter;

import java.util.Map;

@Getter
@Setter
public class ProfileStatisticsDto {
    private Long profileId;
    private long totalTools;
    private Map<String, Long> byPosition;
    private Map<String, Long> byType;
    private long totalKnives;
}
