package com.hydromat.tooling.model;

import java.util.Optional;

/**
 * Cutter kind. The digit is the second character of a tool code.
 */
public enum ToolType {
    STRAIGHT("Straight", '0'),
    PROFILE("Profile", '1');

    private final String label;
    private final char digit;

    ToolType(String label, char digit) {
        this.label = label;
        this.digit = digit;
    }

    public String getLabel() {
        return label;
    }

    public char getDigit() {
        return digit;
    }

    public static Optional<ToolType> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        for (ToolType type : values()) {
            if (type.label.equals(label)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public static Optional<ToolType> fromDigit(char digit) {
        for (ToolType type : values()) {
            if (type.digit == digit) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
