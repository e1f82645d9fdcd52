package com.hydromat.tooling.model;

import java.util.Optional;

/**
 * Mounting side of a tool on the moulder. The digit is the first character of a tool code.
 */
public enum ToolPosition {
    BOTTOM("Bottom", '1'),
    TOP("Top", '2'),
    RIGHT("Right", '3'),
    LEFT("Left", '4');

    private final String label;
    private final char digit;

    ToolPosition(String label, char digit) {
        this.label = label;
        this.digit = digit;
    }

    public String getLabel() {
        return label;
    }

    public char getDigit() {
        return digit;
    }

    /**
     * Exact, case-sensitive label match.
     */
    public static Optional<ToolPosition> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        for (ToolPosition position : values()) {
            if (position.label.equals(label)) {
                return Optional.of(position);
            }
        }
        return Optional.empty();
    }

    public static Optional<ToolPosition> fromDigit(char digit) {
        for (ToolPosition position : values()) {
            if (position.digit == digit) {
                return Optional.of(position);
            }
        }
        return Optional.empty();
    }
}
