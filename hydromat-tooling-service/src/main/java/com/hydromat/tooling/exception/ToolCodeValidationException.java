package com.hydromat.tooling.exception;

/**
 * Raised when tool code inputs are out of range. The message names the offending value verbatim.
 */
public class ToolCodeValidationException extends IllegalArgumentException {

    private final String field;
    private final transient Object rejectedValue;

    public ToolCodeValidationException(String field, Object rejectedValue, String message) {
        super(message);
        this.field = field;
        this.rejectedValue = rejectedValue;
    }

    public String getField() {
        return field;
    }

    public Object getRejectedValue() {
        return rejectedValue;
    }
}
