package com.hydromat.tooling.exception;

/**
 * Caller supplied an unusable value (head number, RPM, sizes, names, ...).
 */
public class InventoryValidationException extends IllegalArgumentException {

    public InventoryValidationException(String message) {
        super(message);
    }
}
