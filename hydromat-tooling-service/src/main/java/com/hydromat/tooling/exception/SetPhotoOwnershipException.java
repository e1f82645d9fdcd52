package com.hydromat.tooling.exception;

/**
 * Photo edits are accepted only on the first tool of a set.
 */
public class SetPhotoOwnershipException extends RuntimeException {

    public static final String MESSAGE = "Image can only be updated for the first tool in the set";

    private final String toolCode;

    public SetPhotoOwnershipException(String toolCode) {
        super(MESSAGE);
        this.toolCode = toolCode;
    }

    public String getToolCode() {
        return toolCode;
    }
}
