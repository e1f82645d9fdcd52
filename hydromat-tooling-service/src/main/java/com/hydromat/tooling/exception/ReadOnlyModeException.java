package com.hydromat.tooling.exception;

public class ReadOnlyModeException extends RuntimeException {

    public ReadOnlyModeException() {
        super("This operation is not available in Read Only mode.");
    }
}
