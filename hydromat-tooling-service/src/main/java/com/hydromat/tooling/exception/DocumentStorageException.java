package com.hydromat.tooling.exception;

/**
 * File-system failure while storing or reading a profile document.
 */
public class DocumentStorageException extends RuntimeException {

    public DocumentStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
