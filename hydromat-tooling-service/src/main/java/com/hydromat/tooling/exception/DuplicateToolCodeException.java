package com.hydromat.tooling.exception;

public class DuplicateToolCodeException extends RuntimeException {

    private final String code;

    public DuplicateToolCodeException(String code) {
        super("Tool with code " + code + " already exists");
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
