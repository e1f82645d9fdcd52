package com.hydromat.tooling.exception;

public class ToolInUseException extends RuntimeException {

    public ToolInUseException() {
        super("Cannot delete tool: The tool is assigned to a head. Please remove it from the head first.");
    }
}
