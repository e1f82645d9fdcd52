package com.hydromat.tooling.model;

import java.util.Locale;
import java.util.Optional;

public enum ToolStatus {
    READY("ready"),
    WORN("worn"),
    IN_SERVICE("in_service");

    private final String key;

    ToolStatus(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static Optional<ToolStatus> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (ToolStatus status : values()) {
            if (status.key.equals(normalized)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
