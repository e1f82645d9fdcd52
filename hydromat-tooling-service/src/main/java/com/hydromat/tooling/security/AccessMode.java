package com.hydromat.tooling.security;

import java.util.Locale;
import java.util.Optional;

public enum AccessMode {
    READ_ONLY("read_only", "Read Only"),
    FULL_ACCESS("full_access", "Full Access");

    private final String key;
    private final String label;

    AccessMode(String key, String label) {
        this.key = key;
        this.label = label;
    }

    public String getKey() {
        return key;
    }

    public String getLabel() {
        return label;
    }

    public static Optional<AccessMode> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (AccessMode mode : values()) {
            if (mode.key.equals(normalized)) {
                return Optional.of(mode);
            }
        }
        return Optional.empty();
    }
}
