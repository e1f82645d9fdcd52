package com.hydromat.tooling.security;

import com.hydromat.tooling.exception.ReadOnlyModeException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Capability passed into every mutating service call. Services check it instead of reading
 * a process-wide mode.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Permissions {

    public static final Permissions READ_ONLY = new Permissions(AccessMode.READ_ONLY);
    public static final Permissions FULL_ACCESS = new Permissions(AccessMode.FULL_ACCESS);

    private final AccessMode mode;

    private Permissions(AccessMode mode) {
        this.mode = mode;
    }

    public static Permissions of(AccessMode mode) {
        return mode == AccessMode.FULL_ACCESS ? FULL_ACCESS : READ_ONLY;
    }

    public boolean canEdit() {
        return mode == AccessMode.FULL_ACCESS;
    }

    /**
     * @throws ReadOnlyModeException when editing is not allowed
     */
    public void requireEdit() {
        if (!canEdit()) {
            throw new ReadOnlyModeException();
        }
    }
}
