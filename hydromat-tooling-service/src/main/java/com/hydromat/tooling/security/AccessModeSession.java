package com.hydromat.tooling.security;

import com.hydromat.tooling.event.AccessModeChangedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Access mode of the single interactive session served by this process.
 * Controllers read it and hand a {@link Permissions} value to the services.
 */
@Component
public class AccessModeSession {

    private static final Logger logger = LoggerFactory.getLogger(AccessModeSession.class);

    private final ApplicationEventPublisher eventPublisher;
    private final Object modeLock = new Object();
    private volatile AccessMode mode;

    public AccessModeSession(ApplicationEventPublisher eventPublisher,
                             @Value("${app.security.default-mode:read_only}") String defaultMode) {
        this.eventPublisher = eventPublisher;
        this.mode = AccessMode.fromKey(defaultMode).orElseGet(() -> {
            logger.warn("Unknown app.security.default-mode '{}', starting in Read Only mode", defaultMode);
            return AccessMode.READ_ONLY;
        });
        logger.info("Security mode initialized as: {}", mode.getLabel());
    }

    public AccessMode getMode() {
        return mode;
    }

    public Permissions currentPermissions() {
        return Permissions.of(mode);
    }

    /**
     * Switches mode and notifies listeners when it actually changed.
     */
    public AccessMode setMode(AccessMode newMode) {
        AccessMode previous;
        synchronized (modeLock) {
            previous = mode;
            mode = newMode;
        }
        if (previous != newMode) {
            logger.info("Switched to {} mode", newMode.getLabel());
            eventPublisher.publishEvent(new AccessModeChangedEvent(previous, newMode));
        }
        return newMode;
    }

    public AccessMode toggle() {
        synchronized (modeLock) {
            return setMode(mode == AccessMode.READ_ONLY ? AccessMode.FULL_ACCESS : AccessMode.READ_ONLY);
        }
    }
}
