package com.hydromat.tooling.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Writes inventory and access-mode changes to the application log.
 */
@Component
public class InventoryEventLogger {

    private static final Logger logger = LoggerFactory.getLogger(InventoryEventLogger.class);

    @EventListener
    public void onInventoryEvent(InventoryEvent event) {
        logger.info("Inventory event {} profile={} tool={} head={} code={}",
                event.getType(), event.getProfileId(), event.getToolId(),
                event.getHeadNumber(), event.getToolCode());
    }

    @EventListener
    public void onAccessModeChanged(AccessModeChangedEvent event) {
        logger.info("Access mode changed {} -> {}", event.getPrevious().getKey(), event.getCurrent().getKey());
    }
}
