package com.hydromat.tooling.event;

import lombok.Value;

/**
 * Change notification published after inventory writes. Fields not relevant to the
 * {@link Type} are null.
 */
@Value
public class InventoryEvent {

    public enum Type {
        PROFILE_CREATED,
        PROFILE_UPDATED,
        PROFILE_DELETED,
        TOOL_CREATED,
        TOOL_UPDATED,
        TOOL_DELETED,
        TOOL_ASSIGNED,
        ASSIGNMENT_CLEARED
    }

    Type type;
    Long profileId;
    Long toolId;
    Integer headNumber;
    String toolCode;

    public static InventoryEvent profile(Type type, Long profileId) {
        return new InventoryEvent(type, profileId, null, null, null);
    }

    public static InventoryEvent tool(Type type, Long profileId, Long toolId, String toolCode) {
        return new InventoryEvent(type, profileId, toolId, null, toolCode);
    }

    public static InventoryEvent head(Type type, Long profileId, Integer headNumber, Long toolId) {
        return new InventoryEvent(type, profileId, toolId, headNumber, null);
    }
}
