package com.hydromat.tooling.service;

import com.hydromat.tooling.exception.InventoryValidationException;
import com.hydromat.tooling.model.ToolPosition;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fixed layout of the ten spindle heads: which tool position each head takes.
 */
@Service
public class HeadPositionTable {

    public static final int FIRST_HEAD = 1;
    public static final int LAST_HEAD = 10;

    private final Map<Integer, HeadInfo> heads = new LinkedHashMap<>();

    public HeadPositionTable() {
        // Heads numbered along the feed direction; display name is "<station> <side>"
        addHead(1, ToolPosition.BOTTOM, "1 Bottom");
        addHead(2, ToolPosition.TOP, "1 Top");
        addHead(3, ToolPosition.RIGHT, "1 Right");
        addHead(4, ToolPosition.LEFT, "1 Left");
        addHead(5, ToolPosition.RIGHT, "2 Right");
        addHead(6, ToolPosition.LEFT, "2 Left");
        addHead(7, ToolPosition.TOP, "2 Top");
        addHead(8, ToolPosition.BOTTOM, "2 Bottom");
        addHead(9, ToolPosition.TOP, "3 Top");
        addHead(10, ToolPosition.BOTTOM, "3 Bottom");
    }

    private void addHead(int headNumber, ToolPosition requiredPosition, String name) {
        heads.put(headNumber, new HeadInfo(headNumber, requiredPosition, name));
    }

    /**
     * @throws InventoryValidationException for heads outside 1..10
     */
    public ToolPosition getRequiredPositionForHead(int headNumber) {
        return requireHead(headNumber).requiredPosition;
    }

    public String getHeadName(int headNumber) {
        return requireHead(headNumber).name;
    }

    /**
     * Advisory check; a mismatching tool may still be assigned.
     */
    public boolean matchesRequiredPosition(int headNumber, ToolPosition position) {
        return requireHead(headNumber).requiredPosition == position;
    }

    public Map<Integer, HeadInfo> getHeads() {
        return Collections.unmodifiableMap(heads);
    }

    public HeadInfo requireHead(int headNumber) {
        HeadInfo info = heads.get(headNumber);
        if (info == null) {
            throw new InventoryValidationException(
                    "Head number must be " + FIRST_HEAD + "-" + LAST_HEAD + ", got " + headNumber);
        }
        return info;
    }

    public static class HeadInfo {
        public final int headNumber;
        public final ToolPosition requiredPosition;
        public final String name;

        public HeadInfo(int headNumber, ToolPosition requiredPosition, String name) {
            this.headNumber = headNumber;
            this.requiredPosition = requiredPosition;
            this.name = name;
        }
    }
}
