package com.hydromat.tooling.code;

import com.hydromat.tooling.model.ToolPosition;
import com.hydromat.tooling.model.ToolType;
import lombok.Value;

/**
 * Structural fields read back from a 6-digit tool code.
 * Profile id and set number are not range-checked here.
 */
@Value
public class DecodedToolCode {
    ToolPosition position;
    ToolType toolType;
    int profileId;
    int setNumber;
}
