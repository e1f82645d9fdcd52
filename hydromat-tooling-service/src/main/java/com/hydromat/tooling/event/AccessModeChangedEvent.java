package com.hydromat.tooling.event;

import com.hydromat.tooling.security.AccessMode;
import lombok.Value;

@Value
public class AccessModeChangedEvent {
    AccessMode previous;
    AccessMode current;
}
