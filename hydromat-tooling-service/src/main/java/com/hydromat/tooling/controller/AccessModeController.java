package com.hydromat.tooling.controller;

import com.hydromat.tooling.dto.AccessModeDto;
import com.hydromat.tooling.exception.InventoryValidationException;
import com.hydromat.tooling.security.AccessMode;
import com.hydromat.tooling.security.AccessModeSession;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/access-mode")
@Tag(name = "Access Mode", description = "Read Only / Full Access switch of the session")
public class AccessModeController {

    private final AccessModeSession accessModeSession;

    public AccessModeController(AccessModeSession accessModeSession) {
        this.accessModeSession = accessModeSession;
    }

    @Operation(summary = "Current access mode")
    @GetMapping
    public ResponseEntity<AccessModeDto> getMode() {
        return ResponseEntity.ok(toDto(accessModeSession.getMode()));
    }

    @Operation(summary = "Set the access mode (read_only or full_access)")
    @PutMapping
    public ResponseEntity<AccessModeDto> setMode(@RequestBody AccessModeDto request) {
        String key = request != null ? request.getMode() : null;
        AccessMode mode = AccessMode.fromKey(key)
                .orElseThrow(() -> new InventoryValidationException("Unknown access mode: " + key));
        return ResponseEntity.ok(toDto(accessModeSession.setMode(mode)));
    }

    @Operation(summary = "Toggle between Read Only and Full Access")
    @PostMapping("/toggle")
    public ResponseEntity<AccessModeDto> toggle() {
        return ResponseEntity.ok(toDto(accessModeSession.toggle()));
    }

    private static AccessModeDto toDto(AccessMode mode) {
        AccessModeDto dto = new AccessModeDto();
        dto.setMode(mode.getKey());
        dto.setLabel(mode.getLabel());
        dto.setCanEdit(mode == AccessMode.FULL_ACCESS);
        return dto;
    }
}
