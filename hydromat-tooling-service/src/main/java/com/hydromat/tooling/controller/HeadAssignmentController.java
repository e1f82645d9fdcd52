package com.hydromat.tooling.controller;

import com.hydromat.tooling.dto.AssignmentRequest;
import com.hydromat.tooling.dto.HeadAssignmentDto;
import com.hydromat.tooling.dto.HeadDto;
import com.hydromat.tooling.security.AccessModeSession;
import com.hydromat.tooling.service.HeadPositionTable;
import com.hydromat.tooling.service.ToolAssignmentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Spindle heads and the tools mounted on them per profile.
 */
@RestController
@RequestMapping("/api")
@Tag(name = "Heads", description = "Head layout and tool assignments")
public class HeadAssignmentController {

    private final ToolAssignmentService assignmentService;
    private final HeadPositionTable headPositionTable;
    private final AccessModeSession accessModeSession;

    public HeadAssignmentController(ToolAssignmentService assignmentService,
                                    HeadPositionTable headPositionTable,
                                    AccessModeSession accessModeSession) {
        this.assignmentService = assignmentService;
        this.headPositionTable = headPositionTable;
        this.accessModeSession = accessModeSession;
    }

    @Operation(summary = "List the ten heads with their required tool position")
    @GetMapping("/heads")
    public ResponseEntity<List<HeadDto>> listHeads() {
        return ResponseEntity.ok(headPositionTable.getHeads().values().stream()
                .map(head -> new HeadDto(head.headNumber, head.name, head.requiredPosition.getLabel()))
                .toList());
    }

    @Operation(summary = "List head assignments of a profile")
    @GetMapping("/profiles/{profileId}/heads")
    public ResponseEntity<List<HeadAssignmentDto>> listAssignments(@PathVariable("profileId") Long profileId) {
        return ResponseEntity.ok(assignmentService.getAssignments(profileId));
    }

    @Operation(summary = "Assign a tool to a head, replacing the current one")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Assignment stored; positionMismatch is advisory"),
            @ApiResponse(responseCode = "400", description = "Head, RPM or pass depth out of range"),
            @ApiResponse(responseCode = "404", description = "Profile or tool not found")
    })
    @PutMapping("/profiles/{profileId}/heads/{headNumber}")
    public ResponseEntity<HeadAssignmentDto> assign(@PathVariable("profileId") Long profileId,
                                                    @PathVariable("headNumber") int headNumber,
                                                    @Valid @RequestBody AssignmentRequest request) {
        return ResponseEntity.ok(assignmentService.assignToolToHead(
                profileId, headNumber, request, accessModeSession.currentPermissions()));
    }

    @Operation(summary = "Clear a head")
    @DeleteMapping("/profiles/{profileId}/heads/{headNumber}")
    public ResponseEntity<Void> clear(@PathVariable("profileId") Long profileId,
                                      @PathVariable("headNumber") int headNumber) {
        assignmentService.clearHeadAssignment(profileId, headNumber, accessModeSession.currentPermissions());
        return ResponseEntity.noContent().build();
    }
}
