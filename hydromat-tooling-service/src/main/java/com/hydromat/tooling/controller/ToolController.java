package com.hydromat.tooling.controller;

import com.hydromat.tooling.dto.ToolChanges;
import com.hydromat.tooling.dto.ToolDraft;
import com.hydromat.tooling.dto.ToolDto;
import com.hydromat.tooling.exception.ResourceNotFoundException;
import com.hydromat.tooling.model.Tool;
import com.hydromat.tooling.security.AccessModeSession;
import com.hydromat.tooling.service.ToolService;
import com.hydromat.tooling.service.ToolUpdateResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Tool records, tool sets and the shared set photo.
 */
@RestController
@RequestMapping("/api")
@Tag(name = "Tools", description = "Tool inventory and tool-set photos")
public class ToolController {

    private final ToolService toolService;
    private final AccessModeSession accessModeSession;

    public ToolController(ToolService toolService, AccessModeSession accessModeSession) {
        this.toolService = toolService;
        this.accessModeSession = accessModeSession;
    }

    @Operation(summary = "List tools of a profile ordered by code")
    @GetMapping("/profiles/{profileId}/tools")
    public ResponseEntity<List<ToolDto>> listTools(@PathVariable("profileId") Long profileId,
                                                   @RequestParam(value = "position", required = false) String position) {
        List<Tool> tools = position == null
                ? toolService.getToolsByProfile(profileId)
                : toolService.getAvailableToolsForPosition(profileId, position);
        return ResponseEntity.ok(toolService.toDtos(tools));
    }

    @Operation(summary = "List members of a tool set in creation order")
    @GetMapping("/profiles/{profileId}/tool-sets/{setPrefix}")
    public ResponseEntity<List<ToolDto>> listSet(@PathVariable("profileId") Long profileId,
                                                 @PathVariable("setPrefix") String setPrefix) {
        return ResponseEntity.ok(toolService.toDtos(toolService.getToolsInSet(profileId, setPrefix)));
    }

    @Operation(summary = "Get a tool")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Tool returned"),
            @ApiResponse(responseCode = "404", description = "Tool not found")
    })
    @GetMapping("/tools/{id}")
    public ResponseEntity<ToolDto> getTool(@PathVariable("id") Long id) {
        return ResponseEntity.ok(toolService.toDto(requireTool(id)));
    }

    @Operation(summary = "Find a tool by code or template id")
    @GetMapping("/tools")
    public ResponseEntity<?> findTool(@RequestParam(value = "code", required = false) String code,
                                      @RequestParam(value = "templateId", required = false) String templateId) {
        if (code != null) {
            return toolService.getToolByCode(code)
                    .<ResponseEntity<?>>map(tool -> ResponseEntity.ok(toolService.toDto(tool)))
                    .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                            .body(Map.of("error", "Tool not found for code " + code)));
        }
        if (templateId != null) {
            return toolService.getToolByTemplateId(templateId)
                    .<ResponseEntity<?>>map(tool -> ResponseEntity.ok(toolService.toDto(tool)))
                    .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                            .body(Map.of("error", "Tool not found for template " + templateId)));
        }
        return ResponseEntity.badRequest().body(Map.of("error", "Either code or templateId is required"));
    }

    @Operation(summary = "Create a tool")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Tool created"),
            @ApiResponse(responseCode = "400", description = "Invalid code input"),
            @ApiResponse(responseCode = "403", description = "Read Only mode"),
            @ApiResponse(responseCode = "409", description = "Tool code already exists")
    })
    @PostMapping("/tools")
    public ResponseEntity<ToolDto> createTool(@RequestBody ToolDraft draft) {
        Tool tool = toolService.createTool(draft, accessModeSession.currentPermissions());
        return ResponseEntity.status(HttpStatus.CREATED).body(toolService.toDto(tool));
    }

    /**
     * Other field changes are kept even when the photo change is refused; the 409 body then
     * carries the updated tool as well.
     */
    @Operation(summary = "Update a tool")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Tool updated"),
            @ApiResponse(responseCode = "409", description = "Duplicate code, or photo change refused for a non-first set member")
    })
    @PutMapping("/tools/{id}")
    public ResponseEntity<?> updateTool(@PathVariable("id") Long id,
                                        @RequestBody(required = false) ToolChanges changes,
                                        HttpServletRequest request) {
        ToolUpdateResult result = toolService.updateTool(id, changes, accessModeSession.currentPermissions());
        return updateResponse(result, request);
    }

    @Operation(summary = "Delete a tool")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "204", description = "Tool deleted"),
            @ApiResponse(responseCode = "409", description = "Tool is assigned to a head")
    })
    @DeleteMapping("/tools/{id}")
    public ResponseEntity<Void> deleteTool(@PathVariable("id") Long id) {
        toolService.deleteTool(id, accessModeSession.currentPermissions());
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Download the tool photo")
    @GetMapping(value = "/tools/{id}/photo", produces = MediaType.APPLICATION_OCTET_STREAM_VALUE)
    public ResponseEntity<byte[]> getPhoto(@PathVariable("id") Long id) {
        Tool tool = requireTool(id);
        if (tool.getPhoto() == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok().contentType(MediaType.APPLICATION_OCTET_STREAM).body(tool.getPhoto());
    }

    @Operation(summary = "Replace the set photo through its first tool")
    @PutMapping(value = "/tools/{id}/photo", consumes = {MediaType.APPLICATION_OCTET_STREAM_VALUE,
            MediaType.IMAGE_JPEG_VALUE, MediaType.IMAGE_PNG_VALUE, MediaType.IMAGE_GIF_VALUE})
    public ResponseEntity<?> putPhoto(@PathVariable("id") Long id, @RequestBody byte[] photo,
                                      HttpServletRequest request) {
        ToolChanges changes = new ToolChanges();
        changes.setPhoto(photo);
        return updateResponse(toolService.updateTool(id, changes, accessModeSession.currentPermissions()), request);
    }

    @Operation(summary = "Remove the set photo through its first tool")
    @DeleteMapping("/tools/{id}/photo")
    public ResponseEntity<?> deletePhoto(@PathVariable("id") Long id, HttpServletRequest request) {
        ToolChanges changes = new ToolChanges();
        changes.setClearPhoto(Boolean.TRUE);
        return updateResponse(toolService.updateTool(id, changes, accessModeSession.currentPermissions()), request);
    }

    @Operation(summary = "Whether a tool is assigned to any head")
    @GetMapping("/tools/{id}/assigned")
    public ResponseEntity<Map<String, Object>> isAssigned(@PathVariable("id") Long id) {
        requireTool(id);
        return ResponseEntity.ok(Map.of("toolId", id, "assigned", toolService.isToolAssigned(id)));
    }

    private ResponseEntity<?> updateResponse(ToolUpdateResult result, HttpServletRequest request) {
        ToolDto dto = toolService.toDto(result.getTool());
        if (result.isPhotoRejected()) {
            Map<String, Object> body = ApiExceptionAdvice.body(
                    HttpStatus.CONFLICT, "set_photo_owner_only", result.getPhotoRejection(), request);
            body.put("tool", dto);
            return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
        }
        return ResponseEntity.ok(dto);
    }

    private Tool requireTool(Long id) {
        return toolService.getTool(id).orElseThrow(() -> new ResourceNotFoundException("Tool", id));
    }
}
