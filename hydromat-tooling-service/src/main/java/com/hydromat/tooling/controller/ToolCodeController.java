package com.hydromat.tooling.controller;

import com.hydromat.tooling.code.DecodedToolCode;
import com.hydromat.tooling.code.ToolCodeGenerator;
import com.hydromat.tooling.dto.ToolCodeRequest;
import com.hydromat.tooling.dto.ToolCodeResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Stateless tool code generation and decoding.
 */
@RestController
@RequestMapping("/api/tool-codes")
@Tag(name = "Tool Codes", description = "Generate and decode 6-digit tool codes")
public class ToolCodeController {

    @Operation(summary = "Generate a tool code")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Code generated"),
            @ApiResponse(responseCode = "400", description = "Profile, position, type or set number rejected")
    })
    @PostMapping("/generate")
    public ResponseEntity<ToolCodeResponse> generate(@Valid @RequestBody ToolCodeRequest request) {
        String code = ToolCodeGenerator.generate(request.getProfileId(), request.getPosition(),
                request.getToolType(), request.getSetNumber());
        return ResponseEntity.ok(toResponse(code, ToolCodeGenerator.decode(code)));
    }

    @Operation(summary = "Decode a tool code")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Code decoded"),
            @ApiResponse(responseCode = "404", description = "Code is not readable")
    })
    @GetMapping("/{code}")
    public ResponseEntity<ToolCodeResponse> decode(@PathVariable("code") String code) {
        DecodedToolCode decoded = ToolCodeGenerator.decode(code);
        if (decoded == null) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(toResponse(code, null));
        }
        return ResponseEntity.ok(toResponse(code, decoded));
    }

    private static ToolCodeResponse toResponse(String code, DecodedToolCode decoded) {
        ToolCodeResponse response = new ToolCodeResponse();
        response.setCode(code);
        response.setValid(decoded != null);
        if (decoded != null) {
            response.setPosition(decoded.getPosition().getLabel());
            response.setToolType(decoded.getToolType().getLabel());
            response.setProfileId(decoded.getProfileId());
            response.setSetNumber(decoded.getSetNumber());
            response.setSetPrefix(ToolCodeGenerator.setPrefix(code));
        }
        return response;
    }
}
