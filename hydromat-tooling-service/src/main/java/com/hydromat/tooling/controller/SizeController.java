package com.hydromat.tooling.controller;

import com.hydromat.tooling.dto.MaterialSizeDto;
import com.hydromat.tooling.dto.MaterialSizeRequest;
import com.hydromat.tooling.dto.ProductVariantDto;
import com.hydromat.tooling.dto.ProductVariantRequest;
import com.hydromat.tooling.exception.ResourceNotFoundException;
import com.hydromat.tooling.security.AccessModeSession;
import com.hydromat.tooling.service.SizeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
@Tag(name = "Sizes", description = "Material blanks and product size variants")
public class SizeController {

    private final SizeService sizeService;
    private final AccessModeSession accessModeSession;

    public SizeController(SizeService sizeService, AccessModeSession accessModeSession) {
        this.sizeService = sizeService;
        this.accessModeSession = accessModeSession;
    }

    @Operation(summary = "List material sizes ordered by width and thickness")
    @GetMapping("/material-sizes")
    public ResponseEntity<List<MaterialSizeDto>> listMaterialSizes() {
        return ResponseEntity.ok(sizeService.getAllMaterialSizes().stream().map(sizeService::toDto).toList());
    }

    @Operation(summary = "Get a material size")
    @GetMapping("/material-sizes/{id}")
    public ResponseEntity<MaterialSizeDto> getMaterialSize(@PathVariable("id") Long id) {
        return ResponseEntity.ok(sizeService.toDto(sizeService.getMaterialSize(id)
                .orElseThrow(() -> new ResourceNotFoundException("Material size", id))));
    }

    @Operation(summary = "Add a material size, or return the existing one with the same dimensions")
    @PostMapping("/material-sizes")
    public ResponseEntity<MaterialSizeDto> addMaterialSize(@RequestBody MaterialSizeRequest request) {
        return ResponseEntity.ok(sizeService.toDto(
                sizeService.addMaterialSize(request, accessModeSession.currentPermissions())));
    }

    @Operation(summary = "List product size variants of a profile")
    @GetMapping("/profiles/{profileId}/variants")
    public ResponseEntity<List<ProductVariantDto>> listVariants(@PathVariable("profileId") Long profileId) {
        return ResponseEntity.ok(sizeService.getVariantsForProfile(profileId).stream().map(sizeService::toDto).toList());
    }

    @Operation(summary = "Default product size variant of a profile")
    @GetMapping("/profiles/{profileId}/variants/default")
    public ResponseEntity<ProductVariantDto> getDefaultVariant(@PathVariable("profileId") Long profileId) {
        return sizeService.getDefaultVariant(profileId)
                .map(variant -> ResponseEntity.ok(sizeService.toDto(variant)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @Operation(summary = "Add a product size variant")
    @PostMapping("/profiles/{profileId}/variants")
    public ResponseEntity<ProductVariantDto> addVariant(@PathVariable("profileId") Long profileId,
                                                        @RequestBody ProductVariantRequest request) {
        return ResponseEntity.ok(sizeService.toDto(
                sizeService.addVariant(profileId, request, accessModeSession.currentPermissions())));
    }

    @Operation(summary = "Update a product size variant")
    @PutMapping("/variants/{id}")
    public ResponseEntity<ProductVariantDto> updateVariant(@PathVariable("id") Long id,
                                                           @RequestBody(required = false) ProductVariantRequest request) {
        return ResponseEntity.ok(sizeService.toDto(
                sizeService.updateVariant(id, request, accessModeSession.currentPermissions())));
    }

    @Operation(summary = "Delete a product size variant")
    @DeleteMapping("/variants/{id}")
    public ResponseEntity<Void> deleteVariant(@PathVariable("id") Long id) {
        sizeService.deleteVariant(id, accessModeSession.currentPermissions());
        return ResponseEntity.noContent().build();
    }
}
