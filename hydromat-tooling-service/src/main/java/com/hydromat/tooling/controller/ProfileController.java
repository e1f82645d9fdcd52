package com.hydromat.tooling.controller;

import com.hydromat.tooling.dto.ProfileDto;
import com.hydromat.tooling.dto.ProfileRequest;
import com.hydromat.tooling.dto.ProfileStatisticsDto;
import com.hydromat.tooling.exception.ResourceNotFoundException;
import com.hydromat.tooling.model.Profile;
import com.hydromat.tooling.security.AccessModeSession;
import com.hydromat.tooling.service.ProfileService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;

@RestController
@RequestMapping("/api/profiles")
@Tag(name = "Profiles", description = "Machining profiles and their PDF documentation")
public class ProfileController {

    private final ProfileService profileService;
    private final AccessModeSession accessModeSession;

    public ProfileController(ProfileService profileService, AccessModeSession accessModeSession) {
        this.profileService = profileService;
        this.accessModeSession = accessModeSession;
    }

    @Operation(summary = "List profiles ordered by name")
    @GetMapping
    public ResponseEntity<List<ProfileDto>> listProfiles() {
        return ResponseEntity.ok(profileService.getAllProfiles().stream().map(profileService::toDto).toList());
    }

    @Operation(summary = "Get a profile")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Profile returned"),
            @ApiResponse(responseCode = "404", description = "Profile not found")
    })
    @GetMapping("/{id}")
    public ResponseEntity<ProfileDto> getProfile(@PathVariable("id") Long id) {
        Profile profile = profileService.getProfile(id)
                .orElseThrow(() -> new ResourceNotFoundException("Profile", id));
        return ResponseEntity.ok(profileService.toDto(profile));
    }

    @Operation(summary = "Create a profile")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Profile created"),
            @ApiResponse(responseCode = "400", description = "Name missing or already used"),
            @ApiResponse(responseCode = "403", description = "Read Only mode")
    })
    @PostMapping
    public ResponseEntity<ProfileDto> createProfile(@RequestBody ProfileRequest request) {
        Profile profile = profileService.createProfile(request, accessModeSession.currentPermissions());
        return ResponseEntity.status(HttpStatus.CREATED).body(profileService.toDto(profile));
    }

    @Operation(summary = "Update a profile; omitted fields are kept")
    @PutMapping("/{id}")
    public ResponseEntity<ProfileDto> updateProfile(@PathVariable("id") Long id,
                                                    @RequestBody(required = false) ProfileRequest request) {
        Profile profile = profileService.updateProfile(id, request, accessModeSession.currentPermissions());
        return ResponseEntity.ok(profileService.toDto(profile));
    }

    @Operation(summary = "Delete a profile with its tools, head assignments and product sizes")
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteProfile(@PathVariable("id") Long id) {
        profileService.deleteProfile(id, accessModeSession.currentPermissions());
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Tool counts of a profile")
    @GetMapping("/{id}/statistics")
    public ResponseEntity<ProfileStatisticsDto> getStatistics(@PathVariable("id") Long id) {
        return ResponseEntity.ok(profileService.getStatistics(id));
    }

    @Operation(summary = "Download the profile PDF")
    @GetMapping(value = "/{id}/document", produces = MediaType.APPLICATION_PDF_VALUE)
    public ResponseEntity<byte[]> getDocument(@PathVariable("id") Long id) {
        return profileService.loadDocument(id)
                .map(bytes -> ResponseEntity.ok()
                        .contentType(MediaType.APPLICATION_PDF)
                        .header(HttpHeaders.CONTENT_DISPOSITION, "inline")
                        .body(bytes))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @Operation(summary = "Attach or replace the profile PDF")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Document stored"),
            @ApiResponse(responseCode = "400", description = "Empty document")
    })
    @PutMapping(value = "/{id}/document", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ProfileDto> putDocument(@PathVariable("id") Long id,
                                                  @RequestParam("file") MultipartFile file) throws IOException {
        Profile profile = profileService.attachDocument(id, file.getBytes(), file.getOriginalFilename(),
                accessModeSession.currentPermissions());
        return ResponseEntity.ok(profileService.toDto(profile));
    }

    @Operation(summary = "Remove the profile PDF and preview")
    @DeleteMapping("/{id}/document")
    public ResponseEntity<ProfileDto> deleteDocument(@PathVariable("id") Long id) {
        Profile profile = profileService.removeDocument(id, accessModeSession.currentPermissions());
        return ResponseEntity.ok(profileService.toDto(profile));
    }
}
