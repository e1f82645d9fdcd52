package com.hydromat.tooling.service;

import com.hydromat.tooling.dto.AssignmentRequest;
import com.hydromat.tooling.dto.MaterialSizeRequest;
import com.hydromat.tooling.dto.ProductVariantRequest;
import com.hydromat.tooling.dto.ProfileDto;
import com.hydromat.tooling.dto.ProfileRequest;
import com.hydromat.tooling.dto.ProfileStatisticsDto;
import com.hydromat.tooling.dto.ToolDraft;
import com.hydromat.tooling.exception.InventoryValidationException;
import com.hydromat.tooling.exception.ResourceNotFoundException;
import com.hydromat.tooling.model.MaterialSize;
import com.hydromat.tooling.model.Profile;
import com.hydromat.tooling.model.Tool;
import com.hydromat.tooling.repository.MaterialSizeRepository;
import com.hydromat.tooling.repository.ProductSizeVariantRepository;
import com.hydromat.tooling.repository.ProfileRepository;
import com.hydromat.tooling.repository.ToolAssignmentRepository;
import com.hydromat.tooling.repository.ToolRepository;
import com.hydromat.tooling.security.Permissions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class ProfileServiceTest {

    @Autowired
    private ProfileService profileService;

    @Autowired
    private ToolService toolService;

    @Autowired
    private ToolAssignmentService assignmentService;

    @Autowired
    private SizeService sizeService;

    @Autowired
    private ProfileRepository profileRepository;

    @Autowired
    private ToolRepository toolRepository;

    @Autowired
    private ToolAssignmentRepository assignmentRepository;

    @Autowired
    private ProductSizeVariantRepository variantRepository;

    @Autowired
    private MaterialSizeRepository materialSizeRepository;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @AfterEach
    void cleanUp() {
        assignmentRepository.deleteAll();
        toolRepository.deleteAll();
        variantRepository.deleteAll();
        for (Profile profile : profileRepository.findAll()) {
            profileService.deleteProfile(profile.getId(), Permissions.FULL_ACCESS);
        }
        materialSizeRepository.deleteAll();
    }

    @Test
    void create_appliesDefaultFeedRateAndTrimsName() {
        Profile profile = profileService.createProfile(request("  Window sill " + UUID.randomUUID() + "  "),
                Permissions.FULL_ACCESS);

        assertThat(profile.getName()).startsWith("Window sill").doesNotEndWith(" ");
        assertThat(profile.getFeedRate()).isEqualTo(30.0);
        assertThat(profile.getCreatedAt()).isNotNull();
    }

    @Test
    void create_rejectsMissingOrDuplicateName() {
        String name = "Door frame " + UUID.randomUUID();
        profileService.createProfile(request(name), Permissions.FULL_ACCESS);

        assertThatThrownBy(() -> profileService.createProfile(request(name), Permissions.FULL_ACCESS))
                .isInstanceOf(InventoryValidationException.class)
                .hasMessageContaining("already exists");
        assertThatThrownBy(() -> profileService.createProfile(request("   "), Permissions.FULL_ACCESS))
                .isInstanceOf(InventoryValidationException.class)
                .hasMessage("Profile name is required");
    }

    @Test
    void create_requiresExistingMaterialSize() {
        ProfileRequest request = request("Panel " + UUID.randomUUID());
        request.setMaterialSizeId(987654L);

        assertThatThrownBy(() -> profileService.createProfile(request, Permissions.FULL_ACCESS))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void update_keepsOmittedFields() {
        Profile profile = profileService.createProfile(request("Batten " + UUID.randomUUID()), Permissions.FULL_ACCESS);
        ProfileRequest changes = new ProfileRequest();
        changes.setDescription("planed four sides");

        Profile updated = profileService.updateProfile(profile.getId(), changes, Permissions.FULL_ACCESS);

        assertThat(updated.getName()).isEqualTo(profile.getName());
        assertThat(updated.getDescription()).isEqualTo("planed four sides");
        assertThat(updated.getFeedRate()).isEqualTo(30.0);
    }

    @Test
    void toDto_includesLegacySizeStrings() {
        MaterialSizeRequest sizeRequest = new MaterialSizeRequest();
        sizeRequest.setWidth(22.0);
        sizeRequest.setThickness(95.0);
        MaterialSize size = sizeService.addMaterialSize(sizeRequest, Permissions.FULL_ACCESS);
        ProfileRequest request = request("Cladding " + UUID.randomUUID());
        request.setMaterialSizeId(size.getId());
        Profile profile = profileService.createProfile(request, Permissions.FULL_ACCESS);
        ProductVariantRequest variant = new ProductVariantRequest();
        variant.setWidth(90.0);
        variant.setThickness(18.0);
        sizeService.addVariant(profile.getId(), variant, Permissions.FULL_ACCESS);

        ProfileDto dto = profileService.toDto(profile);

        assertThat(dto.getMaterialSizeDisplay()).isEqualTo("22 x 95");
        assertThat(dto.getProductSizesDisplay()).isEqualTo("90 × 18 mm (±0.5)");
        assertThat(dto.isHasPdf()).isFalse();
    }

    @Test
    void statistics_countByPositionTypeAndKnives() {
        Profile profile = profileService.createProfile(request("Moulding " + UUID.randomUUID()), Permissions.FULL_ACCESS);
        createTool(profile, "Top", "Profile", 1, 4);
        createTool(profile, "Top", "Profile", 2, 6);
        createTool(profile, "Left", "Straight", 1, 2);

        ProfileStatisticsDto stats = profileService.getStatistics(profile.getId());

        assertThat(stats.getTotalTools()).isEqualTo(3);
        assertThat(stats.getByPosition()).containsEntry("Top", 2L).containsEntry("Left", 1L).containsEntry("Bottom", 0L);
        assertThat(stats.getByType()).containsEntry("Profile", 2L).containsEntry("Straight", 1L);
        assertThat(stats.getTotalKnives()).isEqualTo(12);
    }

    @Test
    void delete_removesToolsAssignmentsVariantsAndDocument() {
        Profile profile = profileService.createProfile(request("Architrave " + UUID.randomUUID()), Permissions.FULL_ACCESS);
        Tool tool = createTool(profile, "Bottom", "Profile", 1, 6);
        AssignmentRequest assignment = new AssignmentRequest();
        assignment.setToolId(tool.getId());
        assignmentService.assignToolToHead(profile.getId(), 1, assignment, Permissions.FULL_ACCESS);
        ProductVariantRequest variant = new ProductVariantRequest();
        variant.setWidth(68.0);
        sizeService.addVariant(profile.getId(), variant, Permissions.FULL_ACCESS);
        Profile withPdf = profileService.attachDocument(profile.getId(),
                "%PDF-1.4".getBytes(StandardCharsets.US_ASCII), "architrave.pdf", Permissions.FULL_ACCESS);
        Path pdf = Paths.get(withPdf.getPdfPath());
        assertThat(Files.exists(pdf)).isTrue();

        profileService.deleteProfile(profile.getId(), Permissions.FULL_ACCESS);

        assertThat(profileRepository.findById(profile.getId())).isEmpty();
        assertThat(toolRepository.findByProfileIdOrderByCodeAsc(profile.getId())).isEmpty();
        assertThat(assignmentRepository.findByProfileIdOrderByHeadNumberAsc(profile.getId())).isEmpty();
        assertThat(variantRepository.findByProfileIdOrderByIdAsc(profile.getId())).isEmpty();
        assertThat(Files.exists(pdf)).isFalse();
    }

    @Test
    void delete_rolledBackKeepsProfileAndDocument() {
        Profile profile = profileService.createProfile(request("Dado rail " + UUID.randomUUID()), Permissions.FULL_ACCESS);
        Profile withPdf = profileService.attachDocument(profile.getId(),
                "%PDF-1.4 dado".getBytes(StandardCharsets.US_ASCII), "dado.pdf", Permissions.FULL_ACCESS);
        Path pdf = Paths.get(withPdf.getPdfPath());

        new TransactionTemplate(transactionManager).executeWithoutResult(status -> {
            profileService.deleteProfile(profile.getId(), Permissions.FULL_ACCESS);
            status.setRollbackOnly();
        });

        assertThat(profileRepository.findById(profile.getId())).isPresent();
        assertThat(Files.exists(pdf)).isTrue();
        assertThat(profileService.loadDocument(profile.getId())).isPresent();
    }

    @Test
    void document_replacementRolledBackKeepsPreviousFile() {
        Profile profile = profileService.createProfile(request("Quadrant " + UUID.randomUUID()), Permissions.FULL_ACCESS);
        byte[] original = "%PDF-1.4 quadrant".getBytes(StandardCharsets.US_ASCII);
        Path previous = Paths.get(profileService.attachDocument(profile.getId(), original, "quadrant.pdf",
                Permissions.FULL_ACCESS).getPdfPath());

        Path[] written = new Path[1];
        new TransactionTemplate(transactionManager).executeWithoutResult(status -> {
            Profile replaced = profileService.attachDocument(profile.getId(),
                    "%PDF-1.4 revised".getBytes(StandardCharsets.US_ASCII), "revised.pdf", Permissions.FULL_ACCESS);
            written[0] = Paths.get(replaced.getPdfPath());
            status.setRollbackOnly();
        });

        assertThat(Files.exists(previous)).isTrue();
        assertThat(Files.exists(written[0])).isFalse();
        assertThat(profileService.loadDocument(profile.getId())).contains(original);
    }

    @Test
    void document_replacementRemovesPreviousFileAfterCommit() {
        Profile profile = profileService.createProfile(request("Scotia " + UUID.randomUUID()), Permissions.FULL_ACCESS);
        Path previous = Paths.get(profileService.attachDocument(profile.getId(),
                "%PDF-1.4 scotia".getBytes(StandardCharsets.US_ASCII), "scotia.pdf", Permissions.FULL_ACCESS).getPdfPath());

        Path current = Paths.get(profileService.attachDocument(profile.getId(),
                "%PDF-1.4 scotia v2".getBytes(StandardCharsets.US_ASCII), "scotia v2.pdf", Permissions.FULL_ACCESS).getPdfPath());

        assertThat(Files.exists(previous)).isFalse();
        assertThat(Files.exists(current)).isTrue();
    }

    @Test
    void document_attachLoadAndRemove() {
        Profile profile = profileService.createProfile(request("Handrail " + UUID.randomUUID()), Permissions.FULL_ACCESS);
        byte[] content = "%PDF-1.7 handrail".getBytes(StandardCharsets.US_ASCII);

        Profile attached = profileService.attachDocument(profile.getId(), content, "rail drawing.pdf",
                Permissions.FULL_ACCESS);

        assertThat(profileService.toDto(attached).getPdfFileName())
                .isEqualTo(String.format("profile_%04d_rail drawing.pdf", profile.getId()));
        assertThat(profileService.loadDocument(profile.getId())).contains(content);

        profileService.removeDocument(profile.getId(), Permissions.FULL_ACCESS);

        assertThat(profileService.loadDocument(profile.getId())).isEmpty();
        assertThat(profileRepository.findById(profile.getId()).orElseThrow().getPdfPath()).isNull();
    }

    private Tool createTool(Profile profile, String position, String type, int setNumber, int knives) {
        ToolDraft draft = new ToolDraft();
        draft.setProfileId(profile.getId());
        draft.setPosition(position);
        draft.setToolType(type);
        draft.setSetNumber(setNumber);
        draft.setKnivesCount(knives);
        return toolService.createTool(draft, Permissions.FULL_ACCESS);
    }

    private static ProfileRequest request(String name) {
        ProfileRequest request = new ProfileRequest();
        request.setName(name);
        return request;
    }
}
