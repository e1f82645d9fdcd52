package com.hydromat.tooling.service;

import com.hydromat.tooling.dto.LegacySizeFormatter;
import com.hydromat.tooling.dto.ProfileDto;
import com.hydromat.tooling.dto.ProfileRequest;
import com.hydromat.tooling.dto.ProfileStatisticsDto;
import com.hydromat.tooling.event.InventoryEvent;
import com.hydromat.tooling.exception.InventoryValidationException;
import com.hydromat.tooling.exception.ResourceNotFoundException;
import com.hydromat.tooling.model.Profile;
import com.hydromat.tooling.model.Tool;
import com.hydromat.tooling.model.ToolPosition;
import com.hydromat.tooling.model.ToolType;
import com.hydromat.tooling.repository.MaterialSizeRepository;
import com.hydromat.tooling.repository.ProductSizeVariantRepository;
import com.hydromat.tooling.repository.ProfileRepository;
import com.hydromat.tooling.repository.ToolAssignmentRepository;
import com.hydromat.tooling.repository.ToolRepository;
import com.hydromat.tooling.security.Permissions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Profiles with their documentation. Deleting a profile removes everything filed under it.
 */
@Service
public class ProfileService {

    private static final Logger logger = LoggerFactory.getLogger(ProfileService.class);

    private final ProfileRepository profileRepository;
    private final ToolRepository toolRepository;
    private final ToolAssignmentRepository assignmentRepository;
    private final ProductSizeVariantRepository variantRepository;
    private final MaterialSizeRepository materialSizeRepository;
    private final ProfileDocumentStorage documentStorage;
    private final ApplicationEventPublisher eventPublisher;
    private final InventoryWriteLock writeLock;

    @Value("${app.profiles.default-feed-rate:30.0}")
    private double defaultFeedRate = 30.0;

    public ProfileService(ProfileRepository profileRepository,
                          ToolRepository toolRepository,
                          ToolAssignmentRepository assignmentRepository,
                          ProductSizeVariantRepository variantRepository,
                          MaterialSizeRepository materialSizeRepository,
                          ProfileDocumentStorage documentStorage,
                          ApplicationEventPublisher eventPublisher,
                          InventoryWriteLock writeLock) {
        this.profileRepository = profileRepository;
        this.toolRepository = toolRepository;
        this.assignmentRepository = assignmentRepository;
        this.variantRepository = variantRepository;
        this.materialSizeRepository = materialSizeRepository;
        this.documentStorage = documentStorage;
        this.eventPublisher = eventPublisher;
        this.writeLock = writeLock;
    }

    @Transactional(readOnly = true)
    public List<Profile> getAllProfiles() {
        return profileRepository.findAllByOrderByNameAsc();
    }

    @Transactional(readOnly = true)
    public Optional<Profile> getProfile(Long id) {
        return profileRepository.findById(id);
    }

    @Transactional
    public Profile createProfile(ProfileRequest request, Permissions permissions) {
        permissions.requireEdit();
        if (request == null) {
            throw new InventoryValidationException("Profile name is required");
        }
        String name = requireName(request.getName());
        if (profileRepository.existsByName(name)) {
            throw new InventoryValidationException("Profile with name '" + name + "' already exists");
        }

        Profile profile = new Profile();
        profile.setName(name);
        profile.setDescription(normalizeText(request.getDescription()));
        profile.setFeedRate(resolveFeedRate(request.getFeedRate(), defaultFeedRate));
        profile.setMaterialSizeId(requireMaterialSize(request.getMaterialSizeId()));
        profile.setPreviewImage(request.getPreviewImage());

        Profile saved = profileRepository.save(profile);
        logger.info("Created profile ID: {}, name: {}", saved.getId(), saved.getName());
        eventPublisher.publishEvent(InventoryEvent.profile(InventoryEvent.Type.PROFILE_CREATED, saved.getId()));
        return saved;
    }

    /**
     * Partial update: null fields keep their stored value.
     */
    @Transactional
    public Profile updateProfile(Long id, ProfileRequest request, Permissions permissions) {
        permissions.requireEdit();
        Profile profile = profileRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Profile", id));
        if (request == null) {
            return profile;
        }
        if (request.getName() != null) {
            String name = requireName(request.getName());
            if (profileRepository.existsByNameAndIdNot(name, id)) {
                throw new InventoryValidationException("Profile with name '" + name + "' already exists");
            }
            profile.setName(name);
        }
        if (request.getDescription() != null) {
            profile.setDescription(normalizeText(request.getDescription()));
        }
        if (request.getFeedRate() != null) {
            profile.setFeedRate(resolveFeedRate(request.getFeedRate(), profile.getFeedRate()));
        }
        if (request.getMaterialSizeId() != null) {
            profile.setMaterialSizeId(requireMaterialSize(request.getMaterialSizeId()));
        }
        if (request.getPreviewImage() != null) {
            profile.setPreviewImage(request.getPreviewImage().length == 0 ? null : request.getPreviewImage());
        }
        Profile saved = profileRepository.save(profile);
        logger.info("Updated profile ID: {}", id);
        eventPublisher.publishEvent(InventoryEvent.profile(InventoryEvent.Type.PROFILE_UPDATED, id));
        return saved;
    }

    /**
     * Deletes the profile with its head assignments, tools and product sizes. Its PDF files are
     * removed once the deletion has committed.
     */
    public void deleteProfile(Long id, Permissions permissions) {
        permissions.requireEdit();
        writeLock.run(() -> removeProfile(id));
    }

    private void removeProfile(Long id) {
        if (!profileRepository.existsById(id)) {
            throw new ResourceNotFoundException("Profile", id);
        }
        int assignments = assignmentRepository.deleteAllForProfile(id);
        int tools = toolRepository.deleteAllForProfile(id);
        int variants = variantRepository.deleteAllForProfile(id);
        profileRepository.deleteById(id);
        logger.info("Deleted profile ID: {} ({} assignments, {} tools, {} product sizes)",
                id, assignments, tools, variants);

        afterCommit(() -> {
            if (documentStorage.deleteAll(id)) {
                logger.info("PDF file deleted for profile {}", id);
            } else {
                logger.warn("PDF file not found for profile {}", id);
            }
        });
        eventPublisher.publishEvent(InventoryEvent.profile(InventoryEvent.Type.PROFILE_DELETED, id));
    }

    @Transactional(readOnly = true)
    public ProfileStatisticsDto getStatistics(Long id) {
        if (!profileRepository.existsById(id)) {
            throw new ResourceNotFoundException("Profile", id);
        }
        List<Tool> tools = toolRepository.findByProfileIdOrderByCodeAsc(id);
        Map<String, Long> byPosition = new LinkedHashMap<>();
        for (ToolPosition position : ToolPosition.values()) {
            byPosition.put(position.getLabel(), 0L);
        }
        Map<String, Long> byType = new LinkedHashMap<>();
        for (ToolType type : ToolType.values()) {
            byType.put(type.getLabel(), 0L);
        }
        long knives = 0;
        for (Tool tool : tools) {
            byPosition.merge(tool.getPosition().getLabel(), 1L, Long::sum);
            byType.merge(tool.getToolType().getLabel(), 1L, Long::sum);
            knives += tool.getKnivesCount() != null ? tool.getKnivesCount() : 0;
        }

        ProfileStatisticsDto dto = new ProfileStatisticsDto();
        dto.setProfileId(id);
        dto.setTotalTools(tools.size());
        dto.setByPosition(byPosition);
        dto.setByType(byType);
        dto.setTotalKnives(knives);
        return dto;
    }

    /**
     * Stores or replaces the profile's PDF. The previous file is removed after commit; on rollback
     * the newly written file is discarded instead.
     */
    @Transactional
    public Profile attachDocument(Long id, byte[] content, String filename, Permissions permissions) {
        permissions.requireEdit();
        Profile profile = profileRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Profile", id));
        if (content == null || content.length == 0) {
            throw new InventoryValidationException("PDF document is empty");
        }
        String previous = profile.getPdfPath();
        Path stored = documentStorage.store(id, content, filename);
        boolean newFile = previous == null || !Paths.get(previous).toAbsolutePath().normalize().equals(stored);
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                if (status == STATUS_COMMITTED) {
                    documentStorage.deleteAllExcept(id, stored);
                } else if (status == STATUS_ROLLED_BACK && newFile) {
                    documentStorage.delete(stored);
                }
            }
        });
        profile.setPdfPath(stored.toString());
        Profile saved = profileRepository.save(profile);
        eventPublisher.publishEvent(InventoryEvent.profile(InventoryEvent.Type.PROFILE_UPDATED, id));
        return saved;
    }

    @Transactional
    public Profile removeDocument(Long id, Permissions permissions) {
        permissions.requireEdit();
        Profile profile = profileRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Profile", id));
        afterCommit(() -> documentStorage.deleteAll(id));
        profile.setPdfPath(null);
        profile.setPreviewImage(null);
        Profile saved = profileRepository.save(profile);
        logger.info("Removed PDF of profile {}", id);
        eventPublisher.publishEvent(InventoryEvent.profile(InventoryEvent.Type.PROFILE_UPDATED, id));
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<byte[]> loadDocument(Long id) {
        Profile profile = profileRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Profile", id));
        return documentStorage.load(profile.getPdfPath());
    }

    @Transactional(readOnly = true)
    public ProfileDto toDto(Profile profile) {
        ProfileDto dto = new ProfileDto();
        dto.setId(profile.getId());
        dto.setName(profile.getName());
        dto.setDescription(profile.getDescription());
        dto.setFeedRate(profile.getFeedRate());
        dto.setMaterialSizeId(profile.getMaterialSizeId());
        if (profile.getMaterialSizeId() != null) {
            materialSizeRepository.findById(profile.getMaterialSizeId())
                    .ifPresent(size -> dto.setMaterialSizeDisplay(LegacySizeFormatter.materialSize(size)));
        }
        dto.setProductSizesDisplay(LegacySizeFormatter.productVariants(
                variantRepository.findByProfileIdOrderByIdAsc(profile.getId())));
        dto.setHasPdf(profile.getPdfPath() != null);
        if (profile.getPdfPath() != null) {
            Path fileName = Paths.get(profile.getPdfPath()).getFileName();
            dto.setPdfFileName(fileName != null ? fileName.toString() : null);
        }
        dto.setHasPreview(profile.getPreviewImage() != null);
        dto.setCreatedAt(profile.getCreatedAt());
        return dto;
    }

    private static void afterCommit(Runnable action) {
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                action.run();
            }
        });
    }

    private Long requireMaterialSize(Long materialSizeId) {
        if (materialSizeId != null && !materialSizeRepository.existsById(materialSizeId)) {
            throw new ResourceNotFoundException("Material size", materialSizeId);
        }
        return materialSizeId;
    }

    private static String requireName(String name) {
        String normalized = normalizeText(name);
        if (normalized == null) {
            throw new InventoryValidationException("Profile name is required");
        }
        return normalized;
    }

    private static Double resolveFeedRate(Double feedRate, Double fallback) {
        if (feedRate == null) {
            return fallback;
        }
        if (feedRate <= 0) {
            throw new InventoryValidationException("Feed rate must be greater than 0");
        }
        return feedRate;
    }

    private static String normalizeText(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
