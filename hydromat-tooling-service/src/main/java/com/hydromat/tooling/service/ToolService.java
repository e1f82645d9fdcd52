package com.hydromat.tooling.service;

import com.hydromat.tooling.code.ToolCodeGenerator;
import com.hydromat.tooling.dto.ToolChanges;
import com.hydromat.tooling.dto.ToolDraft;
import com.hydromat.tooling.dto.ToolDto;
import com.hydromat.tooling.event.InventoryEvent;
import com.hydromat.tooling.exception.DuplicateToolCodeException;
import com.hydromat.tooling.exception.InventoryValidationException;
import com.hydromat.tooling.exception.ResourceNotFoundException;
import com.hydromat.tooling.exception.SetPhotoOwnershipException;
import com.hydromat.tooling.exception.ToolInUseException;
import com.hydromat.tooling.model.Tool;
import com.hydromat.tooling.model.ToolPosition;
import com.hydromat.tooling.model.ToolStatus;
import com.hydromat.tooling.model.ToolType;
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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tool records and the tool-set rules built on the code scheme.
 *
 * <p>A set is every tool of a profile sharing the first five code digits. The member with the
 * lowest id owns the set photo; all members always carry identical photo bytes.</p>
 */
@Service
public class ToolService {

    private static final Logger logger = LoggerFactory.getLogger(ToolService.class);

    private final ToolRepository toolRepository;
    private final ToolAssignmentRepository toolAssignmentRepository;
    private final ProfileRepository profileRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final InventoryWriteLock writeLock;

    @Value("${app.tools.default-knives-count:6}")
    private int defaultKnivesCount = 6;

    public ToolService(ToolRepository toolRepository,
                       ToolAssignmentRepository toolAssignmentRepository,
                       ProfileRepository profileRepository,
                       ApplicationEventPublisher eventPublisher,
                       InventoryWriteLock writeLock) {
        this.toolRepository = toolRepository;
        this.toolAssignmentRepository = toolAssignmentRepository;
        this.profileRepository = profileRepository;
        this.eventPublisher = eventPublisher;
        this.writeLock = writeLock;
    }

    /**
     * Registers a tool under its generated code. A tool joining an existing set takes the
     * set photo; the photo it was submitted with is dropped.
     */
    public Tool createTool(ToolDraft draft, Permissions permissions) {
        permissions.requireEdit();
        return writeLock.call(() -> insertTool(draft));
    }

    private Tool insertTool(ToolDraft draft) {
        if (draft == null || draft.getProfileId() == null) {
            throw new InventoryValidationException("Profile ID is required");
        }
        int setNumber = draft.getSetNumber() != null ? draft.getSetNumber() : 1;
        String code = ToolCodeGenerator.generate(
                codeProfileId(draft.getProfileId()), draft.getPosition(), draft.getToolType(), setNumber);

        if (!profileRepository.existsById(draft.getProfileId())) {
            throw new ResourceNotFoundException("Profile", draft.getProfileId());
        }
        if (toolRepository.existsByCode(code)) {
            throw new DuplicateToolCodeException(code);
        }

        Tool tool = new Tool();
        tool.setProfileId(draft.getProfileId());
        tool.setPosition(ToolPosition.fromLabel(draft.getPosition()).orElseThrow());
        tool.setToolType(ToolType.fromLabel(draft.getToolType()).orElseThrow());
        tool.setSetNumber(setNumber);
        tool.setCode(code);
        tool.setKnivesCount(resolveKnivesCount(draft.getKnivesCount()));
        tool.setTemplateId(normalizeText(draft.getTemplateId()));
        tool.setStatus(resolveStatus(draft.getStatus(), ToolStatus.READY));
        tool.setNotes(normalizeText(draft.getNotes()));
        tool.setPhoto(draft.getPhoto());

        String prefix = code.substring(0, ToolCodeGenerator.SET_PREFIX_LENGTH);
        List<Tool> members = findSetMembers(tool.getProfileId(), prefix);
        if (!members.isEmpty()) {
            Tool first = members.get(0);
            if (draft.getPhoto() != null && !Arrays.equals(draft.getPhoto(), first.getPhoto())) {
                logger.info("Ignoring photo submitted with tool {}: set {}x photo is owned by tool {}",
                        code, prefix, first.getId());
            }
            tool.setPhoto(copyOf(first.getPhoto()));
            logger.info("Using photo from first tool in set {}x", prefix);
        }

        Tool saved = toolRepository.save(tool);
        logger.info("Added new tool ID: {}, Code: {}", saved.getId(), code);
        eventPublisher.publishEvent(InventoryEvent.tool(
                InventoryEvent.Type.TOOL_CREATED, saved.getProfileId(), saved.getId(), code));
        return saved;
    }

    /**
     * Applies a partial update. Changing profile, position, type or set number re-generates the
     * code and moves the tool to the matching set; set ownership is judged after that move.
     */
    public ToolUpdateResult updateTool(Long toolId, ToolChanges changes, Permissions permissions) {
        permissions.requireEdit();
        return writeLock.call(() -> applyChanges(toolId, changes));
    }

    private ToolUpdateResult applyChanges(Long toolId, ToolChanges changes) {
        Tool tool = toolRepository.findById(toolId)
                .orElseThrow(() -> new ResourceNotFoundException("Tool", toolId));
        ToolChanges safeChanges = changes != null ? changes : new ToolChanges();

        boolean photoRequested = isPhotoChange(safeChanges, tool);
        byte[] requestedPhoto = Boolean.TRUE.equals(safeChanges.getClearPhoto()) ? null : safeChanges.getPhoto();

        Long profileId = safeChanges.getProfileId() != null ? safeChanges.getProfileId() : tool.getProfileId();
        String position = safeChanges.getPosition() != null
                ? safeChanges.getPosition() : tool.getPosition().getLabel();
        String toolType = safeChanges.getToolType() != null
                ? safeChanges.getToolType() : tool.getToolType().getLabel();
        int setNumber = safeChanges.getSetNumber() != null ? safeChanges.getSetNumber() : tool.getSetNumber();

        String newCode = ToolCodeGenerator.generate(codeProfileId(profileId), position, toolType, setNumber);
        boolean codeChanged = !newCode.equals(tool.getCode());
        if (codeChanged) {
            if (!profileId.equals(tool.getProfileId()) && !profileRepository.existsById(profileId)) {
                throw new ResourceNotFoundException("Profile", profileId);
            }
            if (toolRepository.existsByCode(newCode)) {
                throw new DuplicateToolCodeException(newCode);
            }
            logger.info("Tool {} code changes {} -> {}", toolId, tool.getCode(), newCode);
            tool.setProfileId(profileId);
            tool.setPosition(ToolPosition.fromLabel(position).orElseThrow());
            tool.setToolType(ToolType.fromLabel(toolType).orElseThrow());
            tool.setSetNumber(setNumber);
            tool.setCode(newCode);
        }

        if (safeChanges.getKnivesCount() != null) {
            tool.setKnivesCount(resolveKnivesCount(safeChanges.getKnivesCount()));
        }
        if (safeChanges.getTemplateId() != null) {
            tool.setTemplateId(normalizeText(safeChanges.getTemplateId()));
        }
        if (safeChanges.getStatus() != null) {
            tool.setStatus(resolveStatus(safeChanges.getStatus(), tool.getStatus()));
        }
        if (safeChanges.getNotes() != null) {
            tool.setNotes(normalizeText(safeChanges.getNotes()));
        }

        String prefix = tool.getCode().substring(0, ToolCodeGenerator.SET_PREFIX_LENGTH);
        List<Tool> others = findSetMembers(tool.getProfileId(), prefix).stream()
                .filter(member -> !member.getId().equals(tool.getId()))
                .toList();
        boolean ownsSetPhoto = others.isEmpty() || others.get(0).getId() > tool.getId();

        SetPhotoOwnershipException photoRejection = null;
        if (ownsSetPhoto) {
            if (photoRequested) {
                tool.setPhoto(requestedPhoto);
            }
            if (photoRequested || codeChanged) {
                propagatePhoto(tool, others);
            }
        } else {
            if (photoRequested) {
                photoRejection = new SetPhotoOwnershipException(tool.getCode());
                logger.warn("Rejected photo change for tool {} ({}): set {}x photo is owned by tool {}",
                        tool.getId(), tool.getCode(), prefix, others.get(0).getId());
            }
            if (codeChanged) {
                tool.setPhoto(copyOf(others.get(0).getPhoto()));
            }
        }

        Tool saved = toolRepository.save(tool);
        logger.info("Updated tool {} ({})", saved.getId(), saved.getCode());
        eventPublisher.publishEvent(InventoryEvent.tool(
                InventoryEvent.Type.TOOL_UPDATED, saved.getProfileId(), saved.getId(), saved.getCode()));
        return new ToolUpdateResult(saved, photoRejection);
    }

    /**
     * Deletes an unassigned tool. Remaining set members keep their stored photo.
     */
    public void deleteTool(Long toolId, Permissions permissions) {
        permissions.requireEdit();
        writeLock.run(() -> removeTool(toolId));
    }

    private void removeTool(Long toolId) {
        Tool tool = toolRepository.findById(toolId)
                .orElseThrow(() -> new ResourceNotFoundException("Tool", toolId));
        if (toolAssignmentRepository.existsByToolId(toolId)) {
            throw new ToolInUseException();
        }
        toolRepository.delete(tool);
        logger.info("Deleted tool ID: {} ({})", toolId, tool.getCode());

        String prefix = ToolCodeGenerator.setPrefix(tool.getCode());
        if (prefix != null && findSetMembers(tool.getProfileId(), prefix).isEmpty()) {
            logger.info("All tools of set {}x removed", prefix);
        }
        eventPublisher.publishEvent(InventoryEvent.tool(
                InventoryEvent.Type.TOOL_DELETED, tool.getProfileId(), toolId, tool.getCode()));
    }

    @Transactional(readOnly = true)
    public Optional<Tool> getTool(Long toolId) {
        return toolRepository.findById(toolId);
    }

    @Transactional(readOnly = true)
    public Optional<Tool> getToolByCode(String code) {
        if (!ToolCodeGenerator.validateCode(code)) {
            return Optional.empty();
        }
        return toolRepository.findByCode(code);
    }

    @Transactional(readOnly = true)
    public Optional<Tool> getToolByTemplateId(String templateId) {
        String normalized = normalizeText(templateId);
        if (normalized == null) {
            return Optional.empty();
        }
        return toolRepository.findFirstByTemplateIdOrderByIdAsc(normalized);
    }

    @Transactional(readOnly = true)
    public List<Tool> getToolsByProfile(Long profileId) {
        return toolRepository.findByProfileIdOrderByCodeAsc(profileId);
    }

    /**
     * Members of a set in creation order.
     *
     * @param setPrefix the first five code digits
     */
    @Transactional(readOnly = true)
    public List<Tool> getToolsInSet(Long profileId, String setPrefix) {
        if (setPrefix == null || setPrefix.length() != ToolCodeGenerator.SET_PREFIX_LENGTH) {
            throw new InventoryValidationException("Set prefix must be the first 5 digits of a tool code");
        }
        return findSetMembers(profileId, setPrefix);
    }

    @Transactional(readOnly = true)
    public boolean isFirstInSet(Long toolId) {
        Tool tool = toolRepository.findById(toolId)
                .orElseThrow(() -> new ResourceNotFoundException("Tool", toolId));
        return isFirstInSet(tool);
    }

    @Transactional(readOnly = true)
    public List<Tool> getAvailableToolsForPosition(Long profileId, String position) {
        ToolPosition resolved = ToolPosition.fromLabel(position)
                .orElseThrow(() -> new InventoryValidationException("Invalid position: " + position));
        return toolRepository.findByProfileIdAndPositionOrderByCodeAsc(profileId, resolved);
    }

    @Transactional(readOnly = true)
    public boolean isToolAssigned(Long toolId) {
        return toolAssignmentRepository.existsByToolId(toolId);
    }

    public ToolDto toDto(Tool tool) {
        return toDto(tool, isFirstInSet(tool));
    }

    /**
     * Maps a listing that contains whole sets (e.g. all tools of a profile); set ownership is
     * derived from the listing itself.
     */
    public List<ToolDto> toDtos(List<Tool> tools) {
        Map<String, Long> firstIdBySet = new HashMap<>();
        for (Tool tool : tools) {
            String key = tool.getProfileId() + "|" + setKey(tool.getCode());
            firstIdBySet.merge(key, tool.getId(), Math::min);
        }
        List<ToolDto> result = new ArrayList<>(tools.size());
        for (Tool tool : tools) {
            String key = tool.getProfileId() + "|" + setKey(tool.getCode());
            result.add(toDto(tool, tool.getId().equals(firstIdBySet.get(key))));
        }
        return result;
    }

    private ToolDto toDto(Tool tool, boolean firstInSet) {
        ToolDto dto = new ToolDto();
        dto.setId(tool.getId());
        dto.setProfileId(tool.getProfileId());
        dto.setCode(tool.getCode());
        dto.setPosition(tool.getPosition() != null ? tool.getPosition().getLabel() : null);
        dto.setToolType(tool.getToolType() != null ? tool.getToolType().getLabel() : null);
        dto.setSetNumber(tool.getSetNumber());
        dto.setKnivesCount(tool.getKnivesCount());
        dto.setTemplateId(tool.getTemplateId());
        dto.setStatus(tool.getStatus() != null ? tool.getStatus().getKey() : null);
        dto.setNotes(tool.getNotes());
        dto.setHasPhoto(tool.getPhoto() != null);
        dto.setFirstInSet(firstInSet);
        dto.setCreatedAt(tool.getCreatedAt());
        dto.setUpdatedAt(tool.getUpdatedAt());
        return dto;
    }

    private boolean isFirstInSet(Tool tool) {
        String prefix = ToolCodeGenerator.setPrefix(tool.getCode());
        if (prefix == null) {
            return true;
        }
        List<Tool> members = findSetMembers(tool.getProfileId(), prefix);
        return members.isEmpty() || members.get(0).getId().equals(tool.getId());
    }

    /**
     * Loads set members ordered by id, skipping stored rows whose code cannot be decoded.
     */
    private List<Tool> findSetMembers(Long profileId, String prefix) {
        List<Tool> rows = toolRepository.findByProfileIdAndCodeStartingWithOrderByIdAsc(profileId, prefix);
        List<Tool> members = new ArrayList<>(rows.size());
        for (Tool row : rows) {
            if (ToolCodeGenerator.validateCode(row.getCode())) {
                members.add(row);
            } else {
                logger.warn("Skipping tool {} with unreadable code '{}'", row.getId(), row.getCode());
            }
        }
        return members;
    }

    private void propagatePhoto(Tool owner, List<Tool> members) {
        if (members.isEmpty()) {
            return;
        }
        for (Tool member : members) {
            member.setPhoto(copyOf(owner.getPhoto()));
        }
        toolRepository.saveAll(members);
        logger.info("Propagated photo of tool {} to {} other member(s) of set {}x",
                owner.getId(), members.size(), owner.getCode().substring(0, ToolCodeGenerator.SET_PREFIX_LENGTH));
    }

    private static boolean isPhotoChange(ToolChanges changes, Tool tool) {
        if (Boolean.TRUE.equals(changes.getClearPhoto())) {
            return tool.getPhoto() != null;
        }
        return changes.getPhoto() != null && !Arrays.equals(changes.getPhoto(), tool.getPhoto());
    }

    private int resolveKnivesCount(Integer knivesCount) {
        if (knivesCount == null) {
            return defaultKnivesCount;
        }
        if (knivesCount < 1) {
            throw new InventoryValidationException("Knives count must be at least 1, got " + knivesCount);
        }
        return knivesCount;
    }

    private static ToolStatus resolveStatus(String status, ToolStatus fallback) {
        if (normalizeText(status) == null) {
            return fallback;
        }
        return ToolStatus.fromKey(status)
                .orElseThrow(() -> new InventoryValidationException("Invalid tool status: " + status));
    }

    private static String setKey(String code) {
        String prefix = ToolCodeGenerator.setPrefix(code);
        return prefix != null ? prefix : code;
    }

    /**
     * Profile ids beyond int range are clamped; the generator rejects them either way.
     */
    private static int codeProfileId(Long profileId) {
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, profileId));
    }

    private static byte[] copyOf(byte[] photo) {
        return photo == null ? null : photo.clone();
    }

    private static String normalizeText(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
