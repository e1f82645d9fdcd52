package com.hydromat.tooling.service;

import com.hydromat.tooling.dto.AssignmentRequest;
import com.hydromat.tooling.dto.HeadAssignmentDto;
import com.hydromat.tooling.event.InventoryEvent;
import com.hydromat.tooling.exception.InventoryValidationException;
import com.hydromat.tooling.exception.ResourceNotFoundException;
import com.hydromat.tooling.model.Tool;
import com.hydromat.tooling.model.ToolAssignment;
import com.hydromat.tooling.repository.ProfileRepository;
import com.hydromat.tooling.repository.ToolAssignmentRepository;
import com.hydromat.tooling.repository.ToolRepository;
import com.hydromat.tooling.security.Permissions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class ToolAssignmentService {

    private static final Logger logger = LoggerFactory.getLogger(ToolAssignmentService.class);

    static final int MIN_RPM = 1000;
    static final int MAX_RPM = 8000;
    static final double MIN_PASS_DEPTH = 0.1;
    static final double MAX_PASS_DEPTH = 10.0;

    private final ToolAssignmentRepository assignmentRepository;
    private final ToolRepository toolRepository;
    private final ProfileRepository profileRepository;
    private final HeadPositionTable headPositionTable;
    private final ApplicationEventPublisher eventPublisher;
    private final InventoryWriteLock writeLock;

    public ToolAssignmentService(ToolAssignmentRepository assignmentRepository,
                                 ToolRepository toolRepository,
                                 ProfileRepository profileRepository,
                                 HeadPositionTable headPositionTable,
                                 ApplicationEventPublisher eventPublisher,
                                 InventoryWriteLock writeLock) {
        this.assignmentRepository = assignmentRepository;
        this.toolRepository = toolRepository;
        this.profileRepository = profileRepository;
        this.headPositionTable = headPositionTable;
        this.eventPublisher = eventPublisher;
        this.writeLock = writeLock;
    }

    /**
     * Binds a tool to a head of the profile, replacing whatever the head held before.
     * The delete and the insert share one transaction, so the head is never left empty
     * or doubly assigned.
     */
    public HeadAssignmentDto assignToolToHead(Long profileId, int headNumber,
                                              AssignmentRequest request, Permissions permissions) {
        permissions.requireEdit();
        return writeLock.call(() -> replaceHead(profileId, headNumber, request));
    }

    private HeadAssignmentDto replaceHead(Long profileId, int headNumber, AssignmentRequest request) {
        headPositionTable.requireHead(headNumber);
        if (request == null || request.getToolId() == null) {
            throw new InventoryValidationException("Tool ID is required");
        }
        validateRpm(request.getRpm());
        validatePassDepth(request.getPassDepth());

        if (!profileRepository.existsById(profileId)) {
            throw new ResourceNotFoundException("Profile", profileId);
        }
        Tool tool = toolRepository.findById(request.getToolId())
                .orElseThrow(() -> new ResourceNotFoundException("Tool", request.getToolId()));

        List<Integer> otherHeads = assignmentRepository
                .findByProfileIdAndToolIdOrderByHeadNumberAsc(profileId, tool.getId()).stream()
                .map(ToolAssignment::getHeadNumber)
                .filter(head -> head != headNumber)
                .toList();
        if (!otherHeads.isEmpty()) {
            logger.warn("Tool {} is already assigned to head(s) {} of profile {}",
                    tool.getCode(), otherHeads, profileId);
        }

        int removed = assignmentRepository.deleteHead(profileId, headNumber);

        ToolAssignment assignment = new ToolAssignment();
        assignment.setProfileId(profileId);
        assignment.setHeadNumber(headNumber);
        assignment.setToolId(tool.getId());
        assignment.setRpm(request.getRpm());
        assignment.setPassDepth(request.getPassDepth());
        assignment.setWorkMaterial(normalizeText(request.getWorkMaterial()));
        assignment.setRemarks(normalizeText(request.getRemarks()));
        ToolAssignment saved = assignmentRepository.save(assignment);

        boolean mismatch = !headPositionTable.matchesRequiredPosition(headNumber, tool.getPosition());
        if (mismatch) {
            logger.warn("Tool {} ({}) assigned to head {} which requires {}", tool.getCode(),
                    tool.getPosition().getLabel(), headNumber,
                    headPositionTable.getRequiredPositionForHead(headNumber).getLabel());
        }
        logger.info("Assigned tool {} to profile {} head {}{}", tool.getCode(), profileId, headNumber,
                removed > 0 ? " (replaced previous assignment)" : "");
        eventPublisher.publishEvent(InventoryEvent.head(
                InventoryEvent.Type.TOOL_ASSIGNED, profileId, headNumber, tool.getId()));

        HeadAssignmentDto dto = toDto(saved, tool);
        dto.setAlsoAssignedToHeads(otherHeads);
        return dto;
    }

    public void clearHeadAssignment(Long profileId, int headNumber, Permissions permissions) {
        permissions.requireEdit();
        headPositionTable.requireHead(headNumber);
        writeLock.run(() -> clearHead(profileId, headNumber));
    }

    private void clearHead(Long profileId, int headNumber) {
        int removed = assignmentRepository.deleteHead(profileId, headNumber);
        if (removed == 0) {
            logger.info("Head {} of profile {} had no assignment", headNumber, profileId);
            return;
        }
        logger.info("Cleared head {} of profile {}", headNumber, profileId);
        eventPublisher.publishEvent(InventoryEvent.head(
                InventoryEvent.Type.ASSIGNMENT_CLEARED, profileId, headNumber, null));
    }

    @Transactional(readOnly = true)
    public List<HeadAssignmentDto> getAssignments(Long profileId) {
        List<ToolAssignment> assignments = assignmentRepository.findByProfileIdOrderByHeadNumberAsc(profileId);
        List<Long> toolIds = assignments.stream().map(ToolAssignment::getToolId).distinct().toList();
        Map<Long, Tool> tools = toolRepository.findAllById(toolIds).stream()
                .collect(Collectors.toMap(Tool::getId, Function.identity()));

        List<HeadAssignmentDto> result = new ArrayList<>(assignments.size());
        for (ToolAssignment assignment : assignments) {
            Tool tool = tools.get(assignment.getToolId());
            if (tool == null) {
                logger.warn("Assignment {} references missing tool {}", assignment.getId(), assignment.getToolId());
            }
            HeadAssignmentDto dto = toDto(assignment, tool);
            dto.setAlsoAssignedToHeads(assignments.stream()
                    .filter(other -> other.getToolId().equals(assignment.getToolId()))
                    .map(ToolAssignment::getHeadNumber)
                    .filter(head -> !head.equals(assignment.getHeadNumber()))
                    .toList());
            result.add(dto);
        }
        return result;
    }

    private HeadAssignmentDto toDto(ToolAssignment assignment, Tool tool) {
        HeadPositionTable.HeadInfo head = headPositionTable.requireHead(assignment.getHeadNumber());
        HeadAssignmentDto dto = new HeadAssignmentDto();
        dto.setId(assignment.getId());
        dto.setProfileId(assignment.getProfileId());
        dto.setHeadNumber(assignment.getHeadNumber());
        dto.setHeadName(head.name);
        dto.setRequiredPosition(head.requiredPosition.getLabel());
        dto.setToolId(assignment.getToolId());
        if (tool != null) {
            dto.setToolCode(tool.getCode());
            dto.setToolPosition(tool.getPosition().getLabel());
            dto.setPositionMismatch(tool.getPosition() != head.requiredPosition);
        }
        dto.setRpm(assignment.getRpm());
        dto.setPassDepth(assignment.getPassDepth());
        dto.setWorkMaterial(assignment.getWorkMaterial());
        dto.setRemarks(assignment.getRemarks());
        return dto;
    }

    private static void validateRpm(Integer rpm) {
        if (rpm != null && (rpm < MIN_RPM || rpm > MAX_RPM)) {
            throw new InventoryValidationException("RPM must be between " + MIN_RPM + " and " + MAX_RPM);
        }
    }

    private static void validatePassDepth(Double passDepth) {
        if (passDepth != null && (passDepth < MIN_PASS_DEPTH || passDepth > MAX_PASS_DEPTH)) {
            throw new InventoryValidationException("Pass depth must be between 0.1 and 10.0 mm");
        }
    }

    private static String normalizeText(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
