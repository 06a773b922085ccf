package com.loandesk.service;

import com.loandesk.api.request.CreateStageRequest;
import com.loandesk.api.request.CreateTransitionRequest;
import com.loandesk.api.request.CreateWorkflowRequest;
import com.loandesk.api.request.StageDefinition;
import com.loandesk.api.request.TransitionDefinition;
import com.loandesk.api.request.UpdateStageRequest;
import com.loandesk.api.request.UpdateWorkflowRequest;
import com.loandesk.api.response.TransitionCheckResponse;
import com.loandesk.dto.AvailableTransition;
import com.loandesk.dto.WorkflowGraph;
import com.loandesk.error.ForbiddenOperationException;
import com.loandesk.error.ResourceConflictException;
import com.loandesk.model.Workflow;
import com.loandesk.model.WorkflowStage;
import com.loandesk.model.WorkflowTransition;
import com.loandesk.repository.ContractRepository;
import com.loandesk.repository.WorkflowRepository;
import com.loandesk.repository.WorkflowStageRepository;
import com.loandesk.repository.WorkflowTransitionRepository;
import jakarta.persistence.EntityNotFoundException;
import jakarta.transaction.Transactional;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Versioned workflows: the stage graphs loan contracts move through.
 *
 * <p>Every workflow that defines stages contains {@value #DRAFT}, {@value #SUBMITTED} and
 * {@value #COMPLETED}. Only the newest version of a workflow name is active.
 */
@Service
@Validated
@AllArgsConstructor
@Slf4j
public class WorkflowService {

    public static final String DRAFT = "DRAFT";
    public static final String SUBMITTED = "SUBMITTED";
    public static final String COMPLETED = "COMPLETED";

    static final List<String> REQUIRED_STAGE_CODES = List.of(DRAFT, SUBMITTED, COMPLETED);

    private static final List<StageDefinition> DEFAULT_STAGES = List.of(
            new StageDefinition(DRAFT, "Draft", 0, "#6B7280", false),
            new StageDefinition(SUBMITTED, "Submitted", 1, "#3B82F6", false),
            new StageDefinition("REVIEWING", "Reviewing", 2, "#F59E0B", false),
            new StageDefinition("APPROVED", "Approved", 3, "#10B981", false),
            new StageDefinition("DISBURSED", "Disbursed", 4, "#8B5CF6", false),
            new StageDefinition(COMPLETED, "Completed", 5, "#059669", true),
            new StageDefinition("REJECTED", "Rejected", 6, "#EF4444", false)
    );

    private final WorkflowRepository workflowRepository;
    private final WorkflowStageRepository stageRepository;
    private final WorkflowTransitionRepository transitionRepository;
    private final ContractRepository contractRepository;
    private final WorkflowTransitionGuard transitionGuard;

    /**
     * Creates the next version of a workflow.
     *
     * <p>The version number is one above the highest existing version of the name. Stages and
     * transitions are created in the same transaction, and all earlier versions of the name are
     * deactivated. Transitions reference stages by code.
     *
     * @param request workflow definition
     * @return the created workflow with stages and transitions
     * @throws IllegalArgumentException if a required stage is missing, a stage code repeats or a
     *                                  transition references an unknown stage code
     */
    @Transactional
    public WorkflowGraph createWorkflow(@Valid @NotNull CreateWorkflowRequest request) {
        List<StageDefinition> stageDefinitions = request.stages() == null ? List.of() : request.stages();
        List<TransitionDefinition> transitionDefinitions =
                request.transitions() == null ? List.of() : request.transitions();

        if (!stageDefinitions.isEmpty()) {
            validateRequiredStages(stageDefinitions);
        }

        Integer maxVersion = workflowRepository.findMaxVersionByName(request.name());
        int version = maxVersion == null ? 1 : maxVersion + 1;
        LocalDateTime now = LocalDateTime.now();

        Workflow workflow = new Workflow();
        workflow.setName(request.name());
        workflow.setDescription(request.description());
        workflow.setVersion(version);
        workflow.setActive(true);
        workflow.setCreatedAt(now);
        workflow.setUpdatedAt(now);
        workflow = workflowRepository.save(workflow);

        Map<String, WorkflowStage> stagesByCode = new HashMap<>();
        List<WorkflowStage> stages = new ArrayList<>();
        for (StageDefinition definition : stageDefinitions) {
            String code = normalizeCode(definition.code());
            if (stagesByCode.containsKey(code)) {
                throw new IllegalArgumentException("Duplicate stage code: " + code);
            }
            WorkflowStage stage = new WorkflowStage();
            stage.setWorkflowId(workflow.getId());
            stage.setCode(code);
            stage.setName(definition.name());
            stage.setStageOrder(definition.stageOrder());
            stage.setColor(colorOrDefault(definition.color()));
            stage.setRequired(REQUIRED_STAGE_CODES.contains(code));
            stage.setTriggersCommission(Boolean.TRUE.equals(definition.triggersCommission()));
            stage.setCreatedAt(now);
            stage = stageRepository.save(stage);
            stagesByCode.put(code, stage);
            stages.add(stage);
        }

        List<WorkflowTransition> transitions = new ArrayList<>();
        for (TransitionDefinition definition : transitionDefinitions) {
            WorkflowStage from = stagesByCode.get(normalizeCode(definition.fromStageCode()));
            WorkflowStage to = stagesByCode.get(normalizeCode(definition.toStageCode()));
            if (from == null || to == null) {
                throw new IllegalArgumentException(String.format("Invalid stage code in transition: %s -> %s",
                        definition.fromStageCode(), definition.toStageCode()));
            }
            WorkflowTransition transition = new WorkflowTransition();
            transition.setWorkflowId(workflow.getId());
            transition.setFromStageId(from.getId());
            transition.setToStageId(to.getId());
            transition.setRequiredPermission(blankToNull(definition.requiredPermission()));
            transition.setCreatedAt(now);
            transitions.add(transitionRepository.save(transition));
        }

        int deactivated = workflowRepository.deactivateOtherVersions(workflow.getName(), workflow.getId(), now);

        log.info("Created workflow: id={}, name={}, version={}, stages={}, transitions={}, deactivatedVersions={}",
                workflow.getId(), workflow.getName(), version, stages.size(), transitions.size(), deactivated);

        stages.sort((a, b) -> Integer.compare(a.getStageOrder(), b.getStageOrder()));
        return new WorkflowGraph(workflow, stages, transitions);
    }

    /**
     * The seven-stage template new workflows usually start from.
     */
    public List<StageDefinition> getDefaultStages() {
        return DEFAULT_STAGES;
    }

    public Workflow findById(@NotNull UUID workflowId) {
        return workflowRepository.findById(workflowId)
                .orElseThrow(() -> new EntityNotFoundException("Workflow not found: " + workflowId));
    }

    public WorkflowGraph getWorkflowGraph(@NotNull UUID workflowId) {
        Workflow workflow = findById(workflowId);
        return new WorkflowGraph(workflow,
                stageRepository.findByWorkflowIdOrderByStageOrderAsc(workflowId),
                transitionRepository.findByWorkflowId(workflowId));
    }

    public Page<Workflow> findAll(Pageable pageable) {
        return workflowRepository.findAllByOrderByCreatedAtDesc(pageable);
    }

    public Optional<Workflow> findActiveByName(String name) {
        return workflowRepository.findFirstByNameAndActiveTrueOrderByVersionDesc(name);
    }

    /**
     * Updates name, description and active flag. Stages are not re-validated. Activating a
     * version deactivates the other versions of its name.
     */
    @Transactional
    public Workflow updateWorkflow(@NotNull UUID workflowId, @NotNull UpdateWorkflowRequest request) {
        Workflow workflow = findById(workflowId);
        LocalDateTime now = LocalDateTime.now();

        if (request.name() != null && !request.name().isBlank()) {
            workflow.setName(request.name());
        }
        if (request.description() != null) {
            workflow.setDescription(request.description());
        }
        if (request.active() != null) {
            workflow.setActive(request.active());
        }
        workflow.setUpdatedAt(now);
        workflow = workflowRepository.save(workflow);

        if (workflow.isActive()) {
            workflowRepository.deactivateOtherVersions(workflow.getName(), workflow.getId(), now);
        }
        log.info("Updated workflow: id={}, name={}, active={}", workflowId, workflow.getName(), workflow.isActive());
        return workflow;
    }

    /**
     * @return the stage with the lowest stage order
     * @throws IllegalArgumentException if the workflow has no stages
     */
    public WorkflowStage getInitialStage(@NotNull UUID workflowId) {
        return stageRepository.findFirstByWorkflowIdOrderByStageOrderAsc(workflowId)
                .orElseThrow(() -> new IllegalArgumentException("Service workflow has no stages"));
    }

    /**
     * @return the stage following {@code stage} in stage order, if any
     */
    public Optional<WorkflowStage> getNextStage(@NotNull WorkflowStage stage) {
        return stageRepository.findFirstByWorkflowIdAndStageOrderGreaterThanOrderByStageOrderAsc(
                stage.getWorkflowId(), stage.getStageOrder());
    }

    public Optional<WorkflowStage> getStageByCode(@NotNull UUID workflowId, @NotNull String code) {
        return stageRepository.findByWorkflowIdAndCode(workflowId, normalizeCode(code));
    }

    public WorkflowStage getStage(@NotNull UUID stageId) {
        return stageRepository.findById(stageId)
                .orElseThrow(() -> new EntityNotFoundException("Stage not found: " + stageId));
    }

    /**
     * Transitions leaving {@code currentStageId}, each with its destination stage, ordered by the
     * destination's stage order.
     */
    public List<AvailableTransition> getAvailableTransitions(@NotNull UUID workflowId, @NotNull UUID currentStageId) {
        List<AvailableTransition> result = new ArrayList<>();
        for (WorkflowTransition transition : transitionRepository.findByWorkflowIdAndFromStageId(workflowId,
                currentStageId)) {
            stageRepository.findById(transition.getToStageId())
                    .ifPresent(toStage -> result.add(new AvailableTransition(transition, toStage)));
        }
        result.sort((a, b) -> Integer.compare(a.toStage().getStageOrder(), b.toStage().getStageOrder()));
        return result;
    }

    public TransitionCheckResponse canTransition(@NotNull UUID workflowId, @NotNull UUID fromStageId,
                                                 @NotNull UUID toStageId, UUID actorId) {
        return transitionGuard.check(workflowId, fromStageId, toStageId, actorId);
    }

    /**
     * @throws ForbiddenOperationException if the transition does not exist or the actor lacks its permission
     */
    public void validateTransition(@NotNull UUID workflowId, @NotNull UUID fromStageId, @NotNull UUID toStageId,
                                   UUID actorId) {
        transitionGuard.validate(workflowId, fromStageId, toStageId, actorId);
    }

    // Stage management

    @Transactional
    public WorkflowStage createStage(@NotNull UUID workflowId, @Valid @NotNull CreateStageRequest request) {
        findById(workflowId);
        String code = normalizeCode(request.code());
        if (stageRepository.existsByWorkflowIdAndCode(workflowId, code)) {
            throw new ResourceConflictException("Stage code already exists in this workflow: " + code);
        }

        WorkflowStage stage = new WorkflowStage();
        stage.setWorkflowId(workflowId);
        stage.setCode(code);
        stage.setName(request.name());
        stage.setStageOrder(request.stageOrder());
        stage.setColor(colorOrDefault(request.color()));
        stage.setRequired(Boolean.TRUE.equals(request.required()) || REQUIRED_STAGE_CODES.contains(code));
        stage.setTriggersCommission(Boolean.TRUE.equals(request.triggersCommission()));
        stage.setCreatedAt(LocalDateTime.now());
        stage = stageRepository.save(stage);

        log.info("Created stage: workflowId={}, stageId={}, code={}", workflowId, stage.getId(), code);
        return stage;
    }

    @Transactional
    public WorkflowStage updateStage(@NotNull UUID workflowId, @NotNull UUID stageId,
                                     @NotNull UpdateStageRequest request) {
        WorkflowStage stage = getStageInWorkflow(workflowId, stageId);
        if (request.name() != null && !request.name().isBlank()) {
            stage.setName(request.name());
        }
        if (request.stageOrder() != null) {
            stage.setStageOrder(request.stageOrder());
        }
        if (request.color() != null && !request.color().isBlank()) {
            stage.setColor(request.color());
        }
        if (request.triggersCommission() != null) {
            stage.setTriggersCommission(request.triggersCommission());
        }
        return stageRepository.save(stage);
    }

    /**
     * Deletes a stage and every transition touching it.
     *
     * @throws IllegalArgumentException if contracts currently sit in the stage or the stage is required
     */
    @Transactional
    public void deleteStage(@NotNull UUID workflowId, @NotNull UUID stageId) {
        WorkflowStage stage = getStageInWorkflow(workflowId, stageId);

        long contracts = contractRepository.countByCurrentStageId(stageId);
        if (contracts > 0) {
            throw new IllegalArgumentException(
                    String.format("Cannot delete stage: %d contract(s) are using this stage", contracts));
        }
        if (stage.isRequired()) {
            throw new IllegalArgumentException("Cannot delete required stage: " + stage.getCode());
        }

        int removedTransitions = transitionRepository.deleteTouchingStage(stageId);
        stageRepository.delete(stage);
        log.info("Deleted stage: workflowId={}, stageId={}, code={}, removedTransitions={}",
                workflowId, stageId, stage.getCode(), removedTransitions);
    }

    // Transition management

    @Transactional
    public WorkflowTransition createTransition(@NotNull UUID workflowId,
                                               @Valid @NotNull CreateTransitionRequest request) {
        findById(workflowId);

        WorkflowStage from = stageRepository.findById(request.fromStageId())
                .filter(stage -> stage.getWorkflowId().equals(workflowId))
                .orElseThrow(() -> new IllegalArgumentException("From stage not found in this workflow"));
        WorkflowStage to = stageRepository.findById(request.toStageId())
                .filter(stage -> stage.getWorkflowId().equals(workflowId))
                .orElseThrow(() -> new IllegalArgumentException("To stage not found in this workflow"));

        if (transitionRepository.existsByWorkflowIdAndFromStageIdAndToStageId(workflowId, from.getId(), to.getId())) {
            throw new ResourceConflictException("This transition already exists");
        }

        WorkflowTransition transition = new WorkflowTransition();
        transition.setWorkflowId(workflowId);
        transition.setFromStageId(from.getId());
        transition.setToStageId(to.getId());
        transition.setRequiredPermission(blankToNull(request.requiredPermission()));
        transition.setCreatedAt(LocalDateTime.now());
        transition = transitionRepository.save(transition);

        log.info("Created transition: workflowId={}, {} -> {}, permission={}",
                workflowId, from.getCode(), to.getCode(), transition.getRequiredPermission());
        return transition;
    }

    @Transactional
    public void deleteTransition(@NotNull UUID workflowId, @NotNull UUID transitionId) {
        WorkflowTransition transition = transitionRepository.findById(transitionId)
                .filter(t -> t.getWorkflowId().equals(workflowId))
                .orElseThrow(() -> new EntityNotFoundException("Transition not found: " + transitionId));
        transitionRepository.delete(transition);
        log.info("Deleted transition: workflowId={}, transitionId={}", workflowId, transitionId);
    }

    private WorkflowStage getStageInWorkflow(UUID workflowId, UUID stageId) {
        return stageRepository.findById(stageId)
                .filter(stage -> stage.getWorkflowId().equals(workflowId))
                .orElseThrow(() -> new EntityNotFoundException("Stage not found: " + stageId));
    }

    private static void validateRequiredStages(List<StageDefinition> stages) {
        Set<String> codes = new LinkedHashSet<>();
        stages.forEach(stage -> codes.add(normalizeCode(stage.code())));

        List<String> missing = REQUIRED_STAGE_CODES.stream()
                .filter(code -> !codes.contains(code))
                .toList();
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException(String.format(
                    "Workflow must include required stages: %s. These stages are mandatory for proper contract flow.",
                    String.join(", ", missing)));
        }
    }

    private static String normalizeCode(String code) {
        return code == null ? null : code.trim().toUpperCase(Locale.ROOT);
    }

    private static String colorOrDefault(String color) {
        return color == null || color.isBlank() ? WorkflowStage.DEFAULT_COLOR : color;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
