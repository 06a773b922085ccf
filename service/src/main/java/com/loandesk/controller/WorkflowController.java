package com.loandesk.controller;

import com.loandesk.api.WorkflowApi;
import com.loandesk.api.dto.PagedResponse;
import com.loandesk.api.dto.StageDTO;
import com.loandesk.api.dto.TransitionDTO;
import com.loandesk.api.dto.WorkflowDTO;
import com.loandesk.api.request.CreateStageRequest;
import com.loandesk.api.request.CreateTransitionRequest;
import com.loandesk.api.request.CreateWorkflowRequest;
import com.loandesk.api.request.StageDefinition;
import com.loandesk.api.request.UpdateStageRequest;
import com.loandesk.api.request.UpdateWorkflowRequest;
import com.loandesk.api.response.TransitionCheckResponse;
import com.loandesk.dto.WorkflowGraph;
import com.loandesk.mapper.WorkflowMapper;
import com.loandesk.model.Workflow;
import com.loandesk.model.WorkflowStage;
import com.loandesk.model.WorkflowTransition;
import com.loandesk.service.WorkflowService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class WorkflowController implements WorkflowApi {

    private final WorkflowService workflowService;
    private final Paging paging;

    @Override
    public ResponseEntity<WorkflowDTO> createWorkflow(CreateWorkflowRequest request) {
        WorkflowGraph graph = workflowService.createWorkflow(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(WorkflowMapper.INSTANCE.toDTO(graph));
    }

    @Override
    public ResponseEntity<PagedResponse<WorkflowDTO>> listWorkflows(int page, int size) {
        Page<Workflow> workflows = workflowService.findAll(paging.of(page, size));
        PagedResponse<WorkflowDTO> response = Paging.toResponse(workflows, WorkflowMapper.INSTANCE::toDTO);
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<List<StageDefinition>> getDefaultStages() {
        return ResponseEntity.ok(workflowService.getDefaultStages());
    }

    @Override
    public ResponseEntity<WorkflowDTO> getWorkflow(UUID workflowId) {
        return ResponseEntity.ok(WorkflowMapper.INSTANCE.toDTO(workflowService.getWorkflowGraph(workflowId)));
    }

    @Override
    public ResponseEntity<WorkflowDTO> updateWorkflow(UUID workflowId, UpdateWorkflowRequest request) {
        workflowService.updateWorkflow(workflowId, request);
        return ResponseEntity.ok(WorkflowMapper.INSTANCE.toDTO(workflowService.getWorkflowGraph(workflowId)));
    }

    @Override
    public ResponseEntity<List<TransitionDTO>> getAvailableTransitions(UUID workflowId, UUID stageId) {
        return ResponseEntity.ok(WorkflowMapper.INSTANCE.toAvailableDTOList(
                workflowService.getAvailableTransitions(workflowId, stageId)));
    }

    @Override
    public ResponseEntity<TransitionCheckResponse> checkTransition(UUID workflowId, UUID fromStageId, UUID toStageId,
                                                                   UUID actorId) {
        return ResponseEntity.ok(workflowService.canTransition(workflowId, fromStageId, toStageId, actorId));
    }

    // ==================== Stages ====================

    @Override
    public ResponseEntity<StageDTO> createStage(UUID workflowId, CreateStageRequest request) {
        WorkflowStage stage = workflowService.createStage(workflowId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(WorkflowMapper.INSTANCE.toDTO(stage));
    }

    @Override
    public ResponseEntity<StageDTO> updateStage(UUID workflowId, UUID stageId, UpdateStageRequest request) {
        return ResponseEntity.ok(WorkflowMapper.INSTANCE.toDTO(workflowService.updateStage(workflowId, stageId, request)));
    }

    @Override
    public ResponseEntity<Void> deleteStage(UUID workflowId, UUID stageId) {
        workflowService.deleteStage(workflowId, stageId);
        return ResponseEntity.noContent().build();
    }

    // ==================== Transitions ====================

    @Override
    public ResponseEntity<TransitionDTO> createTransition(UUID workflowId, CreateTransitionRequest request) {
        WorkflowTransition transition = workflowService.createTransition(workflowId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(WorkflowMapper.INSTANCE.toDTO(transition));
    }

    @Override
    public ResponseEntity<Void> deleteTransition(UUID workflowId, UUID transitionId) {
        workflowService.deleteTransition(workflowId, transitionId);
        return ResponseEntity.noContent().build();
    }
}
