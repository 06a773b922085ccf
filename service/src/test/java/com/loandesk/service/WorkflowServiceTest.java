package com.loandesk.service;

import com.loandesk.api.request.CreateTransitionRequest;
import com.loandesk.api.request.CreateWorkflowRequest;
import com.loandesk.api.request.StageDefinition;
import com.loandesk.api.request.TransitionDefinition;
import com.loandesk.dto.WorkflowGraph;
import com.loandesk.error.ResourceConflictException;
import com.loandesk.model.Workflow;
import com.loandesk.model.WorkflowStage;
import com.loandesk.model.WorkflowTransition;
import com.loandesk.repository.ContractRepository;
import com.loandesk.repository.WorkflowRepository;
import com.loandesk.repository.WorkflowStageRepository;
import com.loandesk.repository.WorkflowTransitionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkflowServiceTest {

    @Mock
    private WorkflowRepository workflowRepository;

    @Mock
    private WorkflowStageRepository stageRepository;

    @Mock
    private WorkflowTransitionRepository transitionRepository;

    @Mock
    private ContractRepository contractRepository;

    @Mock
    private WorkflowTransitionGuard transitionGuard;

    @InjectMocks
    private WorkflowService workflowService;

    @BeforeEach
    void setUp() {
        lenient().when(workflowRepository.save(any(Workflow.class))).thenAnswer(inv -> {
            Workflow workflow = inv.getArgument(0);
            workflow.setId(UUID.randomUUID());
            return workflow;
        });
        lenient().when(stageRepository.save(any(WorkflowStage.class))).thenAnswer(inv -> {
            WorkflowStage stage = inv.getArgument(0);
            stage.setId(UUID.randomUUID());
            return stage;
        });
        lenient().when(transitionRepository.save(any(WorkflowTransition.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    @Test
    void createWorkflowRejectsMissingRequiredStages() {
        CreateWorkflowRequest request = new CreateWorkflowRequest("Consumer loan", null,
                List.of(stage("DRAFT", 0), stage("SUBMITTED", 1)), List.of());

        assertThatThrownBy(() -> workflowService.createWorkflow(request))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("COMPLETED");

        verify(workflowRepository, never()).save(any(Workflow.class));
    }

    @Test
    void createWorkflowRejectsTransitionToUnknownStage() {
        CreateWorkflowRequest request = new CreateWorkflowRequest("Consumer loan", null,
                List.of(stage("DRAFT", 0), stage("SUBMITTED", 1), stage("COMPLETED", 2)),
                List.of(new TransitionDefinition("DRAFT", "ARCHIVED", null)));

        assertThatThrownBy(() -> workflowService.createWorkflow(request))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid stage code in transition");
    }

    @Test
    void createWorkflowRejectsDuplicateStageCodes() {
        CreateWorkflowRequest request = new CreateWorkflowRequest("Consumer loan", null,
                List.of(stage("DRAFT", 0), stage("draft", 1), stage("SUBMITTED", 2), stage("COMPLETED", 3)),
                List.of());

        assertThatThrownBy(() -> workflowService.createWorkflow(request))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Duplicate stage code: DRAFT");
    }

    @Test
    void createWorkflowBumpsVersionAndDeactivatesOlderVersions() {
        when(workflowRepository.findMaxVersionByName("Consumer loan")).thenReturn(2);
        CreateWorkflowRequest request = new CreateWorkflowRequest("Consumer loan", "v3",
                List.of(stage("completed", 2), stage("draft", 0), stage("submitted", 1)),
                List.of(new TransitionDefinition("DRAFT", "SUBMITTED", null),
                        new TransitionDefinition("SUBMITTED", "COMPLETED", "contract.complete")));

        WorkflowGraph graph = workflowService.createWorkflow(request);

        assertThat(graph.workflow().getVersion()).isEqualTo(3);
        assertThat(graph.workflow().isActive()).isTrue();
        assertThat(graph.stages()).extracting(WorkflowStage::getCode)
                .containsExactly("DRAFT", "SUBMITTED", "COMPLETED");
        assertThat(graph.stages()).allMatch(WorkflowStage::isRequired);
        assertThat(graph.transitions()).hasSize(2);
        assertThat(graph.transitions().get(1).getRequiredPermission()).isEqualTo("contract.complete");
        verify(workflowRepository).deactivateOtherVersions(eq("Consumer loan"), eq(graph.workflow().getId()), any());
    }

    @Test
    void initialStageIsLowestOrderedStage() {
        UUID workflowId = UUID.randomUUID();
        WorkflowStage draft = new WorkflowStage();
        draft.setCode("DRAFT");
        when(stageRepository.findFirstByWorkflowIdOrderByStageOrderAsc(workflowId)).thenReturn(Optional.of(draft));

        assertThat(workflowService.getInitialStage(workflowId)).isSameAs(draft);
    }

    @Test
    void initialStageOfEmptyWorkflowIsRejected() {
        UUID workflowId = UUID.randomUUID();
        when(stageRepository.findFirstByWorkflowIdOrderByStageOrderAsc(workflowId)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> workflowService.getInitialStage(workflowId))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Service workflow has no stages");
    }

    @Test
    void requiredStageCannotBeDeleted() {
        UUID workflowId = UUID.randomUUID();
        UUID stageId = UUID.randomUUID();
        WorkflowStage submitted = new WorkflowStage();
        submitted.setId(stageId);
        submitted.setWorkflowId(workflowId);
        submitted.setCode("SUBMITTED");
        submitted.setRequired(true);
        lenient().when(stageRepository.findById(stageId)).thenReturn(Optional.of(submitted));
        lenient().when(contractRepository.countByCurrentStageId(stageId)).thenReturn(0L);

        assertThatThrownBy(() -> workflowService.deleteStage(workflowId, stageId))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Cannot delete required stage: SUBMITTED");
        verify(stageRepository, never()).delete(any(WorkflowStage.class));
    }

    @Test
    void occupiedStageCannotBeDeleted() {
        UUID workflowId = UUID.randomUUID();
        WorkflowStage reviewing = stageEntity(workflowId, "REVIEWING");
        when(stageRepository.findById(reviewing.getId())).thenReturn(Optional.of(reviewing));
        when(contractRepository.countByCurrentStageId(reviewing.getId())).thenReturn(3L);

        assertThatThrownBy(() -> workflowService.deleteStage(workflowId, reviewing.getId()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Cannot delete stage: 3 contract(s) are using this stage");
        verify(transitionRepository, never()).deleteTouchingStage(any());
        verify(stageRepository, never()).delete(any(WorkflowStage.class));
    }

    @Test
    void emptyOptionalStageIsDeletedWithItsTransitions() {
        UUID workflowId = UUID.randomUUID();
        WorkflowStage reviewing = stageEntity(workflowId, "REVIEWING");
        when(stageRepository.findById(reviewing.getId())).thenReturn(Optional.of(reviewing));
        when(contractRepository.countByCurrentStageId(reviewing.getId())).thenReturn(0L);
        when(transitionRepository.deleteTouchingStage(reviewing.getId())).thenReturn(2);

        workflowService.deleteStage(workflowId, reviewing.getId());

        verify(stageRepository).delete(reviewing);
    }

    @Test
    void duplicateTransitionIsRejected() {
        UUID workflowId = UUID.randomUUID();
        WorkflowStage draft = stageEntity(workflowId, "DRAFT");
        WorkflowStage submitted = stageEntity(workflowId, "SUBMITTED");
        when(workflowRepository.findById(workflowId)).thenReturn(Optional.of(new Workflow()));
        when(stageRepository.findById(draft.getId())).thenReturn(Optional.of(draft));
        when(stageRepository.findById(submitted.getId())).thenReturn(Optional.of(submitted));
        when(transitionRepository.existsByWorkflowIdAndFromStageIdAndToStageId(workflowId, draft.getId(),
                submitted.getId())).thenReturn(true);

        assertThatThrownBy(() -> workflowService.createTransition(workflowId,
                new CreateTransitionRequest(draft.getId(), submitted.getId(), null)))
                .isInstanceOf(ResourceConflictException.class)
                .hasMessage("This transition already exists");
        verify(transitionRepository, never()).save(any(WorkflowTransition.class));
    }

    @Test
    void transitionToStageOfAnotherWorkflowIsRejected() {
        UUID workflowId = UUID.randomUUID();
        WorkflowStage draft = stageEntity(workflowId, "DRAFT");
        WorkflowStage foreign = stageEntity(UUID.randomUUID(), "SUBMITTED");
        when(workflowRepository.findById(workflowId)).thenReturn(Optional.of(new Workflow()));
        when(stageRepository.findById(draft.getId())).thenReturn(Optional.of(draft));
        when(stageRepository.findById(foreign.getId())).thenReturn(Optional.of(foreign));

        assertThatThrownBy(() -> workflowService.createTransition(workflowId,
                new CreateTransitionRequest(draft.getId(), foreign.getId(), null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("To stage not found in this workflow");
        verify(transitionRepository, never()).save(any(WorkflowTransition.class));
    }

    private static WorkflowStage stageEntity(UUID workflowId, String code) {
        WorkflowStage stage = new WorkflowStage();
        stage.setId(UUID.randomUUID());
        stage.setWorkflowId(workflowId);
        stage.setCode(code);
        return stage;
    }

    private static StageDefinition stage(String code, int order) {
        return new StageDefinition(code, code.substring(0, 1).toUpperCase() + code.substring(1).toLowerCase(),
                order, null, "COMPLETED".equalsIgnoreCase(code));
    }
}
