package com.loandesk.api;

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
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Workflow API: versioned stage graphs that loan contracts move through.
 *
 * <p>This interface is implemented by:
 * <ul>
 *   <li>WorkflowController - in service module (server-side implementation)</li>
 *   <li>WorkflowClient - in api module (WebClient-based client for consumers)</li>
 * </ul>
 */
@RequestMapping("/api/v1/workflows")
public interface WorkflowApi {

    /**
     * Creates a new version of a workflow and deactivates older versions with the same name.
     *
     * @param request workflow name, stages and transitions (transitions reference stage codes)
     * @return the created workflow with its stages and transitions
     */
    @PostMapping
    ResponseEntity<WorkflowDTO> createWorkflow(@RequestBody @Valid CreateWorkflowRequest request);

    @GetMapping
    ResponseEntity<PagedResponse<WorkflowDTO>> listWorkflows(
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "20") int size);

    /**
     * Returns the seven-stage template used as a starting point for new workflows.
     */
    @GetMapping("/default-stages")
    ResponseEntity<List<StageDefinition>> getDefaultStages();

    @GetMapping("/{workflowId}")
    ResponseEntity<WorkflowDTO> getWorkflow(@PathVariable("workflowId") UUID workflowId);

    /**
     * Updates workflow metadata. Stage completeness is not re-validated.
     */
    @PutMapping("/{workflowId}")
    ResponseEntity<WorkflowDTO> updateWorkflow(@PathVariable("workflowId") UUID workflowId,
                                               @RequestBody @Valid UpdateWorkflowRequest request);

    /**
     * Lists transitions leaving a stage, each with its destination stage.
     */
    @GetMapping("/{workflowId}/stages/{stageId}/transitions")
    ResponseEntity<List<TransitionDTO>> getAvailableTransitions(@PathVariable("workflowId") UUID workflowId,
                                                                @PathVariable("stageId") UUID stageId);

    /**
     * Checks whether the acting user may move a contract between two stages.
     */
    @GetMapping("/{workflowId}/transitions/check")
    ResponseEntity<TransitionCheckResponse> checkTransition(@PathVariable("workflowId") UUID workflowId,
                                                            @RequestParam("fromStageId") UUID fromStageId,
                                                            @RequestParam("toStageId") UUID toStageId,
                                                            @RequestHeader(ApiHeaders.USER_ID) UUID actorId);

    @PostMapping("/{workflowId}/stages")
    ResponseEntity<StageDTO> createStage(@PathVariable("workflowId") UUID workflowId,
                                         @RequestBody @Valid CreateStageRequest request);

    @PutMapping("/{workflowId}/stages/{stageId}")
    ResponseEntity<StageDTO> updateStage(@PathVariable("workflowId") UUID workflowId,
                                         @PathVariable("stageId") UUID stageId,
                                         @RequestBody @Valid UpdateStageRequest request);

    /**
     * Deletes a stage together with every transition touching it.
     * Fails while any contract currently sits in the stage.
     */
    @DeleteMapping("/{workflowId}/stages/{stageId}")
    ResponseEntity<Void> deleteStage(@PathVariable("workflowId") UUID workflowId,
                                     @PathVariable("stageId") UUID stageId);

    @PostMapping("/{workflowId}/transitions")
    ResponseEntity<TransitionDTO> createTransition(@PathVariable("workflowId") UUID workflowId,
                                                   @RequestBody @Valid CreateTransitionRequest request);

    @DeleteMapping("/{workflowId}/transitions/{transitionId}")
    ResponseEntity<Void> deleteTransition(@PathVariable("workflowId") UUID workflowId,
                                          @PathVariable("transitionId") UUID transitionId);
}
