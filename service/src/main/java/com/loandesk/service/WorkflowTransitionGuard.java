package com.loandesk.service;

import com.loandesk.api.response.TransitionCheckResponse;
import com.loandesk.error.ForbiddenOperationException;
import com.loandesk.model.WorkflowTransition;
import com.loandesk.repository.WorkflowTransitionRepository;
import lombok.AllArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

/**
 * Decides whether an actor may move a contract between two stages of a workflow.
 *
 * <p>A move is allowed when:
 * <ul>
 *   <li>the workflow has a transition {@code from -> to}, and</li>
 *   <li>the transition has no required permission, or the actor holds it.</li>
 * </ul>
 * Stage graphs are data, so unlike a fixed status enum the edges are read from
 * {@code workflow_transition} on every check.
 */
@Component
@AllArgsConstructor
public class WorkflowTransitionGuard {

    static final String INVALID_TRANSITION = "Invalid transition";
    static final String MISSING_PERMISSION = "Missing permission: ";

    private final WorkflowTransitionRepository transitionRepository;
    private final RbacService rbacService;

    public TransitionCheckResponse check(UUID workflowId, UUID fromStageId, UUID toStageId, UUID actorId) {
        if (workflowId == null || fromStageId == null || toStageId == null) {
            return TransitionCheckResponse.deny(INVALID_TRANSITION);
        }

        Optional<WorkflowTransition> transition =
                transitionRepository.findByWorkflowIdAndFromStageIdAndToStageId(workflowId, fromStageId, toStageId);
        if (transition.isEmpty()) {
            return TransitionCheckResponse.deny(INVALID_TRANSITION);
        }

        String requiredPermission = transition.get().getRequiredPermission();
        if (requiredPermission != null && !requiredPermission.isBlank()
                && !rbacService.hasPermission(actorId, requiredPermission)) {
            return TransitionCheckResponse.deny(MISSING_PERMISSION + requiredPermission);
        }
        return TransitionCheckResponse.allow();
    }

    /**
     * Same as {@link #check} but throws when the move is refused.
     *
     * @throws ForbiddenOperationException carrying the refusal reason
     */
    public void validate(UUID workflowId, UUID fromStageId, UUID toStageId, UUID actorId) {
        TransitionCheckResponse result = check(workflowId, fromStageId, toStageId, actorId);
        if (!result.allowed()) {
            throw new ForbiddenOperationException(result.reason());
        }
    }
}
