package com.loandesk.api.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * Request for creating a new workflow version.
 * <p>
 * When {@code stages} is supplied it must contain DRAFT, SUBMITTED and COMPLETED.
 * Creating a workflow deactivates every earlier version with the same name.
 * </p>
 */
public record CreateWorkflowRequest(
        @NotBlank(message = "Workflow name is required")
        String name,

        String description,

        List<@Valid StageDefinition> stages,

        List<@Valid TransitionDefinition> transitions
) {
}
