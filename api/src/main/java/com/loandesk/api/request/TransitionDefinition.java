package com.loandesk.api.request;

import jakarta.validation.constraints.NotBlank;

/**
 * Transition entry of a workflow definition, referencing stages by code.
 */
public record TransitionDefinition(
        @NotBlank(message = "From stage code is required")
        String fromStageCode,

        @NotBlank(message = "To stage code is required")
        String toStageCode,

        String requiredPermission
) {
}
