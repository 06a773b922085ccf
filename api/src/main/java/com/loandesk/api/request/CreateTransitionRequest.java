package com.loandesk.api.request;

import jakarta.validation.constraints.NotNull;

import java.util.UUID;

public record CreateTransitionRequest(
        @NotNull(message = "From stage is required")
        UUID fromStageId,

        @NotNull(message = "To stage is required")
        UUID toStageId,

        String requiredPermission
) {
}
