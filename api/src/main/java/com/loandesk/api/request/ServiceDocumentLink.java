package com.loandesk.api.request;

import jakarta.validation.constraints.NotNull;

import java.util.UUID;

public record ServiceDocumentLink(
        @NotNull(message = "Document requirement ID is required")
        UUID documentRequirementId,

        Boolean required
) {
}
