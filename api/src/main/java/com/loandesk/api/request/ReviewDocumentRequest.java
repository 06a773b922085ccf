package com.loandesk.api.request;

import com.loandesk.api.model.DocumentStatus;
import jakarta.validation.constraints.NotNull;

public record ReviewDocumentRequest(
        @NotNull(message = "Review status is required")
        DocumentStatus status,

        String note
) {
}
