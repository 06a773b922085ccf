package com.loandesk.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.util.List;

public record CreateDocumentRequirementRequest(
        @NotBlank(message = "Document code is required")
        String code,

        @NotBlank(message = "Document name is required")
        String name,

        String description,

        @PositiveOrZero(message = "Minimum files must not be negative")
        Integer minFiles,

        @Positive(message = "Maximum files must be positive")
        Integer maxFiles,

        List<String> allowedTypes,

        @Positive(message = "Maximum size must be positive")
        Long maxSizeBytes,

        @Positive(message = "Expiration must be positive")
        Integer expirationDays
) {
}
