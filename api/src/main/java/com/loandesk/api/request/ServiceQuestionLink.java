package com.loandesk.api.request;

import jakarta.validation.constraints.NotNull;

import java.util.UUID;

public record ServiceQuestionLink(
        @NotNull(message = "Question ID is required")
        UUID questionId,

        Boolean required,

        Integer sortOrder
) {
}
