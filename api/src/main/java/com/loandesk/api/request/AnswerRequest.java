package com.loandesk.api.request;

import jakarta.validation.constraints.NotNull;

import java.util.UUID;

public record AnswerRequest(
        @NotNull(message = "Question ID is required")
        UUID questionId,

        String answer
) {
}
