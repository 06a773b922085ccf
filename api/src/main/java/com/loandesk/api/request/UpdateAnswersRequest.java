package com.loandesk.api.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record UpdateAnswersRequest(
        @NotEmpty(message = "At least one answer is required")
        List<@Valid AnswerRequest> answers
) {
}
