package com.loandesk.api.request;

import com.loandesk.api.model.QuestionType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.List;

public record CreateQuestionRequest(
        @NotBlank(message = "Question content is required")
        String content,

        @NotNull(message = "Question type is required")
        QuestionType type,

        List<String> options,

        String placeholder,

        @Positive(message = "Maximum length must be positive")
        Integer maxLength
) {
}
