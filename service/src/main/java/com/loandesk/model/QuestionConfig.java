package com.loandesk.model;

import java.util.List;

/**
 * Rendering hints of a question, stored as JSON.
 */
public record QuestionConfig(
        List<String> options,
        String placeholder,
        Integer maxLength
) {
}
