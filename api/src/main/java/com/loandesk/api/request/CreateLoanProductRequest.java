package com.loandesk.api.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Request for creating a loan product. Loan bounds default to 1,000,000 and 100,000,000.
 */
public record CreateLoanProductRequest(
        @NotBlank(message = "Service name is required")
        String name,

        String description,

        @NotNull(message = "Workflow ID is required")
        UUID workflowId,

        @Positive(message = "Minimum loan amount must be positive")
        BigDecimal minLoanAmount,

        @Positive(message = "Maximum loan amount must be positive")
        BigDecimal maxLoanAmount,

        Boolean commissionEnabled,

        List<@Valid ServiceDocumentLink> documents,

        List<@Valid ServiceQuestionLink> questions
) {
}
