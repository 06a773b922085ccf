package com.loandesk.api.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

public record UpdateDisbursementRequest(
        @NotNull(message = "Disbursed amount is required")
        @Positive(message = "Disbursed amount must be positive")
        BigDecimal amount
) {
}
