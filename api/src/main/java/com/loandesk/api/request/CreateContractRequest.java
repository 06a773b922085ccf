package com.loandesk.api.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Request for opening a loan contract.
 *
 * @param serviceId       loan product to apply for
 * @param requestedAmount amount requested, checked against the product's loan bounds
 * @param targetUserId    beneficiary when an agent creates the contract for somebody else
 * @param answers         optional initial answers
 */
public record CreateContractRequest(
        @NotNull(message = "Service ID is required")
        UUID serviceId,

        @NotNull(message = "Requested amount is required")
        @Positive(message = "Requested amount must be positive")
        BigDecimal requestedAmount,

        UUID targetUserId,

        List<@Valid AnswerRequest> answers
) {
}
