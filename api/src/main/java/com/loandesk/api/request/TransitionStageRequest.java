package com.loandesk.api.request;

import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Request for moving a contract to another stage.
 * <p>
 * {@code disbursementAmount} and {@code revenuePercentage} are mandatory when the destination stage
 * triggers commission processing and the loan product has commissions enabled.
 * </p>
 */
public record TransitionStageRequest(
        @NotNull(message = "Target stage is required")
        UUID toStageId,

        String note,

        BigDecimal disbursementAmount,

        BigDecimal revenuePercentage
) {
}
