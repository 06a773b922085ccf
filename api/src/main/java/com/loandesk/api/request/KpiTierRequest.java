package com.loandesk.api.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;

/**
 * Create or replace a KPI tier. Exactly one of {@code bonusRate} and {@code bonusAmount} must be given.
 */
public record KpiTierRequest(
        @NotBlank(message = "Tier name is required")
        String name,

        @NotBlank(message = "Role code is required")
        String roleCode,

        @PositiveOrZero(message = "Minimum contracts must not be negative")
        Integer minContracts,

        @DecimalMin(value = "0", message = "Minimum disbursement must not be negative")
        BigDecimal minDisbursement,

        @DecimalMin(value = "0", message = "Bonus rate must be between 0 and 1")
        @DecimalMax(value = "1", message = "Bonus rate must be between 0 and 1")
        BigDecimal bonusRate,

        @DecimalMin(value = "0", message = "Bonus amount must not be negative")
        BigDecimal bonusAmount,

        @NotNull(message = "Tier order is required")
        Integer tierOrder,

        Boolean active
) {
}
