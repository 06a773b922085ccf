package com.loandesk.api.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;

/**
 * @param roleCode role the rate applies to (CTV, USER, ...)
 * @param rate     fraction of contract revenue paid to the referrer, e.g. 0.05 for 5%
 */
public record CreateCommissionConfigRequest(
        @NotBlank(message = "Role code is required")
        String roleCode,

        @NotNull(message = "Rate is required")
        @DecimalMin(value = "0", message = "Rate must be between 0 and 1")
        @DecimalMax(value = "1", message = "Rate must be between 0 and 1")
        BigDecimal rate
) {
}
