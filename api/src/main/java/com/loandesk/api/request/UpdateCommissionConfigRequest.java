package com.loandesk.api.request;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;

import java.math.BigDecimal;

public record UpdateCommissionConfigRequest(
        @DecimalMin(value = "0", message = "Rate must be between 0 and 1")
        @DecimalMax(value = "1", message = "Rate must be between 0 and 1")
        BigDecimal rate,

        Boolean active
) {
}
