package com.loandesk.dto;

import java.math.BigDecimal;

/**
 * Commission rate that applies to a referrer, and the role it was resolved from ({@code null} when
 * no config matched and the rate is zero).
 */
public record ReferrerRate(BigDecimal rate, String roleCode) {

    public static ReferrerRate none() {
        return new ReferrerRate(BigDecimal.ZERO, null);
    }

    public boolean isZero() {
        return rate.signum() == 0;
    }
}
