package com.loandesk.dto;

import com.loandesk.model.KpiCommissionTier;

import java.math.BigDecimal;

/**
 * Tier reached in a month and the bonus it yields. {@code tier} is {@code null} when no tier matched.
 */
public record KpiTierResult(KpiCommissionTier tier, BigDecimal bonus) {

    public static KpiTierResult none() {
        return new KpiTierResult(null, BigDecimal.ZERO);
    }
}
