package com.loandesk.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Bonus granted by a KPI tier: either a fraction of the month's disbursement or a fixed amount.
 */
public sealed interface KpiReward permits KpiReward.Rate, KpiReward.FixedAmount {

    /**
     * @param totalDisbursement disbursement volume of the evaluated month
     * @return bonus amount, scale 2
     */
    BigDecimal bonusFor(BigDecimal totalDisbursement);

    record Rate(BigDecimal fraction) implements KpiReward {
        @Override
        public BigDecimal bonusFor(BigDecimal totalDisbursement) {
            return totalDisbursement.multiply(fraction).setScale(2, RoundingMode.HALF_UP);
        }
    }

    record FixedAmount(BigDecimal amount) implements KpiReward {
        @Override
        public BigDecimal bonusFor(BigDecimal totalDisbursement) {
            return amount.setScale(2, RoundingMode.HALF_UP);
        }
    }
}
