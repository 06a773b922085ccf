package com.loandesk.event;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Published when a contract enters a commission-triggering stage. Handled after the stage
 * change commits.
 *
 * @param contractId         the contract
 * @param ownerId            owner of the contract, whose referrer earns the commission
 * @param disbursementAmount disbursed loan amount
 * @param revenuePercentage  revenue share of the disbursement, in percent
 * @param totalRevenue       revenue the commission is computed from
 */
public record CommissionTriggeredEvent(
        UUID contractId,
        UUID ownerId,
        BigDecimal disbursementAmount,
        BigDecimal revenuePercentage,
        BigDecimal totalRevenue
) {
}
