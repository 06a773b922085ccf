package com.loandesk.api.response;

import java.math.BigDecimal;

/**
 * Commission overview of one user.
 *
 * @param totalEarned                sum of commission and KPI bonus credits ever received
 * @param currentMonthContracts      commission records created this month
 * @param currentMonthCommission     commission amount of those records
 * @param currentMonthDisbursement   disbursement volume behind those records
 * @param referredUsers              users who registered with this user as referrer
 * @param walletBalance              current wallet balance
 */
public record CommissionSummaryResponse(
        BigDecimal totalEarned,
        long currentMonthContracts,
        BigDecimal currentMonthCommission,
        BigDecimal currentMonthDisbursement,
        long referredUsers,
        BigDecimal walletBalance
) {}
