package com.loandesk.api.response;

import com.loandesk.api.model.StatisticPeriod;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Disbursement and revenue totals of one reporting bucket. Both bounds are inclusive.
 */
public record RevenueStatisticsResponse(
        StatisticPeriod period,
        LocalDateTime from,
        LocalDateTime to,
        long contractCount,
        BigDecimal totalDisbursed,
        BigDecimal totalRevenue
) {}
