package com.loandesk.dto;

import java.math.BigDecimal;

/**
 * Aggregated disbursement and revenue of contracts in a time range. Sums are {@code null} when no
 * contract matched.
 */
public record RevenueTotals(Long contractCount, BigDecimal totalDisbursed, BigDecimal totalRevenue) {
}
