package com.loandesk.api.model;

/**
 * Reporting bucket used by revenue statistics.
 */
public enum StatisticPeriod {
    DAY,
    WEEK,
    MONTH,
    YEAR
}
