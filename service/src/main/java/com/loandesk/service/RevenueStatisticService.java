package com.loandesk.service;

import com.loandesk.api.model.StatisticPeriod;
import com.loandesk.api.response.CreatorRevenueResponse;
import com.loandesk.api.response.RevenueStatisticsResponse;
import com.loandesk.config.LoanDeskProperties;
import com.loandesk.dto.CreatorRevenue;
import com.loandesk.dto.RevenueTotals;
import com.loandesk.repository.ContractRepository;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.TemporalAdjusters;
import java.time.temporal.WeekFields;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Disbursement and revenue reporting over contracts.
 * Only contracts with a recorded disbursement count; a contract is attributed to the bucket of its
 * last update.
 */
@Service
@Validated
@AllArgsConstructor
public class RevenueStatisticService {

    static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59, 999_000_000);

    private final ContractRepository contractRepository;
    private final LoanDeskProperties properties;

    /**
     * Totals of the DAY, WEEK, MONTH or YEAR bucket containing {@code date}.
     */
    public RevenueStatisticsResponse getRevenueStatistics(@NotNull StatisticPeriod period, @NotNull LocalDate date) {
        Bounds bounds = periodBounds(period, date, properties.getStatistics().getWeekLocale());
        RevenueTotals totals = contractRepository.sumRevenueBetween(bounds.from(), bounds.to());
        return new RevenueStatisticsResponse(period, bounds.from(), bounds.to(),
                totals == null || totals.contractCount() == null ? 0 : totals.contractCount(),
                zeroIfNull(totals == null ? null : totals.totalDisbursed()),
                zeroIfNull(totals == null ? null : totals.totalRevenue()));
    }

    /**
     * Totals per creator between two days, both inclusive, highest revenue first. Contracts opened
     * by their owners are attributed to the owner.
     */
    public List<CreatorRevenueResponse> getRevenueByCreator(@NotNull LocalDate from, @NotNull LocalDate to) {
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("'from' must not be after 'to'");
        }
        List<CreatorRevenue> rows = contractRepository.sumRevenueByCreatorBetween(from.atStartOfDay(),
                to.atTime(END_OF_DAY));
        return rows.stream()
                .map(row -> new CreatorRevenueResponse(row.creatorId(),
                        row.contractCount() == null ? 0 : row.contractCount(),
                        zeroIfNull(row.totalDisbursed()), zeroIfNull(row.totalRevenue())))
                .sorted(Comparator.comparing(CreatorRevenueResponse::totalRevenue).reversed())
                .toList();
    }

    /**
     * Inclusive bounds of the bucket containing {@code date}. Weeks start on the first day of the
     * week of {@code locale}.
     */
    static Bounds periodBounds(StatisticPeriod period, LocalDate date, Locale locale) {
        LocalDate first;
        LocalDate last;
        switch (period) {
            case DAY -> {
                first = date;
                last = date;
            }
            case WEEK -> {
                first = date.with(TemporalAdjusters.previousOrSame(WeekFields.of(locale).getFirstDayOfWeek()));
                last = first.plusDays(6);
            }
            case MONTH -> {
                first = date.withDayOfMonth(1);
                last = date.with(TemporalAdjusters.lastDayOfMonth());
            }
            case YEAR -> {
                first = date.withDayOfYear(1);
                last = date.with(TemporalAdjusters.lastDayOfYear());
            }
            default -> throw new IllegalArgumentException("Unsupported period: " + period);
        }
        return new Bounds(first.atStartOfDay(), last.atTime(END_OF_DAY));
    }

    private static BigDecimal zeroIfNull(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    record Bounds(LocalDateTime from, LocalDateTime to) {
    }
}
