package com.loandesk.service;

import com.loandesk.api.model.StatisticPeriod;
import com.loandesk.api.response.CreatorRevenueResponse;
import com.loandesk.api.response.RevenueStatisticsResponse;
import com.loandesk.config.LoanDeskProperties;
import com.loandesk.dto.CreatorRevenue;
import com.loandesk.repository.ContractRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RevenueStatisticServiceTest {

    // Wednesday
    private static final LocalDate DATE = LocalDate.of(2025, 3, 12);

    @Mock
    private ContractRepository contractRepository;

    private RevenueStatisticService statisticService;

    @BeforeEach
    void setUp() {
        statisticService = new RevenueStatisticService(contractRepository, new LoanDeskProperties());
    }

    @Test
    void dayBucketCoversWholeDay() {
        RevenueStatisticService.Bounds bounds = RevenueStatisticService.periodBounds(StatisticPeriod.DAY, DATE,
                Locale.US);

        assertThat(bounds.from()).isEqualTo(LocalDateTime.of(2025, 3, 12, 0, 0));
        assertThat(bounds.to()).isEqualTo(LocalDateTime.of(2025, 3, 12, 23, 59, 59, 999_000_000));
    }

    @Test
    void weekStartDependsOnLocale() {
        assertThat(RevenueStatisticService.periodBounds(StatisticPeriod.WEEK, DATE, Locale.US).from().toLocalDate())
                .isEqualTo(LocalDate.of(2025, 3, 9));
        assertThat(RevenueStatisticService.periodBounds(StatisticPeriod.WEEK, DATE, Locale.FRANCE).from().toLocalDate())
                .isEqualTo(LocalDate.of(2025, 3, 10));
        assertThat(RevenueStatisticService.periodBounds(StatisticPeriod.WEEK, DATE, Locale.FRANCE).to().toLocalDate())
                .isEqualTo(LocalDate.of(2025, 3, 16));
    }

    @Test
    void monthAndYearBuckets() {
        assertThat(RevenueStatisticService.periodBounds(StatisticPeriod.MONTH, LocalDate.of(2024, 2, 10), Locale.US))
                .isEqualTo(new RevenueStatisticService.Bounds(LocalDateTime.of(2024, 2, 1, 0, 0),
                        LocalDateTime.of(2024, 2, 29, 23, 59, 59, 999_000_000)));
        assertThat(RevenueStatisticService.periodBounds(StatisticPeriod.YEAR, DATE, Locale.US).to())
                .isEqualTo(LocalDateTime.of(2025, 12, 31, 23, 59, 59, 999_000_000));
    }

    @Test
    void emptyBucketReportsZeros() {
        when(contractRepository.sumRevenueBetween(any(), any())).thenReturn(null);

        RevenueStatisticsResponse response = statisticService.getRevenueStatistics(StatisticPeriod.MONTH, DATE);

        assertThat(response.contractCount()).isZero();
        assertThat(response.totalDisbursed()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(response.totalRevenue()).isEqualByComparingTo(BigDecimal.ZERO);
    }

    @Test
    void creatorsAreOrderedByRevenue() {
        UUID small = UUID.randomUUID();
        UUID large = UUID.randomUUID();
        when(contractRepository.sumRevenueByCreatorBetween(any(), any())).thenReturn(List.of(
                new CreatorRevenue(small, 1L, new BigDecimal("1000000"), new BigDecimal("50000")),
                new CreatorRevenue(large, 3L, new BigDecimal("9000000"), new BigDecimal("450000"))));

        List<CreatorRevenueResponse> rows = statisticService.getRevenueByCreator(DATE.minusDays(30), DATE);

        assertThat(rows).extracting(CreatorRevenueResponse::creatorId).containsExactly(large, small);
    }

    @Test
    void invertedRangeIsRejected() {
        assertThatThrownBy(() -> statisticService.getRevenueByCreator(DATE, DATE.minusDays(1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("'from' must not be after 'to'");
    }
}
