package com.loandesk.scheduler;

import com.loandesk.service.CommissionSnapshotBatchService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * Daily trigger of the monthly commission snapshot batch.
 *
 * <p>Configuration:
 * <pre>
 * loandesk:
 *   scheduler:
 *     enabled: true                  # enable/disable scheduler
 *     snapshot-cron: "0 0 1 * * *"   # every day at 01:00
 * </pre>
 * The batch itself only runs on the day of month stored in the {@code commission_snapshot_day}
 * system setting and covers the previous calendar month.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(
        value = "loandesk.scheduler.enabled",
        havingValue = "true",
        matchIfMissing = true
)
public class CommissionSnapshotScheduler {

    private final CommissionSnapshotBatchService batchService;

    @Scheduled(cron = "${loandesk.scheduler.snapshot-cron:0 0 1 * * *}")
    public void createMonthlySnapshots() {
        log.info("Starting scheduled job: commission snapshots");

        try {
            batchService.runIfSnapshotDay(LocalDate.now()).ifPresentOrElse(
                    result -> log.info("Commission snapshots created: period={}-{}, success={}, errors={}",
                            result.year(), result.month(), result.successCount(), result.errorCount()),
                    () -> log.debug("Not the snapshot day, nothing to do"));
        } catch (Exception e) {
            log.error("Failed to create commission snapshots: {}", e.getMessage(), e);
        }
    }
}
