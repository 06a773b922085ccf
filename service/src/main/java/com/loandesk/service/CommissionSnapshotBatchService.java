package com.loandesk.service;

import com.loandesk.api.response.SnapshotBatchResponse;
import com.loandesk.model.CommissionSnapshot;
import com.loandesk.repository.CommissionRecordRepository;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Creates the monthly snapshots of every user who earned commissions in a month.
 *
 * <p>Each user's snapshot is created in its own transaction; a failing user is recorded and the
 * batch goes on with the next one.
 */
@Service
@AllArgsConstructor
@Slf4j
public class CommissionSnapshotBatchService {

    private final CommissionRecordRepository recordRepository;
    private final CommissionSnapshotService snapshotService;
    private final SystemConfigService systemConfigService;
    private final AuditService auditService;

    /**
     * Runs the batch for the month before {@code today} if {@code today} is the configured
     * snapshot day.
     *
     * @return the batch outcome, empty when today is not the snapshot day
     */
    public Optional<SnapshotBatchResponse> runIfSnapshotDay(LocalDate today) {
        int snapshotDay = systemConfigService.getCommissionSnapshotDay();
        if (today.getDayOfMonth() != snapshotDay) {
            log.debug("Not a snapshot day: today={}, snapshotDay={}", today, snapshotDay);
            return Optional.empty();
        }
        YearMonth previous = YearMonth.from(today).minusMonths(1);
        return Optional.of(runBatch(previous.getYear(), previous.getMonthValue()));
    }

    public SnapshotBatchResponse runBatch(int year, int month) {
        YearMonth period = YearMonth.of(year, month);
        List<UUID> userIds = recordRepository.findDistinctUserIdsCreatedInRange(CommissionService.monthStart(period),
                CommissionService.nextMonthStart(period));
        log.info("Starting commission snapshot batch: period={}, users={}", period, userIds.size());

        List<SnapshotBatchResponse.UserResult> results = new ArrayList<>();
        int successCount = 0;
        int errorCount = 0;
        for (UUID userId : userIds) {
            try {
                CommissionSnapshot snapshot = snapshotService.createMonthlySnapshot(userId, year, month);
                results.add(new SnapshotBatchResponse.UserResult(userId, true, snapshot.getId(), null));
                successCount++;
            } catch (Exception e) {
                log.error("Failed to create snapshot: userId={}, period={}", userId, period, e);
                results.add(new SnapshotBatchResponse.UserResult(userId, false, null, e.getMessage()));
                errorCount++;
            }
        }

        auditService.log(SystemActor.ID, "COMMISSION_SNAPSHOT_BATCH", AuditService.TARGET_SYSTEM, null,
                Map.of("year", year, "month", month, "totalUsers", userIds.size(),
                        "successCount", successCount, "errorCount", errorCount));
        log.info("Finished commission snapshot batch: period={}, success={}, errors={}",
                period, successCount, errorCount);
        return new SnapshotBatchResponse(year, month, userIds.size(), successCount, errorCount, results);
    }
}
