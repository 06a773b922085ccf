package com.loandesk.service;

import com.loandesk.model.AuditLog;
import com.loandesk.repository.AuditLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * Write-only audit trail.
 *
 * <p>Inside a transaction the entry is written after that transaction commits, so a rolled back
 * change leaves no entry behind. Outside a transaction it is written immediately. Entries are
 * written in their own transaction, and a failing audit write is logged and never propagates to
 * the business operation that triggered it.
 */
@Service
@Slf4j
public class AuditService {

    public static final String TARGET_CONTRACT = "contract";
    public static final String TARGET_COMMISSION = "commission";
    public static final String TARGET_COMMISSION_CONFIG = "commission_config";
    public static final String TARGET_KPI_TIER = "kpi_tier";
    public static final String TARGET_SNAPSHOT = "commission_snapshot";
    public static final String TARGET_WITHDRAWAL = "withdrawal";
    public static final String TARGET_DOCUMENT = "contract_document";
    public static final String TARGET_SYSTEM = "system";

    private final AuditLogRepository auditLogRepository;
    private final TransactionTemplate transactionTemplate;

    public AuditService(AuditLogRepository auditLogRepository, PlatformTransactionManager transactionManager) {
        this.auditLogRepository = auditLogRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public void log(UUID userId, String action, String targetType, UUID targetId, Map<String, Object> metadata) {
        AuditLog entry = new AuditLog();
        entry.setUserId(userId);
        entry.setAction(action);
        entry.setTargetType(targetType);
        entry.setTargetId(targetId);
        entry.setMetadata(metadata);
        entry.setCreatedAt(LocalDateTime.now());

        if (TransactionSynchronizationManager.isSynchronizationActive()
                && TransactionSynchronizationManager.isActualTransactionActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    write(entry);
                }
            });
        } else {
            write(entry);
        }
    }

    private void write(AuditLog entry) {
        try {
            transactionTemplate.executeWithoutResult(status -> auditLogRepository.save(entry));
            log.debug("Audit: userId={}, action={}, targetType={}, targetId={}",
                    entry.getUserId(), entry.getAction(), entry.getTargetType(), entry.getTargetId());
        } catch (RuntimeException e) {
            log.error("Failed to write audit entry: userId={}, action={}, targetType={}, targetId={}",
                    entry.getUserId(), entry.getAction(), entry.getTargetType(), entry.getTargetId(), e);
        }
    }
}
