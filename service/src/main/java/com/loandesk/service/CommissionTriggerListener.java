package com.loandesk.service;

import com.loandesk.event.CommissionTriggeredEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Runs commission processing once a stage transition into a commission stage has committed.
 * A failure here never undoes the transition; it is logged and can be retried, since
 * {@link CommissionService#processContractCompletion} is idempotent.
 */
@Component
@Slf4j
public class CommissionTriggerListener {

    private final CommissionService commissionService;
    private final TransactionTemplate transactionTemplate;

    public CommissionTriggerListener(CommissionService commissionService, PlatformTransactionManager transactionManager) {
        this.commissionService = commissionService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onCommissionTriggered(CommissionTriggeredEvent event) {
        log.debug("Commission triggered: contractId={}, ownerId={}", event.contractId(), event.ownerId());
        try {
            transactionTemplate.executeWithoutResult(status -> commissionService.processContractCompletion(
                    event.contractId(), event.ownerId(), event.disbursementAmount(), event.revenuePercentage(),
                    event.totalRevenue()));
        } catch (RuntimeException e) {
            log.error("Commission processing failed: contractId={}, ownerId={}, totalRevenue={}",
                    event.contractId(), event.ownerId(), event.totalRevenue(), e);
        }
    }
}
