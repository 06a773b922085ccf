package com.loandesk.service;

import com.loandesk.event.CommissionTriggeredEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.math.BigDecimal;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CommissionTriggerListenerTest {

    @Mock
    private CommissionService commissionService;
    @Mock
    private PlatformTransactionManager transactionManager;

    private CommissionTriggerListener listener;

    private final CommissionTriggeredEvent event = new CommissionTriggeredEvent(UUID.randomUUID(), UUID.randomUUID(),
            new BigDecimal("10000000"), new BigDecimal("5"), new BigDecimal("500000.00"));

    @BeforeEach
    void setUp() {
        when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        listener = new CommissionTriggerListener(commissionService, transactionManager);
    }

    @Test
    void processesCommissionInNewTransaction() {
        listener.onCommissionTriggered(event);

        verify(commissionService).processContractCompletion(event.contractId(), event.ownerId(),
                event.disbursementAmount(), event.revenuePercentage(), event.totalRevenue());
        verify(transactionManager).getTransaction(argThat(definition ->
                definition.getPropagationBehavior() == TransactionDefinition.PROPAGATION_REQUIRES_NEW));
        verify(transactionManager).commit(any());
    }

    @Test
    void failureIsRolledBackAndNotPropagated() {
        when(commissionService.processContractCompletion(any(), any(), any(), any(), any()))
                .thenThrow(new IllegalStateException("database down"));

        assertThatCode(() -> listener.onCommissionTriggered(event)).doesNotThrowAnyException();
        verify(transactionManager).rollback(any());
    }
}
