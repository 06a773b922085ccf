package com.loandesk.service;

import com.loandesk.api.model.WithdrawalStatus;
import com.loandesk.api.request.CreateWithdrawalRequest;
import com.loandesk.api.request.ProcessWithdrawalRequest;
import com.loandesk.error.ResourceConflictException;
import com.loandesk.model.Wallet;
import com.loandesk.model.WithdrawalRequest;
import com.loandesk.repository.WithdrawalRequestRepository;
import jakarta.persistence.EntityNotFoundException;
import jakarta.transaction.Transactional;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Cash-out of wallet balances.
 *
 * <p>Creating a request debits the amount from the wallet right away, so the same money cannot be
 * requested twice. Rejecting a request credits it back.
 * <pre>
 *   PENDING  --> APPROVED | REJECTED
 *   APPROVED --> PAID | REJECTED
 * </pre>
 */
@Service
@Validated
@AllArgsConstructor
@Slf4j
public class WithdrawalService {

    private static final Map<WithdrawalStatus, Set<WithdrawalStatus>> ALLOWED_TRANSITIONS = Map.of(
            WithdrawalStatus.PENDING, EnumSet.of(WithdrawalStatus.APPROVED, WithdrawalStatus.REJECTED),
            WithdrawalStatus.APPROVED, EnumSet.of(WithdrawalStatus.PAID, WithdrawalStatus.REJECTED));

    private final WithdrawalRequestRepository withdrawalRepository;
    private final WalletService walletService;
    private final AuditService auditService;

    /**
     * @throws com.loandesk.error.WalletNotFoundException    if the user has no wallet
     * @throws com.loandesk.error.ResourceConflictException  if the user already has a pending request
     * @throws com.loandesk.error.InsufficientFundsException if the balance does not cover the amount
     */
    @Transactional
    public WithdrawalRequest createRequest(@NotNull UUID userId, @Valid @NotNull CreateWithdrawalRequest request) {
        Wallet wallet = walletService.getWalletByUserId(userId);
        if (withdrawalRepository.existsByUserIdAndStatus(userId, WithdrawalStatus.PENDING)) {
            throw new ResourceConflictException("You already have a pending withdrawal request");
        }

        LocalDateTime now = LocalDateTime.now();
        WithdrawalRequest withdrawal = new WithdrawalRequest();
        withdrawal.setUserId(userId);
        withdrawal.setAmount(request.amount());
        withdrawal.setMethod(request.method());
        withdrawal.setAccountInfo(request.accountInfo());
        withdrawal.setStatus(WithdrawalStatus.PENDING);
        withdrawal.setCreatedAt(now);
        withdrawal.setUpdatedAt(now);
        withdrawal = withdrawalRepository.save(withdrawal);

        walletService.debit(wallet.getId(), request.amount(), withdrawal.getId(), WalletService.REF_WITHDRAWAL_HOLD,
                "Withdrawal request " + withdrawal.getId(), Map.of("method", request.method().name()));

        auditService.log(userId, "WITHDRAWAL_REQUESTED", AuditService.TARGET_WITHDRAWAL, withdrawal.getId(),
                Map.of("amount", request.amount(), "method", request.method().name()));
        log.info("Created withdrawal request: id={}, userId={}, amount={}, method={}",
                withdrawal.getId(), userId, request.amount(), request.method());
        return withdrawal;
    }

    /**
     * Moves a request along its lifecycle. Rejection returns the withheld amount to the wallet.
     *
     * @throws IllegalArgumentException if the transition is not allowed or PAID lacks a proof URL
     */
    @Transactional
    public WithdrawalRequest processRequest(@NotNull UUID withdrawalId, @NotNull UUID adminId,
                                            @Valid @NotNull ProcessWithdrawalRequest request) {
        WithdrawalRequest withdrawal = getRequest(withdrawalId);
        WithdrawalStatus from = withdrawal.getStatus();
        WithdrawalStatus to = request.status();

        if (!ALLOWED_TRANSITIONS.getOrDefault(from, Set.of()).contains(to)) {
            throw new IllegalArgumentException(String.format("Cannot change withdrawal status from %s to %s", from, to));
        }
        if (to == WithdrawalStatus.PAID && (request.proofFileUrl() == null || request.proofFileUrl().isBlank())) {
            throw new IllegalArgumentException("Proof of transfer is required to mark a withdrawal as paid");
        }

        if (to == WithdrawalStatus.REJECTED) {
            Wallet wallet = walletService.getWalletByUserId(withdrawal.getUserId());
            walletService.credit(wallet.getId(), withdrawal.getAmount(), withdrawal.getId(),
                    WalletService.REF_WITHDRAWAL_REFUND, "Refund of rejected withdrawal " + withdrawal.getId(), null);
        }
        if (to == WithdrawalStatus.PAID) {
            withdrawal.setProofFileUrl(request.proofFileUrl());
        }

        LocalDateTime now = LocalDateTime.now();
        withdrawal.setStatus(to);
        withdrawal.setAdminNote(request.adminNote());
        withdrawal.setProcessedBy(adminId);
        withdrawal.setProcessedAt(now);
        withdrawal.setUpdatedAt(now);
        withdrawal = withdrawalRepository.save(withdrawal);

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("fromStatus", from.name());
        metadata.put("toStatus", to.name());
        metadata.put("amount", withdrawal.getAmount());
        metadata.put("adminNote", request.adminNote());
        auditService.log(adminId, "WITHDRAWAL_PROCESSED", AuditService.TARGET_WITHDRAWAL, withdrawalId, metadata);
        log.info("Processed withdrawal: id={}, {} -> {}, admin={}", withdrawalId, from, to, adminId);
        return withdrawal;
    }

    public WithdrawalRequest getRequest(@NotNull UUID withdrawalId) {
        return withdrawalRepository.findById(withdrawalId)
                .orElseThrow(() -> new EntityNotFoundException("Withdrawal request not found"));
    }

    public Page<WithdrawalRequest> getUserRequests(@NotNull UUID userId, Pageable pageable) {
        return withdrawalRepository.findByUserIdOrderByCreatedAtDesc(userId, pageable);
    }

    public Page<WithdrawalRequest> searchRequests(WithdrawalStatus status, Pageable pageable) {
        return status == null
                ? withdrawalRepository.findAllByOrderByCreatedAtDesc(pageable)
                : withdrawalRepository.findByStatusOrderByCreatedAtDesc(status, pageable);
    }
}
