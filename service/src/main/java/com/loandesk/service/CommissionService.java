package com.loandesk.service;

import com.loandesk.api.model.CommissionStatus;
import com.loandesk.api.model.TransactionType;
import com.loandesk.api.request.CreateCommissionConfigRequest;
import com.loandesk.api.request.UpdateCommissionConfigRequest;
import com.loandesk.api.response.CommissionSummaryResponse;
import com.loandesk.dto.ReferrerRate;
import com.loandesk.error.ResourceConflictException;
import com.loandesk.model.CommissionConfig;
import com.loandesk.model.CommissionRecord;
import com.loandesk.model.UserAccount;
import com.loandesk.model.Wallet;
import com.loandesk.model.WalletTransaction;
import com.loandesk.repository.CommissionConfigRepository;
import com.loandesk.repository.CommissionRecordRepository;
import com.loandesk.repository.UserAccountRepository;
import com.loandesk.repository.WalletTransactionRepository;
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

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Referral commissions.
 *
 * <p>When a contract reaches a commission stage, the user who referred the contract owner earns
 * {@code totalRevenue * rate}, where the rate comes from the {@link CommissionConfig} of the
 * referrer's role. The earning is recorded as a {@link CommissionRecord} and credited to the
 * referrer's wallet. At most one record exists per contract.
 */
@Service
@Validated
@AllArgsConstructor
@Slf4j
public class CommissionService {

    private final CommissionConfigRepository configRepository;
    private final CommissionRecordRepository recordRepository;
    private final UserAccountRepository userAccountRepository;
    private final WalletTransactionRepository walletTransactionRepository;
    private final WalletService walletService;
    private final RbacService rbacService;
    private final AuditService auditService;

    @Transactional
    public CommissionConfig createConfig(@Valid @NotNull CreateCommissionConfigRequest request, @NotNull UUID adminId) {
        String roleCode = request.roleCode().trim().toUpperCase(Locale.ROOT);
        if (configRepository.existsByRoleCodeAndActiveTrue(roleCode)) {
            throw new ResourceConflictException("Active commission config already exists for this role");
        }

        LocalDateTime now = LocalDateTime.now();
        CommissionConfig config = new CommissionConfig();
        config.setRoleCode(roleCode);
        config.setRate(request.rate());
        config.setActive(true);
        config.setCreatedAt(now);
        config.setUpdatedAt(now);
        config = configRepository.save(config);

        auditService.log(adminId, "COMMISSION_CONFIG_CREATED", AuditService.TARGET_COMMISSION_CONFIG, config.getId(),
                Map.of("roleCode", roleCode, "rate", request.rate()));
        log.info("Created commission config: id={}, role={}, rate={}", config.getId(), roleCode, request.rate());
        return config;
    }

    @Transactional
    public CommissionConfig updateConfig(@NotNull UUID configId, @Valid @NotNull UpdateCommissionConfigRequest request,
                                         @NotNull UUID adminId) {
        CommissionConfig config = getConfig(configId);
        BigDecimal previousRate = config.getRate();

        if (request.active() != null && request.active() && !config.isActive()
                && configRepository.existsByRoleCodeAndActiveTrue(config.getRoleCode())) {
            throw new ResourceConflictException("Active commission config already exists for this role");
        }
        if (request.rate() != null) {
            config.setRate(request.rate());
        }
        if (request.active() != null) {
            config.setActive(request.active());
        }
        config.setUpdatedAt(LocalDateTime.now());
        config = configRepository.save(config);

        auditService.log(adminId, "COMMISSION_CONFIG_UPDATED", AuditService.TARGET_COMMISSION_CONFIG, configId,
                Map.of("previousRate", previousRate, "rate", config.getRate(), "active", config.isActive()));
        log.info("Updated commission config: id={}, rate {} -> {}, active={}",
                configId, previousRate, config.getRate(), config.isActive());
        return config;
    }

    public CommissionConfig getConfig(@NotNull UUID configId) {
        return configRepository.findById(configId)
                .orElseThrow(() -> new EntityNotFoundException("Commission config not found"));
    }

    public List<CommissionConfig> listConfigs() {
        return configRepository.findAllByOrderByRoleCodeAsc();
    }

    /**
     * @return the active rate of a role, zero when the role has no active config
     */
    public BigDecimal getCommissionRate(@NotNull String roleCode) {
        return configRepository.findByRoleCodeAndActiveTrue(roleCode)
                .map(CommissionConfig::getRate)
                .orElse(BigDecimal.ZERO);
    }

    /**
     * Resolves the rate of a referrer: the CTV rate if the referrer is a CTV and a CTV config is
     * active, otherwise the USER rate, otherwise zero.
     */
    public ReferrerRate getReferrerCommissionRate(@NotNull UUID referrerId) {
        if (rbacService.hasRole(referrerId, RbacService.ROLE_CTV)) {
            var ctvConfig = configRepository.findByRoleCodeAndActiveTrue(RbacService.ROLE_CTV);
            if (ctvConfig.isPresent()) {
                return new ReferrerRate(ctvConfig.get().getRate(), RbacService.ROLE_CTV);
            }
        }
        return configRepository.findByRoleCodeAndActiveTrue(RbacService.ROLE_USER)
                .map(config -> new ReferrerRate(config.getRate(), RbacService.ROLE_USER))
                .orElseGet(ReferrerRate::none);
    }

    /**
     * Pays the referral commission of a completed contract.
     *
     * <p>Returns {@code null} without side effects when the owner has no referrer, when the
     * contract already has a commission record, or when the referrer's rate is zero.
     *
     * @param contractId         completed contract
     * @param ownerId            contract owner, whose referrer earns the commission
     * @param disbursementAmount amount disbursed to the owner
     * @param revenuePercentage  share of the disbursement kept as revenue, in percent
     * @param totalRevenue       revenue the commission is calculated from
     * @return the credited record, or {@code null} when no commission is due
     */
    @Transactional
    public CommissionRecord processContractCompletion(@NotNull UUID contractId, @NotNull UUID ownerId,
                                                      @NotNull BigDecimal disbursementAmount,
                                                      @NotNull BigDecimal revenuePercentage,
                                                      @NotNull BigDecimal totalRevenue) {
        UserAccount owner = userAccountRepository.findById(ownerId)
                .orElseThrow(() -> new EntityNotFoundException("User not found"));
        UUID referrerId = owner.getReferredBy();
        if (referrerId == null) {
            log.debug("No referrer, skipping commission: contractId={}, ownerId={}", contractId, ownerId);
            return null;
        }
        if (recordRepository.existsByContractId(contractId)) {
            log.warn("Commission already processed for contract {}", contractId);
            return null;
        }

        ReferrerRate referrerRate = getReferrerCommissionRate(referrerId);
        if (referrerRate.isZero()) {
            log.info("Zero commission rate, skipping: contractId={}, referrerId={}", contractId, referrerId);
            return null;
        }
        BigDecimal amount = totalRevenue.multiply(referrerRate.rate()).setScale(2, RoundingMode.HALF_UP);

        LocalDateTime now = LocalDateTime.now();
        CommissionRecord record = new CommissionRecord();
        record.setUserId(referrerId);
        record.setContractId(contractId);
        record.setReferredUserId(ownerId);
        record.setAmount(amount);
        record.setRate(referrerRate.rate());
        record.setDisbursementAmount(disbursementAmount);
        record.setRevenuePercentage(revenuePercentage);
        record.setTotalRevenue(totalRevenue);
        record.setStatus(CommissionStatus.PENDING);
        record.setCreatedAt(now);
        record = recordRepository.save(record);

        if (amount.signum() > 0) {
            Wallet wallet = walletService.getOrCreateWallet(referrerId);
            walletService.credit(wallet.getId(), amount, record.getId(), WalletService.REF_COMMISSION,
                    "Commission for contract " + contractId,
                    Map.of("contractId", contractId, "rate", referrerRate.rate(), "roleCode", referrerRate.roleCode()));
        }

        record.setStatus(CommissionStatus.CREDITED);
        record.setCreditedAt(LocalDateTime.now());
        record = recordRepository.save(record);

        auditService.log(referrerId, "COMMISSION_CREDITED", AuditService.TARGET_COMMISSION, record.getId(),
                Map.of("contractId", contractId, "amount", amount, "rate", referrerRate.rate(),
                        "totalRevenue", totalRevenue, "referredUserId", ownerId));
        log.info("Commission credited: recordId={}, contractId={}, referrerId={}, amount={}, rate={}",
                record.getId(), contractId, referrerId, amount, referrerRate.rate());
        return record;
    }

    public Page<CommissionRecord> getCommissionRecords(@NotNull UUID userId, CommissionStatus status, Pageable pageable) {
        return status == null
                ? recordRepository.findByUserIdOrderByCreatedAtDesc(userId, pageable)
                : recordRepository.findByUserIdAndStatusOrderByCreatedAtDesc(userId, status, pageable);
    }

    /**
     * Wallet credits of a user caused by commissions, newest first.
     */
    public Page<WalletTransaction> getCommissionHistory(@NotNull UUID userId, Pageable pageable) {
        Wallet wallet = walletService.getOrCreateWallet(userId);
        return walletTransactionRepository.findByWalletIdAndReferenceTypeOrderByCreatedAtDesc(wallet.getId(),
                WalletService.REF_COMMISSION, pageable);
    }

    /**
     * Lifetime earnings, current month figures, number of referred users and wallet balance.
     */
    @Transactional
    public CommissionSummaryResponse getUserCommissionSummary(@NotNull UUID userId) {
        Wallet wallet = walletService.getOrCreateWallet(userId);
        BigDecimal totalEarned = walletTransactionRepository.sumByWalletIdAndTypeAndReferenceTypes(wallet.getId(),
                TransactionType.CREDIT, List.of(WalletService.REF_COMMISSION, WalletService.REF_KPI_BONUS));

        YearMonth month = YearMonth.from(LocalDate.now());
        List<CommissionRecord> monthRecords = recordRepository.findByUserIdCreatedInRange(userId,
                monthStart(month), nextMonthStart(month));
        BigDecimal monthCommission = monthRecords.stream()
                .map(CommissionRecord::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal monthDisbursement = monthRecords.stream()
                .map(CommissionRecord::getDisbursementAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        return new CommissionSummaryResponse(totalEarned, monthRecords.size(), monthCommission, monthDisbursement,
                userAccountRepository.countByReferredBy(userId), wallet.getBalance());
    }

    static LocalDateTime monthStart(YearMonth month) {
        return month.atDay(1).atStartOfDay();
    }

    /**
     * Exclusive upper bound of the month window.
     */
    static LocalDateTime nextMonthStart(YearMonth month) {
        return month.plusMonths(1).atDay(1).atStartOfDay();
    }
}
