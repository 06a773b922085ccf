package com.loandesk.service;

import com.loandesk.api.model.TransactionType;
import com.loandesk.api.response.IntegrityResponse;
import com.loandesk.error.InsufficientFundsException;
import com.loandesk.error.WalletNotFoundException;
import com.loandesk.model.Wallet;
import com.loandesk.model.WalletTransaction;
import com.loandesk.repository.WalletRepository;
import com.loandesk.repository.WalletTransactionRepository;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Ledger of user wallets.
 *
 * <p>Every balance change appends one immutable {@link WalletTransaction} and rewrites the cached
 * {@link Wallet#getBalance() balance} in the same transaction, while the wallet row is held under a
 * pessimistic write lock. Hence for every wallet:
 * <pre>
 *   balance = SUM(CREDIT amounts) - SUM(DEBIT amounts)
 * </pre>
 * which {@link #verifyWalletIntegrity(UUID)} re-checks from the log.
 *
 * <p>Reference types used by callers:
 * <ul>
 *   <li>{@value #REF_COMMISSION} - referral commission of a contract</li>
 *   <li>{@value #REF_KPI_BONUS} - monthly KPI bonus of a snapshot</li>
 *   <li>{@value #REF_WITHDRAWAL_HOLD} - amount withheld for a withdrawal request</li>
 *   <li>{@value #REF_WITHDRAWAL_REFUND} - withheld amount returned on rejection</li>
 * </ul>
 */
@Service
@Validated
@AllArgsConstructor
@Slf4j
public class WalletService {

    public static final String REF_COMMISSION = "commission";
    public static final String REF_KPI_BONUS = "kpi_bonus";
    public static final String REF_WITHDRAWAL_HOLD = "withdrawal_hold";
    public static final String REF_WITHDRAWAL_REFUND = "withdrawal_refund";

    private final WalletRepository walletRepository;
    private final WalletTransactionRepository walletTransactionRepository;

    /**
     * Returns the user's wallet, creating an empty one if the user has none yet. Safe to call
     * concurrently for the same user: exactly one wallet is created and every caller gets it.
     */
    @Transactional
    public Wallet getOrCreateWallet(@NotNull UUID userId) {
        Optional<Wallet> existing = walletRepository.findByUserId(userId);
        if (existing.isPresent()) {
            return existing.get();
        }

        UUID walletId = UUID.randomUUID();
        if (walletRepository.insertIfAbsent(walletId, userId, LocalDateTime.now()) > 0) {
            log.info("Created wallet: walletId={}, userId={}", walletId, userId);
        } else {
            log.debug("Wallet created concurrently: userId={}", userId);
        }
        return walletRepository.findByUserId(userId)
                .orElseThrow(() -> new IllegalStateException("Wallet for user " + userId + " could not be created"));
    }

    public Wallet getWalletByUserId(@NotNull UUID userId) {
        return walletRepository.findByUserId(userId)
                .orElseThrow(() -> new WalletNotFoundException("Wallet for user " + userId + " not found"));
    }

    public Wallet getWallet(@NotNull UUID walletId) {
        return walletRepository.findById(walletId)
                .orElseThrow(() -> new WalletNotFoundException("Wallet with ID " + walletId + " not found"));
    }

    /**
     * @return the cached balance, zero when the user has no wallet
     */
    public BigDecimal getBalance(@NotNull UUID userId) {
        return walletRepository.findByUserId(userId)
                .map(Wallet::getBalance)
                .orElse(BigDecimal.ZERO);
    }

    /**
     * Credits a wallet.
     *
     * @param walletId      wallet to credit
     * @param amount        positive amount
     * @param referenceId   ID of the business object causing the credit
     * @param referenceType kind of that object, see the {@code REF_*} constants
     * @param description   human readable description
     * @param metadata      optional structured details
     * @return the appended ledger entry
     * @throws IllegalArgumentException if the amount is not positive
     * @throws WalletNotFoundException  if the wallet does not exist
     */
    @Transactional
    public WalletTransaction credit(@NotNull UUID walletId, @NotNull BigDecimal amount, UUID referenceId,
                                    String referenceType, String description, Map<String, Object> metadata) {
        requirePositive(amount);
        Wallet wallet = lockWallet(walletId);

        WalletTransaction transaction = append(wallet, TransactionType.CREDIT, amount, referenceId, referenceType,
                description, metadata);
        wallet.setBalance(wallet.getBalance().add(amount));
        wallet.setUpdatedAt(transaction.getCreatedAt());
        walletRepository.save(wallet);

        log.info("Credited wallet: walletId={}, amount={}, referenceType={}, referenceId={}, balance={}",
                walletId, amount, referenceType, referenceId, wallet.getBalance());
        return transaction;
    }

    /**
     * Debits a wallet. Nothing is written when the balance does not cover the amount.
     *
     * @throws InsufficientFundsException if {@code amount} exceeds the current balance
     * @see #credit(UUID, BigDecimal, UUID, String, String, Map)
     */
    @Transactional
    public WalletTransaction debit(@NotNull UUID walletId, @NotNull BigDecimal amount, UUID referenceId,
                                   String referenceType, String description, Map<String, Object> metadata) {
        requirePositive(amount);
        Wallet wallet = lockWallet(walletId);

        if (amount.compareTo(wallet.getBalance()) > 0) {
            throw new InsufficientFundsException(String.format("Insufficient balance: available=%s, requested=%s",
                    wallet.getBalance().toPlainString(), amount.toPlainString()));
        }

        WalletTransaction transaction = append(wallet, TransactionType.DEBIT, amount, referenceId, referenceType,
                description, metadata);
        wallet.setBalance(wallet.getBalance().subtract(amount));
        wallet.setUpdatedAt(transaction.getCreatedAt());
        walletRepository.save(wallet);

        log.info("Debited wallet: walletId={}, amount={}, referenceType={}, referenceId={}, balance={}",
                walletId, amount, referenceType, referenceId, wallet.getBalance());
        return transaction;
    }

    /**
     * Recomputes the balance from the full ledger of the wallet.
     */
    public BigDecimal calculateDerivedBalance(@NotNull UUID walletId) {
        BigDecimal credits = walletTransactionRepository.sumByWalletIdAndType(walletId, TransactionType.CREDIT);
        BigDecimal debits = walletTransactionRepository.sumByWalletIdAndType(walletId, TransactionType.DEBIT);
        return nullToZero(credits).subtract(nullToZero(debits));
    }

    /**
     * Compares the cached balance with the balance derived from the ledger.
     */
    public IntegrityResponse verifyWalletIntegrity(@NotNull UUID walletId) {
        Wallet wallet = getWallet(walletId);
        BigDecimal derived = calculateDerivedBalance(walletId);
        boolean valid = wallet.getBalance().compareTo(derived) == 0;
        if (!valid) {
            log.error("Wallet integrity violation: walletId={}, stored={}, derived={}",
                    walletId, wallet.getBalance(), derived);
        }
        return new IntegrityResponse(walletId, valid, wallet.getBalance(), derived);
    }

    public Page<WalletTransaction> getTransactions(@NotNull UUID walletId, Pageable pageable) {
        return walletTransactionRepository.findByWalletIdOrderByCreatedAtDesc(walletId, pageable);
    }

    public Page<WalletTransaction> getTransactionsByUser(@NotNull UUID userId, Pageable pageable) {
        Wallet wallet = getWalletByUserId(userId);
        return getTransactions(wallet.getId(), pageable);
    }

    private Wallet lockWallet(UUID walletId) {
        Wallet wallet = walletRepository.getOneForUpdate(walletId);
        if (wallet == null) {
            throw new WalletNotFoundException("Wallet with ID " + walletId + " not found");
        }
        return wallet;
    }

    private WalletTransaction append(Wallet wallet, TransactionType type, BigDecimal amount, UUID referenceId,
                                     String referenceType, String description, Map<String, Object> metadata) {
        WalletTransaction transaction = new WalletTransaction();
        transaction.setWalletId(wallet.getId());
        transaction.setType(type);
        transaction.setAmount(amount);
        transaction.setReferenceId(referenceId);
        transaction.setReferenceType(referenceType);
        transaction.setDescription(description);
        transaction.setMetadata(metadata);
        transaction.setCreatedAt(LocalDateTime.now());
        return walletTransactionRepository.save(transaction);
    }

    private static void requirePositive(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
    }

    private static BigDecimal nullToZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
