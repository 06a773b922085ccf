package com.loandesk.repository;

import com.loandesk.api.model.TransactionType;
import com.loandesk.model.WalletTransaction;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface WalletTransactionRepository extends JpaRepository<WalletTransaction, UUID> {

    Page<WalletTransaction> findByWalletIdOrderByCreatedAtDesc(UUID walletId, Pageable pageable);

    Page<WalletTransaction> findByWalletIdAndReferenceTypeOrderByCreatedAtDesc(UUID walletId, String referenceType,
                                                                              Pageable pageable);

    List<WalletTransaction> findByReferenceTypeAndReferenceId(String referenceType, UUID referenceId);

    /**
     * Sums all entries of one direction over the full log of a wallet.
     *
     * @return the sum, {@code 0} when the wallet has no entries of that type
     */
    @Query("SELECT COALESCE(SUM(t.amount), 0) FROM WalletTransaction t WHERE t.walletId = :walletId AND t.type = :type")
    BigDecimal sumByWalletIdAndType(@Param("walletId") UUID walletId, @Param("type") TransactionType type);

    @Query("SELECT COALESCE(SUM(t.amount), 0) FROM WalletTransaction t " +
            "WHERE t.walletId = :walletId AND t.type = :type AND t.referenceType IN :referenceTypes")
    BigDecimal sumByWalletIdAndTypeAndReferenceTypes(@Param("walletId") UUID walletId,
                                                     @Param("type") TransactionType type,
                                                     @Param("referenceTypes") Collection<String> referenceTypes);
}
