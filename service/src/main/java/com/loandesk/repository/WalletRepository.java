package com.loandesk.repository;

import com.loandesk.model.Wallet;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface WalletRepository extends JpaRepository<Wallet, UUID> {
    /**
     * Retrieves the {@link Wallet} with the specified ID and locks its row for update.
     * <p>
     * Every balance mutation goes through this method, which serializes credits and debits of the
     * same wallet. Keep the surrounding transaction short: concurrent writers to the wallet block
     * until it commits.
     * </p>
     *
     * @param id the wallet ID
     * @return the locked wallet, or {@code null} if it does not exist
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM Wallet w WHERE w.id = :id")
    Wallet getOneForUpdate(@Param("id") UUID id);

    Optional<Wallet> findByUserId(UUID userId);

    /**
     * Inserts an empty wallet unless the user already has one. A concurrent insert for the same user
     * makes this call wait for the other transaction and then insert nothing.
     *
     * @return 1 if a wallet was inserted, 0 otherwise
     */
    @Modifying
    @Query(value = """
    INSERT INTO wallet (id, user_id, balance, created_at, updated_at)
    VALUES (:id, :userId, 0, :now, :now)
    ON CONFLICT (user_id) DO NOTHING
    """, nativeQuery = true)
    int insertIfAbsent(@Param("id") UUID id, @Param("userId") UUID userId, @Param("now") LocalDateTime now);
}
