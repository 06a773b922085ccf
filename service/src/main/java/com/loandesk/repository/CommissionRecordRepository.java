package com.loandesk.repository;

import com.loandesk.api.model.CommissionStatus;
import com.loandesk.model.CommissionRecord;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface CommissionRecordRepository extends JpaRepository<CommissionRecord, UUID> {

    boolean existsByContractId(UUID contractId);

    Page<CommissionRecord> findByUserIdOrderByCreatedAtDesc(UUID userId, Pageable pageable);

    Page<CommissionRecord> findByUserIdAndStatusOrderByCreatedAtDesc(UUID userId, CommissionStatus status,
                                                                     Pageable pageable);

    /**
     * Records of a user in a given status created within {@code [from, until)}. Used for monthly rollups.
     */
    @Query("SELECT r FROM CommissionRecord r WHERE r.userId = :userId AND r.status = :status " +
            "AND r.createdAt >= :from AND r.createdAt < :until")
    List<CommissionRecord> findByUserIdAndStatusCreatedInRange(@Param("userId") UUID userId,
                                                               @Param("status") CommissionStatus status,
                                                               @Param("from") LocalDateTime from,
                                                               @Param("until") LocalDateTime until);

    @Query("SELECT r FROM CommissionRecord r WHERE r.userId = :userId " +
            "AND r.createdAt >= :from AND r.createdAt < :until")
    List<CommissionRecord> findByUserIdCreatedInRange(@Param("userId") UUID userId,
                                                      @Param("from") LocalDateTime from,
                                                      @Param("until") LocalDateTime until);

    @Query("SELECT DISTINCT r.userId FROM CommissionRecord r WHERE r.createdAt >= :from AND r.createdAt < :until")
    List<UUID> findDistinctUserIdsCreatedInRange(@Param("from") LocalDateTime from,
                                                 @Param("until") LocalDateTime until);
}
