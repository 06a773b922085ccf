package com.loandesk.repository;

import com.loandesk.dto.CreatorRevenue;
import com.loandesk.dto.RevenueTotals;
import com.loandesk.model.Contract;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ContractRepository extends JpaRepository<Contract, UUID> {

    /**
     * Finds the contract with the highest number for a prefix such as {@code HD-2024-}.
     * Numbers are zero padded, so lexical order equals numeric order.
     */
    Optional<Contract> findFirstByContractNumberStartingWithOrderByContractNumberDesc(String prefix);

    long countByCurrentStageId(UUID stageId);

    Page<Contract> findByUserIdOrderByCreatedAtDesc(UUID userId, Pageable pageable);

    Page<Contract> findByCreatorIdOrderByCreatedAtDesc(UUID creatorId, Pageable pageable);

    /**
     * Admin search over contracts.
     *
     * @param pattern   lower-case LIKE pattern matched against the contract number and the owner's
     *                  email, phone and full name; {@code %} matches everything
     * @param serviceId optional loan product filter
     * @param stageId   optional current stage filter
     */
    @Query(value = "SELECT c FROM Contract c LEFT JOIN UserAccount u ON u.id = c.userId " +
            "WHERE (LOWER(c.contractNumber) LIKE :pattern OR LOWER(u.email) LIKE :pattern " +
            "OR LOWER(u.phone) LIKE :pattern OR LOWER(u.fullname) LIKE :pattern) " +
            "AND (:serviceId IS NULL OR c.serviceId = :serviceId) " +
            "AND (:stageId IS NULL OR c.currentStageId = :stageId) " +
            "ORDER BY c.createdAt DESC",
            countQuery = "SELECT COUNT(c) FROM Contract c LEFT JOIN UserAccount u ON u.id = c.userId " +
                    "WHERE (LOWER(c.contractNumber) LIKE :pattern OR LOWER(u.email) LIKE :pattern " +
                    "OR LOWER(u.phone) LIKE :pattern OR LOWER(u.fullname) LIKE :pattern) " +
                    "AND (:serviceId IS NULL OR c.serviceId = :serviceId) " +
                    "AND (:stageId IS NULL OR c.currentStageId = :stageId)")
    Page<Contract> search(@Param("pattern") String pattern,
                          @Param("serviceId") UUID serviceId,
                          @Param("stageId") UUID stageId,
                          Pageable pageable);

    @Query("SELECT new com.loandesk.dto.RevenueTotals(COUNT(c), SUM(c.disbursedAmount), SUM(c.totalRevenue)) " +
            "FROM Contract c WHERE c.disbursedAmount IS NOT NULL AND c.updatedAt BETWEEN :from AND :to")
    RevenueTotals sumRevenueBetween(@Param("from") LocalDateTime from, @Param("to") LocalDateTime to);

    @Query("SELECT new com.loandesk.dto.CreatorRevenue(COALESCE(c.creatorId, c.userId), COUNT(c), " +
            "SUM(c.disbursedAmount), SUM(c.totalRevenue)) " +
            "FROM Contract c WHERE c.disbursedAmount IS NOT NULL AND c.updatedAt BETWEEN :from AND :to " +
            "GROUP BY COALESCE(c.creatorId, c.userId)")
    List<CreatorRevenue> sumRevenueByCreatorBetween(@Param("from") LocalDateTime from,
                                                    @Param("to") LocalDateTime to);
}
