package com.loandesk.repository;

import com.loandesk.api.model.SnapshotStatus;
import com.loandesk.model.CommissionSnapshot;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface CommissionSnapshotRepository extends JpaRepository<CommissionSnapshot, UUID> {

    Optional<CommissionSnapshot> findByUserIdAndPeriodYearAndPeriodMonth(UUID userId, Integer periodYear,
                                                                        Integer periodMonth);

    boolean existsByKpiTierId(UUID kpiTierId);

    Page<CommissionSnapshot> findByUserIdOrderByPeriodYearDescPeriodMonthDesc(UUID userId, Pageable pageable);

    @Query("SELECT s FROM CommissionSnapshot s " +
            "WHERE (:year IS NULL OR s.periodYear = :year) " +
            "AND (:month IS NULL OR s.periodMonth = :month) " +
            "AND (:status IS NULL OR s.status = :status) " +
            "ORDER BY s.periodYear DESC, s.periodMonth DESC, s.createdAt DESC")
    Page<CommissionSnapshot> search(@Param("year") Integer year,
                                    @Param("month") Integer month,
                                    @Param("status") SnapshotStatus status,
                                    Pageable pageable);
}
