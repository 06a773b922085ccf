package com.loandesk.repository;

import com.loandesk.model.KpiCommissionTier;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface KpiCommissionTierRepository extends JpaRepository<KpiCommissionTier, UUID> {

    // Evaluation order: highest tier first
    List<KpiCommissionTier> findByRoleCodeAndActiveTrueOrderByTierOrderDesc(String roleCode);

    List<KpiCommissionTier> findByRoleCodeOrderByTierOrderAsc(String roleCode);

    List<KpiCommissionTier> findAllByOrderByRoleCodeAscTierOrderAsc();
}
