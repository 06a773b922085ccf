package com.loandesk.repository;

import com.loandesk.model.CommissionConfig;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CommissionConfigRepository extends JpaRepository<CommissionConfig, UUID> {

    Optional<CommissionConfig> findByRoleCodeAndActiveTrue(String roleCode);

    boolean existsByRoleCodeAndActiveTrue(String roleCode);

    List<CommissionConfig> findAllByOrderByRoleCodeAsc();
}
