package com.loandesk.repository;

import com.loandesk.model.ContractStageHistory;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ContractStageHistoryRepository extends JpaRepository<ContractStageHistory, UUID> {

    List<ContractStageHistory> findByContractIdOrderByCreatedAtDesc(UUID contractId);
}
