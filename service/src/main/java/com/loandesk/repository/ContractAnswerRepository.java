package com.loandesk.repository;

import com.loandesk.model.ContractAnswer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ContractAnswerRepository extends JpaRepository<ContractAnswer, UUID> {

    List<ContractAnswer> findByContractId(UUID contractId);

    Optional<ContractAnswer> findByContractIdAndQuestionId(UUID contractId, UUID questionId);
}
