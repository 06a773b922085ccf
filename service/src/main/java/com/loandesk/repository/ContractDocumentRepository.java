package com.loandesk.repository;

import com.loandesk.model.ContractDocument;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ContractDocumentRepository extends JpaRepository<ContractDocument, UUID> {

    List<ContractDocument> findByContractId(UUID contractId);

    Optional<ContractDocument> findByContractIdAndDocumentRequirementId(UUID contractId, UUID documentRequirementId);
}
