package com.loandesk.repository;

import com.loandesk.model.ContractFile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface ContractFileRepository extends JpaRepository<ContractFile, UUID> {

    List<ContractFile> findByContractDocumentId(UUID contractDocumentId);

    List<ContractFile> findByContractDocumentIdIn(Collection<UUID> contractDocumentIds);

    long countByContractDocumentId(UUID contractDocumentId);
}
