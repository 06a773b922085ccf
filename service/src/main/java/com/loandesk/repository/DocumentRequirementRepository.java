package com.loandesk.repository;

import com.loandesk.model.DocumentRequirement;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface DocumentRequirementRepository extends JpaRepository<DocumentRequirement, UUID> {

    boolean existsByCode(String code);
}
