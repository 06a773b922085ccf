package com.loandesk.repository;

import com.loandesk.model.ServiceDocument;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ServiceDocumentRepository extends JpaRepository<ServiceDocument, UUID> {

    List<ServiceDocument> findByServiceId(UUID serviceId);
}
