package com.loandesk.repository;

import com.loandesk.model.AuditLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface AuditLogRepository extends JpaRepository<AuditLog, UUID> {

    List<AuditLog> findByTargetTypeAndTargetIdOrderByCreatedAtAsc(String targetType, UUID targetId);

    List<AuditLog> findByAction(String action);
}
