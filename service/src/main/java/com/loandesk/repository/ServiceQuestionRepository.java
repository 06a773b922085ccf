package com.loandesk.repository;

import com.loandesk.model.ServiceQuestion;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ServiceQuestionRepository extends JpaRepository<ServiceQuestion, UUID> {

    List<ServiceQuestion> findByServiceIdOrderBySortOrderAsc(UUID serviceId);
}
