package com.loandesk.repository;

import com.loandesk.model.WorkflowStage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface WorkflowStageRepository extends JpaRepository<WorkflowStage, UUID> {

    List<WorkflowStage> findByWorkflowIdOrderByStageOrderAsc(UUID workflowId);

    Optional<WorkflowStage> findByWorkflowIdAndCode(UUID workflowId, String code);

    boolean existsByWorkflowIdAndCode(UUID workflowId, String code);

    // Initial stage of a workflow
    Optional<WorkflowStage> findFirstByWorkflowIdOrderByStageOrderAsc(UUID workflowId);

    Optional<WorkflowStage> findFirstByWorkflowIdAndStageOrderGreaterThanOrderByStageOrderAsc(UUID workflowId,
                                                                                             Integer stageOrder);
}
