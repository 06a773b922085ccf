package com.loandesk.repository;

import com.loandesk.model.WorkflowTransition;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface WorkflowTransitionRepository extends JpaRepository<WorkflowTransition, UUID> {

    List<WorkflowTransition> findByWorkflowId(UUID workflowId);

    List<WorkflowTransition> findByWorkflowIdAndFromStageId(UUID workflowId, UUID fromStageId);

    Optional<WorkflowTransition> findByWorkflowIdAndFromStageIdAndToStageId(UUID workflowId, UUID fromStageId,
                                                                            UUID toStageId);

    boolean existsByWorkflowIdAndFromStageIdAndToStageId(UUID workflowId, UUID fromStageId, UUID toStageId);

    @Modifying
    @Query("DELETE FROM WorkflowTransition t WHERE t.fromStageId = :stageId OR t.toStageId = :stageId")
    int deleteTouchingStage(@Param("stageId") UUID stageId);
}
