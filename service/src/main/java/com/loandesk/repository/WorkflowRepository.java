package com.loandesk.repository;

import com.loandesk.model.Workflow;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface WorkflowRepository extends JpaRepository<Workflow, UUID> {

    @Query("SELECT MAX(w.version) FROM Workflow w WHERE w.name = :name")
    Integer findMaxVersionByName(@Param("name") String name);

    Optional<Workflow> findFirstByNameAndActiveTrueOrderByVersionDesc(String name);

    Page<Workflow> findAllByOrderByCreatedAtDesc(Pageable pageable);

    /**
     * Deactivates every version of a workflow except the given one.
     *
     * @return number of deactivated versions
     */
    @Modifying
    @Query("UPDATE Workflow w SET w.active = false, w.updatedAt = :now " +
            "WHERE w.name = :name AND w.id <> :keepId AND w.active = true")
    int deactivateOtherVersions(@Param("name") String name, @Param("keepId") UUID keepId,
                                @Param("now") LocalDateTime now);
}
