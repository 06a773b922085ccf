package com.loandesk.mapper;

import com.loandesk.api.dto.StageDTO;
import com.loandesk.api.dto.TransitionDTO;
import com.loandesk.api.dto.WorkflowDTO;
import com.loandesk.dto.AvailableTransition;
import com.loandesk.dto.WorkflowGraph;
import com.loandesk.model.Workflow;
import com.loandesk.model.WorkflowStage;
import com.loandesk.model.WorkflowTransition;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.factory.Mappers;

import java.util.List;

/**
 * MapStruct mapper for workflows, their stages and transitions.
 */
@Mapper
public interface WorkflowMapper {

    WorkflowMapper INSTANCE = Mappers.getMapper(WorkflowMapper.class);

    /**
     * Maps the workflow row only; {@code stages} and {@code transitions} stay {@code null}.
     */
    @Mapping(target = "stages", ignore = true)
    @Mapping(target = "transitions", ignore = true)
    WorkflowDTO toDTO(Workflow workflow);

    StageDTO toDTO(WorkflowStage stage);

    @Mapping(target = "toStage", ignore = true)
    TransitionDTO toDTO(WorkflowTransition transition);

    List<StageDTO> toStageDTOList(List<WorkflowStage> stages);

    List<TransitionDTO> toTransitionDTOList(List<WorkflowTransition> transitions);

    default WorkflowDTO toDTO(WorkflowGraph graph) {
        WorkflowDTO dto = toDTO(graph.workflow());
        dto.setStages(toStageDTOList(graph.stages()));
        dto.setTransitions(toTransitionDTOList(graph.transitions()));
        return dto;
    }

    default TransitionDTO toDTO(AvailableTransition available) {
        TransitionDTO dto = toDTO(available.transition());
        dto.setToStage(toDTO(available.toStage()));
        return dto;
    }

    default List<TransitionDTO> toAvailableDTOList(List<AvailableTransition> transitions) {
        return transitions.stream().map(this::toDTO).toList();
    }
}
