package com.loandesk.mapper;

import com.loandesk.api.dto.ContractAnswerDTO;
import com.loandesk.api.dto.ContractDTO;
import com.loandesk.api.dto.ContractDocumentDTO;
import com.loandesk.api.dto.ContractFileDTO;
import com.loandesk.api.dto.StageHistoryDTO;
import com.loandesk.dto.ContractDetails;
import com.loandesk.model.Contract;
import com.loandesk.model.ContractAnswer;
import com.loandesk.model.ContractDocument;
import com.loandesk.model.ContractFile;
import com.loandesk.model.ContractStageHistory;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.factory.Mappers;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

@Mapper
public interface ContractMapper {

    ContractMapper INSTANCE = Mappers.getMapper(ContractMapper.class);

    @Mapping(target = "currentStage", ignore = true)
    @Mapping(target = "documents", ignore = true)
    @Mapping(target = "answers", ignore = true)
    ContractDTO toDTO(Contract contract);

    @Mapping(target = "files", ignore = true)
    ContractDocumentDTO toDTO(ContractDocument document);

    ContractFileDTO toDTO(ContractFile file);

    ContractAnswerDTO toDTO(ContractAnswer answer);

    StageHistoryDTO toDTO(ContractStageHistory history);

    List<ContractDTO> toDTOList(List<Contract> contracts);

    List<ContractFileDTO> toFileDTOList(List<ContractFile> files);

    List<ContractAnswerDTO> toAnswerDTOList(List<ContractAnswer> answers);

    List<StageHistoryDTO> toHistoryDTOList(List<ContractStageHistory> history);

    /**
     * Full view of a contract: current stage, documents with their files, and answers.
     */
    default ContractDTO toDTO(ContractDetails details) {
        ContractDTO dto = toDTO(details.contract());
        dto.setCurrentStage(WorkflowMapper.INSTANCE.toDTO(details.currentStage()));

        Map<UUID, List<ContractFile>> filesByDocument = details.files().stream()
                .collect(Collectors.groupingBy(ContractFile::getContractDocumentId));
        dto.setDocuments(details.documents().stream()
                .map(document -> toDTO(document, filesByDocument.getOrDefault(document.getId(), List.of())))
                .toList());
        dto.setAnswers(toAnswerDTOList(details.answers()));
        return dto;
    }

    default ContractDocumentDTO toDTO(ContractDocument document, List<ContractFile> files) {
        ContractDocumentDTO dto = toDTO(document);
        dto.setFiles(toFileDTOList(files));
        return dto;
    }
}
