package com.loandesk.controller;

import com.loandesk.api.ContractApi;
import com.loandesk.api.dto.ContractAnswerDTO;
import com.loandesk.api.dto.ContractDTO;
import com.loandesk.api.dto.ContractDocumentDTO;
import com.loandesk.api.dto.PagedResponse;
import com.loandesk.api.dto.StageHistoryDTO;
import com.loandesk.api.dto.TransitionDTO;
import com.loandesk.api.request.AnswerRequest;
import com.loandesk.api.request.CreateContractRequest;
import com.loandesk.api.request.ReviewDocumentRequest;
import com.loandesk.api.request.TransitionStageRequest;
import com.loandesk.api.request.UpdateAnswersRequest;
import com.loandesk.api.request.UpdateDisbursementRequest;
import com.loandesk.dto.DocumentUpload;
import com.loandesk.error.StorageException;
import com.loandesk.mapper.ContractMapper;
import com.loandesk.mapper.WorkflowMapper;
import com.loandesk.model.Contract;
import com.loandesk.model.ContractDocument;
import com.loandesk.service.ContractService;
import com.loandesk.service.DocumentService;
import com.loandesk.storage.UploadFile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@RestController
@Validated
@RequiredArgsConstructor
@Slf4j
public class ContractController implements ContractApi {

    private final ContractService contractService;
    private final DocumentService documentService;
    private final Paging paging;

    @Override
    public ResponseEntity<ContractDTO> createContract(UUID actorId, CreateContractRequest request) {
        Contract contract = contractService.createContract(actorId, request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ContractMapper.INSTANCE.toDTO(contractService.toDetails(contract)));
    }

    @Override
    public ResponseEntity<ContractDTO> getContract(UUID contractId) {
        return ResponseEntity.ok(ContractMapper.INSTANCE.toDTO(contractService.getContractDetails(contractId)));
    }

    @Override
    public ResponseEntity<PagedResponse<ContractDTO>> getMyContracts(UUID actorId, int page, int size) {
        Page<Contract> contracts = contractService.findByUser(actorId, paging.of(page, size));
        PagedResponse<ContractDTO> response = Paging.toResponse(contracts, ContractMapper.INSTANCE::toDTO);
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<PagedResponse<ContractDTO>> getCreatedContracts(UUID actorId, int page, int size) {
        Page<Contract> contracts = contractService.findCreatedBy(actorId, paging.of(page, size));
        PagedResponse<ContractDTO> response = Paging.toResponse(contracts, ContractMapper.INSTANCE::toDTO);
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<PagedResponse<ContractDTO>> searchContracts(String query, UUID serviceId, UUID stageId,
                                                                      int page, int size) {
        Page<Contract> contracts = contractService.search(query, serviceId, stageId, paging.of(page, size));
        PagedResponse<ContractDTO> response = Paging.toResponse(contracts, ContractMapper.INSTANCE::toDTO);
        return ResponseEntity.ok(response);
    }

    @Override
    public ResponseEntity<List<ContractAnswerDTO>> updateAnswers(UUID actorId, UUID contractId,
                                                                 UpdateAnswersRequest request) {
        return ResponseEntity.ok(ContractMapper.INSTANCE.toAnswerDTOList(
                contractService.updateAnswers(contractId, actorId, request.answers())));
    }

    @Override
    public ResponseEntity<ContractDocumentDTO> uploadDocument(UUID actorId, UUID contractId, UUID requirementId,
                                                              List<MultipartFile> files) {
        ContractDocument document = contractService.uploadDocument(contractId, requirementId, toUploadFiles(files),
                actorId);
        return ResponseEntity.status(HttpStatus.CREATED).body(
                ContractMapper.INSTANCE.toDTO(document, documentService.getFiles(document.getId())));
    }

    @Override
    public ResponseEntity<ContractDTO> submitContract(UUID actorId, UUID contractId, List<AnswerRequest> answers,
                                                      List<UUID> requirementIds, List<MultipartFile> files) {
        List<MultipartFile> uploaded = files == null ? List.of() : files;
        List<UUID> requirements = requirementIds == null ? List.of() : requirementIds;
        if (uploaded.size() != requirements.size()) {
            throw new IllegalArgumentException("Each uploaded file needs exactly one requirement ID");
        }

        List<DocumentUpload> uploads = new ArrayList<>();
        for (int i = 0; i < uploaded.size(); i++) {
            uploads.add(new DocumentUpload(requirements.get(i), toUploadFile(uploaded.get(i))));
        }
        contractService.submitContract(contractId, actorId, answers, uploads);
        return ResponseEntity.ok(ContractMapper.INSTANCE.toDTO(contractService.getContractDetails(contractId)));
    }

    @Override
    public ResponseEntity<ContractDTO> transitionStage(UUID actorId, UUID contractId, TransitionStageRequest request) {
        Contract contract = contractService.transitionStage(contractId, request, actorId);
        return ResponseEntity.ok(ContractMapper.INSTANCE.toDTO(contractService.toDetails(contract)));
    }

    @Override
    public ResponseEntity<ContractDTO> updateDisbursedAmount(UUID actorId, UUID contractId,
                                                             UpdateDisbursementRequest request) {
        Contract contract = contractService.updateDisbursedAmount(contractId, request.amount(), actorId);
        return ResponseEntity.ok(ContractMapper.INSTANCE.toDTO(contract));
    }

    @Override
    public ResponseEntity<List<TransitionDTO>> getAvailableTransitions(UUID contractId) {
        return ResponseEntity.ok(WorkflowMapper.INSTANCE.toAvailableDTOList(
                contractService.getAvailableTransitions(contractId)));
    }

    @Override
    public ResponseEntity<List<StageHistoryDTO>> getStageHistory(UUID contractId) {
        return ResponseEntity.ok(ContractMapper.INSTANCE.toHistoryDTOList(contractService.getStageHistory(contractId)));
    }

    // ==================== Documents ====================

    @Override
    public ResponseEntity<ContractDocumentDTO> reviewDocument(UUID actorId, UUID documentId,
                                                              ReviewDocumentRequest request) {
        ContractDocument document = documentService.reviewDocument(documentId, request.status(), request.note(), actorId);
        return ResponseEntity.ok(ContractMapper.INSTANCE.toDTO(document, documentService.getFiles(documentId)));
    }

    @Override
    public ResponseEntity<Void> deleteFile(UUID actorId, UUID fileId) {
        documentService.deleteFile(fileId, actorId);
        return ResponseEntity.noContent().build();
    }

    private static List<UploadFile> toUploadFiles(List<MultipartFile> files) {
        return files.stream().map(ContractController::toUploadFile).toList();
    }

    private static UploadFile toUploadFile(MultipartFile file) {
        try {
            return new UploadFile(file.getOriginalFilename(), file.getContentType(), file.getBytes());
        } catch (IOException e) {
            throw new StorageException("Failed to read uploaded file " + file.getOriginalFilename(), e);
        }
    }
}
