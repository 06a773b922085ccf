package com.loandesk.api;

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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * WebClient-based implementation of ContractApi. Not a Spring bean, see {@link WorkflowClient}
 * for a registration example.
 */
@RequiredArgsConstructor
@Slf4j
public class ContractClient implements ContractApi {

    private static final ParameterizedTypeReference<PagedResponse<ContractDTO>> CONTRACT_PAGE =
            new ParameterizedTypeReference<>() {};

    private final WebClient webClient;

    @Override
    public ResponseEntity<ContractDTO> createContract(UUID actorId, CreateContractRequest request) {
        log.debug("Calling createContract: actorId={}, serviceId={}, requestedAmount={}",
                actorId, request.serviceId(), request.requestedAmount());

        return webClient.post()
                .uri("/api/v1/contracts")
                .header(ApiHeaders.USER_ID, actorId.toString())
                .bodyValue(request)
                .retrieve()
                .toEntity(ContractDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<ContractDTO> getContract(UUID contractId) {
        log.debug("Calling getContract: contractId={}", contractId);

        return webClient.get()
                .uri("/api/v1/contracts/{contractId}", contractId)
                .retrieve()
                .toEntity(ContractDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<PagedResponse<ContractDTO>> getMyContracts(UUID actorId, int page, int size) {
        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/contracts/mine")
                        .queryParam("page", page)
                        .queryParam("size", size)
                        .build())
                .header(ApiHeaders.USER_ID, actorId.toString())
                .retrieve()
                .toEntity(CONTRACT_PAGE)
                .block();
    }

    @Override
    public ResponseEntity<PagedResponse<ContractDTO>> getCreatedContracts(UUID actorId, int page, int size) {
        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/contracts/created")
                        .queryParam("page", page)
                        .queryParam("size", size)
                        .build())
                .header(ApiHeaders.USER_ID, actorId.toString())
                .retrieve()
                .toEntity(CONTRACT_PAGE)
                .block();
    }

    @Override
    public ResponseEntity<PagedResponse<ContractDTO>> searchContracts(String query, UUID serviceId, UUID stageId,
                                                                      int page, int size) {
        log.debug("Calling searchContracts: query={}, serviceId={}, stageId={}", query, serviceId, stageId);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/contracts")
                        .queryParamIfPresent("query", Optional.ofNullable(query))
                        .queryParamIfPresent("serviceId", Optional.ofNullable(serviceId))
                        .queryParamIfPresent("stageId", Optional.ofNullable(stageId))
                        .queryParam("page", page)
                        .queryParam("size", size)
                        .build())
                .retrieve()
                .toEntity(CONTRACT_PAGE)
                .block();
    }

    @Override
    public ResponseEntity<List<ContractAnswerDTO>> updateAnswers(UUID actorId, UUID contractId,
                                                                 UpdateAnswersRequest request) {
        log.debug("Calling updateAnswers: contractId={}, answers={}", contractId, request.answers().size());

        return webClient.put()
                .uri("/api/v1/contracts/{contractId}/answers", contractId)
                .header(ApiHeaders.USER_ID, actorId.toString())
                .bodyValue(request)
                .retrieve()
                .toEntityList(ContractAnswerDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<ContractDocumentDTO> uploadDocument(UUID actorId, UUID contractId, UUID requirementId,
                                                              List<MultipartFile> files) {
        log.debug("Calling uploadDocument: contractId={}, requirementId={}, files={}",
                contractId, requirementId, files.size());

        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        files.forEach(file -> builder.part("files", file.getResource()));

        return webClient.post()
                .uri("/api/v1/contracts/{contractId}/documents/{requirementId}/files", contractId, requirementId)
                .header(ApiHeaders.USER_ID, actorId.toString())
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(builder.build()))
                .retrieve()
                .toEntity(ContractDocumentDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<ContractDTO> submitContract(UUID actorId, UUID contractId, List<AnswerRequest> answers,
                                                      List<UUID> requirementIds, List<MultipartFile> files) {
        log.debug("Calling submitContract: contractId={}, actorId={}", contractId, actorId);

        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        if (answers != null) {
            builder.part("answers", answers, MediaType.APPLICATION_JSON);
        }
        if (requirementIds != null) {
            requirementIds.forEach(id -> builder.part("requirementIds", id.toString()));
        }
        if (files != null) {
            files.forEach(file -> builder.part("files", file.getResource()));
        }

        return webClient.post()
                .uri("/api/v1/contracts/{contractId}/submit", contractId)
                .header(ApiHeaders.USER_ID, actorId.toString())
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(BodyInserters.fromMultipartData(builder.build()))
                .retrieve()
                .toEntity(ContractDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<ContractDTO> transitionStage(UUID actorId, UUID contractId, TransitionStageRequest request) {
        log.debug("Calling transitionStage: contractId={}, toStageId={}, actorId={}",
                contractId, request.toStageId(), actorId);

        return webClient.post()
                .uri("/api/v1/contracts/{contractId}/transition", contractId)
                .header(ApiHeaders.USER_ID, actorId.toString())
                .bodyValue(request)
                .retrieve()
                .toEntity(ContractDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<ContractDTO> updateDisbursedAmount(UUID actorId, UUID contractId,
                                                             UpdateDisbursementRequest request) {
        log.debug("Calling updateDisbursedAmount: contractId={}, amount={}", contractId, request.amount());

        return webClient.put()
                .uri("/api/v1/contracts/{contractId}/disbursement", contractId)
                .header(ApiHeaders.USER_ID, actorId.toString())
                .bodyValue(request)
                .retrieve()
                .toEntity(ContractDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<List<TransitionDTO>> getAvailableTransitions(UUID contractId) {
        return webClient.get()
                .uri("/api/v1/contracts/{contractId}/transitions", contractId)
                .retrieve()
                .toEntityList(TransitionDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<List<StageHistoryDTO>> getStageHistory(UUID contractId) {
        return webClient.get()
                .uri("/api/v1/contracts/{contractId}/history", contractId)
                .retrieve()
                .toEntityList(StageHistoryDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<ContractDocumentDTO> reviewDocument(UUID actorId, UUID documentId,
                                                              ReviewDocumentRequest request) {
        log.debug("Calling reviewDocument: documentId={}, status={}", documentId, request.status());

        return webClient.put()
                .uri("/api/v1/contracts/documents/{documentId}/review", documentId)
                .header(ApiHeaders.USER_ID, actorId.toString())
                .bodyValue(request)
                .retrieve()
                .toEntity(ContractDocumentDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<Void> deleteFile(UUID actorId, UUID fileId) {
        log.debug("Calling deleteFile: fileId={}", fileId);

        return webClient.delete()
                .uri("/api/v1/contracts/files/{fileId}", fileId)
                .header(ApiHeaders.USER_ID, actorId.toString())
                .retrieve()
                .toBodilessEntity()
                .block();
    }
}
