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
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.UUID;

/**
 * Contract API: loan applications and their movement through the product's workflow.
 *
 * <p>The acting user is taken from the {@value ApiHeaders#USER_ID} header. Owner and creator
 * of a contract may edit answers, upload documents and submit it; stage transitions are gated
 * by the permissions configured on the workflow.
 */
@RequestMapping("/api/v1/contracts")
public interface ContractApi {

    /**
     * Opens a contract in the first stage of the product workflow.
     * When {@code targetUserId} differs from the actor, the actor is recorded as creator.
     */
    @PostMapping
    ResponseEntity<ContractDTO> createContract(@RequestHeader(ApiHeaders.USER_ID) UUID actorId,
                                               @RequestBody @Valid CreateContractRequest request);

    @GetMapping("/{contractId}")
    ResponseEntity<ContractDTO> getContract(@PathVariable("contractId") UUID contractId);

    @GetMapping("/mine")
    ResponseEntity<PagedResponse<ContractDTO>> getMyContracts(
            @RequestHeader(ApiHeaders.USER_ID) UUID actorId,
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "20") int size);

    /**
     * Contracts the actor created on behalf of other users.
     */
    @GetMapping("/created")
    ResponseEntity<PagedResponse<ContractDTO>> getCreatedContracts(
            @RequestHeader(ApiHeaders.USER_ID) UUID actorId,
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "20") int size);

    /**
     * Admin search. {@code query} matches contract number or the owner's email, phone or name.
     */
    @GetMapping
    ResponseEntity<PagedResponse<ContractDTO>> searchContracts(
            @RequestParam(value = "query", required = false) String query,
            @RequestParam(value = "serviceId", required = false) UUID serviceId,
            @RequestParam(value = "stageId", required = false) UUID stageId,
            @RequestParam(value = "page", defaultValue = "0") int page,
            @RequestParam(value = "size", defaultValue = "20") int size);

    @PutMapping("/{contractId}/answers")
    ResponseEntity<List<ContractAnswerDTO>> updateAnswers(@RequestHeader(ApiHeaders.USER_ID) UUID actorId,
                                                          @PathVariable("contractId") UUID contractId,
                                                          @RequestBody @Valid UpdateAnswersRequest request);

    @PostMapping(value = "/{contractId}/documents/{requirementId}/files", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    ResponseEntity<ContractDocumentDTO> uploadDocument(@RequestHeader(ApiHeaders.USER_ID) UUID actorId,
                                                       @PathVariable("contractId") UUID contractId,
                                                       @PathVariable("requirementId") UUID requirementId,
                                                       @RequestPart("files") List<MultipartFile> files);

    /**
     * Submits a DRAFT contract.
     *
     * <p>{@code requirementIds[i]} names the document requirement that {@code files[i]} belongs to.
     * Every required document must end up with at least one file, otherwise nothing is stored.
     */
    @PostMapping(value = "/{contractId}/submit", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    ResponseEntity<ContractDTO> submitContract(@RequestHeader(ApiHeaders.USER_ID) UUID actorId,
                                               @PathVariable("contractId") UUID contractId,
                                               @RequestPart(value = "answers", required = false) List<AnswerRequest> answers,
                                               @RequestParam(value = "requirementIds", required = false) List<UUID> requirementIds,
                                               @RequestPart(value = "files", required = false) List<MultipartFile> files);

    @PostMapping("/{contractId}/transition")
    ResponseEntity<ContractDTO> transitionStage(@RequestHeader(ApiHeaders.USER_ID) UUID actorId,
                                                @PathVariable("contractId") UUID contractId,
                                                @RequestBody @Valid TransitionStageRequest request);

    @PutMapping("/{contractId}/disbursement")
    ResponseEntity<ContractDTO> updateDisbursedAmount(@RequestHeader(ApiHeaders.USER_ID) UUID actorId,
                                                      @PathVariable("contractId") UUID contractId,
                                                      @RequestBody @Valid UpdateDisbursementRequest request);

    @GetMapping("/{contractId}/transitions")
    ResponseEntity<List<TransitionDTO>> getAvailableTransitions(@PathVariable("contractId") UUID contractId);

    /**
     * Stage history, newest entry first.
     */
    @GetMapping("/{contractId}/history")
    ResponseEntity<List<StageHistoryDTO>> getStageHistory(@PathVariable("contractId") UUID contractId);

    @PutMapping("/documents/{documentId}/review")
    ResponseEntity<ContractDocumentDTO> reviewDocument(@RequestHeader(ApiHeaders.USER_ID) UUID actorId,
                                                       @PathVariable("documentId") UUID documentId,
                                                       @RequestBody @Valid ReviewDocumentRequest request);

    @DeleteMapping("/files/{fileId}")
    ResponseEntity<Void> deleteFile(@RequestHeader(ApiHeaders.USER_ID) UUID actorId,
                                    @PathVariable("fileId") UUID fileId);
}
