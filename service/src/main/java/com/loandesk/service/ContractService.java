package com.loandesk.service;

import com.loandesk.api.model.DocumentStatus;
import com.loandesk.api.request.AnswerRequest;
import com.loandesk.api.request.CreateContractRequest;
import com.loandesk.api.request.TransitionStageRequest;
import com.loandesk.dto.AvailableTransition;
import com.loandesk.dto.ContractDetails;
import com.loandesk.dto.DocumentUpload;
import com.loandesk.error.ForbiddenOperationException;
import com.loandesk.event.CommissionTriggeredEvent;
import com.loandesk.model.Contract;
import com.loandesk.model.ContractAnswer;
import com.loandesk.model.ContractDocument;
import com.loandesk.model.ContractFile;
import com.loandesk.model.ContractStageHistory;
import com.loandesk.model.DocumentRequirement;
import com.loandesk.model.LoanProduct;
import com.loandesk.model.ServiceDocument;
import com.loandesk.model.WorkflowStage;
import com.loandesk.repository.ContractAnswerRepository;
import com.loandesk.repository.ContractDocumentRepository;
import com.loandesk.repository.ContractFileRepository;
import com.loandesk.repository.ContractRepository;
import com.loandesk.repository.ContractStageHistoryRepository;
import com.loandesk.repository.UserAccountRepository;
import com.loandesk.storage.StorageService;
import com.loandesk.storage.StoredFile;
import com.loandesk.storage.UploadFile;
import com.loandesk.storage.UploadOptions;
import jakarta.persistence.EntityNotFoundException;
import jakarta.transaction.Transactional;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Contract lifecycle: creation, answers and documents, submission and stage transitions.
 *
 * <p>Every stage change of a contract is validated against its product's workflow and appends a
 * {@link ContractStageHistory} row in the same transaction. Entering a stage flagged
 * {@code triggers_commission} publishes a {@link CommissionTriggeredEvent}, which is handled
 * once the transition has committed.
 */
@Service
@Validated
@AllArgsConstructor
@Slf4j
public class ContractService {

    static final String CONTRACT_NUMBER_PREFIX = "HD-";
    private static final int CONTRACT_SEQUENCE_DIGITS = 6;
    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private final ContractRepository contractRepository;
    private final ContractDocumentRepository documentRepository;
    private final ContractFileRepository fileRepository;
    private final ContractAnswerRepository answerRepository;
    private final ContractStageHistoryRepository historyRepository;
    private final UserAccountRepository userAccountRepository;
    private final CatalogService catalogService;
    private final WorkflowService workflowService;
    private final DocumentService documentService;
    private final RbacService rbacService;
    private final AuditService auditService;
    private final StorageService storageService;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;

    /**
     * Opens a contract in the initial stage of the product's workflow.
     *
     * <p>One PENDING document is created per document requirement of the product. When
     * {@code targetUserId} names somebody else, the actor becomes the contract's creator and must
     * be a CTV or hold {@value RbacService#PERMISSION_CREATE_FOR_OTHERS}.
     *
     * @throws EntityNotFoundException     if the product or target user does not exist
     * @throws IllegalArgumentException    if the product is inactive, has no stages or the amount is out of range
     * @throws ForbiddenOperationException if the actor may not create contracts for others
     */
    @Transactional
    public Contract createContract(@NotNull UUID actorId, @Valid @NotNull CreateContractRequest request) {
        LoanProduct product = catalogService.getService(request.serviceId());
        if (!product.isActive()) {
            throw new IllegalArgumentException("Service is not active");
        }
        WorkflowStage initialStage = workflowService.getInitialStage(product.getWorkflowId());

        BigDecimal amount = request.requestedAmount();
        if (amount.compareTo(product.getMinLoanAmount()) < 0 || amount.compareTo(product.getMaxLoanAmount()) > 0) {
            throw new IllegalArgumentException(String.format("Requested amount must be between %s and %s",
                    product.getMinLoanAmount().toPlainString(), product.getMaxLoanAmount().toPlainString()));
        }

        UUID ownerId = actorId;
        UUID creatorId = null;
        if (request.targetUserId() != null && !request.targetUserId().equals(actorId)) {
            if (!rbacService.hasRole(actorId, RbacService.ROLE_CTV)
                    && !rbacService.hasPermission(actorId, RbacService.PERMISSION_CREATE_FOR_OTHERS)) {
                throw new ForbiddenOperationException("Not allowed to create contracts for other users");
            }
            if (!userAccountRepository.existsById(request.targetUserId())) {
                throw new EntityNotFoundException("Target user not found");
            }
            ownerId = request.targetUserId();
            creatorId = actorId;
        }

        LocalDateTime now = LocalDateTime.now();
        Contract contract = new Contract();
        contract.setContractNumber(generateContractNumber(now.getYear()));
        contract.setUserId(ownerId);
        contract.setCreatorId(creatorId);
        contract.setServiceId(product.getId());
        contract.setCurrentStageId(initialStage.getId());
        contract.setRequestedAmount(amount);
        contract.setCreatedAt(now);
        contract.setUpdatedAt(now);
        contract = contractRepository.save(contract);

        for (ServiceDocument serviceDocument : catalogService.getServiceDocuments(product.getId())) {
            ContractDocument document = new ContractDocument();
            document.setContractId(contract.getId());
            document.setDocumentRequirementId(serviceDocument.getDocumentRequirementId());
            document.setStatus(DocumentStatus.PENDING);
            document.setCreatedAt(now);
            document.setUpdatedAt(now);
            documentRepository.save(document);
        }

        if (request.answers() != null) {
            upsertAnswers(contract.getId(), request.answers(), now);
        }

        appendHistory(contract.getId(), null, initialStage.getId(), actorId, Map.of("action", "contract_created"), now);

        Map<String, Object> auditMetadata = new HashMap<>();
        auditMetadata.put("serviceId", product.getId());
        auditMetadata.put("contractNumber", contract.getContractNumber());
        if (creatorId != null) {
            auditMetadata.put("onBehalfOf", ownerId);
        }
        auditService.log(actorId, "CONTRACT_CREATED", AuditService.TARGET_CONTRACT, contract.getId(), auditMetadata);

        log.info("Created contract: id={}, number={}, owner={}, creator={}, serviceId={}, amount={}",
                contract.getId(), contract.getContractNumber(), ownerId, creatorId, product.getId(), amount);
        return contract;
    }

    /**
     * Next contract number of a year: {@code HD-<year>-<sequence>}, the sequence zero padded to six
     * digits and restarting at 1 every year.
     */
    String generateContractNumber(int year) {
        String prefix = CONTRACT_NUMBER_PREFIX + year + "-";
        int next = contractRepository.findFirstByContractNumberStartingWithOrderByContractNumberDesc(prefix)
                .map(latest -> parseSequence(latest.getContractNumber(), prefix) + 1)
                .orElse(1);
        return prefix + String.format("%0" + CONTRACT_SEQUENCE_DIGITS + "d", next);
    }

    private static int parseSequence(String contractNumber, String prefix) {
        try {
            return Integer.parseInt(contractNumber.substring(prefix.length()));
        } catch (RuntimeException e) {
            log.warn("Unparseable contract number {}, restarting sequence", contractNumber);
            return 0;
        }
    }

    public Contract getContract(@NotNull UUID contractId) {
        return contractRepository.findById(contractId)
                .orElseThrow(() -> new EntityNotFoundException("Contract not found"));
    }

    public ContractDetails getContractDetails(@NotNull UUID contractId) {
        return toDetails(getContract(contractId));
    }

    public ContractDetails toDetails(@NotNull Contract contract) {
        WorkflowStage stage = workflowService.getStage(contract.getCurrentStageId());
        List<ContractDocument> documents = documentRepository.findByContractId(contract.getId());
        List<ContractFile> files = documents.isEmpty()
                ? List.of()
                : fileRepository.findByContractDocumentIdIn(documents.stream().map(ContractDocument::getId).toList());
        return new ContractDetails(contract, stage, documents, files, answerRepository.findByContractId(contract.getId()));
    }

    public Page<Contract> findByUser(@NotNull UUID userId, Pageable pageable) {
        return contractRepository.findByUserIdOrderByCreatedAtDesc(userId, pageable);
    }

    public Page<Contract> findCreatedBy(@NotNull UUID creatorId, Pageable pageable) {
        return contractRepository.findByCreatorIdOrderByCreatedAtDesc(creatorId, pageable);
    }

    /**
     * Admin search by contract number or the owner's email, phone or name, optionally filtered by
     * product and stage.
     */
    public Page<Contract> search(String query, UUID serviceId, UUID stageId, Pageable pageable) {
        String pattern = query == null || query.isBlank()
                ? "%"
                : "%" + query.trim().toLowerCase(Locale.ROOT) + "%";
        return contractRepository.search(pattern, serviceId, stageId, pageable);
    }

    /**
     * Inserts or replaces answers, keyed by question.
     */
    @Transactional
    public List<ContractAnswer> updateAnswers(@NotNull UUID contractId, @NotNull UUID actorId,
                                              @NotNull List<@Valid AnswerRequest> answers) {
        Contract contract = getContract(contractId);
        requireOwnerOrCreator(contract, actorId);

        LocalDateTime now = LocalDateTime.now();
        upsertAnswers(contractId, answers, now);
        contract.setUpdatedAt(now);
        contractRepository.save(contract);

        log.info("Updated answers: contractId={}, count={}", contractId, answers.size());
        return answerRepository.findByContractId(contractId);
    }

    /**
     * Adds files to one document of a contract. Files are stored before their metadata is written.
     *
     * @throws IllegalArgumentException if the document was reviewed already or the files violate its requirement
     */
    public ContractDocument uploadDocument(@NotNull UUID contractId, @NotNull UUID requirementId,
                                           @NotNull List<UploadFile> files, @NotNull UUID actorId) {
        if (files.isEmpty()) {
            throw new IllegalArgumentException("At least one file is required");
        }
        Contract contract = getContract(contractId);
        requireOwnerOrCreator(contract, actorId);

        ContractDocument document = documentRepository.findByContractIdAndDocumentRequirementId(contractId, requirementId)
                .orElseThrow(() -> new EntityNotFoundException("Document requirement not found for this contract"));
        if (document.getStatus() != DocumentStatus.PENDING) {
            throw new IllegalArgumentException("Cannot upload to a reviewed document");
        }

        DocumentRequirement requirement = catalogService.getDocumentRequirement(requirementId);
        List<String> errors = documentService.validateDocumentFiles(requirement,
                fileRepository.countByContractDocumentId(document.getId()), files);
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException(String.join("; ", errors));
        }

        List<StoredFile> stored = storageService.uploadFiles(files, uploadOptions(contractId, requirement));
        try {
            transactionTemplate.executeWithoutResult(status -> {
                saveFileMetadata(document.getId(), stored, LocalDateTime.now());
                document.setUpdatedAt(LocalDateTime.now());
                documentRepository.save(document);
            });
        } catch (RuntimeException e) {
            log.error("Storage inconsistency: files uploaded but metadata not saved: contractId={}, urls={}",
                    contractId, stored.stream().map(StoredFile::url).toList(), e);
            throw e;
        }

        log.info("Uploaded documents: contractId={}, requirementId={}, files={}", contractId, requirementId, stored.size());
        return document;
    }

    /**
     * Submits a DRAFT contract.
     *
     * <p>All checks run first. Every required document must end up with at least one file, counting
     * files uploaded earlier and the ones supplied here. Then the new files are stored, outside any
     * database transaction. Finally one transaction writes answers and file metadata, moves the
     * contract to the stage following DRAFT and appends the history entry. Nothing is written when
     * a check fails.
     *
     * @throws IllegalArgumentException if the contract is not a draft or a required document is missing
     */
    public Contract submitContract(@NotNull UUID contractId, @NotNull UUID actorId, List<@Valid AnswerRequest> answers,
                                   List<DocumentUpload> uploads) {
        List<AnswerRequest> newAnswers = answers == null ? List.of() : answers;
        List<DocumentUpload> newUploads = uploads == null ? List.of() : uploads;

        Contract contract = getContract(contractId);
        requireOwnerOrCreator(contract, actorId);

        WorkflowStage draftStage = workflowService.getStage(contract.getCurrentStageId());
        if (!WorkflowService.DRAFT.equals(draftStage.getCode())) {
            throw new IllegalArgumentException("Contract has already been submitted");
        }
        WorkflowStage nextStage = workflowService.getNextStage(draftStage)
                .orElseThrow(() -> new IllegalStateException("Workflow has no stage after " + WorkflowService.DRAFT));

        Map<UUID, ContractDocument> documentsByRequirement = documentRepository.findByContractId(contractId).stream()
                .collect(Collectors.toMap(ContractDocument::getDocumentRequirementId, d -> d));
        Map<UUID, List<UploadFile>> filesByRequirement = new LinkedHashMap<>();
        for (DocumentUpload upload : newUploads) {
            ContractDocument document = documentsByRequirement.get(upload.documentRequirementId());
            if (document == null) {
                throw new IllegalArgumentException("Document requirement not found for this contract");
            }
            if (document.getStatus() != DocumentStatus.PENDING) {
                throw new IllegalArgumentException("Cannot upload to a reviewed document");
            }
            filesByRequirement.computeIfAbsent(upload.documentRequirementId(), id -> new ArrayList<>()).add(upload.file());
        }

        for (ServiceDocument serviceDocument : catalogService.getServiceDocuments(contract.getServiceId())) {
            if (!serviceDocument.isRequired()) {
                continue;
            }
            UUID requirementId = serviceDocument.getDocumentRequirementId();
            ContractDocument document = documentsByRequirement.get(requirementId);
            long existing = document == null ? 0 : fileRepository.countByContractDocumentId(document.getId());
            int supplied = filesByRequirement.getOrDefault(requirementId, List.of()).size();
            if (existing + supplied < 1) {
                DocumentRequirement requirement = catalogService.getDocumentRequirement(requirementId);
                throw new IllegalArgumentException("Missing required document: " + requirement.getName());
            }
        }

        Map<UUID, DocumentRequirement> requirements = new HashMap<>();
        for (Map.Entry<UUID, List<UploadFile>> entry : filesByRequirement.entrySet()) {
            DocumentRequirement requirement = catalogService.getDocumentRequirement(entry.getKey());
            requirements.put(entry.getKey(), requirement);
            List<String> errors = documentService.validateDocumentFiles(requirement,
                    fileRepository.countByContractDocumentId(documentsByRequirement.get(entry.getKey()).getId()),
                    entry.getValue());
            if (!errors.isEmpty()) {
                throw new IllegalArgumentException(requirement.getName() + ": " + String.join("; ", errors));
            }
        }

        Map<UUID, List<StoredFile>> stored = new LinkedHashMap<>();
        try {
            for (Map.Entry<UUID, List<UploadFile>> entry : filesByRequirement.entrySet()) {
                stored.put(entry.getKey(), storageService.uploadFiles(entry.getValue(),
                        uploadOptions(contractId, requirements.get(entry.getKey()))));
            }
        } catch (RuntimeException e) {
            logOrphanedUploads(contractId, stored, "file upload", e);
            throw e;
        }

        Contract submitted;
        try {
            submitted = transactionTemplate.execute(status -> {
                Contract current = getContract(contractId);
                if (!draftStage.getId().equals(current.getCurrentStageId())) {
                    throw new IllegalArgumentException("Contract has already been submitted");
                }
                LocalDateTime now = LocalDateTime.now();
                upsertAnswers(contractId, newAnswers, now);
                stored.forEach((requirementId, files) ->
                        saveFileMetadata(documentsByRequirement.get(requirementId).getId(), files, now));

                current.setCurrentStageId(nextStage.getId());
                current.setUpdatedAt(now);
                current = contractRepository.save(current);
                appendHistory(contractId, draftStage.getId(), nextStage.getId(), actorId,
                        Map.of("action", "contract_submitted"), now);
                return current;
            });
        } catch (RuntimeException e) {
            logOrphanedUploads(contractId, stored, "database update", e);
            throw e;
        }

        auditService.log(actorId, "CONTRACT_SUBMITTED", AuditService.TARGET_CONTRACT, contractId,
                Map.of("toStageId", nextStage.getId(), "toStageCode", nextStage.getCode(),
                        "answers", newAnswers.size(), "files", newUploads.size()));
        log.info("Submitted contract: id={}, stage={}, answers={}, files={}",
                contractId, nextStage.getCode(), newAnswers.size(), newUploads.size());
        return submitted;
    }

    /**
     * Moves a contract to another stage of its workflow.
     *
     * <p>When the destination triggers commission and the product has commissions enabled, the
     * disbursement amount and revenue percentage are required and recorded on the contract, and
     * commission processing is scheduled to run after commit.
     *
     * @throws ForbiddenOperationException if the workflow has no such transition or the actor lacks its permission
     * @throws IllegalArgumentException    if the disbursement details are missing or out of range
     */
    @Transactional
    public Contract transitionStage(@NotNull UUID contractId, @Valid @NotNull TransitionStageRequest request,
                                    @NotNull UUID actorId) {
        Contract contract = getContract(contractId);
        LoanProduct product = catalogService.getService(contract.getServiceId());

        workflowService.validateTransition(product.getWorkflowId(), contract.getCurrentStageId(), request.toStageId(),
                actorId);

        WorkflowStage fromStage = workflowService.getStage(contract.getCurrentStageId());
        WorkflowStage toStage = workflowService.getStage(request.toStageId());

        boolean triggersCommission = toStage.isTriggersCommission() && product.isCommissionEnabled();
        if (triggersCommission) {
            BigDecimal disbursement = request.disbursementAmount();
            BigDecimal percentage = request.revenuePercentage();
            if (disbursement == null || disbursement.signum() <= 0) {
                throw new IllegalArgumentException("Disbursement amount must be greater than 0 to complete the contract");
            }
            if (percentage == null || percentage.signum() <= 0 || percentage.compareTo(HUNDRED) > 0) {
                throw new IllegalArgumentException("Revenue percentage must be greater than 0 and at most 100");
            }
            contract.setDisbursedAmount(disbursement);
            contract.setRevenuePercentage(percentage);
            contract.setTotalRevenue(calculateRevenue(disbursement, percentage));
        }

        LocalDateTime now = LocalDateTime.now();
        contract.setCurrentStageId(toStage.getId());
        contract.setUpdatedAt(now);
        contract = contractRepository.save(contract);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("fromStageCode", fromStage.getCode());
        metadata.put("toStageCode", toStage.getCode());
        if (request.note() != null) {
            metadata.put("note", request.note());
        }
        if (triggersCommission) {
            metadata.put("disbursementAmount", contract.getDisbursedAmount());
            metadata.put("revenuePercentage", contract.getRevenuePercentage());
            metadata.put("totalRevenue", contract.getTotalRevenue());
        }
        appendHistory(contractId, fromStage.getId(), toStage.getId(), actorId, metadata, now);

        Map<String, Object> auditMetadata = new LinkedHashMap<>(metadata);
        auditMetadata.put("fromStageId", fromStage.getId());
        auditMetadata.put("toStageId", toStage.getId());
        auditService.log(actorId, "CONTRACT_STAGE_CHANGED", AuditService.TARGET_CONTRACT, contractId, auditMetadata);

        if (triggersCommission) {
            eventPublisher.publishEvent(new CommissionTriggeredEvent(contractId, contract.getUserId(),
                    contract.getDisbursedAmount(), contract.getRevenuePercentage(), contract.getTotalRevenue()));
        }

        log.info("Contract stage changed: id={}, {} -> {}, actor={}, commissionTriggered={}",
                contractId, fromStage.getCode(), toStage.getCode(), actorId, triggersCommission);
        return contract;
    }

    /**
     * Corrects the disbursed amount of a contract that is past DRAFT and not in a commission stage.
     * The total revenue is recomputed when a revenue percentage is recorded.
     */
    @Transactional
    public Contract updateDisbursedAmount(@NotNull UUID contractId, @NotNull BigDecimal amount, @NotNull UUID adminId) {
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("Disbursed amount must be greater than 0");
        }
        Contract contract = getContract(contractId);
        WorkflowStage stage = workflowService.getStage(contract.getCurrentStageId());

        if (WorkflowService.DRAFT.equals(stage.getCode())) {
            throw new IllegalArgumentException("Cannot update disbursed amount of a draft contract");
        }
        if (stage.isTriggersCommission()) {
            throw new IllegalArgumentException("Cannot update disbursed amount after commission has been processed");
        }

        BigDecimal previous = contract.getDisbursedAmount();
        contract.setDisbursedAmount(amount);
        if (contract.getRevenuePercentage() != null) {
            contract.setTotalRevenue(calculateRevenue(amount, contract.getRevenuePercentage()));
        }
        contract.setUpdatedAt(LocalDateTime.now());
        contract = contractRepository.save(contract);

        Map<String, Object> metadata = new HashMap<>();
        metadata.put("previousAmount", previous);
        metadata.put("newAmount", amount);
        auditService.log(adminId, "CONTRACT_DISBURSEMENT_UPDATED", AuditService.TARGET_CONTRACT, contractId, metadata);
        log.info("Updated disbursed amount: contractId={}, {} -> {}", contractId, previous, amount);
        return contract;
    }

    public List<AvailableTransition> getAvailableTransitions(@NotNull UUID contractId) {
        Contract contract = getContract(contractId);
        LoanProduct product = catalogService.getService(contract.getServiceId());
        return workflowService.getAvailableTransitions(product.getWorkflowId(), contract.getCurrentStageId());
    }

    /**
     * @return the stage history, newest entry first
     */
    public List<ContractStageHistory> getStageHistory(@NotNull UUID contractId) {
        getContract(contractId);
        return historyRepository.findByContractIdOrderByCreatedAtDesc(contractId);
    }

    private static void logOrphanedUploads(UUID contractId, Map<UUID, List<StoredFile>> stored, String failedStep,
                                           RuntimeException cause) {
        List<String> urls = stored.values().stream().flatMap(List::stream).map(StoredFile::url).toList();
        if (!urls.isEmpty()) {
            log.error("Storage inconsistency: files uploaded but contract submission failed at {}: contractId={}, urls={}",
                    failedStep, contractId, urls, cause);
        }
    }

    static BigDecimal calculateRevenue(BigDecimal disbursement, BigDecimal percentage) {
        return disbursement.multiply(percentage).divide(HUNDRED, 2, RoundingMode.HALF_UP);
    }

    private void requireOwnerOrCreator(Contract contract, UUID actorId) {
        if (!contract.isOwnedOrCreatedBy(actorId)) {
            throw new ForbiddenOperationException("Not authorized to update this contract");
        }
    }

    private void upsertAnswers(UUID contractId, List<AnswerRequest> answers, LocalDateTime now) {
        Map<UUID, String> latest = new LinkedHashMap<>();
        answers.forEach(answer -> latest.put(answer.questionId(), answer.answer()));

        latest.forEach((questionId, value) -> {
            Optional<ContractAnswer> existing = answerRepository.findByContractIdAndQuestionId(contractId, questionId);
            ContractAnswer answer = existing.orElseGet(() -> {
                ContractAnswer created = new ContractAnswer();
                created.setContractId(contractId);
                created.setQuestionId(questionId);
                created.setCreatedAt(now);
                return created;
            });
            answer.setAnswer(value);
            answer.setUpdatedAt(now);
            answerRepository.save(answer);
        });
    }

    private void saveFileMetadata(UUID documentId, List<StoredFile> files, LocalDateTime now) {
        for (StoredFile stored : files) {
            ContractFile file = new ContractFile();
            file.setContractDocumentId(documentId);
            file.setFileUrl(stored.url());
            file.setFileName(stored.fileName());
            file.setFileSize(stored.fileSize());
            file.setMimeType(stored.mimeType() == null ? "application/octet-stream" : stored.mimeType());
            file.setCreatedAt(now);
            fileRepository.save(file);
        }
    }

    private void appendHistory(UUID contractId, UUID fromStageId, UUID toStageId, UUID actorId,
                               Map<String, Object> metadata, LocalDateTime now) {
        ContractStageHistory history = new ContractStageHistory();
        history.setContractId(contractId);
        history.setFromStageId(fromStageId);
        history.setToStageId(toStageId);
        history.setChangedBy(actorId);
        history.setMetadata(metadata);
        history.setCreatedAt(now);
        historyRepository.save(history);
    }

    private static UploadOptions uploadOptions(UUID contractId, DocumentRequirement requirement) {
        return new UploadOptions("contracts/" + contractId,
                requirement.getConfig() == null ? List.of() : requirement.getConfig().allowedTypesOrEmpty(),
                requirement.getConfig() == null ? null : requirement.getConfig().maxSizeBytes());
    }
}
