package com.loandesk.service;

import com.loandesk.api.model.DocumentStatus;
import com.loandesk.error.ForbiddenOperationException;
import com.loandesk.model.Contract;
import com.loandesk.model.ContractDocument;
import com.loandesk.model.ContractFile;
import com.loandesk.model.DocumentConfig;
import com.loandesk.model.DocumentRequirement;
import com.loandesk.repository.ContractDocumentRepository;
import com.loandesk.repository.ContractFileRepository;
import com.loandesk.repository.ContractRepository;
import com.loandesk.storage.StorageService;
import com.loandesk.storage.UploadFile;
import jakarta.persistence.EntityNotFoundException;
import jakarta.transaction.Transactional;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.validation.annotation.Validated;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Contract documents: file validation, review and file removal.
 */
@Service
@Validated
@AllArgsConstructor
@Slf4j
public class DocumentService {

    public static final String PERMISSION_REVIEW = "document.review";

    private final ContractDocumentRepository documentRepository;
    private final ContractFileRepository fileRepository;
    private final ContractRepository contractRepository;
    private final StorageService storageService;
    private final RbacService rbacService;
    private final AuditService auditService;

    /**
     * Checks files against the constraints of a document requirement.
     *
     * @param requirement   the requirement
     * @param existingFiles number of files the document already holds
     * @param files         files to add
     * @return every violation found, empty when the files are acceptable
     */
    public List<String> validateDocumentFiles(@NotNull DocumentRequirement requirement, long existingFiles,
                                              @NotNull List<UploadFile> files) {
        DocumentConfig config = requirement.getConfig();
        List<String> errors = new ArrayList<>();
        if (config == null) {
            return errors;
        }

        long total = existingFiles + files.size();
        if (config.minFiles() != null && total < config.minFiles()) {
            errors.add(String.format("Minimum %d files required", config.minFiles()));
        }
        if (config.maxFiles() != null && total > config.maxFiles()) {
            errors.add(String.format("Maximum %d files allowed", config.maxFiles()));
        }

        List<String> allowedTypes = config.allowedTypesOrEmpty();
        for (UploadFile file : files) {
            if (!allowedTypes.isEmpty() && !allowedTypes.contains(file.contentType())) {
                errors.add(String.format("File type %s is not allowed for %s", file.contentType(), file.fileName()));
            }
            if (config.maxSizeBytes() != null && file.size() > config.maxSizeBytes()) {
                errors.add(String.format("File %s exceeds maximum size of %d bytes",
                        file.fileName(), config.maxSizeBytes()));
            }
        }
        return errors;
    }

    public ContractDocument getDocument(@NotNull UUID documentId) {
        return documentRepository.findById(documentId)
                .orElseThrow(() -> new EntityNotFoundException("Document not found"));
    }

    public List<ContractDocument> getContractDocuments(@NotNull UUID contractId) {
        return documentRepository.findByContractId(contractId);
    }

    public List<ContractFile> getFiles(@NotNull UUID documentId) {
        return fileRepository.findByContractDocumentId(documentId);
    }

    /**
     * Approves or rejects a pending document.
     *
     * @throws IllegalArgumentException    if the status is not a review outcome or the document was reviewed before
     * @throws ForbiddenOperationException if the reviewer lacks {@value #PERMISSION_REVIEW}
     */
    @Transactional
    public ContractDocument reviewDocument(@NotNull UUID documentId, @NotNull DocumentStatus status, String note,
                                           @NotNull UUID reviewerId) {
        if (status == DocumentStatus.PENDING) {
            throw new IllegalArgumentException("Review status must be APPROVED or REJECTED");
        }
        if (!rbacService.hasPermission(reviewerId, PERMISSION_REVIEW)) {
            throw new ForbiddenOperationException("Missing permission: " + PERMISSION_REVIEW);
        }

        ContractDocument document = getDocument(documentId);
        if (document.getStatus() != DocumentStatus.PENDING) {
            throw new IllegalArgumentException("Document has already been reviewed");
        }

        LocalDateTime now = LocalDateTime.now();
        document.setStatus(status);
        document.setReviewNote(note);
        document.setReviewedBy(reviewerId);
        document.setReviewedAt(now);
        document.setUpdatedAt(now);
        document = documentRepository.save(document);

        auditService.log(reviewerId, "DOCUMENT_REVIEWED", AuditService.TARGET_DOCUMENT, documentId,
                Map.of("contractId", document.getContractId(), "status", status.name()));
        log.info("Reviewed document: documentId={}, contractId={}, status={}, reviewer={}",
                documentId, document.getContractId(), status, reviewerId);
        return document;
    }

    /**
     * Removes a file from a pending document. Only the contract's owner or creator may do so.
     */
    @Transactional
    public void deleteFile(@NotNull UUID fileId, @NotNull UUID actorId) {
        ContractFile file = fileRepository.findById(fileId)
                .orElseThrow(() -> new EntityNotFoundException("File not found"));
        ContractDocument document = getDocument(file.getContractDocumentId());
        Contract contract = contractRepository.findById(document.getContractId())
                .orElseThrow(() -> new EntityNotFoundException("Contract not found"));

        if (!contract.isOwnedOrCreatedBy(actorId)) {
            throw new ForbiddenOperationException("Not authorized to update this contract");
        }
        if (document.getStatus() != DocumentStatus.PENDING) {
            throw new IllegalArgumentException("Cannot delete files from a reviewed document");
        }

        fileRepository.delete(file);

        String key = storageService.extractKeyFromUrl(file.getFileUrl());
        if (key != null) {
            if (TransactionSynchronizationManager.isSynchronizationActive()) {
                TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                    @Override
                    public void afterCommit() {
                        deleteBlob(fileId, key, file.getFileUrl());
                    }
                });
            } else {
                deleteBlob(fileId, key, file.getFileUrl());
            }
        }
        log.info("Deleted file: fileId={}, documentId={}, actor={}", fileId, document.getId(), actorId);
    }

    // The blob goes only once the metadata row is gone for good.
    private void deleteBlob(UUID fileId, String key, String url) {
        try {
            storageService.deleteFile(key);
        } catch (RuntimeException e) {
            log.error("Storage inconsistency: file metadata removed but blob remains: fileId={}, url={}",
                    fileId, url, e);
        }
    }
}
