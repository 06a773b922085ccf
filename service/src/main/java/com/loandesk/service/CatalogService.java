package com.loandesk.service;

import com.loandesk.api.request.CreateDocumentRequirementRequest;
import com.loandesk.api.request.CreateLoanProductRequest;
import com.loandesk.api.request.CreateQuestionRequest;
import com.loandesk.api.request.ServiceDocumentLink;
import com.loandesk.api.request.ServiceQuestionLink;
import com.loandesk.error.ResourceConflictException;
import com.loandesk.model.DocumentConfig;
import com.loandesk.model.DocumentRequirement;
import com.loandesk.model.LoanProduct;
import com.loandesk.model.Question;
import com.loandesk.model.QuestionConfig;
import com.loandesk.model.ServiceDocument;
import com.loandesk.model.ServiceQuestion;
import com.loandesk.model.Workflow;
import com.loandesk.repository.DocumentRequirementRepository;
import com.loandesk.repository.LoanProductRepository;
import com.loandesk.repository.QuestionRepository;
import com.loandesk.repository.ServiceDocumentRepository;
import com.loandesk.repository.ServiceQuestionRepository;
import jakarta.persistence.EntityNotFoundException;
import jakarta.transaction.Transactional;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Loan products ("services") and the document requirements and questions attached to them.
 */
@Service
@Validated
@AllArgsConstructor
@Slf4j
public class CatalogService {

    private final LoanProductRepository loanProductRepository;
    private final DocumentRequirementRepository documentRequirementRepository;
    private final QuestionRepository questionRepository;
    private final ServiceDocumentRepository serviceDocumentRepository;
    private final ServiceQuestionRepository serviceQuestionRepository;
    private final WorkflowService workflowService;

    /**
     * Creates a loan product bound to an active workflow.
     *
     * @throws IllegalArgumentException if the workflow is inactive or the loan bounds are inverted
     */
    @Transactional
    public LoanProduct createService(@Valid @NotNull CreateLoanProductRequest request) {
        Workflow workflow = workflowService.findById(request.workflowId());
        if (!workflow.isActive()) {
            throw new IllegalArgumentException("Workflow is not active");
        }

        BigDecimal min = request.minLoanAmount() != null ? request.minLoanAmount() : LoanProduct.DEFAULT_MIN_LOAN_AMOUNT;
        BigDecimal max = request.maxLoanAmount() != null ? request.maxLoanAmount() : LoanProduct.DEFAULT_MAX_LOAN_AMOUNT;
        if (min.compareTo(max) > 0) {
            throw new IllegalArgumentException("Minimum loan amount must not exceed maximum loan amount");
        }

        LocalDateTime now = LocalDateTime.now();
        LoanProduct product = new LoanProduct();
        product.setName(request.name());
        product.setDescription(request.description());
        product.setWorkflowId(workflow.getId());
        product.setMinLoanAmount(min);
        product.setMaxLoanAmount(max);
        product.setCommissionEnabled(request.commissionEnabled() == null || request.commissionEnabled());
        product.setActive(true);
        product.setCreatedAt(now);
        product.setUpdatedAt(now);
        product = loanProductRepository.save(product);

        if (request.documents() != null) {
            for (ServiceDocumentLink link : request.documents()) {
                getDocumentRequirement(link.documentRequirementId());
                ServiceDocument document = new ServiceDocument();
                document.setServiceId(product.getId());
                document.setDocumentRequirementId(link.documentRequirementId());
                document.setRequired(link.required() == null || link.required());
                serviceDocumentRepository.save(document);
            }
        }
        if (request.questions() != null) {
            for (ServiceQuestionLink link : request.questions()) {
                getQuestion(link.questionId());
                ServiceQuestion question = new ServiceQuestion();
                question.setServiceId(product.getId());
                question.setQuestionId(link.questionId());
                question.setRequired(Boolean.TRUE.equals(link.required()));
                question.setSortOrder(link.sortOrder() == null ? 0 : link.sortOrder());
                serviceQuestionRepository.save(question);
            }
        }

        log.info("Created loan service: id={}, name={}, workflowId={}, min={}, max={}",
                product.getId(), product.getName(), workflow.getId(), min, max);
        return product;
    }

    public LoanProduct getService(@NotNull UUID serviceId) {
        return loanProductRepository.findById(serviceId)
                .orElseThrow(() -> new EntityNotFoundException("Service not found"));
    }

    @Transactional
    public LoanProduct setServiceActive(@NotNull UUID serviceId, boolean active) {
        LoanProduct product = getService(serviceId);
        product.setActive(active);
        product.setUpdatedAt(LocalDateTime.now());
        log.info("Loan service {}: id={}", active ? "activated" : "deactivated", serviceId);
        return loanProductRepository.save(product);
    }

    public List<ServiceDocument> getServiceDocuments(@NotNull UUID serviceId) {
        return serviceDocumentRepository.findByServiceId(serviceId);
    }

    public List<ServiceQuestion> getServiceQuestions(@NotNull UUID serviceId) {
        return serviceQuestionRepository.findByServiceIdOrderBySortOrderAsc(serviceId);
    }

    @Transactional
    public DocumentRequirement createDocumentRequirement(@Valid @NotNull CreateDocumentRequirementRequest request) {
        String code = request.code().trim().toUpperCase(Locale.ROOT);
        if (documentRequirementRepository.existsByCode(code)) {
            throw new ResourceConflictException("Document requirement code already exists: " + code);
        }
        if (request.minFiles() != null && request.maxFiles() != null && request.minFiles() > request.maxFiles()) {
            throw new IllegalArgumentException("Minimum files must not exceed maximum files");
        }

        LocalDateTime now = LocalDateTime.now();
        DocumentRequirement requirement = new DocumentRequirement();
        requirement.setCode(code);
        requirement.setName(request.name());
        requirement.setDescription(request.description());
        requirement.setVersion(1);
        requirement.setConfig(new DocumentConfig(request.maxFiles(), request.minFiles(),
                request.allowedTypes() == null ? List.of() : request.allowedTypes(),
                request.maxSizeBytes(), request.expirationDays()));
        requirement.setActive(true);
        requirement.setCreatedAt(now);
        requirement.setUpdatedAt(now);
        requirement = documentRequirementRepository.save(requirement);

        log.info("Created document requirement: id={}, code={}", requirement.getId(), code);
        return requirement;
    }

    public DocumentRequirement getDocumentRequirement(@NotNull UUID requirementId) {
        return documentRequirementRepository.findById(requirementId)
                .orElseThrow(() -> new EntityNotFoundException("Document requirement not found"));
    }

    @Transactional
    public Question createQuestion(@Valid @NotNull CreateQuestionRequest request) {
        LocalDateTime now = LocalDateTime.now();
        Question question = new Question();
        question.setContent(request.content());
        question.setType(request.type());
        question.setConfig(new QuestionConfig(request.options(), request.placeholder(), request.maxLength()));
        question.setActive(true);
        question.setCreatedAt(now);
        question.setUpdatedAt(now);
        question = questionRepository.save(question);

        log.info("Created question: id={}, type={}", question.getId(), question.getType());
        return question;
    }

    public Question getQuestion(@NotNull UUID questionId) {
        return questionRepository.findById(questionId)
                .orElseThrow(() -> new EntityNotFoundException("Question not found"));
    }
}
