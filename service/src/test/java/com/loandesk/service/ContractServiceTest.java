package com.loandesk.service;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.loandesk.api.model.DocumentStatus;
import com.loandesk.api.request.CreateContractRequest;
import com.loandesk.api.request.TransitionStageRequest;
import com.loandesk.dto.DocumentUpload;
import com.loandesk.error.ForbiddenOperationException;
import com.loandesk.error.StorageException;
import com.loandesk.event.CommissionTriggeredEvent;
import com.loandesk.model.Contract;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ContractServiceTest {

    private static final UUID OWNER = UUID.randomUUID();
    private static final UUID WORKFLOW = UUID.randomUUID();
    private static final UUID REQUIREMENT = UUID.randomUUID();

    @Mock
    private ContractRepository contractRepository;
    @Mock
    private ContractDocumentRepository documentRepository;
    @Mock
    private ContractFileRepository fileRepository;
    @Mock
    private ContractAnswerRepository answerRepository;
    @Mock
    private ContractStageHistoryRepository historyRepository;
    @Mock
    private UserAccountRepository userAccountRepository;
    @Mock
    private CatalogService catalogService;
    @Mock
    private WorkflowService workflowService;
    @Mock
    private DocumentService documentService;
    @Mock
    private RbacService rbacService;
    @Mock
    private AuditService auditService;
    @Mock
    private StorageService storageService;
    @Mock
    private ApplicationEventPublisher eventPublisher;
    @Mock
    private TransactionTemplate transactionTemplate;

    @InjectMocks
    private ContractService contractService;

    private LoanProduct product;
    private WorkflowStage draft;
    private WorkflowStage submitted;
    private WorkflowStage completed;

    @BeforeEach
    void setUp() {
        product = new LoanProduct();
        product.setId(UUID.randomUUID());
        product.setWorkflowId(WORKFLOW);
        product.setMinLoanAmount(new BigDecimal("1000000"));
        product.setMaxLoanAmount(new BigDecimal("5000000"));
        product.setActive(true);
        product.setCommissionEnabled(true);

        draft = stage("DRAFT", 0, false);
        submitted = stage("SUBMITTED", 1, false);
        completed = stage("COMPLETED", 5, true);

        lenient().when(contractRepository.save(any(Contract.class))).thenAnswer(inv -> {
            Contract contract = inv.getArgument(0);
            if (contract.getId() == null) {
                contract.setId(UUID.randomUUID());
            }
            return contract;
        });
        lenient().when(transactionTemplate.execute(any())).thenAnswer(inv ->
                ((TransactionCallback<?>) inv.getArgument(0)).doInTransaction(null));
    }

    // ==================== Numbering ====================

    @Test
    void contractNumberContinuesYearSequence() {
        Contract latest = new Contract();
        latest.setContractNumber("HD-2025-000041");
        when(contractRepository.findFirstByContractNumberStartingWithOrderByContractNumberDesc("HD-2025-"))
                .thenReturn(Optional.of(latest));

        assertThat(contractService.generateContractNumber(2025)).isEqualTo("HD-2025-000042");
    }

    @Test
    void contractNumberRestartsEveryYear() {
        when(contractRepository.findFirstByContractNumberStartingWithOrderByContractNumberDesc("HD-2026-"))
                .thenReturn(Optional.empty());

        assertThat(contractService.generateContractNumber(2026)).isEqualTo("HD-2026-000001");
    }

    // ==================== Creation ====================

    @Test
    void createContractStartsInInitialStageWithPendingDocuments() {
        when(catalogService.getService(product.getId())).thenReturn(product);
        when(workflowService.getInitialStage(WORKFLOW)).thenReturn(draft);
        ServiceDocument link = new ServiceDocument(UUID.randomUUID(), product.getId(), REQUIREMENT, true);
        when(catalogService.getServiceDocuments(product.getId())).thenReturn(List.of(link));

        Contract contract = contractService.createContract(OWNER,
                new CreateContractRequest(product.getId(), new BigDecimal("2000000"), null, null));

        assertThat(contract.getContractNumber()).matches("HD-\\d{4}-000001");
        assertThat(contract.getUserId()).isEqualTo(OWNER);
        assertThat(contract.getCreatorId()).isNull();
        assertThat(contract.getCurrentStageId()).isEqualTo(draft.getId());

        ArgumentCaptor<ContractDocument> document = ArgumentCaptor.forClass(ContractDocument.class);
        verify(documentRepository).save(document.capture());
        assertThat(document.getValue().getStatus()).isEqualTo(DocumentStatus.PENDING);
        assertThat(document.getValue().getDocumentRequirementId()).isEqualTo(REQUIREMENT);

        ArgumentCaptor<ContractStageHistory> history = ArgumentCaptor.forClass(ContractStageHistory.class);
        verify(historyRepository).save(history.capture());
        assertThat(history.getValue().getFromStageId()).isNull();
        assertThat(history.getValue().getToStageId()).isEqualTo(draft.getId());
        assertThat(history.getValue().getMetadata()).containsEntry("action", "contract_created");
    }

    @Test
    void createContractRejectsAmountOutsideProductRange() {
        when(catalogService.getService(product.getId())).thenReturn(product);
        when(workflowService.getInitialStage(WORKFLOW)).thenReturn(draft);

        assertThatThrownBy(() -> contractService.createContract(OWNER,
                new CreateContractRequest(product.getId(), new BigDecimal("500"), null, null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Requested amount must be between 1000000 and 5000000");

        verify(contractRepository, never()).save(any(Contract.class));
    }

    @Test
    void createContractForOthersRequiresAgentRole() {
        when(catalogService.getService(product.getId())).thenReturn(product);
        when(workflowService.getInitialStage(WORKFLOW)).thenReturn(draft);
        when(rbacService.hasRole(OWNER, RbacService.ROLE_CTV)).thenReturn(false);
        when(rbacService.hasPermission(OWNER, RbacService.PERMISSION_CREATE_FOR_OTHERS)).thenReturn(false);

        assertThatThrownBy(() -> contractService.createContract(OWNER,
                new CreateContractRequest(product.getId(), new BigDecimal("2000000"), UUID.randomUUID(), null)))
                .isInstanceOf(ForbiddenOperationException.class);
        verify(contractRepository, never()).save(any(Contract.class));
    }

    @Test
    void agentCreatesContractOnBehalfOfCustomer() {
        UUID customer = UUID.randomUUID();
        when(catalogService.getService(product.getId())).thenReturn(product);
        when(workflowService.getInitialStage(WORKFLOW)).thenReturn(draft);
        when(rbacService.hasRole(OWNER, RbacService.ROLE_CTV)).thenReturn(true);
        when(userAccountRepository.existsById(customer)).thenReturn(true);

        Contract contract = contractService.createContract(OWNER,
                new CreateContractRequest(product.getId(), new BigDecimal("2000000"), customer, null));

        assertThat(contract.getUserId()).isEqualTo(customer);
        assertThat(contract.getCreatorId()).isEqualTo(OWNER);
    }

    // ==================== Submission ====================

    @Test
    void submitWithoutRequiredDocumentChangesNothing() {
        Contract contract = draftContract();
        ContractDocument document = pendingDocument(contract.getId());
        DocumentRequirement requirement = new DocumentRequirement();
        requirement.setName("ID card");

        when(contractRepository.findById(contract.getId())).thenReturn(Optional.of(contract));
        when(workflowService.getStage(draft.getId())).thenReturn(draft);
        when(workflowService.getNextStage(draft)).thenReturn(Optional.of(submitted));
        when(documentRepository.findByContractId(contract.getId())).thenReturn(List.of(document));
        when(catalogService.getServiceDocuments(product.getId()))
                .thenReturn(List.of(new ServiceDocument(UUID.randomUUID(), product.getId(), REQUIREMENT, true)));
        when(fileRepository.countByContractDocumentId(document.getId())).thenReturn(0L);
        when(catalogService.getDocumentRequirement(REQUIREMENT)).thenReturn(requirement);

        assertThatThrownBy(() -> contractService.submitContract(contract.getId(), OWNER, List.of(), List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Missing required document: ID card");

        verify(storageService, never()).uploadFiles(anyList(), any());
        verify(transactionTemplate, never()).execute(any());
        assertThat(contract.getCurrentStageId()).isEqualTo(draft.getId());
    }

    @Test
    void submitMovesDraftToNextStageWithUploadedFiles() {
        Contract contract = draftContract();
        ContractDocument document = pendingDocument(contract.getId());
        DocumentRequirement requirement = new DocumentRequirement();
        requirement.setId(REQUIREMENT);
        requirement.setName("ID card");
        UploadFile file = new UploadFile("id.pdf", "application/pdf", new byte[]{1, 2, 3});

        when(contractRepository.findById(contract.getId())).thenReturn(Optional.of(contract));
        when(workflowService.getStage(draft.getId())).thenReturn(draft);
        when(workflowService.getNextStage(draft)).thenReturn(Optional.of(submitted));
        when(documentRepository.findByContractId(contract.getId())).thenReturn(List.of(document));
        when(catalogService.getServiceDocuments(product.getId()))
                .thenReturn(List.of(new ServiceDocument(UUID.randomUUID(), product.getId(), REQUIREMENT, true)));
        when(catalogService.getDocumentRequirement(REQUIREMENT)).thenReturn(requirement);
        when(storageService.uploadFiles(anyList(), any())).thenReturn(List.of(
                new StoredFile("contracts/x/id.pdf", "http://localhost/files/contracts/x/id.pdf", "id.pdf", 3,
                        "application/pdf")));

        Contract result = contractService.submitContract(contract.getId(), OWNER, List.of(),
                List.of(new DocumentUpload(REQUIREMENT, file)));

        assertThat(result.getCurrentStageId()).isEqualTo(submitted.getId());
        ArgumentCaptor<ContractFile> saved = ArgumentCaptor.forClass(ContractFile.class);
        verify(fileRepository).save(saved.capture());
        assertThat(saved.getValue().getContractDocumentId()).isEqualTo(document.getId());
        assertThat(saved.getValue().getFileName()).isEqualTo("id.pdf");

        ArgumentCaptor<ContractStageHistory> history = ArgumentCaptor.forClass(ContractStageHistory.class);
        verify(historyRepository).save(history.capture());
        assertThat(history.getValue().getFromStageId()).isEqualTo(draft.getId());
        assertThat(history.getValue().getToStageId()).isEqualTo(submitted.getId());
        assertThat(history.getValue().getMetadata()).containsEntry("action", "contract_submitted");
    }

    @Test
    void failedSecondUploadReportsFilesAlreadyStored() {
        Contract contract = draftContract();
        UUID optionalRequirement = UUID.randomUUID();
        ContractDocument idCard = pendingDocument(contract.getId());
        ContractDocument payslip = pendingDocument(contract.getId());
        payslip.setDocumentRequirementId(optionalRequirement);
        DocumentRequirement idCardRequirement = new DocumentRequirement();
        idCardRequirement.setName("ID card");
        DocumentRequirement payslipRequirement = new DocumentRequirement();
        payslipRequirement.setName("Payslip");

        when(contractRepository.findById(contract.getId())).thenReturn(Optional.of(contract));
        when(workflowService.getStage(draft.getId())).thenReturn(draft);
        when(workflowService.getNextStage(draft)).thenReturn(Optional.of(submitted));
        when(documentRepository.findByContractId(contract.getId())).thenReturn(List.of(idCard, payslip));
        when(catalogService.getServiceDocuments(product.getId()))
                .thenReturn(List.of(new ServiceDocument(UUID.randomUUID(), product.getId(), REQUIREMENT, true)));
        when(catalogService.getDocumentRequirement(REQUIREMENT)).thenReturn(idCardRequirement);
        when(catalogService.getDocumentRequirement(optionalRequirement)).thenReturn(payslipRequirement);
        String storedUrl = "http://localhost/files/contracts/x/id.pdf";
        when(storageService.uploadFiles(anyList(), any()))
                .thenReturn(List.of(new StoredFile("contracts/x/id.pdf", storedUrl, "id.pdf", 3, "application/pdf")))
                .thenThrow(new StorageException("Failed to store file payslip.pdf"));

        Logger logger = (Logger) LoggerFactory.getLogger(ContractService.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            assertThatThrownBy(() -> contractService.submitContract(contract.getId(), OWNER, List.of(), List.of(
                    new DocumentUpload(REQUIREMENT, new UploadFile("id.pdf", "application/pdf", new byte[]{1, 2, 3})),
                    new DocumentUpload(optionalRequirement,
                            new UploadFile("payslip.pdf", "application/pdf", new byte[]{4})))))
                    .isInstanceOf(StorageException.class);
        } finally {
            logger.detachAppender(appender);
        }

        verify(transactionTemplate, never()).execute(any());
        assertThat(contract.getCurrentStageId()).isEqualTo(draft.getId());
        assertThat(appender.list)
                .anySatisfy(event -> {
                    assertThat(event.getLevel()).isEqualTo(Level.ERROR);
                    assertThat(event.getFormattedMessage()).contains("Storage inconsistency").contains(storedUrl);
                });
    }

    @Test
    void submittedContractCannotBeSubmittedAgain() {
        Contract contract = draftContract();
        contract.setCurrentStageId(submitted.getId());
        when(contractRepository.findById(contract.getId())).thenReturn(Optional.of(contract));
        when(workflowService.getStage(submitted.getId())).thenReturn(submitted);

        assertThatThrownBy(() -> contractService.submitContract(contract.getId(), OWNER, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Contract has already been submitted");
    }

    @Test
    void strangerCannotSubmit() {
        Contract contract = draftContract();
        when(contractRepository.findById(contract.getId())).thenReturn(Optional.of(contract));

        assertThatThrownBy(() -> contractService.submitContract(contract.getId(), UUID.randomUUID(), null, null))
                .isInstanceOf(ForbiddenOperationException.class)
                .hasMessage("Not authorized to update this contract");
    }

    // ==================== Transitions ====================

    @Test
    void completingContractRecordsRevenueAndPublishesCommissionEvent() {
        Contract contract = draftContract();
        contract.setCurrentStageId(submitted.getId());
        when(contractRepository.findById(contract.getId())).thenReturn(Optional.of(contract));
        when(catalogService.getService(product.getId())).thenReturn(product);
        when(workflowService.getStage(submitted.getId())).thenReturn(submitted);
        when(workflowService.getStage(completed.getId())).thenReturn(completed);

        UUID admin = UUID.randomUUID();
        contractService.transitionStage(contract.getId(), new TransitionStageRequest(completed.getId(), "done",
                new BigDecimal("10000000"), new BigDecimal("5")), admin);

        assertThat(contract.getCurrentStageId()).isEqualTo(completed.getId());
        assertThat(contract.getTotalRevenue()).isEqualByComparingTo("500000.00");
        ArgumentCaptor<CommissionTriggeredEvent> event = ArgumentCaptor.forClass(CommissionTriggeredEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertThat(event.getValue().contractId()).isEqualTo(contract.getId());
        assertThat(event.getValue().ownerId()).isEqualTo(OWNER);
        assertThat(event.getValue().totalRevenue()).isEqualByComparingTo("500000.00");
    }

    @Test
    void completingContractRequiresDisbursement() {
        Contract contract = draftContract();
        contract.setCurrentStageId(submitted.getId());
        when(contractRepository.findById(contract.getId())).thenReturn(Optional.of(contract));
        when(catalogService.getService(product.getId())).thenReturn(product);
        when(workflowService.getStage(submitted.getId())).thenReturn(submitted);
        when(workflowService.getStage(completed.getId())).thenReturn(completed);

        assertThatThrownBy(() -> contractService.transitionStage(contract.getId(),
                new TransitionStageRequest(completed.getId(), null, null, new BigDecimal("5")), OWNER))
                .isInstanceOf(IllegalArgumentException.class);

        verify(contractRepository, never()).save(any(Contract.class));
        verify(eventPublisher, never()).publishEvent(any(CommissionTriggeredEvent.class));
    }

    @Test
    void refusedTransitionLeavesContractUntouched() {
        Contract contract = draftContract();
        when(contractRepository.findById(contract.getId())).thenReturn(Optional.of(contract));
        when(catalogService.getService(product.getId())).thenReturn(product);
        doThrow(new ForbiddenOperationException("Invalid transition"))
                .when(workflowService).validateTransition(WORKFLOW, draft.getId(), completed.getId(), OWNER);

        assertThatThrownBy(() -> contractService.transitionStage(contract.getId(),
                new TransitionStageRequest(completed.getId(), null, null, null), OWNER))
                .isInstanceOf(ForbiddenOperationException.class)
                .hasMessage("Invalid transition");

        assertThat(contract.getCurrentStageId()).isEqualTo(draft.getId());
        verify(historyRepository, never()).save(any());
    }

    @Test
    void revenueIsRoundedHalfUp() {
        assertThat(ContractService.calculateRevenue(new BigDecimal("1234.56"), new BigDecimal("3.33")))
                .isEqualByComparingTo("41.11");
    }

    // ==================== Disbursement correction ====================

    @Test
    void disbursementCorrectionRecomputesRevenue() {
        WorkflowStage disbursed = stage("DISBURSED", 4, false);
        Contract contract = draftContract();
        contract.setCurrentStageId(disbursed.getId());
        contract.setDisbursedAmount(new BigDecimal("10000000"));
        contract.setRevenuePercentage(new BigDecimal("5"));
        contract.setTotalRevenue(new BigDecimal("500000.00"));
        when(contractRepository.findById(contract.getId())).thenReturn(Optional.of(contract));
        when(workflowService.getStage(disbursed.getId())).thenReturn(disbursed);
        UUID admin = UUID.randomUUID();

        Contract updated = contractService.updateDisbursedAmount(contract.getId(), new BigDecimal("8000000"), admin);

        assertThat(updated.getDisbursedAmount()).isEqualByComparingTo("8000000");
        assertThat(updated.getTotalRevenue()).isEqualByComparingTo("400000.00");
        verify(auditService).log(eq(admin), eq("CONTRACT_DISBURSEMENT_UPDATED"), eq(AuditService.TARGET_CONTRACT),
                eq(contract.getId()), anyMap());
    }

    @Test
    void disbursementCorrectionWithoutPercentageKeepsRevenueEmpty() {
        WorkflowStage approved = stage("APPROVED", 3, false);
        Contract contract = draftContract();
        contract.setCurrentStageId(approved.getId());
        when(contractRepository.findById(contract.getId())).thenReturn(Optional.of(contract));
        when(workflowService.getStage(approved.getId())).thenReturn(approved);

        Contract updated = contractService.updateDisbursedAmount(contract.getId(), new BigDecimal("3000000"),
                UUID.randomUUID());

        assertThat(updated.getDisbursedAmount()).isEqualByComparingTo("3000000");
        assertThat(updated.getTotalRevenue()).isNull();
    }

    @Test
    void disbursementCorrectionRejectedForDraft() {
        Contract contract = draftContract();
        when(contractRepository.findById(contract.getId())).thenReturn(Optional.of(contract));
        when(workflowService.getStage(draft.getId())).thenReturn(draft);

        assertThatThrownBy(() -> contractService.updateDisbursedAmount(contract.getId(), new BigDecimal("3000000"),
                UUID.randomUUID()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Cannot update disbursed amount of a draft contract");
        verify(contractRepository, never()).save(any(Contract.class));
    }

    @Test
    void disbursementCorrectionRejectedInCommissionStage() {
        Contract contract = draftContract();
        contract.setCurrentStageId(completed.getId());
        contract.setDisbursedAmount(new BigDecimal("10000000"));
        when(contractRepository.findById(contract.getId())).thenReturn(Optional.of(contract));
        when(workflowService.getStage(completed.getId())).thenReturn(completed);

        assertThatThrownBy(() -> contractService.updateDisbursedAmount(contract.getId(), new BigDecimal("3000000"),
                UUID.randomUUID()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Cannot update disbursed amount after commission has been processed");
        assertThat(contract.getDisbursedAmount()).isEqualByComparingTo("10000000");
        verify(contractRepository, never()).save(any(Contract.class));
    }

    @Test
    void disbursementCorrectionRejectsNonPositiveAmount() {
        UUID contractId = UUID.randomUUID();

        assertThatThrownBy(() -> contractService.updateDisbursedAmount(contractId, BigDecimal.ZERO, UUID.randomUUID()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Disbursed amount must be greater than 0");
        assertThatThrownBy(() -> contractService.updateDisbursedAmount(contractId, new BigDecimal("-5"),
                UUID.randomUUID()))
                .isInstanceOf(IllegalArgumentException.class);
        verify(contractRepository, never()).findById(any());
    }

    private Contract draftContract() {
        Contract contract = new Contract();
        contract.setId(UUID.randomUUID());
        contract.setContractNumber("HD-2025-000001");
        contract.setUserId(OWNER);
        contract.setServiceId(product.getId());
        contract.setCurrentStageId(draft.getId());
        contract.setRequestedAmount(new BigDecimal("2000000"));
        return contract;
    }

    private static ContractDocument pendingDocument(UUID contractId) {
        ContractDocument document = new ContractDocument();
        document.setId(UUID.randomUUID());
        document.setContractId(contractId);
        document.setDocumentRequirementId(REQUIREMENT);
        document.setStatus(DocumentStatus.PENDING);
        return document;
    }

    private static WorkflowStage stage(String code, int order, boolean triggersCommission) {
        WorkflowStage stage = new WorkflowStage();
        stage.setId(UUID.randomUUID());
        stage.setWorkflowId(WORKFLOW);
        stage.setCode(code);
        stage.setName(code);
        stage.setStageOrder(order);
        stage.setTriggersCommission(triggersCommission);
        return stage;
    }
}
