package com.loandesk;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loandesk.api.request.CreateLoanProductRequest;
import com.loandesk.api.request.CreateWorkflowRequest;
import com.loandesk.api.request.StageDefinition;
import com.loandesk.api.request.TransitionDefinition;
import com.loandesk.dto.WorkflowGraph;
import com.loandesk.model.LoanProduct;
import com.loandesk.model.WorkflowStage;
import com.loandesk.service.CatalogService;
import com.loandesk.service.CommissionService;
import com.loandesk.service.ContractService;
import com.loandesk.service.WalletService;
import com.loandesk.service.WorkflowService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@SpringBootTest(
        classes = LoanDeskApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
@ActiveProfiles("test")
public abstract class TestBase {
    protected static final DockerImageName DOCKER_IMAGE = DockerImageName.parse("postgres:16.6")
            .asCompatibleSubstituteFor("postgres");
    protected static final PostgreSQLContainer<?> postgres =
            new PostgreSQLContainer<>(DOCKER_IMAGE);

    @Autowired
    protected WorkflowService workflowService;

    @Autowired
    protected CatalogService catalogService;

    @Autowired
    protected ContractService contractService;

    @Autowired
    protected CommissionService commissionService;

    @Autowired
    protected WalletService walletService;

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @Autowired
    protected MockMvc mockMvc;

    @Autowired
    protected ObjectMapper objectMapper;

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        postgres.start();
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    /**
     * Inserts a user into the directory table, optionally referred by another user.
     */
    protected UUID createUser(UUID referredBy, String... roleCodes) {
        UUID userId = UUID.randomUUID();
        jdbcTemplate.update("INSERT INTO app_user (id, email, fullname, referred_by) VALUES (?, ?, ?, ?)",
                userId, userId + "@example.com", "User " + userId.toString().substring(0, 8), referredBy);
        for (String roleCode : roleCodes) {
            jdbcTemplate.update("INSERT INTO user_role (user_id, role_id) SELECT ?, id FROM role WHERE code = ?",
                    userId, roleCode);
        }
        return userId;
    }

    /**
     * Creates a workflow from the default stage template, linked linearly from DRAFT to COMPLETED,
     * with extra REJECTED exits. No transition requires a permission.
     */
    protected WorkflowGraph createLinearWorkflow() {
        List<StageDefinition> stages = workflowService.getDefaultStages();
        List<TransitionDefinition> transitions = new ArrayList<>();
        for (int i = 0; i < stages.size() - 2; i++) {
            transitions.add(new TransitionDefinition(stages.get(i).code(), stages.get(i + 1).code(), null));
        }
        transitions.add(new TransitionDefinition("SUBMITTED", "REJECTED", null));
        transitions.add(new TransitionDefinition("REVIEWING", "REJECTED", null));

        return workflowService.createWorkflow(new CreateWorkflowRequest("Test workflow " + UUID.randomUUID(),
                null, stages, transitions));
    }

    protected LoanProduct createProduct(UUID workflowId, String min, String max) {
        return catalogService.createService(new CreateLoanProductRequest("Test loan " + UUID.randomUUID(), null,
                workflowId, new BigDecimal(min), new BigDecimal(max), true, null, null));
    }

    protected static WorkflowStage stage(WorkflowGraph graph, String code) {
        return graph.stages().stream()
                .filter(stage -> stage.getCode().equals(code))
                .findFirst()
                .orElseThrow();
    }
}
