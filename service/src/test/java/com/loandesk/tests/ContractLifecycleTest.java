package com.loandesk.tests;

import com.loandesk.TestBase;
import com.loandesk.api.ApiHeaders;
import com.loandesk.api.model.CommissionStatus;
import com.loandesk.api.request.CreateCommissionConfigRequest;
import com.loandesk.api.request.CreateContractRequest;
import com.loandesk.api.request.TransitionStageRequest;
import com.loandesk.dto.WorkflowGraph;
import com.loandesk.model.CommissionRecord;
import com.loandesk.model.Contract;
import com.loandesk.model.LoanProduct;
import com.loandesk.service.RbacService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.MediaType;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.matchesPattern;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Contract lifecycle through the REST API, from creation to completion and commission payout.
 */
public class ContractLifecycleTest extends TestBase {

    private WorkflowGraph workflow;
    private LoanProduct product;
    private UUID admin;

    @BeforeEach
    public void setup() {
        workflow = createLinearWorkflow();
        product = createProduct(workflow.workflow().getId(), "1000000", "5000000");
        admin = createUser(null, RbacService.ROLE_ADMIN);
    }

    // ==================== Creation ====================

    @Test
    public void createContract_WithinRange_StartsInDraft() throws Exception {
        UUID owner = createUser(null, RbacService.ROLE_USER);

        mockMvc.perform(post("/api/v1/contracts")
                        .header(ApiHeaders.USER_ID, owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new CreateContractRequest(product.getId(),
                                new BigDecimal("2000000"), null, null))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.userId").value(owner.toString()))
                .andExpect(jsonPath("$.currentStage.code").value("DRAFT"))
                .andExpect(jsonPath("$.contractNumber").value(matchesPattern("HD-\\d{4}-\\d{6}")));
    }

    @Test
    public void createContract_BelowMinimum_Returns400AndWritesNothing() throws Exception {
        UUID owner = createUser(null, RbacService.ROLE_USER);

        mockMvc.perform(post("/api/v1/contracts")
                        .header(ApiHeaders.USER_ID, owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new CreateContractRequest(product.getId(),
                                new BigDecimal("500"), null, null))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(startsWith("Requested amount must be between")));

        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM contract WHERE service_id = ?",
                Integer.class, product.getId());
        assertThat(count).isZero();
    }

    @Test
    public void createContract_WithoutActorHeader_Returns400() throws Exception {
        mockMvc.perform(post("/api/v1/contracts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new CreateContractRequest(product.getId(),
                                new BigDecimal("2000000"), null, null))))
                .andExpect(status().isBadRequest());
    }

    @Test
    public void createContract_ForOtherUserWithoutAgentRole_Returns403() throws Exception {
        UUID actor = createUser(null, RbacService.ROLE_USER);
        UUID other = createUser(null, RbacService.ROLE_USER);

        mockMvc.perform(post("/api/v1/contracts")
                        .header(ApiHeaders.USER_ID, actor)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new CreateContractRequest(product.getId(),
                                new BigDecimal("2000000"), other, null))))
                .andExpect(status().isForbidden());
    }

    @Test
    public void createContract_ByAgentForCustomer_RecordsCreator() throws Exception {
        UUID agent = createUser(null, RbacService.ROLE_CTV);
        UUID customer = createUser(null, RbacService.ROLE_USER);

        mockMvc.perform(post("/api/v1/contracts")
                        .header(ApiHeaders.USER_ID, agent)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new CreateContractRequest(product.getId(),
                                new BigDecimal("2000000"), customer, null))))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.userId").value(customer.toString()))
                .andExpect(jsonPath("$.creatorId").value(agent.toString()));
    }

    // ==================== Submission and transitions ====================

    @Test
    public void submitContract_Twice_SecondReturns400() throws Exception {
        UUID owner = createUser(null, RbacService.ROLE_USER);
        Contract contract = contractService.createContract(owner,
                new CreateContractRequest(product.getId(), new BigDecimal("2000000"), null, null));

        mockMvc.perform(multipart("/api/v1/contracts/{contractId}/submit", contract.getId())
                        .header(ApiHeaders.USER_ID, owner))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currentStage.code").value("SUBMITTED"));

        mockMvc.perform(multipart("/api/v1/contracts/{contractId}/submit", contract.getId())
                        .header(ApiHeaders.USER_ID, owner))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Contract has already been submitted"));
    }

    @Test
    public void transitionStage_NotInWorkflow_Returns403() throws Exception {
        UUID owner = createUser(null, RbacService.ROLE_USER);
        Contract contract = contractService.createContract(owner,
                new CreateContractRequest(product.getId(), new BigDecimal("2000000"), null, null));

        mockMvc.perform(post("/api/v1/contracts/{contractId}/transition", contract.getId())
                        .header(ApiHeaders.USER_ID, admin)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new TransitionStageRequest(
                                stage(workflow, "COMPLETED").getId(), null, new BigDecimal("2000000"),
                                new BigDecimal("5")))))
                .andExpect(status().isForbidden());

        assertThat(contractService.getContract(contract.getId()).getCurrentStageId())
                .isEqualTo(stage(workflow, "DRAFT").getId());
    }

    @Test
    public void completeContract_CreditsReferrerCommission() throws Exception {
        if (commissionService.getCommissionRate(RbacService.ROLE_USER).signum() == 0) {
            commissionService.createConfig(new CreateCommissionConfigRequest(RbacService.ROLE_USER,
                    new BigDecimal("0.1")), admin);
        }
        BigDecimal rate = commissionService.getCommissionRate(RbacService.ROLE_USER);

        UUID referrer = createUser(null, RbacService.ROLE_USER);
        UUID owner = createUser(referrer, RbacService.ROLE_USER);
        Contract contract = contractService.createContract(owner,
                new CreateContractRequest(product.getId(), new BigDecimal("5000000"), null, null));

        mockMvc.perform(multipart("/api/v1/contracts/{contractId}/submit", contract.getId())
                        .header(ApiHeaders.USER_ID, owner))
                .andExpect(status().isOk());

        for (String code : List.of("REVIEWING", "APPROVED", "DISBURSED")) {
            transition(contract.getId(), code, null, null);
        }

        mockMvc.perform(post("/api/v1/contracts/{contractId}/transition", contract.getId())
                        .header(ApiHeaders.USER_ID, admin)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new TransitionStageRequest(
                                stage(workflow, "COMPLETED").getId(), null, null, new BigDecimal("5")))))
                .andExpect(status().isBadRequest());

        transition(contract.getId(), "COMPLETED", new BigDecimal("10000000"), new BigDecimal("5"));

        Contract completed = contractService.getContract(contract.getId());
        assertThat(completed.getTotalRevenue()).isEqualByComparingTo("500000.00");

        List<CommissionRecord> records = commissionService.getCommissionRecords(referrer, null, PageRequest.of(0, 10))
                .getContent();
        assertThat(records).hasSize(1);
        assertThat(records.get(0).getContractId()).isEqualTo(contract.getId());
        assertThat(records.get(0).getStatus()).isEqualTo(CommissionStatus.CREDITED);
        BigDecimal expected = new BigDecimal("500000.00").multiply(rate);
        assertThat(records.get(0).getAmount()).isEqualByComparingTo(expected);
        assertThat(walletService.getBalance(referrer)).isEqualByComparingTo(expected);

        mockMvc.perform(get("/api/v1/contracts/{contractId}/history", contract.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(6));
    }

    private void transition(UUID contractId, String stageCode, BigDecimal disbursement, BigDecimal percentage)
            throws Exception {
        mockMvc.perform(post("/api/v1/contracts/{contractId}/transition", contractId)
                        .header(ApiHeaders.USER_ID, admin)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(new TransitionStageRequest(
                                stage(workflow, stageCode).getId(), null, disbursement, percentage))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.currentStage.code").value(stageCode));
    }
}
