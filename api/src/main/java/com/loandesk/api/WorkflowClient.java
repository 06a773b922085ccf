package com.loandesk.api;

import com.loandesk.api.dto.PagedResponse;
import com.loandesk.api.dto.StageDTO;
import com.loandesk.api.dto.TransitionDTO;
import com.loandesk.api.dto.WorkflowDTO;
import com.loandesk.api.request.CreateStageRequest;
import com.loandesk.api.request.CreateTransitionRequest;
import com.loandesk.api.request.CreateWorkflowRequest;
import com.loandesk.api.request.StageDefinition;
import com.loandesk.api.request.UpdateStageRequest;
import com.loandesk.api.request.UpdateWorkflowRequest;
import com.loandesk.api.response.TransitionCheckResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.UUID;

/**
 * WebClient-based implementation of WorkflowApi.
 *
 * <p><b>IMPORTANT:</b> This client is NOT a Spring @Component. Consuming services must
 * register it as a bean themselves:
 * <pre>
 * {@code
 * @Configuration
 * public class LoanDeskClientConfig {
 *     @Bean
 *     public WebClient loandeskWebClient(WebClient.Builder builder,
 *                                        @Value("${services.loandesk.url}") String baseUrl) {
 *         return builder.baseUrl(baseUrl).build();
 *     }
 *
 *     @Bean
 *     public WorkflowClient workflowClient(WebClient loandeskWebClient) {
 *         return new WorkflowClient(loandeskWebClient);
 *     }
 * }
 * }
 * </pre>
 */
@RequiredArgsConstructor
@Slf4j
public class WorkflowClient implements WorkflowApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<WorkflowDTO> createWorkflow(CreateWorkflowRequest request) {
        log.debug("Calling createWorkflow: name={}", request.name());

        return webClient.post()
                .uri("/api/v1/workflows")
                .bodyValue(request)
                .retrieve()
                .toEntity(WorkflowDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<PagedResponse<WorkflowDTO>> listWorkflows(int page, int size) {
        log.debug("Calling listWorkflows: page={}, size={}", page, size);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/workflows")
                        .queryParam("page", page)
                        .queryParam("size", size)
                        .build())
                .retrieve()
                .toEntity(new ParameterizedTypeReference<PagedResponse<WorkflowDTO>>() {})
                .block();
    }

    @Override
    public ResponseEntity<List<StageDefinition>> getDefaultStages() {
        return webClient.get()
                .uri("/api/v1/workflows/default-stages")
                .retrieve()
                .toEntityList(StageDefinition.class)
                .block();
    }

    @Override
    public ResponseEntity<WorkflowDTO> getWorkflow(UUID workflowId) {
        log.debug("Calling getWorkflow: workflowId={}", workflowId);

        return webClient.get()
                .uri("/api/v1/workflows/{workflowId}", workflowId)
                .retrieve()
                .toEntity(WorkflowDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<WorkflowDTO> updateWorkflow(UUID workflowId, UpdateWorkflowRequest request) {
        log.debug("Calling updateWorkflow: workflowId={}", workflowId);

        return webClient.put()
                .uri("/api/v1/workflows/{workflowId}", workflowId)
                .bodyValue(request)
                .retrieve()
                .toEntity(WorkflowDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<List<TransitionDTO>> getAvailableTransitions(UUID workflowId, UUID stageId) {
        log.debug("Calling getAvailableTransitions: workflowId={}, stageId={}", workflowId, stageId);

        return webClient.get()
                .uri("/api/v1/workflows/{workflowId}/stages/{stageId}/transitions", workflowId, stageId)
                .retrieve()
                .toEntityList(TransitionDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<TransitionCheckResponse> checkTransition(UUID workflowId, UUID fromStageId,
                                                                   UUID toStageId, UUID actorId) {
        log.debug("Calling checkTransition: workflowId={}, from={}, to={}, actorId={}",
                workflowId, fromStageId, toStageId, actorId);

        return webClient.get()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/workflows/{workflowId}/transitions/check")
                        .queryParam("fromStageId", fromStageId)
                        .queryParam("toStageId", toStageId)
                        .build(workflowId))
                .header(ApiHeaders.USER_ID, actorId.toString())
                .retrieve()
                .toEntity(TransitionCheckResponse.class)
                .block();
    }

    @Override
    public ResponseEntity<StageDTO> createStage(UUID workflowId, CreateStageRequest request) {
        log.debug("Calling createStage: workflowId={}, code={}", workflowId, request.code());

        return webClient.post()
                .uri("/api/v1/workflows/{workflowId}/stages", workflowId)
                .bodyValue(request)
                .retrieve()
                .toEntity(StageDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<StageDTO> updateStage(UUID workflowId, UUID stageId, UpdateStageRequest request) {
        log.debug("Calling updateStage: workflowId={}, stageId={}", workflowId, stageId);

        return webClient.put()
                .uri("/api/v1/workflows/{workflowId}/stages/{stageId}", workflowId, stageId)
                .bodyValue(request)
                .retrieve()
                .toEntity(StageDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<Void> deleteStage(UUID workflowId, UUID stageId) {
        log.debug("Calling deleteStage: workflowId={}, stageId={}", workflowId, stageId);

        return webClient.delete()
                .uri("/api/v1/workflows/{workflowId}/stages/{stageId}", workflowId, stageId)
                .retrieve()
                .toBodilessEntity()
                .block();
    }

    @Override
    public ResponseEntity<TransitionDTO> createTransition(UUID workflowId, CreateTransitionRequest request) {
        log.debug("Calling createTransition: workflowId={}, from={}, to={}",
                workflowId, request.fromStageId(), request.toStageId());

        return webClient.post()
                .uri("/api/v1/workflows/{workflowId}/transitions", workflowId)
                .bodyValue(request)
                .retrieve()
                .toEntity(TransitionDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<Void> deleteTransition(UUID workflowId, UUID transitionId) {
        log.debug("Calling deleteTransition: workflowId={}, transitionId={}", workflowId, transitionId);

        return webClient.delete()
                .uri("/api/v1/workflows/{workflowId}/transitions/{transitionId}", workflowId, transitionId)
                .retrieve()
                .toBodilessEntity()
                .block();
    }
}
