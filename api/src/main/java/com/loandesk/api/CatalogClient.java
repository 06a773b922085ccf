package com.loandesk.api;

import com.loandesk.api.dto.DocumentRequirementDTO;
import com.loandesk.api.dto.LoanProductDTO;
import com.loandesk.api.dto.QuestionDTO;
import com.loandesk.api.request.CreateDocumentRequirementRequest;
import com.loandesk.api.request.CreateLoanProductRequest;
import com.loandesk.api.request.CreateQuestionRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.UUID;

@RequiredArgsConstructor
@Slf4j
public class CatalogClient implements CatalogApi {

    private final WebClient webClient;

    @Override
    public ResponseEntity<LoanProductDTO> createService(CreateLoanProductRequest request) {
        log.debug("Calling createService: name={}, workflowId={}", request.name(), request.workflowId());

        return webClient.post()
                .uri("/api/v1/catalog/services")
                .bodyValue(request)
                .retrieve()
                .toEntity(LoanProductDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<LoanProductDTO> getService(UUID serviceId) {
        return webClient.get()
                .uri("/api/v1/catalog/services/{serviceId}", serviceId)
                .retrieve()
                .toEntity(LoanProductDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<LoanProductDTO> setServiceActive(UUID serviceId, boolean active) {
        log.debug("Calling setServiceActive: serviceId={}, active={}", serviceId, active);

        return webClient.put()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/v1/catalog/services/{serviceId}/active")
                        .queryParam("active", active)
                        .build(serviceId))
                .retrieve()
                .toEntity(LoanProductDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<DocumentRequirementDTO> createDocumentRequirement(CreateDocumentRequirementRequest request) {
        log.debug("Calling createDocumentRequirement: code={}", request.code());

        return webClient.post()
                .uri("/api/v1/catalog/document-requirements")
                .bodyValue(request)
                .retrieve()
                .toEntity(DocumentRequirementDTO.class)
                .block();
    }

    @Override
    public ResponseEntity<QuestionDTO> createQuestion(CreateQuestionRequest request) {
        log.debug("Calling createQuestion: type={}", request.type());

        return webClient.post()
                .uri("/api/v1/catalog/questions")
                .bodyValue(request)
                .retrieve()
                .toEntity(QuestionDTO.class)
                .block();
    }
}
