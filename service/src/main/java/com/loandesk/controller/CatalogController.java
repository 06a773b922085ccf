package com.loandesk.controller;

import com.loandesk.api.CatalogApi;
import com.loandesk.api.dto.DocumentRequirementDTO;
import com.loandesk.api.dto.LoanProductDTO;
import com.loandesk.api.dto.QuestionDTO;
import com.loandesk.api.request.CreateDocumentRequirementRequest;
import com.loandesk.api.request.CreateLoanProductRequest;
import com.loandesk.api.request.CreateQuestionRequest;
import com.loandesk.mapper.CatalogMapper;
import com.loandesk.service.CatalogService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@Validated
@RequiredArgsConstructor
public class CatalogController implements CatalogApi {

    private final CatalogService catalogService;

    @Override
    public ResponseEntity<LoanProductDTO> createService(CreateLoanProductRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(CatalogMapper.INSTANCE.toDTO(catalogService.createService(request)));
    }

    @Override
    public ResponseEntity<LoanProductDTO> getService(UUID serviceId) {
        return ResponseEntity.ok(CatalogMapper.INSTANCE.toDTO(catalogService.getService(serviceId)));
    }

    @Override
    public ResponseEntity<LoanProductDTO> setServiceActive(UUID serviceId, boolean active) {
        return ResponseEntity.ok(CatalogMapper.INSTANCE.toDTO(catalogService.setServiceActive(serviceId, active)));
    }

    @Override
    public ResponseEntity<DocumentRequirementDTO> createDocumentRequirement(CreateDocumentRequirementRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(CatalogMapper.INSTANCE.toDTO(catalogService.createDocumentRequirement(request)));
    }

    @Override
    public ResponseEntity<QuestionDTO> createQuestion(CreateQuestionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(CatalogMapper.INSTANCE.toDTO(catalogService.createQuestion(request)));
    }
}
