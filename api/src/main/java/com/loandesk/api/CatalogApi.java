package com.loandesk.api;

import com.loandesk.api.dto.DocumentRequirementDTO;
import com.loandesk.api.dto.LoanProductDTO;
import com.loandesk.api.dto.QuestionDTO;
import com.loandesk.api.request.CreateDocumentRequirementRequest;
import com.loandesk.api.request.CreateLoanProductRequest;
import com.loandesk.api.request.CreateQuestionRequest;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Catalog API: loan products and the document requirements and questions attached to them.
 */
@RequestMapping("/api/v1/catalog")
public interface CatalogApi {

    @PostMapping("/services")
    ResponseEntity<LoanProductDTO> createService(@RequestBody @Valid CreateLoanProductRequest request);

    @GetMapping("/services/{serviceId}")
    ResponseEntity<LoanProductDTO> getService(@PathVariable("serviceId") UUID serviceId);

    @PutMapping("/services/{serviceId}/active")
    ResponseEntity<LoanProductDTO> setServiceActive(@PathVariable("serviceId") UUID serviceId,
                                                    @RequestParam("active") boolean active);

    @PostMapping("/document-requirements")
    ResponseEntity<DocumentRequirementDTO> createDocumentRequirement(
            @RequestBody @Valid CreateDocumentRequirementRequest request);

    @PostMapping("/questions")
    ResponseEntity<QuestionDTO> createQuestion(@RequestBody @Valid CreateQuestionRequest request);
}
