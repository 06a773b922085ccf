package com.loandesk.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

/**
 * Links a document requirement to a loan product.
 */
@Entity
@Table(name = "service_document")
@Getter
@Setter
@AllArgsConstructor
@NoArgsConstructor
public class ServiceDocument {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "service_id", nullable = false)
    private UUID serviceId;

    @Column(name = "document_requirement_id", nullable = false)
    private UUID documentRequirementId;

    @Column(name = "is_required", nullable = false)
    private boolean required = true;
}
