package com.loandesk.dto;

import com.loandesk.storage.UploadFile;

import java.util.UUID;

/**
 * A file supplied for one document requirement of a contract.
 */
public record DocumentUpload(UUID documentRequirementId, UploadFile file) {
}
