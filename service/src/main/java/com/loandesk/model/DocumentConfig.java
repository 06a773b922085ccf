package com.loandesk.model;

import java.util.List;

/**
 * File constraints of a document requirement, stored as JSON.
 *
 * @param maxFiles       maximum number of files, {@code null} for no limit
 * @param minFiles       minimum number of files, {@code null} for none
 * @param allowedTypes   accepted MIME types, empty for any
 * @param maxSizeBytes   per-file size limit, {@code null} for no limit
 * @param expirationDays how long an approved document stays valid
 */
public record DocumentConfig(
        Integer maxFiles,
        Integer minFiles,
        List<String> allowedTypes,
        Long maxSizeBytes,
        Integer expirationDays
) {
    public List<String> allowedTypesOrEmpty() {
        return allowedTypes == null ? List.of() : allowedTypes;
    }
}
