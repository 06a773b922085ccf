package com.loandesk.storage;

import java.util.List;

/**
 * @param folder           logical folder, e.g. {@code contracts/<id>}
 * @param allowedMimeTypes accepted content types; empty accepts all
 * @param maxSizeBytes     per-file limit; {@code null} uses the configured default
 */
public record UploadOptions(String folder, List<String> allowedMimeTypes, Long maxSizeBytes) {

    public static UploadOptions folder(String folder) {
        return new UploadOptions(folder, List.of(), null);
    }
}
