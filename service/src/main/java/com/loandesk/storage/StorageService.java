package com.loandesk.storage;

import java.util.List;

/**
 * Blob storage for uploaded contract documents.
 */
public interface StorageService {

    /**
     * Stores all files or none of them. Files already written are removed when a later one fails.
     *
     * @throws IllegalArgumentException when a file violates the type or size limits
     * @throws com.loandesk.error.StorageException when the backend fails
     */
    List<StoredFile> uploadFiles(List<UploadFile> files, UploadOptions options);

    byte[] getFile(String key);

    void deleteFile(String key);

    /**
     * @return the backend key of a URL handed out by {@link #uploadFiles}, or {@code null} for foreign URLs
     */
    String extractKeyFromUrl(String url);
}
