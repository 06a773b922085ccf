package com.loandesk.storage;

/**
 * File content handed to the storage backend, detached from the HTTP request it came from.
 */
public record UploadFile(String fileName, String contentType, byte[] content) {

    public long size() {
        return content == null ? 0 : content.length;
    }
}
