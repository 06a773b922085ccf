package com.loandesk.storage;

/**
 * @param key  backend key of the stored file
 * @param url  public URL persisted with the file metadata
 */
public record StoredFile(String key, String url, String fileName, long fileSize, String mimeType) {
}
