package com.loandesk.storage;

import com.loandesk.config.LoanDeskProperties;
import com.loandesk.error.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * {@link StorageService} writing files below {@code loandesk.storage.root}.
 */
@Service
@Slf4j
public class LocalStorageService implements StorageService {

    private final Path root;
    private final String publicUrl;
    private final long defaultMaxSizeBytes;

    public LocalStorageService(LoanDeskProperties properties) {
        LoanDeskProperties.Storage storage = properties.getStorage();
        this.root = Paths.get(storage.getRoot()).toAbsolutePath().normalize();
        this.publicUrl = storage.getPublicUrl().endsWith("/")
                ? storage.getPublicUrl().substring(0, storage.getPublicUrl().length() - 1)
                : storage.getPublicUrl();
        this.defaultMaxSizeBytes = storage.getMaxFileSizeBytes();
    }

    @Override
    public List<StoredFile> uploadFiles(List<UploadFile> files, UploadOptions options) {
        for (UploadFile file : files) {
            validate(file, options);
        }

        List<StoredFile> stored = new ArrayList<>();
        try {
            for (UploadFile file : files) {
                stored.add(store(file, options.folder()));
            }
        } catch (StorageException e) {
            stored.forEach(s -> deleteQuietly(s.key()));
            throw e;
        }
        return stored;
    }

    @Override
    public byte[] getFile(String key) {
        try {
            return Files.readAllBytes(resolve(key));
        } catch (IOException e) {
            throw new StorageException("Failed to read file " + key, e);
        }
    }

    @Override
    public void deleteFile(String key) {
        try {
            Files.deleteIfExists(resolve(key));
            log.info("Deleted stored file: key={}", key);
        } catch (IOException e) {
            throw new StorageException("Failed to delete file " + key, e);
        }
    }

    @Override
    public String extractKeyFromUrl(String url) {
        if (url == null || !url.startsWith(publicUrl + "/")) {
            return null;
        }
        return url.substring(publicUrl.length() + 1);
    }

    private void validate(UploadFile file, UploadOptions options) {
        List<String> allowed = options.allowedMimeTypes();
        if (allowed != null && !allowed.isEmpty() && !allowed.contains(file.contentType())) {
            throw new IllegalArgumentException(String.format("File type %s is not allowed. Allowed types: %s",
                    file.contentType(), String.join(", ", allowed)));
        }
        long maxSize = options.maxSizeBytes() != null ? options.maxSizeBytes() : defaultMaxSizeBytes;
        if (file.size() > maxSize) {
            throw new IllegalArgumentException(String.format("File %s exceeds maximum size of %d bytes",
                    file.fileName(), maxSize));
        }
    }

    private StoredFile store(UploadFile file, String folder) {
        String key = (folder == null || folder.isBlank() ? "uploads" : folder)
                + "/" + UUID.randomUUID() + "-" + sanitize(file.fileName());
        Path target = resolve(key);
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, file.content());
        } catch (IOException e) {
            throw new StorageException("Failed to store file " + file.fileName(), e);
        }
        log.info("Stored file: key={}, size={}", key, file.size());
        return new StoredFile(key, publicUrl + "/" + key, file.fileName(), file.size(), file.contentType());
    }

    private Path resolve(String key) {
        Path path = root.resolve(key).normalize();
        if (!path.startsWith(root)) {
            throw new IllegalArgumentException("Invalid file key: " + key);
        }
        return path;
    }

    private void deleteQuietly(String key) {
        try {
            Files.deleteIfExists(resolve(key));
        } catch (IOException e) {
            log.warn("Failed to remove partially uploaded file: key={}", key, e);
        }
    }

    private static String sanitize(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            return "file";
        }
        return fileName.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
