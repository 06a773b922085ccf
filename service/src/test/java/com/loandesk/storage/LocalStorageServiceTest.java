package com.loandesk.storage;

import com.loandesk.config.LoanDeskProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalStorageServiceTest {

    @TempDir
    Path root;

    private LocalStorageService storageService;

    @BeforeEach
    void setUp() {
        LoanDeskProperties properties = new LoanDeskProperties();
        properties.getStorage().setRoot(root.toString());
        properties.getStorage().setPublicUrl("http://files.test/");
        properties.getStorage().setMaxFileSizeBytes(16);
        storageService = new LocalStorageService(properties);
    }

    @Test
    void storesAndReadsBackFile() {
        byte[] content = "hello".getBytes(StandardCharsets.UTF_8);

        List<StoredFile> stored = storageService.uploadFiles(
                List.of(new UploadFile("my id card.pdf", "application/pdf", content)),
                UploadOptions.folder("contracts/42"));

        assertThat(stored).hasSize(1);
        StoredFile file = stored.get(0);
        assertThat(file.key()).startsWith("contracts/42/").endsWith("-my_id_card.pdf");
        assertThat(file.url()).isEqualTo("http://files.test/" + file.key());
        assertThat(file.fileSize()).isEqualTo(5);
        assertThat(storageService.getFile(file.key())).isEqualTo(content);
        assertThat(storageService.extractKeyFromUrl(file.url())).isEqualTo(file.key());
    }

    @Test
    void rejectsWholeBatchWhenOneFileIsInvalid() {
        List<UploadFile> files = List.of(
                new UploadFile("a.pdf", "application/pdf", new byte[4]),
                new UploadFile("b.pdf", "application/pdf", new byte[32]));

        assertThatThrownBy(() -> storageService.uploadFiles(files, UploadOptions.folder("batch")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("File b.pdf exceeds maximum size of 16 bytes");
        assertThat(root.resolve("batch")).doesNotExist();
    }

    @Test
    void rejectsDisallowedMimeType() {
        UploadOptions options = new UploadOptions("docs", List.of("application/pdf"), null);

        assertThatThrownBy(() -> storageService.uploadFiles(
                List.of(new UploadFile("a.png", "image/png", new byte[1])), options))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("File type image/png is not allowed");
    }

    @Test
    void deleteRemovesFile() throws Exception {
        StoredFile file = storageService.uploadFiles(
                List.of(new UploadFile("x.txt", "text/plain", new byte[]{1})),
                UploadOptions.folder("tmp")).get(0);

        storageService.deleteFile(file.key());

        assertThat(Files.exists(root.resolve(file.key()))).isFalse();
    }

    @Test
    void refusesKeysOutsideRoot() {
        assertThatThrownBy(() -> storageService.getFile("../outside.txt"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid file key");
    }

    @Test
    void foreignUrlHasNoKey() {
        assertThat(storageService.extractKeyFromUrl("https://elsewhere/x")).isNull();
        assertThat(storageService.extractKeyFromUrl(null)).isNull();
    }
}
