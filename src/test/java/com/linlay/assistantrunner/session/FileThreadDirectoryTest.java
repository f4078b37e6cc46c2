package com.linlay.assistantrunner.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileThreadDirectoryTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    void shouldPersistAndReloadMappings() {
        Path file = tempDir.resolve("data").resolve("threads.json");
        FileThreadDirectory directory = new FileThreadDirectory(file, objectMapper);

        directory.record("u1", "thread_a");
        directory.record("u2", "thread_b");

        assertThat(file).exists();
        assertThat(file.resolveSibling("threads.json.tmp")).doesNotExist();
        FileThreadDirectory reloaded = new FileThreadDirectory(file, objectMapper);
        assertThat(reloaded.find("u1")).contains("thread_a");
        assertThat(reloaded.find("u2")).contains("thread_b");
        assertThat(reloaded.find("u3")).isEmpty();
        assertThat(reloaded.size()).isEqualTo(2);
    }

    @Test
    void shouldSkipRewriteWhenMappingIsUnchanged() throws Exception {
        Path file = tempDir.resolve("threads.json");
        FileThreadDirectory directory = new FileThreadDirectory(file, objectMapper);
        directory.record("u1", "thread_a");
        Files.writeString(file, "{\"u1\":\"thread_a\",\"marker\":\"kept\"}", StandardCharsets.UTF_8);

        directory.record("u1", "thread_a");

        assertThat(Files.readString(file, StandardCharsets.UTF_8)).contains("marker");
    }

    @Test
    void shouldFailFastOnCorruptFile() throws Exception {
        Path file = tempDir.resolve("threads.json");
        Files.writeString(file, "not json", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> new FileThreadDirectory(file, objectMapper))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("threads.json");
    }
}
