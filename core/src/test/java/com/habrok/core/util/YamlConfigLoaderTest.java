package com.habrok.core.util;

import com.habrok.core.model.ClientConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class YamlConfigLoaderTest {

    private static InputStream yaml(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void loadsEveryKeyFromClasspathResource() throws Exception {
        ClientConfig cfg;
        try (InputStream in = getClass().getResourceAsStream("/habrok-test.yml")) {
            assertThat(in).isNotNull();
            cfg = YamlConfigLoader.load(in);
        }

        assertThat(cfg.isDisableCustomHeaders()).isTrue();
        assertThat(cfg.isDisableAutomaticJson()).isFalse();
        assertThat(cfg.getTimeout()).isEqualTo(Duration.ofMillis(2500));
        assertThat(cfg.isFollowRedirects()).isFalse();
        // retry 블록이 평면 키보다 우선
        assertThat(cfg.getRetryMinDelay()).isEqualTo(Duration.ofMillis(50));
        assertThat(cfg.getRetryMaxDelay()).isEqualTo(Duration.ofMillis(2000));
        assertThat(cfg.getRetryFactor()).isEqualTo(3.0);
        assertThat(cfg.getRetryJitter()).isEqualTo(0.0);
        assertThat(cfg.getRetryableErrorCodes()).containsExactlyInAnyOrder("ECONNRESET", "ETIMEDOUT");
    }

    @Test
    void flatKeysAndCommaSeparatedCodes() throws Exception {
        ClientConfig cfg = YamlConfigLoader.load(yaml(
                "retryMinDelayMs: 0\n" +
                "retryMaxDelayMs: \"500\"\n" +
                "retryableErrorCodes: \"epipe, esockettimedout\"\n"));

        assertThat(cfg.getRetryMinDelay()).isEqualTo(Duration.ZERO);
        assertThat(cfg.getRetryMaxDelay()).isEqualTo(Duration.ofMillis(500));
        assertThat(cfg.getRetryableErrorCodes()).containsExactlyInAnyOrder("EPIPE", "ESOCKETTIMEDOUT");
    }

    @Test
    void emptyDocumentKeepsDefaults() throws Exception {
        ClientConfig cfg = YamlConfigLoader.load(yaml(""));

        assertThat(cfg.getRetryMinDelay()).isEqualTo(ClientConfig.defaults().getRetryMinDelay());
        assertThat(cfg.getRetryableErrorCodes()).isEqualTo(ClientConfig.DEFAULT_RETRYABLE_CODES);
    }

    @Test
    void invalidNumberIsIOException() {
        assertThatThrownBy(() -> YamlConfigLoader.load(yaml("timeoutMs: soon\n")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Invalid number");
    }

    @Test
    void malformedYamlIsIOException() {
        assertThatThrownBy(() -> YamlConfigLoader.load(yaml("retry: [unclosed\n")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Invalid YAML");
    }

    @Test
    void outOfRangeValueFailsValidation() {
        assertThatThrownBy(() -> YamlConfigLoader.load(yaml("retry:\n  factor: 0.5\n")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("retryFactor");
    }

    @Test
    void missingFileIsIOException(@TempDir Path dir) {
        assertThatThrownBy(() -> YamlConfigLoader.load(dir.resolve("habrok.yml")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void loadsFromPath(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("habrok.yml");
        Files.writeString(file, "disableAutomaticJson: true\n");

        assertThat(YamlConfigLoader.load(file).isDisableAutomaticJson()).isTrue();
    }
}
