package com.webtext.core.util;

import com.webtext.core.model.ExtractConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class YamlConfigLoaderTest {

    private static ExtractConfig parse(String yaml) {
        return YamlConfigLoader.load(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void full_file_overrides_every_key(@TempDir Path tmp) throws Exception {
        Path yml = tmp.resolve("webtext.yml");
        Files.writeString(yml, String.join("\n",
                "userAgent: \"TestAgent/1.0\"",
                "timeoutMs: 1500",
                "connectTimeoutMs: 700",
                "retry:",
                "  maxRetries: 1",
                "  baseDelayMs: 50",
                "output:",
                "  defaultDir: \"~/Texts\"",
                "input:",
                "  suffix: \".list\""));

        ExtractConfig cfg = YamlConfigLoader.load(yml);

        assertEquals("TestAgent/1.0", cfg.getUserAgent());
        assertEquals(Duration.ofMillis(1500), cfg.getTimeout());
        assertEquals(Duration.ofMillis(700), cfg.getConnectTimeout());
        assertEquals(1, cfg.getMaxRetries());
        assertEquals(Duration.ofMillis(50), cfg.getRetryBaseDelay());
        assertEquals(Path.of(System.getProperty("user.home"), "Texts"), cfg.getDefaultOutputDir());
        assertEquals(".list", cfg.getInputSuffix());
    }

    @Test
    void missing_keys_keep_defaults() {
        ExtractConfig cfg = parse("retry:\n  maxRetries: 5\n");
        ExtractConfig def = ExtractConfig.defaults();

        assertEquals(5, cfg.getMaxRetries());
        assertEquals(def.getUserAgent(), cfg.getUserAgent());
        assertEquals(def.getTimeout(), cfg.getTimeout());
        assertEquals(def.getRetryBaseDelay(), cfg.getRetryBaseDelay());
        assertEquals(def.getDefaultOutputDir(), cfg.getDefaultOutputDir());
    }

    @Test
    void empty_document_is_all_defaults() {
        ExtractConfig cfg = parse("");
        assertEquals(3, cfg.getMaxRetries());
        assertEquals(".txt", cfg.getInputSuffix());
    }

    @Test
    void numeric_strings_are_accepted() {
        assertEquals(Duration.ofMillis(2500), parse("timeoutMs: \"2500\"").getTimeout());
    }

    @Test
    void bad_values_are_rejected() {
        var nan = assertThrows(IllegalArgumentException.class, () -> parse("timeoutMs: soon"));
        assertTrue(nan.getMessage().contains("timeoutMs"));

        assertThrows(IllegalArgumentException.class, () -> parse("retry:\n  maxRetries: -2"));
        assertThrows(IllegalArgumentException.class, () -> parse("timeoutMs: 0"));
    }

    @Test
    void missing_file_is_an_io_error(@TempDir Path tmp) {
        assertThrows(IOException.class, () -> YamlConfigLoader.load(tmp.resolve("absent.yml")));
    }
}
