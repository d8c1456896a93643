package com.webtext.core.model;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ExtractConfigTest {

    @Test
    void defaults_match_documented_values() {
        ExtractConfig c = ExtractConfig.defaults();

        assertTrue(c.getUserAgent().contains("Safari"));
        assertEquals(Duration.ofSeconds(30), c.getTimeout());
        assertEquals(Duration.ofSeconds(10), c.getConnectTimeout());
        assertEquals(3, c.getMaxRetries());
        assertEquals(Duration.ofMillis(500), c.getRetryBaseDelay());
        assertEquals(Path.of(System.getProperty("user.home"), "Documents", "URL Text"), c.getDefaultOutputDir());
        assertEquals(".txt", c.getInputSuffix());
        assertDoesNotThrow(c::validate);
    }

    @Test
    void millisecond_setters_clamp_to_positive() {
        ExtractConfig c = ExtractConfig.defaults().setTimeoutMs(0).setConnectTimeoutMs(-5);

        assertEquals(Duration.ofMillis(1), c.getTimeout());
        assertEquals(Duration.ofMillis(1), c.getConnectTimeout());
        assertDoesNotThrow(c::validate);
    }

    @Test
    void validate_rejects_nonsense() {
        assertThrows(IllegalArgumentException.class, () -> ExtractConfig.defaults().setUserAgent(" ").validate());
        assertThrows(IllegalArgumentException.class, () -> ExtractConfig.defaults().setTimeout(Duration.ZERO).validate());
        assertThrows(IllegalArgumentException.class, () -> ExtractConfig.defaults().setMaxRetries(-1).validate());
        assertThrows(IllegalArgumentException.class,
                () -> ExtractConfig.defaults().setRetryBaseDelay(Duration.ofMillis(-1)).validate());
        assertThrows(IllegalArgumentException.class, () -> ExtractConfig.defaults().setInputSuffix("").validate());
        assertThrows(NullPointerException.class, () -> ExtractConfig.defaults().setDefaultOutputDir(null).validate());
    }
}
