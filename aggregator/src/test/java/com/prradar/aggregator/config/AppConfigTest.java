package com.prradar.aggregator.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link AppConfig} validation logic.
 */
class AppConfigTest {

    @Test
    @DisplayName("Test constructor creates config with valid values and default tuning")
    void validConfig() {
        AppConfig config = new AppConfig("github.acme.com", "acme", "ghp_test_token", "alice");

        assertEquals("github.acme.com", config.getHostname());
        assertEquals("acme", config.getOrganization());
        assertEquals("ghp_test_token", config.getAccessToken());
        assertEquals("alice", config.getUserLogin());
        assertEquals(Duration.ofSeconds(60), config.getCacheTtl());
        assertEquals(8, config.getMaxConcurrentRequests());
        assertEquals(Duration.ofSeconds(30), config.getRequestTimeout());
    }

    @Test
    @DisplayName("Throws when GITHUB_TOKEN is missing")
    void missingToken_throws() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> new AppConfig("github.acme.com", "acme", "", "alice"));

        assertTrue(ex.getMessage().contains("GITHUB_TOKEN"));
    }

    @Test
    @DisplayName("Throws when GITHUB_HOSTNAME is missing")
    void missingHostname_throws() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> new AppConfig(null, "acme", "token", "alice"));

        assertTrue(ex.getMessage().contains("GITHUB_HOSTNAME"));
    }

    @Test
    @DisplayName("Throws with all missing vars listed in message")
    void allMissing_listsAllVars() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> new AppConfig("", "", "", ""));

        String msg = ex.getMessage();
        assertTrue(msg.contains("GITHUB_HOSTNAME"));
        assertTrue(msg.contains("GITHUB_ORG"));
        assertTrue(msg.contains("GITHUB_TOKEN"));
        assertTrue(msg.contains("GITHUB_USER"));
    }

    @Test
    @DisplayName("Throws when values are blank (whitespace only)")
    void blankValues_throws() {
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> new AppConfig("github.acme.com", "  ", "token", "alice"));

        assertTrue(ex.getMessage().contains("GITHUB_ORG"));
    }

    @Test
    @DisplayName("Rejects a non-positive concurrency cap")
    void zeroConcurrency_throws() {
        assertThrows(IllegalArgumentException.class,
                () -> new AppConfig("github.acme.com", "acme", "token", "alice",
                        Duration.ofSeconds(60), 0, Duration.ofSeconds(30)));
    }

    @Test
    @DisplayName("parsePositive accepts trimmed positive numbers and rejects the rest")
    void parsePositive() {
        assertEquals(45, AppConfig.parsePositive("CACHE_TTL_SECONDS", " 45 "));
        assertThrows(IllegalArgumentException.class, () -> AppConfig.parsePositive("CACHE_TTL_SECONDS", "soon"));
        assertThrows(IllegalArgumentException.class, () -> AppConfig.parsePositive("CACHE_TTL_SECONDS", "0"));
        assertThrows(IllegalArgumentException.class, () -> AppConfig.parsePositive("CACHE_TTL_SECONDS", "-5"));
    }
}
