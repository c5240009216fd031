package com.prradar.aggregator.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Configuration management class that reads environment variables
 * and .env file settings using dotenv-java. Validates required
 * variables on startup; tuning values fall back to defaults.
 */
public class AppConfig {

    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);

    static final long DEFAULT_CACHE_TTL_SECONDS = 60;
    static final int DEFAULT_MAX_CONCURRENT_REQUESTS = 8;
    static final long DEFAULT_REQUEST_TIMEOUT_SECONDS = 30;

    private final String hostname;
    private final String organization;
    private final String accessToken;
    private final String userLogin;
    private final Duration cacheTtl;
    private final int maxConcurrentRequests;
    private final Duration requestTimeout;

    public AppConfig() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();

        this.hostname = resolve(dotenv, "GITHUB_HOSTNAME");
        this.organization = resolve(dotenv, "GITHUB_ORG");
        this.accessToken = resolve(dotenv, "GITHUB_TOKEN");
        this.userLogin = resolve(dotenv, "GITHUB_USER");

        validate();

        this.cacheTtl = Duration.ofSeconds(resolvePositive(dotenv, "CACHE_TTL_SECONDS", DEFAULT_CACHE_TTL_SECONDS));
        this.maxConcurrentRequests = Math.toIntExact(
                resolvePositive(dotenv, "MAX_CONCURRENT_REQUESTS", DEFAULT_MAX_CONCURRENT_REQUESTS));
        this.requestTimeout = Duration.ofSeconds(
                resolvePositive(dotenv, "REQUEST_TIMEOUT_SECONDS", DEFAULT_REQUEST_TIMEOUT_SECONDS));

        logger.info("Configuration loaded: hostname={}, organization={}, user={}, cacheTtl={}s, "
                        + "maxConcurrentRequests={}, requestTimeout={}s",
                hostname, organization, userLogin, cacheTtl.toSeconds(),
                maxConcurrentRequests, requestTimeout.toSeconds());
    }

    /**
     * Constructor for testing — accepts values directly, with default tuning.
     */
    public AppConfig(String hostname, String organization, String accessToken, String userLogin) {
        this(hostname, organization, accessToken, userLogin,
                Duration.ofSeconds(DEFAULT_CACHE_TTL_SECONDS),
                DEFAULT_MAX_CONCURRENT_REQUESTS,
                Duration.ofSeconds(DEFAULT_REQUEST_TIMEOUT_SECONDS));
    }

    public AppConfig(String hostname, String organization, String accessToken, String userLogin,
                     Duration cacheTtl, int maxConcurrentRequests, Duration requestTimeout) {
        this.hostname = hostname;
        this.organization = organization;
        this.accessToken = accessToken;
        this.userLogin = userLogin;
        this.cacheTtl = cacheTtl;
        this.maxConcurrentRequests = maxConcurrentRequests;
        this.requestTimeout = requestTimeout;

        validate();
        if (maxConcurrentRequests <= 0) {
            throw new IllegalArgumentException("maxConcurrentRequests must be positive: " + maxConcurrentRequests);
        }
    }

    private void validate() {
        StringBuilder missing = new StringBuilder();
        if (isBlank(hostname)) missing.append("GITHUB_HOSTNAME ");
        if (isBlank(organization)) missing.append("GITHUB_ORG ");
        if (isBlank(accessToken)) missing.append("GITHUB_TOKEN ");
        if (isBlank(userLogin)) missing.append("GITHUB_USER ");

        if (!missing.isEmpty()) {
            throw new IllegalStateException(
                    "Missing required environment variables: " + missing.toString().trim());
        }
    }

    private static String resolve(Dotenv dotenv, String key) {
        String envValue = System.getenv(key);
        if (envValue != null && !envValue.isBlank()) {
            return envValue;
        }
        String dotenvValue = dotenv.get(key);
        return dotenvValue != null ? dotenvValue : "";
    }

    private static long resolvePositive(Dotenv dotenv, String key, long defaultValue) {
        String value = resolve(dotenv, key);
        return value.isBlank() ? defaultValue : parsePositive(key, value);
    }

    static long parsePositive(String key, String value) {
        long parsed;
        try {
            parsed = Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number: " + value, e);
        }
        if (parsed <= 0) {
            throw new IllegalArgumentException(key + " must be positive: " + value);
        }
        return parsed;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public String getHostname() {
        return hostname;
    }

    public String getOrganization() {
        return organization;
    }

    public String getAccessToken() {
        return accessToken;
    }

    public String getUserLogin() {
        return userLogin;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public int getMaxConcurrentRequests() {
        return maxConcurrentRequests;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }
}
