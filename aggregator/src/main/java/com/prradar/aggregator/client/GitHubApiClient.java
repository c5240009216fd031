package com.prradar.aggregator.client;

import com.prradar.aggregator.model.PullRequestPayload;
import com.prradar.aggregator.model.Repository;
import com.prradar.aggregator.model.Review;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Read-only client for the three GitHub Enterprise REST endpoints the aggregator needs:
 * organization repositories, repository pull requests and pull request reviews.
 *
 * <p>Only the first page of each listing is read. There is no retry: a non-2xx status,
 * a transport failure or an unparseable body surfaces as an {@link IOException}.</p>
 *
 * <p>Thread-safe: the underlying {@link OkHttpClient} and {@link ObjectMapper}
 * are both thread-safe, and this class holds no mutable per-request state.</p>
 */
public class GitHubApiClient {

    private static final Logger logger = LoggerFactory.getLogger(GitHubApiClient.class);

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiBaseUrl;
    private final String organization;
    private final String token;

    public GitHubApiClient(String apiBaseUrl, String organization, String token, OkHttpClient httpClient) {
        this.apiBaseUrl = stripTrailingSlash(apiBaseUrl);
        this.organization = organization;
        this.token = token;
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Builds the API root of a GitHub Enterprise host, e.g. {@code https://github.acme.com/api/v3}.
     */
    public static String apiBaseUrlFor(String hostname) {
        return "https://" + hostname + "/api/v3";
    }

    /**
     * Creates an HTTP client whose every call, connect through body read, is bounded by {@code timeout}.
     */
    public static OkHttpClient defaultHttpClient(Duration timeout) {
        return new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .callTimeout(timeout)
                .build();
    }

    // -------------------------------------------------------------------------
    // Public API endpoint methods
    // -------------------------------------------------------------------------

    /**
     * Fetches the repositories of the configured organization.
     * Endpoint: GET /orgs/{org}/repos
     */
    public List<Repository> getRepositories() throws IOException {
        String url = apiBaseUrl + "/orgs/" + organization + "/repos";
        return fetchList(url, new TypeReference<>() {});
    }

    /**
     * Fetches the open pull requests of a repository.
     * Endpoint: GET {repo.url}/pulls
     */
    public List<PullRequestPayload> getPullRequests(String repositoryApiUrl) throws IOException {
        return fetchList(stripTrailingSlash(repositoryApiUrl) + "/pulls", new TypeReference<>() {});
    }

    /**
     * Fetches the reviews of a pull request.
     * Endpoint: GET {pr.url}/reviews
     */
    public List<Review> getReviews(String pullRequestApiUrl) throws IOException {
        return fetchList(stripTrailingSlash(pullRequestApiUrl) + "/reviews", new TypeReference<>() {});
    }

    // -------------------------------------------------------------------------
    // Core HTTP execution
    // -------------------------------------------------------------------------

    /**
     * Fetches a single page and deserializes it into a list of {@code T}.
     * An empty body reads as an empty list.
     */
    <T> List<T> fetchList(String url, TypeReference<List<T>> typeRef) throws IOException {
        String body = execute(buildRequest(url));
        if (body == null || body.isBlank()) {
            return List.of();
        }
        try {
            List<T> items = objectMapper.readValue(body, typeRef);
            logger.debug("Fetched {} items from {}", items.size(), url);
            return items;
        } catch (JsonProcessingException e) {
            throw new IOException("Malformed response body from " + url, e);
        }
    }

    /**
     * Builds a GET request with authentication and API version headers.
     */
    Request buildRequest(String url) {
        return new Request.Builder()
                .url(url)
                .header("Authorization", "Bearer " + token)
                .header("Accept", "application/vnd.github+json")
                .header("X-GitHub-Api-Version", "2022-11-28")
                .build();
    }

    /**
     * Executes a request, returning the response body string.
     *
     * @throws IOException on transport failure, timeout or any non-2xx status
     */
    String execute(Request request) throws IOException {
        try (Response response = httpClient.newCall(request).execute()) {
            int statusCode = response.code();
            logResponse(request.url().toString(), statusCode, response);

            if (statusCode < 200 || statusCode >= 300) {
                throw new IOException("GitHub API error: " + statusCode + " for " + request.url());
            }

            ResponseBody body = response.body();
            return body != null ? body.string() : null;
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    // -------------------------------------------------------------------------
    // Logging
    // -------------------------------------------------------------------------

    private void logResponse(String url, int statusCode, Response response) {
        String remaining = response.header("X-RateLimit-Remaining");
        logger.info("GitHub API {} {} | rate-limit-remaining: {}",
                statusCode, url, remaining != null ? remaining : "n/a");
    }
}
