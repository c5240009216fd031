package com.prradar.aggregator.orchestrator;

import com.prradar.aggregator.model.PullRequest;
import com.prradar.aggregator.model.PullRequestPayload;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Set;

/**
 * Turns a raw pull request payload and its approvers into a normalized {@link PullRequest}.
 * Stateless.
 */
public class PullRequestBuilder {

    static final DateTimeFormatter CREATED_AT_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'");

    public PullRequest build(PullRequestPayload payload, Set<String> approvers)
            throws MalformedPayloadException {
        String source = describe(payload);

        String login = payload.user() != null ? payload.user().login() : null;
        String repository = payload.head() != null && payload.head().repo() != null
                ? payload.head().repo().name()
                : null;

        return new PullRequest(
                require(repository, "head.repo.name", source),
                require(payload.title(), "title", source),
                require(payload.htmlUrl(), "html_url", source),
                Boolean.TRUE.equals(payload.draft()),
                require(login, "user.login", source),
                parseCreatedAt(require(payload.createdAt(), "created_at", source), source),
                approvers);
    }

    /**
     * Returns the API URL of the pull request, the base of its reviews endpoint.
     */
    public String apiUrlOf(PullRequestPayload payload) throws MalformedPayloadException {
        return require(payload.url(), "url", describe(payload));
    }

    static Instant parseCreatedAt(String createdAt, String source) throws MalformedPayloadException {
        try {
            return LocalDateTime.parse(createdAt, CREATED_AT_FORMAT).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new MalformedPayloadException(
                    "Unparseable created_at '" + createdAt + "' in " + source, e);
        }
    }

    private static String require(String value, String field, String source) throws MalformedPayloadException {
        if (value == null) {
            throw new MalformedPayloadException("Missing " + field + " in pull request " + source);
        }
        return value;
    }

    private static String describe(PullRequestPayload payload) {
        if (payload.htmlUrl() != null) {
            return payload.htmlUrl();
        }
        return payload.url() != null ? payload.url() : "<unknown>";
    }
}
