package com.prradar.aggregator.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * Normalized, immutable pull request as shown to the user.
 *
 * <p>{@code url} is the web URL and identifies the pull request within one fetch cycle.
 * {@code approvers} holds the logins of reviewers with an approving review; a reviewer
 * who approved more than once is counted once.</p>
 */
public record PullRequest(
        String repository,
        String title,
        String url,
        boolean draft,
        String createdBy,
        Instant createdAt,
        Set<String> approvers
) {

    public PullRequest {
        Objects.requireNonNull(repository, "repository");
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(createdBy, "createdBy");
        Objects.requireNonNull(createdAt, "createdAt");
        approvers = approvers == null ? Set.of() : Set.copyOf(approvers);
    }

    public boolean isAuthoredBy(String login) {
        return createdBy.equals(login);
    }
}
