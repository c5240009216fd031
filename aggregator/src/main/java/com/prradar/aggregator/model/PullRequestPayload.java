package com.prradar.aggregator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Data transfer object representing a raw GitHub pull request.
 * Maps from: {repo.url}/pulls
 *
 * <p>{@code url} is the API URL of the pull request (base for its reviews endpoint),
 * {@code htmlUrl} the web URL shown to users.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PullRequestPayload(
        @JsonProperty("title") String title,
        @JsonProperty("html_url") String htmlUrl,
        @JsonProperty("url") String url,
        @JsonProperty("draft") Boolean draft,
        @JsonProperty("created_at") String createdAt,
        @JsonProperty("user") User user,
        @JsonProperty("head") Head head
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record User(
            @JsonProperty("login") String login
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Head(
            @JsonProperty("repo") Repo repo
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Repo(
            @JsonProperty("name") String name
    ) {}
}
