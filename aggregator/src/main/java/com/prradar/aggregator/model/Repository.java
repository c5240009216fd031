package com.prradar.aggregator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Data transfer object representing a GitHub repository.
 * Maps from: /orgs/{org}/repos
 *
 * <p>{@code url} is the repository's API URL, used as the base for its pulls endpoint.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Repository(
        @JsonProperty("name") String name,
        @JsonProperty("url") String url
) {}
