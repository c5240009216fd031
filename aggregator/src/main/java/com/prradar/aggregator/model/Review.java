package com.prradar.aggregator.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Data transfer object representing a GitHub pull request review.
 * Maps from: {pr.url}/reviews
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Review(
        @JsonProperty("state") String state,
        @JsonProperty("user") User user
) {

    public static final String STATE_APPROVED = "APPROVED";

    public boolean isApproval() {
        return STATE_APPROVED.equals(state);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record User(
            @JsonProperty("login") String login
    ) {}
}
