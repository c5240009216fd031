package com.prradar.aggregator.orchestrator;

/**
 * The single failure kind surfaced by the aggregation boundary.
 *
 * <p>Network failures, authentication and rate-limit statuses, timeouts and malformed
 * payloads all collapse into this exception with a generic, user-facing title and
 * description. The originating failure is kept as the cause for logging only.</p>
 */
public class FetchException extends Exception {

    public static final String DEFAULT_TITLE = "Error getting Pull Requests";
    public static final String DEFAULT_DESCRIPTION = "Check your connectivity, GitHub URL and access token";

    private final String title;
    private final String description;

    public FetchException(Throwable cause) {
        this(DEFAULT_TITLE, DEFAULT_DESCRIPTION, cause);
    }

    public FetchException(String title, String description, Throwable cause) {
        super(title + ": " + description, cause);
        this.title = title;
        this.description = description;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }
}
