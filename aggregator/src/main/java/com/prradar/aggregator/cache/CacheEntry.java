package com.prradar.aggregator.cache;

import com.prradar.aggregator.pipeline.PullRequestSnapshot;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A snapshot and the instant it was fetched. Replaced wholesale on refresh, never mutated.
 */
public record CacheEntry(Instant fetchedAt, PullRequestSnapshot snapshot) {

    public CacheEntry {
        Objects.requireNonNull(fetchedAt, "fetchedAt");
        Objects.requireNonNull(snapshot, "snapshot");
    }

    public boolean isFresh(Instant now, Duration ttl) {
        return Duration.between(fetchedAt, now).compareTo(ttl) < 0;
    }
}
