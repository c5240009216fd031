package com.prradar.aggregator.cache;

import com.prradar.aggregator.orchestrator.FetchException;
import com.prradar.aggregator.pipeline.PullRequestSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Time-bounded cache in front of the fetch cycle.
 *
 * <p>{@link #get()} serves the cached snapshot while it is younger than the TTL and
 * otherwise refreshes synchronously through the {@link SnapshotLoader}. A failed refresh
 * leaves the previous entry untouched and propagates to that caller only; the next call
 * tries again.</p>
 *
 * <p>All access is serialized on this instance, so callers arriving during a refresh wait
 * for it and then share its result instead of starting their own.</p>
 */
public class PullRequestCache {

    private static final Logger logger = LoggerFactory.getLogger(PullRequestCache.class);

    public static final Duration DEFAULT_TTL = Duration.ofSeconds(60);

    private final SnapshotLoader loader;
    private final Duration ttl;
    private final Clock clock;

    private CacheEntry entry;

    public PullRequestCache(SnapshotLoader loader) {
        this(loader, DEFAULT_TTL, Clock.systemUTC());
    }

    public PullRequestCache(SnapshotLoader loader, Duration ttl, Clock clock) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("TTL must be positive: " + ttl);
        }
        this.loader = loader;
        this.ttl = ttl;
        this.clock = clock;
    }

    public synchronized PullRequestSnapshot get() throws FetchException {
        Instant now = clock.instant();
        if (entry != null && entry.isFresh(now, ttl)) {
            logger.debug("Serving cached snapshot fetched at {}", entry.fetchedAt());
            return entry.snapshot();
        }

        logger.info("Cache {}; refreshing pull requests", entry == null ? "empty" : "stale");
        PullRequestSnapshot snapshot = loader.load();
        entry = new CacheEntry(now, snapshot);
        logger.info("Cache refreshed: {} open, {} approved",
                snapshot.open().size(), snapshot.approved().size());
        return snapshot;
    }

    /**
     * Returns the current entry, fresh or stale, without fetching.
     */
    public synchronized Optional<CacheEntry> peek() {
        return Optional.ofNullable(entry);
    }

    /**
     * Drops the current entry so that the next {@link #get()} refreshes.
     */
    public synchronized void invalidate() {
        entry = null;
    }
}
