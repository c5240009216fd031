package com.prradar.aggregator.cache;

import com.prradar.aggregator.orchestrator.FetchException;
import com.prradar.aggregator.pipeline.PullRequestSnapshot;

/**
 * Produces a fresh snapshot on a cache miss.
 */
@FunctionalInterface
public interface SnapshotLoader {

    PullRequestSnapshot load() throws FetchException;
}
