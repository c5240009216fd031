package com.prradar.aggregator.pipeline;

import com.prradar.aggregator.model.PullRequest;

import java.util.List;

/**
 * The two ordered, disjoint views produced by {@link PullRequestPipeline}.
 */
public record PullRequestSnapshot(
        List<PullRequest> open,
        List<PullRequest> approved
) {

    public PullRequestSnapshot {
        open = List.copyOf(open);
        approved = List.copyOf(approved);
    }
}
