package com.prradar.aggregator.pipeline;

import com.prradar.aggregator.model.PullRequest;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Turns the raw records of a fetch cycle into the "open" and "approved" views.
 *
 * <ol>
 *   <li>Drafts are dropped.</li>
 *   <li>Records are ordered: the user's own pull requests first, then everyone else's;
 *       most recent first within each group. The sort is stable.</li>
 *   <li>Records approved per {@link ApprovalPolicy} move to the approved view, keeping
 *       their relative order; the rest form the open view.</li>
 * </ol>
 */
public class PullRequestPipeline {

    public PullRequestSnapshot process(List<PullRequest> records, String user) {
        Objects.requireNonNull(user, "user");
        Comparator<PullRequest> ownFirst = Comparator.comparing(pr -> !pr.isAuthoredBy(user));
        Comparator<PullRequest> ordering = ownFirst
                .thenComparing(PullRequest::createdAt, Comparator.reverseOrder());

        List<PullRequest> ordered = records.stream()
                .filter(pr -> !pr.draft())
                .sorted(ordering)
                .toList();

        List<PullRequest> open = new ArrayList<>();
        List<PullRequest> approved = new ArrayList<>();
        for (PullRequest pr : ordered) {
            if (ApprovalPolicy.isApproved(pr, user)) {
                approved.add(pr);
            } else {
                open.add(pr);
            }
        }
        return new PullRequestSnapshot(open, approved);
    }
}
