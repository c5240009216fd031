package com.prradar.aggregator.pipeline;

import com.prradar.aggregator.model.PullRequest;

/**
 * Decides whether a pull request counts as approved for the acting user: it has at least
 * {@value #MIN_APPROVERS} distinct approvers, or the user approved it.
 */
public final class ApprovalPolicy {

    public static final int MIN_APPROVERS = 2;

    private ApprovalPolicy() {}

    public static boolean isApproved(PullRequest pullRequest, String user) {
        return pullRequest.approvers().size() >= MIN_APPROVERS
                || pullRequest.approvers().contains(user);
    }
}
