package com.prradar.aggregator.orchestrator;

import com.prradar.aggregator.client.GitHubApiClient;
import com.prradar.aggregator.model.Review;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Fetches the approving reviewers of a single pull request.
 */
public class ReviewFetcher {

    private static final Logger logger = LoggerFactory.getLogger(ReviewFetcher.class);

    private final GitHubApiClient client;

    public ReviewFetcher(GitHubApiClient client) {
        this.client = client;
    }

    /**
     * Returns the logins whose review is in the {@code APPROVED} state. A reviewer who
     * approved several times appears once.
     *
     * @param pullRequestApiUrl the API URL of the pull request
     * @throws IOException on any transport failure, or {@link MalformedPayloadException}
     *                     when an approving review has no user
     */
    public Set<String> fetchApprovers(String pullRequestApiUrl) throws IOException {
        List<Review> reviews = client.getReviews(pullRequestApiUrl);

        Set<String> approvers = new LinkedHashSet<>();
        for (Review review : reviews) {
            if (!review.isApproval()) {
                continue;
            }
            if (review.user() == null || review.user().login() == null) {
                throw new MalformedPayloadException(
                        "Approving review without user login on " + pullRequestApiUrl);
            }
            approvers.add(review.user().login());
        }

        logger.debug("{} reviews, {} approvers for {}", reviews.size(), approvers.size(), pullRequestApiUrl);
        return Collections.unmodifiableSet(approvers);
    }
}
