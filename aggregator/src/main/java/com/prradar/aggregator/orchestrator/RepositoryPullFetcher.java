package com.prradar.aggregator.orchestrator;

import com.prradar.aggregator.client.GitHubApiClient;
import com.prradar.aggregator.model.PullRequest;
import com.prradar.aggregator.model.PullRequestPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Fetches the pull requests of one repository and builds a record for each.
 *
 * <p>One task per pull request fetches its reviews and builds the record; all of them run
 * concurrently on the shared executor and are joined before the results are merged by URL.</p>
 */
public class RepositoryPullFetcher {

    private static final Logger logger = LoggerFactory.getLogger(RepositoryPullFetcher.class);

    private final GitHubApiClient client;
    private final ReviewFetcher reviewFetcher;
    private final PullRequestBuilder builder;
    private final Executor executor;

    public RepositoryPullFetcher(GitHubApiClient client, Executor executor) {
        this(client, new ReviewFetcher(client), new PullRequestBuilder(), executor);
    }

    // Visible for testing
    RepositoryPullFetcher(GitHubApiClient client, ReviewFetcher reviewFetcher,
                          PullRequestBuilder builder, Executor executor) {
        this.client = client;
        this.reviewFetcher = reviewFetcher;
        this.builder = builder;
        this.executor = executor;
    }

    /**
     * Fetches and builds every pull request listed on page one of {@code {repositoryApiUrl}/pulls}.
     *
     * @param repositoryApiUrl the API URL of the repository
     * @return a future of the built records, unordered, one per URL
     */
    public CompletableFuture<List<PullRequest>> fetch(String repositoryApiUrl) {
        if (repositoryApiUrl == null) {
            return CompletableFuture.failedFuture(
                    new MalformedPayloadException("Repository without API url"));
        }

        return FanOut.supplyAsync(() -> client.getPullRequests(repositoryApiUrl), executor)
                .thenCompose(payloads -> {
                    logger.debug("Building {} pull requests for {}", payloads.size(), repositoryApiUrl);
                    return FanOut.allOf(payloads.stream().map(this::buildAsync).toList());
                })
                .thenApply(RepositoryPullFetcher::mergeByUrl);
    }

    private CompletableFuture<PullRequest> buildAsync(PullRequestPayload payload) {
        return FanOut.supplyAsync(() -> {
            Set<String> approvers = reviewFetcher.fetchApprovers(builder.apiUrlOf(payload));
            return builder.build(payload, approvers);
        }, executor);
    }

    /**
     * Collapses records sharing a URL, keeping the last one, in first-seen order.
     */
    static List<PullRequest> mergeByUrl(Collection<PullRequest> pullRequests) {
        Map<String, PullRequest> byUrl = new LinkedHashMap<>();
        for (PullRequest pr : pullRequests) {
            byUrl.put(pr.url(), pr);
        }
        return List.copyOf(byUrl.values());
    }
}
