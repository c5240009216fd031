package com.prradar.aggregator.orchestrator;

import com.prradar.aggregator.client.GitHubApiClient;
import com.prradar.aggregator.model.PullRequest;
import com.prradar.aggregator.model.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * Coordinates a full fetch cycle: repositories -> pull requests -> reviews.
 *
 * <p>The repository listing is fetched once and memoized for the lifetime of this
 * instance; pull request state is fetched anew on every call. Each repository gets
 * one {@link RepositoryPullFetcher} task, and the call returns only after all of them
 * completed.</p>
 *
 * <p>Whole-or-nothing: if any request of the cycle fails, {@link #fetchAll()} throws a
 * single {@link FetchException} and no records are returned.</p>
 */
public class OrganizationFetcher {

    private static final Logger logger = LoggerFactory.getLogger(OrganizationFetcher.class);

    private final GitHubApiClient client;
    private final RepositoryPullFetcher repositoryPullFetcher;

    private volatile List<Repository> repositories;

    public OrganizationFetcher(GitHubApiClient client, Executor executor) {
        this(client, new RepositoryPullFetcher(client, executor));
    }

    OrganizationFetcher(GitHubApiClient client, RepositoryPullFetcher repositoryPullFetcher) {
        this.client = client;
        this.repositoryPullFetcher = repositoryPullFetcher;
    }

    /**
     * Fetches every pull request of every repository of the organization.
     *
     * @return the flattened records, one per URL, in no particular order
     * @throws FetchException if listing repositories, pull requests or reviews failed,
     *                        or a payload was malformed
     */
    public List<PullRequest> fetchAll() throws FetchException {
        long start = System.currentTimeMillis();
        try {
            List<Repository> repos = repositories();

            List<CompletableFuture<List<PullRequest>>> perRepository = repos.stream()
                    .map(repo -> repositoryPullFetcher.fetch(repo.url()))
                    .toList();
            List<List<PullRequest>> results = FanOut.allOf(perRepository).get();

            List<PullRequest> pullRequests = RepositoryPullFetcher.mergeByUrl(
                    results.stream().flatMap(List::stream).toList());

            logger.info("Fetched {} pull requests across {} repositories in {}ms",
                    pullRequests.size(), repos.size(), System.currentTimeMillis() - start);
            return pullRequests;

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Pull request fetch interrupted after {}ms", System.currentTimeMillis() - start);
            throw new FetchException(e);
        } catch (ExecutionException e) {
            Throwable cause = FanOut.unwrap(e);
            logger.error("Pull request fetch failed after {}ms", System.currentTimeMillis() - start, cause);
            throw new FetchException(cause);
        } catch (IOException | RuntimeException e) {
            logger.error("Pull request fetch failed after {}ms", System.currentTimeMillis() - start, e);
            throw new FetchException(e);
        }
    }

    /**
     * Returns the memoized repository listing, fetching it on first use.
     * A failed listing is not memoized.
     */
    List<Repository> repositories() throws IOException {
        List<Repository> cached = repositories;
        if (cached != null) {
            return cached;
        }
        synchronized (this) {
            if (repositories == null) {
                List<Repository> fetched = List.copyOf(client.getRepositories());
                logger.info("Organization has {} repositories", fetched.size());
                repositories = fetched;
            }
            return repositories;
        }
    }
}
