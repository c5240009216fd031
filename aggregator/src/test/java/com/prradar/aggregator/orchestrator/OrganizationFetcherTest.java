package com.prradar.aggregator.orchestrator;

import com.prradar.aggregator.client.GitHubApiClient;
import com.prradar.aggregator.model.PullRequest;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end test for a fetch cycle against a fake GitHub Enterprise API:
 * repositories -> pull requests -> reviews.
 */
class OrganizationFetcherTest {

    private MockWebServer server;
    private FakeGitHub github;
    private GitHubApiClient client;
    private ExecutorService executor;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        github = new FakeGitHub();
        server.setDispatcher(github);
        server.start();

        OkHttpClient httpClient = new OkHttpClient.Builder()
                .connectTimeout(5, TimeUnit.SECONDS)
                .readTimeout(5, TimeUnit.SECONDS)
                .build();
        client = new GitHubApiClient(server.url("/api/v3").toString(), "acme", "test-token", httpClient);
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() throws IOException {
        executor.shutdownNow();
        server.shutdown();
    }

    // =========================================================================
    // Fixture
    // =========================================================================

    private String api(String path) {
        return server.url("/api/v3" + path).toString();
    }

    private void givenTwoRepositories() {
        github.respond("/api/v3/orgs/acme/repos", """
                [{"name": "billing", "url": "%s"}, {"name": "search", "url": "%s"}]"""
                .formatted(api("/repos/acme/billing"), api("/repos/acme/search")));

        github.respond("/api/v3/repos/acme/billing/pulls", "["
                + pullJson("billing", 1, "alice", false, "2024-06-01T10:00:00Z") + ","
                + pullJson("billing", 2, "bob", true, "2024-06-02T10:00:00Z") + "]");
        github.respond("/api/v3/repos/acme/search/pulls", "["
                + pullJson("search", 3, "carol", false, "2024-06-03T10:00:00Z") + "]");

        github.respond("/api/v3/repos/acme/billing/pulls/1/reviews", """
                [{"state": "APPROVED", "user": {"login": "bob"}},
                 {"state": "COMMENTED", "user": {"login": "dan"}},
                 {"state": "APPROVED", "user": {"login": "bob"}}]""");
        github.respond("/api/v3/repos/acme/billing/pulls/2/reviews", "[]");
        github.respond("/api/v3/repos/acme/search/pulls/3/reviews", """
                [{"state": "APPROVED", "user": {"login": "alice"}},
                 {"state": "APPROVED", "user": {"login": "erin"}}]""");
    }

    private String pullJson(String repo, int number, String author, boolean draft, String createdAt) {
        return """
                {"title": "%s change %d", "html_url": "https://ghe/acme/%s/pull/%d", "url": "%s",
                 "draft": %s, "created_at": "%s", "user": {"login": "%s"}, "head": {"repo": {"name": "%s"}}}"""
                .formatted(repo, number, repo, number, api("/repos/acme/" + repo + "/pulls/" + number),
                        draft, createdAt, author, repo);
    }

    // =========================================================================
    // Tests
    // =========================================================================

    @Test
    @DisplayName("Fetches and flattens pull requests of every repository with their approvers")
    void fetchAll_endToEnd() throws Exception {
        givenTwoRepositories();

        List<PullRequest> prs = new OrganizationFetcher(client, executor).fetchAll();

        Map<String, PullRequest> byUrl = prs.stream()
                .collect(Collectors.toMap(PullRequest::url, Function.identity()));
        assertEquals(Set.of("https://ghe/acme/billing/pull/1", "https://ghe/acme/billing/pull/2",
                "https://ghe/acme/search/pull/3"), byUrl.keySet());

        PullRequest first = byUrl.get("https://ghe/acme/billing/pull/1");
        assertEquals("billing", first.repository());
        assertEquals("alice", first.createdBy());
        assertEquals(Set.of("bob"), first.approvers());
        assertFalse(first.draft());

        assertTrue(byUrl.get("https://ghe/acme/billing/pull/2").draft());
        assertEquals(Set.of("alice", "erin"), byUrl.get("https://ghe/acme/search/pull/3").approvers());
    }

    @Test
    @DisplayName("Repository listing is fetched once and reused across cycles")
    void fetchAll_memoizesRepositories() throws Exception {
        givenTwoRepositories();
        OrganizationFetcher fetcher = new OrganizationFetcher(client, executor);

        fetcher.fetchAll();
        fetcher.fetchAll();

        assertEquals(1, github.hits("/api/v3/orgs/acme/repos"));
        assertEquals(2, github.hits("/api/v3/repos/acme/billing/pulls"));
        assertEquals(2, github.hits("/api/v3/repos/acme/search/pulls/3/reviews"));
    }

    @Test
    @DisplayName("A failing review endpoint fails the whole cycle with a single FetchException")
    void fetchAll_reviewFailure_wholeOrNothing() {
        givenTwoRepositories();
        github.fail("/api/v3/repos/acme/search/pulls/3/reviews", 500);

        FetchException ex = assertThrows(FetchException.class,
                () -> new OrganizationFetcher(client, executor).fetchAll());

        assertEquals(FetchException.DEFAULT_TITLE, ex.getTitle());
        assertEquals(FetchException.DEFAULT_DESCRIPTION, ex.getDescription());
        assertInstanceOf(IOException.class, ex.getCause());
    }

    @Test
    @DisplayName("A malformed pull request payload fails the cycle")
    void fetchAll_malformedPayload() {
        givenTwoRepositories();
        github.respond("/api/v3/repos/acme/search/pulls", """
                [{"title": "no author", "html_url": "https://ghe/acme/search/pull/9", "url": "%s",
                  "created_at": "2024-06-03T10:00:00Z", "head": {"repo": {"name": "search"}}}]"""
                .formatted(api("/repos/acme/search/pulls/9")));
        github.respond("/api/v3/repos/acme/search/pulls/9/reviews", "[]");

        FetchException ex = assertThrows(FetchException.class,
                () -> new OrganizationFetcher(client, executor).fetchAll());

        assertInstanceOf(MalformedPayloadException.class, ex.getCause());
    }

    @Test
    @DisplayName("A failed repository listing is not memoized and is retried on the next cycle")
    void fetchAll_repositoryListingFailure_retried() throws Exception {
        givenTwoRepositories();
        github.fail("/api/v3/orgs/acme/repos", 401);
        OrganizationFetcher fetcher = new OrganizationFetcher(client, executor);

        assertThrows(FetchException.class, fetcher::fetchAll);

        github.recover("/api/v3/orgs/acme/repos");
        assertEquals(3, fetcher.fetchAll().size());
        assertEquals(2, github.hits("/api/v3/orgs/acme/repos"));
    }

    @Test
    @DisplayName("Organization without repositories yields no pull requests")
    void fetchAll_noRepositories() throws Exception {
        github.respond("/api/v3/orgs/acme/repos", "[]");

        assertTrue(new OrganizationFetcher(client, executor).fetchAll().isEmpty());
    }

    @Test
    @DisplayName("Review requests of all repositories are in flight at the same time")
    void fetchAll_reviewRequestsRunConcurrently() throws Exception {
        givenTwoRepositories();
        // Each of the three review requests is answered only once all three have arrived.
        github.gateReviews(new CountDownLatch(3));

        List<PullRequest> prs = new OrganizationFetcher(client, executor).fetchAll();

        assertEquals(3, prs.size());
        assertEquals(1, github.hits("/api/v3/repos/acme/search/pulls/3/reviews"));
    }

    @Test
    @DisplayName("Nested fan-out completes on a single worker thread")
    void fetchAll_singleWorker_doesNotDeadlock() {
        givenTwoRepositories();
        ExecutorService singleWorker = Executors.newFixedThreadPool(1);
        try {
            List<PullRequest> prs = assertTimeoutPreemptively(Duration.ofSeconds(10),
                    () -> new OrganizationFetcher(client, singleWorker).fetchAll());
            assertEquals(3, prs.size());
        } finally {
            singleWorker.shutdownNow();
        }
    }

    // =========================================================================
    // Fake API
    // =========================================================================

    private static final class FakeGitHub extends Dispatcher {

        private final Map<String, String> bodies = new ConcurrentHashMap<>();
        private final Map<String, Integer> failures = new ConcurrentHashMap<>();
        private final Map<String, AtomicInteger> hits = new ConcurrentHashMap<>();
        private volatile CountDownLatch reviewGate;

        void respond(String path, String body) {
            bodies.put(path, body);
        }

        void fail(String path, int status) {
            failures.put(path, status);
        }

        void recover(String path) {
            failures.remove(path);
        }

        void gateReviews(CountDownLatch gate) {
            reviewGate = gate;
        }

        int hits(String path) {
            AtomicInteger count = hits.get(path);
            return count != null ? count.get() : 0;
        }

        @Override
        public MockResponse dispatch(RecordedRequest request) throws InterruptedException {
            String path = request.getPath();
            hits.computeIfAbsent(path, p -> new AtomicInteger()).incrementAndGet();

            CountDownLatch gate = reviewGate;
            if (gate != null && path.endsWith("/reviews")) {
                gate.countDown();
                if (!gate.await(5, TimeUnit.SECONDS)) {
                    return new MockResponse().setResponseCode(500).setBody("{\"message\": \"serialized\"}");
                }
            }

            Integer status = failures.get(path);
            if (status != null) {
                return new MockResponse().setResponseCode(status).setBody("{\"message\": \"failure\"}");
            }
            String body = bodies.get(path);
            if (body == null) {
                return new MockResponse().setResponseCode(404).setBody("{\"message\": \"Not Found\"}");
            }
            return new MockResponse()
                    .setResponseCode(200)
                    .setHeader("X-RateLimit-Remaining", "4999")
                    .setBody(body);
        }
    }
}
