package com.prradar.aggregator.display;

import com.prradar.aggregator.cache.PullRequestCache;
import com.prradar.aggregator.client.GitHubApiClient;
import com.prradar.aggregator.config.AppConfig;
import com.prradar.aggregator.model.PullRequest;
import com.prradar.aggregator.orchestrator.FetchException;
import com.prradar.aggregator.orchestrator.OrganizationFetcher;
import com.prradar.aggregator.pipeline.PullRequestPipeline;
import com.prradar.aggregator.pipeline.PullRequestSnapshot;
import com.prradar.aggregator.query.PullRequestQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Builds the display items handed to the presentation layer and reacts to the events
 * those items emit.
 *
 * <p>Items are always built from the cached snapshot; a fetch failure renders as a single
 * error item instead of the list.</p>
 */
public class PullRequestController implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PullRequestController.class);

    static final String APPROVED_BUTTON_TITLE = "Approved Pull Requests";

    private final PullRequestCache cache;
    private final String user;
    private final ExecutorService ownedExecutor;

    private final Set<String> selectedUrls = new LinkedHashSet<>();

    public PullRequestController(PullRequestCache cache, String user) {
        this(cache, user, null);
    }

    private PullRequestController(PullRequestCache cache, String user, ExecutorService ownedExecutor) {
        this.cache = cache;
        this.user = Objects.requireNonNull(user, "user");
        this.ownedExecutor = ownedExecutor;
    }

    /**
     * Wires the full stack from configuration. The returned controller owns the fetch
     * worker pool and shuts it down on {@link #close()}.
     */
    public static PullRequestController create(AppConfig config) {
        ExecutorService executor = Executors.newFixedThreadPool(
                config.getMaxConcurrentRequests(), fetchThreadFactory());

        GitHubApiClient client = new GitHubApiClient(
                GitHubApiClient.apiBaseUrlFor(config.getHostname()),
                config.getOrganization(),
                config.getAccessToken(),
                GitHubApiClient.defaultHttpClient(config.getRequestTimeout()));
        OrganizationFetcher fetcher = new OrganizationFetcher(client, executor);
        PullRequestPipeline pipeline = new PullRequestPipeline();
        String user = config.getUserLogin();

        PullRequestCache cache = new PullRequestCache(
                () -> pipeline.process(fetcher.fetchAll(), user),
                config.getCacheTtl(),
                Clock.systemUTC());

        return new PullRequestController(cache, user, executor);
    }

    private static ThreadFactory fetchThreadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "pr-fetch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    // -------------------------------------------------------------------------
    // Entry points for the presentation layer
    // -------------------------------------------------------------------------

    /**
     * Handles a typed query: clears any multiselect selection and lists the open pull
     * requests matching {@code text}, followed by the approved button.
     */
    public List<DisplayItem> query(String text) {
        synchronized (selectedUrls) {
            selectedUrls.clear();
        }
        return buildItems(PrType.OPEN, PullRequestQuery.matching(text), true);
    }

    /**
     * Handles an event emitted by an item's custom action.
     */
    public List<DisplayItem> handle(ItemEvent event) {
        if (event instanceof ItemEvent.Multiselect multiselect) {
            return select(multiselect);
        }
        if (event instanceof ItemEvent.ShowApproved) {
            return buildItems(PrType.APPROVED, null, false);
        }
        throw new IllegalArgumentException("Unsupported event: " + event);
    }

    private List<DisplayItem> select(ItemEvent.Multiselect event) {
        List<String> selection;
        synchronized (selectedUrls) {
            selectedUrls.add(event.pullRequestUrl());
            selection = List.copyOf(selectedUrls);
        }

        List<DisplayItem> items = new ArrayList<>();
        items.add(new DisplayItem(
                "Open " + selection.size() + " Pull Requests",
                "Do not type a query while selecting multiple Pull Requests",
                IconVariant.APPROVED,
                new ItemAction.OpenUrls(selection),
                null));
        items.addAll(buildItems(event.type(), pr -> !selection.contains(pr.url()), false));
        return items;
    }

    // -------------------------------------------------------------------------
    // Item building
    // -------------------------------------------------------------------------

    /**
     * Builds the items of one view.
     *
     * @param type                  which view to list
     * @param predicate             optional filter; {@code null} keeps every pull request
     * @param includeApprovedButton append a button leading to the approved view when it is not empty
     */
    public List<DisplayItem> buildItems(PrType type, Predicate<PullRequest> predicate,
                                        boolean includeApprovedButton) {
        PullRequestSnapshot snapshot;
        try {
            snapshot = cache.get();
        } catch (FetchException e) {
            logger.warn("Rendering error item: {}", e.getMessage());
            return List.of(errorItem(e));
        }

        List<PullRequest> relevant = type == PrType.APPROVED ? snapshot.approved() : snapshot.open();

        List<DisplayItem> items = new ArrayList<>();
        for (PullRequest pr : relevant) {
            if (predicate == null || predicate.test(pr)) {
                items.add(toItem(type, pr));
            }
        }

        if (includeApprovedButton && !snapshot.approved().isEmpty()) {
            items.add(approvedButton(snapshot.approved().size()));
        }
        return items;
    }

    private DisplayItem toItem(PrType type, PullRequest pr) {
        return new DisplayItem(
                pr.title(),
                pr.repository() + "\n" + pr.url(),
                IconVariant.of(type, pr.isAuthoredBy(user)),
                new ItemAction.OpenUrl(pr.url()),
                new ItemAction.Emit(new ItemEvent.Multiselect(type, pr.url())));
    }

    private static DisplayItem approvedButton(int approvedCount) {
        return new DisplayItem(
                APPROVED_BUTTON_TITLE,
                "View " + approvedCount + " approved Pull Requests",
                IconVariant.APPROVED,
                new ItemAction.Emit(new ItemEvent.ShowApproved()),
                null);
    }

    private static DisplayItem errorItem(FetchException e) {
        return new DisplayItem(
                e.getTitle(),
                e.getDescription(),
                IconVariant.ERROR,
                new ItemAction.DoNothing(),
                null);
    }

    @Override
    public void close() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
        }
    }
}
