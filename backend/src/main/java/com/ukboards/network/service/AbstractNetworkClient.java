package com.ukboards.network.service;

import com.ukboards.network.graph.BoardGraph;
import com.ukboards.network.graph.GraphNode;
import com.ukboards.network.graph.NodeKind;
import com.ukboards.network.model.NetworkSettings;
import com.ukboards.network.model.RunRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

/**
 * Stateful crawler over one registry. Owns a graph, the registry-specific cache behind it and the
 * run ledger, and drives crawls one seed at a time or over many seeds.
 *
 * <p>All graph and cache writes happen inside this object's monitor. The async drivers only fetch
 * root records concurrently; the crawls themselves are chained in submission order.
 *
 * @param <I> registry identifier type
 * @param <S> settings type
 * @param <R> root record type fetched before a crawl starts
 */
public abstract class AbstractNetworkClient<I, S extends NetworkSettings, R> {
    private static final Logger log = LoggerFactory.getLogger(AbstractNetworkClient.class);

    protected final Clock clock;
    private final ExecutorService executor;
    private final RunLedger ledger = new RunLedger();
    private BoardGraph graph = new BoardGraph();
    private S settings;

    protected AbstractNetworkClient(S settings, Clock clock, ExecutorService executor) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = clock;
        this.executor = executor;
    }

    /**
     * Registry kind recorded on run records, {@code company} or {@code charity}.
     */
    protected abstract String runKind();

    protected abstract Collection<NodeKind> networkKinds();

    protected abstract Optional<R> fetchRoot(I rootId);

    /**
     * Crawls outward from {@code rootId} onto {@link #graph()}.
     *
     * @return whether the root was found, or null where the registry does not track it
     */
    protected abstract Boolean crawl(I rootId, Supplier<Optional<R>> root);

    protected abstract void clearCache();

    public synchronized S getSettings() {
        return settings;
    }

    /**
     * Changes the crawl policy for later runs. The next run record will differ from the previous
     * one, which the ledger reports.
     */
    public synchronized void setSettings(S settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public List<RunRecord> runs() {
        return ledger.runs();
    }

    public Optional<RunRecord> latestRun() {
        return ledger.latest();
    }

    /**
     * The live graph. It is replaced, not cleared, on reset, so earlier returned graphs stay intact.
     */
    protected synchronized BoardGraph graph() {
        return graph;
    }

    public synchronized BoardGraph currentGraph() {
        return graph;
    }

    /**
     * Crawls one seed and returns the client's graph. Without {@code resetCache} and
     * {@code composeQueriedNetworks} an existing graph is returned as is.
     */
    public synchronized BoardGraph getNetwork(I rootId) {
        return getNetwork(rootId, () -> fetchRoot(rootId));
    }

    private synchronized BoardGraph getNetwork(I rootId, Supplier<Optional<R>> root) {
        if (!settings.resetCache() && !settings.composeQueriedNetworks() && !graph.isEmpty()) {
            log.debug("Returning cached {} network instead of querying {}", runKind(), rootId);
            return graph;
        }
        if (settings.resetCache() || !settings.composeQueriedNetworks()) {
            reset();
        }
        runSeed(rootId, root);
        return graph;
    }

    /**
     * One graph per seed, in seed order. Each entry is a snapshot taken when its seed finished.
     */
    public synchronized List<BoardGraph> networks(List<I> rootIds) {
        List<BoardGraph> results = new ArrayList<>();
        for (I rootId : rootIds) {
            results.add(getNetwork(rootId).copy());
        }
        return results;
    }

    /**
     * Crawls every seed onto one accumulated graph. The cache is kept between seeds; it is cleared
     * once up front when {@code resetCache} is set.
     */
    public synchronized BoardGraph getComposedNetwork(List<I> rootIds) {
        LocalDateTime start = now();
        int firstRun = ledger.size();
        if (settings.resetCache()) {
            reset();
        }
        for (I rootId : rootIds) {
            log.info("Composed query of {} {}", runKind(), rootId);
            runSeed(rootId, () -> fetchRoot(rootId));
        }
        appendSummary(rootIds, start, firstRun);
        return graph;
    }

    /**
     * Async counterpart of {@link #networks(List)}. Root records are fetched concurrently; crawls
     * run one at a time in seed order, so the futures complete in submission order.
     */
    public List<CompletableFuture<BoardGraph>> asyncNetworks(List<I> rootIds) {
        List<CompletableFuture<Optional<R>>> roots = prefetchRoots(rootIds);
        List<CompletableFuture<BoardGraph>> results = new ArrayList<>();
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (int i = 0; i < rootIds.size(); i++) {
            I rootId = rootIds.get(i);
            CompletableFuture<BoardGraph> result = chain.thenCombineAsync(
                roots.get(i),
                (ignored, root) -> {
                    synchronized (this) {
                        return getNetwork(rootId, () -> root).copy();
                    }
                },
                executor
            );
            results.add(result);
            chain = result.handle((graphSnapshot, error) -> null);
        }
        return results;
    }

    /**
     * Async counterpart of {@link #getComposedNetwork(List)}. The final graph equals the sequential
     * result for the same seeds and settings.
     */
    public CompletableFuture<BoardGraph> asyncGetComposedNetwork(List<I> rootIds) {
        LocalDateTime start = now();
        List<CompletableFuture<Optional<R>>> roots = prefetchRoots(rootIds);
        CompletableFuture<Integer> chain = CompletableFuture.supplyAsync(() -> {
            synchronized (this) {
                int firstRun = ledger.size();
                if (settings.resetCache()) {
                    reset();
                }
                return firstRun;
            }
        }, executor);
        for (int i = 0; i < rootIds.size(); i++) {
            I rootId = rootIds.get(i);
            chain = chain.thenCombineAsync(
                roots.get(i),
                (firstRun, root) -> {
                    synchronized (this) {
                        log.info("Composed async query of {} {}", runKind(), rootId);
                        runSeed(rootId, () -> root);
                        return firstRun;
                    }
                },
                executor
            );
        }
        return chain.thenApplyAsync(firstRun -> {
            synchronized (this) {
                appendSummary(rootIds, start, firstRun);
                return graph.copy();
            }
        }, executor);
    }

    private List<CompletableFuture<Optional<R>>> prefetchRoots(List<I> rootIds) {
        List<CompletableFuture<Optional<R>>> roots = new ArrayList<>();
        for (I rootId : rootIds) {
            roots.add(CompletableFuture.supplyAsync(() -> fetchRoot(rootId), executor));
        }
        return roots;
    }

    private void runSeed(I rootId, Supplier<Optional<R>> root) {
        LocalDateTime start = now();
        Boolean success = crawl(rootId, root);
        LocalDateTime end = now();
        ledger.append(new RunRecord(
            runKind(),
            List.of(String.valueOf(rootId)),
            settings.parameterState(),
            start,
            end,
            graph.connectedComponentsCount(),
            kindsIds(),
            success,
            List.of()
        ));
    }

    private void appendSummary(List<I> rootIds, LocalDateTime start, int firstRun) {
        List<RunRecord> children = ledger.since(firstRun);
        Boolean success = null;
        for (RunRecord child : children) {
            if (child.success() != null) {
                success = (success == null || success) && child.success();
            }
        }
        List<String> ids = new ArrayList<>();
        for (I rootId : rootIds) {
            ids.add(String.valueOf(rootId));
        }
        ledger.append(new RunRecord(
            runKind(),
            ids,
            settings.parameterState(),
            start,
            now(),
            graph.connectedComponentsCount(),
            kindsIds(),
            success,
            children
        ));
    }

    private Map<String, Set<String>> kindsIds() {
        Map<String, Set<String>> result = new LinkedHashMap<>();
        for (Map.Entry<NodeKind, Set<String>> entry : graph.kindsIds(networkKinds()).entrySet()) {
            result.put(entry.getKey().label(), new TreeSet<>(entry.getValue()));
        }
        return result;
    }

    private void reset() {
        graph = new BoardGraph();
        clearCache();
    }

    /**
     * Runs a depth-first worklist until it is empty. A frame either pushes one child and returns
     * false, to be resumed once the child is done, or finishes and returns true without pushing.
     */
    protected final void runWorklist(CrawlFrame root) {
        Deque<CrawlFrame> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            CrawlFrame frame = stack.peek();
            if (frame.advance(stack)) {
                stack.pop();
            }
        }
    }

    /**
     * Checks the hop of a new organisation frame against the configured branches.
     */
    protected final void checkHop(int hop) {
        if (hop < 0) {
            throw new NegativeBranchesException(hop);
        }
        if (hop > settings.branches()) {
            throw new ExceededMaxBranchesException(hop, settings.branches());
        }
    }

    /**
     * Whether {@code memberId} can be used for a board member: either unused, or already a member.
     */
    protected final boolean isMemberSlot(String memberId) {
        return graph.node(memberId).map(node -> node.bipartite() == 1).orElse(true);
    }

    protected final boolean addNode(GraphNode node) {
        return graph.addNode(node);
    }

    protected final LocalDate today() {
        return LocalDate.now(clock);
    }

    protected final LocalDateTime now() {
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
    }

    protected interface CrawlFrame {
        boolean advance(Deque<CrawlFrame> stack);
    }
}
