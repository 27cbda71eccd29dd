package work.lcod.multiverse.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.multiverse.error.UniverseExecutionException;
import work.lcod.multiverse.universe.Universe;

/**
 * Runs universes against a snapshot, one at a time or on a fixed worker pool, and caches what it ran.
 */
public final class ExecutionEngine {
    private static final Logger LOG = LoggerFactory.getLogger(ExecutionEngine.class);

    private final int parallelism;
    private final ResultCache cache = new ResultCache();

    public ExecutionEngine(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be positive");
        }
        this.parallelism = parallelism;
    }

    public int parallelism() {
        return parallelism;
    }

    public ExecutionResult execute(ExecutionSnapshot snapshot, Universe universe) {
        var cached = cached(snapshot, universe);
        if (cached.isPresent()) {
            LOG.debug("Universe {} served from cache", universe.id());
            return cached.get();
        }
        var result = UniverseRunner.run(snapshot, universe);
        cache.put(snapshot.codeHash(), result);
        if (!result.succeeded()) {
            LOG.warn("{}", result.failure().getMessage());
        }
        return result;
    }

    /**
     * Executes every universe and returns the results in the order of {@code universes}. A failing universe never
     * stops the others.
     */
    public List<ExecutionResult> executeAll(ExecutionSnapshot snapshot, List<Universe> universes) {
        if (universes.isEmpty()) {
            return List.of();
        }
        int workers = Math.min(parallelism, universes.size());
        LOG.info("Executing {} universe(s) on {} worker(s)", universes.size(), workers);
        var executor = newWorkerPool(workers);
        try {
            var futures = new ArrayList<Future<ExecutionResult>>(universes.size());
            for (var universe : universes) {
                futures.add(executor.submit(() -> execute(snapshot, universe)));
            }
            var results = new ArrayList<ExecutionResult>(universes.size());
            for (int i = 0; i < futures.size(); i++) {
                results.add(await(futures.get(i), universes.get(i)));
            }
            long failed = results.stream().filter(result -> !result.succeeded()).count();
            LOG.info("Executed {} universe(s): {} succeeded, {} failed", results.size(), results.size() - failed, failed);
            return List.copyOf(results);
        } finally {
            executor.shutdownNow();
        }
    }

    public Optional<ExecutionResult> cached(ExecutionSnapshot snapshot, Universe universe) {
        return cache.get(snapshot.codeHash(), universe.assignment()).map(result -> result.withUniverseId(universe.id()));
    }

    public int cachedCount() {
        return cache.size();
    }

    public void invalidate() {
        if (cache.size() > 0) {
            LOG.debug("Dropping {} cached result(s)", cache.size());
        }
        cache.clear();
    }

    private static ExecutionResult await(Future<ExecutionResult> future, Universe universe) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for universe " + universe.id(), ex);
        } catch (ExecutionException ex) {
            var cause = ex.getCause() == null ? ex : ex.getCause();
            var failure = new UniverseExecutionException(universe.id(), -1, cause);
            LOG.warn("{}", failure.getMessage());
            return new ExecutionResult(universe.id(), universe.assignment(), Map.of(), 0, failure);
        }
    }

    private static ExecutorService newWorkerPool(int workers) {
        var counter = new AtomicInteger();
        return Executors.newFixedThreadPool(workers, task -> {
            var thread = new Thread(task, "multiverse-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
