package com.prradar.aggregator.orchestrator;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fan-out/fan-in helpers for the fetch levels.
 *
 * <p>Tasks run on a caller-supplied (bounded) executor. Joining is composed rather than
 * blocking, so nested levels never hold a worker thread while waiting on their children.</p>
 */
final class FanOut {

    private FanOut() {}

    @FunctionalInterface
    interface IoSupplier<T> {
        T get() throws IOException;
    }

    /**
     * Runs a blocking I/O task on {@code executor}. An {@link IOException} completes the
     * returned future exceptionally with that exception as the cause.
     */
    static <T> CompletableFuture<T> supplyAsync(IoSupplier<T> task, Executor executor) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return task.get();
            } catch (IOException e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    /**
     * Barrier over one fan-out level. Completes with every result, in the order of
     * {@code futures}, once all of them completed normally.
     *
     * <p>The first failure completes the barrier exceptionally at once and cancels the
     * siblings of this level that have not completed yet; a cancelled task still waiting
     * in the executor queue never runs. Cancellation does not reach down: tasks a
     * cancelled sibling already submitted for a nested level still run to completion.</p>
     */
    static <T> CompletableFuture<List<T>> allOf(List<CompletableFuture<T>> futures) {
        if (futures.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }

        CompletableFuture<List<T>> barrier = new CompletableFuture<>();
        AtomicInteger remaining = new AtomicInteger(futures.size());

        for (CompletableFuture<T> future : futures) {
            future.whenComplete((value, error) -> {
                if (error != null) {
                    if (barrier.completeExceptionally(unwrap(error))) {
                        futures.forEach(sibling -> sibling.cancel(false));
                    }
                } else if (remaining.decrementAndGet() == 0) {
                    barrier.complete(futures.stream().map(CompletableFuture::join).toList());
                }
            });
        }
        return barrier;
    }

    /**
     * Strips the {@link CompletionException}/{@link ExecutionException} wrappers the
     * future machinery adds around a task's own failure.
     */
    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
