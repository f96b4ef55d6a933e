package com.releasefeed.pipeline.concurrent;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Fixed-width pool shared by the validation and parsing fan-outs of one run. Excess units queue rather
 * than spawning additional threads, which caps the number of concurrent requests to the remote host.
 */
public final class WorkerPool implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger(WorkerPool.class.getName());

    private final int width;
    private final ExecutorService executor;

    public WorkerPool(int width) {
        if (width < 1) {
            throw new IllegalArgumentException("width must be at least 1, was " + width);
        }
        this.width = width;
        this.executor = new ThreadPoolExecutor(
                width,
                width,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                namedDaemonThreads("feed-worker-")
        );
    }

    public int width() {
        return width;
    }

    public <T> CompletableFuture<T> submit(Supplier<T> task) {
        return CompletableFuture.supplyAsync(task, executor);
    }

    /**
     * Runs {@code unit} for every input on the pool and returns the results in input order. A unit that
     * throws is converted by {@code onFailure}, so one failing input never affects its siblings.
     */
    public <T, R> List<R> mapAll(List<T> inputs, Function<T, R> unit, BiFunction<T, Throwable, R> onFailure) {
        List<CompletableFuture<R>> tasks = new ArrayList<>(inputs.size());
        for (T input : inputs) {
            tasks.add(submit(() -> unit.apply(input))
                    .handle((result, error) -> error == null ? result : onFailure.apply(input, unwrap(error))));
        }
        CompletableFuture.allOf(tasks.toArray(CompletableFuture[]::new)).join();
        return tasks.stream().map(CompletableFuture::join).toList();
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOGGER.warning("Worker pool did not terminate within 5s; forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof java.util.concurrent.CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
