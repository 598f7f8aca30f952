package org.counterseries.datapipeline.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Applies a function to independent groups, optionally on a fixed thread pool.
 * <p>
 * Results are always returned in the order of the input groups, so a parallel run produces
 * exactly the same output as a sequential one.
 */
public final class GroupExecutor {

    private static final Logger log = LoggerFactory.getLogger(GroupExecutor.class);

    private final int parallelism;

    /**
     * @param parallelism number of worker threads; 1 runs on the calling thread
     */
    public GroupExecutor(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be at least 1, was " + parallelism);
        }
        this.parallelism = parallelism;
    }

    public int getParallelism() {
        return parallelism;
    }

    /**
     * @param groups   independent work units
     * @param function per-group transformation, must not share mutable state between groups
     * @return one result per group, in input order
     * @throws IllegalStateException if a group task fails or the calling thread is interrupted
     */
    public <G, R> List<R> map(List<G> groups, Function<G, R> function) {
        if (parallelism == 1 || groups.size() < 2) {
            final List<R> results = new ArrayList<>(groups.size());
            for (G group : groups) {
                results.add(function.apply(group));
            }
            return results;
        }

        final int threads = Math.min(parallelism, groups.size());
        log.debug("Processing {} groups on {} threads", groups.size(), threads);
        final ExecutorService executor = Executors.newFixedThreadPool(threads, new GroupThreadFactory());
        try {
            final List<Future<R>> futures = new ArrayList<>(groups.size());
            for (G group : groups) {
                futures.add(executor.submit(() -> function.apply(group)));
            }
            final List<R> results = new ArrayList<>(groups.size());
            for (Future<R> future : futures) {
                results.add(future.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while processing groups", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Group processing failed", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    private static final class GroupThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            final Thread thread = new Thread(runnable, "group-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
