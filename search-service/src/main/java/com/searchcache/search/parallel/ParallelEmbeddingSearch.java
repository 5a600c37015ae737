package com.searchcache.search.parallel;

import com.searchcache.cache.CacheKeys;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs independent searches concurrently. One task failing or hanging never fails the batch: that
 * task's slot comes back as an empty list.
 *
 * <p>The timeout is measured from dispatch, so the executor is expected to hand each task a thread
 * straight away rather than queue it. A task the executor rejects counts as failed.
 */
@Service
public class ParallelEmbeddingSearch {

    private static final Logger log = LoggerFactory.getLogger(ParallelEmbeddingSearch.class);
    private static final long DEFAULT_TASK_TIMEOUT_MS = 5_000L;

    private final ExecutorService executor;
    private final long taskTimeoutMs;
    private final MeterRegistry meterRegistry;

    public ParallelEmbeddingSearch(ExecutorService executor) {
        this(executor, DEFAULT_TASK_TIMEOUT_MS, null);
    }

    @Autowired
    public ParallelEmbeddingSearch(
            @Qualifier("searchExecutor") ExecutorService executor,
            @Value("${search.parallel.task-timeout-ms:5000}") long taskTimeoutMs,
            MeterRegistry meterRegistry
    ) {
        this.executor = executor;
        this.taskTimeoutMs = Math.max(1L, taskTimeoutMs);
        this.meterRegistry = meterRegistry;
    }

    /**
     * Result lists in input order; a failed or timed-out task yields an empty list.
     */
    public <T> List<List<T>> searchMultiple(List<SearchTask> tasks, SearchFunction<T> searchFn) {
        List<TaskOutcome<T>> outcomes = searchMultipleDetailed(tasks, searchFn);
        List<List<T>> results = new ArrayList<>(outcomes.size());
        for (TaskOutcome<T> outcome : outcomes) {
            results.add(outcome.results());
        }
        return results;
    }

    /**
     * Same as {@link #searchMultiple} but keeps the reason each task failed.
     */
    public <T> List<TaskOutcome<T>> searchMultipleDetailed(List<SearchTask> tasks, SearchFunction<T> searchFn) {
        if (tasks == null || tasks.isEmpty()) {
            return List.of();
        }
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(taskTimeoutMs);
        List<Future<List<T>>> futures = new ArrayList<>(tasks.size());
        for (SearchTask task : tasks) {
            futures.add(dispatch(task, searchFn));
        }

        List<TaskOutcome<T>> outcomes = new ArrayList<>(tasks.size());
        for (int i = 0; i < tasks.size(); i++) {
            outcomes.add(await(i, tasks.get(i), futures.get(i), deadline));
        }
        return outcomes;
    }

    private <T> CompletableFuture<List<T>> dispatch(SearchTask task, SearchFunction<T> searchFn) {
        try {
            return CompletableFuture.supplyAsync(() -> {
                try {
                    return searchFn.search(task.tenantId(), task.query(), task.topK());
                } catch (RuntimeException ex) {
                    throw ex;
                } catch (Exception ex) {
                    throw new CompletionException(ex);
                }
            }, executor);
        } catch (RejectedExecutionException ex) {
            return CompletableFuture.failedFuture(ex);
        }
    }

    private <T> TaskOutcome<T> await(int index, SearchTask task, Future<List<T>> future, long deadlineNanos) {
        try {
            long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
            List<T> results = future.get(remaining, TimeUnit.NANOSECONDS);
            incrementOutcome("success");
            return TaskOutcome.success(results);
        } catch (TimeoutException ex) {
            future.cancel(true);
            incrementOutcome("timeout");
            log.warn("event=parallel_search_task_timeout index={} tenant_id={} query=\"{}\" timeout_ms={}",
                    index, task.tenantId(), CacheKeys.sanitizeForLog(task.query()), taskTimeoutMs);
            return TaskOutcome.timedOut();
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            incrementOutcome("error");
            log.warn("event=parallel_search_task_failed index={} tenant_id={} query=\"{}\" cause={}",
                    index, task.tenantId(), CacheKeys.sanitizeForLog(task.query()), cause.toString());
            return TaskOutcome.failed(cause);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            incrementOutcome("error");
            log.warn("event=parallel_search_interrupted index={} tenant_id={}", index, task.tenantId());
            return TaskOutcome.failed(ex);
        }
    }

    private void incrementOutcome(String outcome) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.counter("parallel_search_task_total", "outcome", outcome).increment();
    }
}
