package org.smileyface.sitecheck.fetch;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.smileyface.sitecheck.model.LinkCandidate;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs subpage fetches concurrently on a shared worker pool and joins all of them.
 * <p>
 * One task's failure never cancels its siblings; every candidate gets exactly one
 * {@link FetchOutcome}, returned in the order of the input list.
 */
@Component
public class FetchManager {

    private static final Logger log = LogManager.getLogger();

    private final PageFetcher fetcher;
    private final ExecutorService executor;
    private final AtomicLong taskSequence = new AtomicLong();

    public FetchManager(PageFetcher fetcher, @Qualifier("fetchExecutor") ExecutorService executor) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Fetches every candidate and waits until all of them have settled.
     *
     * @param candidates selected subpages, in selection order
     * @return one outcome per candidate, in the same order
     */
    public List<FetchOutcome> fetchAll(List<LinkCandidate> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        List<PageFetchTask> tasks = new ArrayList<>(candidates.size());
        List<Future<FetchOutcome>> futures = new ArrayList<>(candidates.size());
        for (LinkCandidate c : candidates) {
            PageFetchTask task = new PageFetchTask("fetch-" + taskSequence.incrementAndGet(), c, fetcher);
            tasks.add(task);
            try {
                futures.add(executor.submit(task));
            } catch (RejectedExecutionException e) {
                log.warn("Fetch pool rejected {}: {}", c.url(), e.getMessage());
                futures.add(null);
            }
        }

        List<FetchOutcome> outcomes = new ArrayList<>(candidates.size());
        for (int i = 0; i < tasks.size(); i++) {
            outcomes.add(join(tasks.get(i), futures.get(i)));
        }
        logAggregate(outcomes);
        return outcomes;
    }

    private FetchOutcome join(PageFetchTask task, Future<FetchOutcome> future) {
        LinkCandidate candidate = task.getCandidate();
        if (future == null) {
            return new FetchOutcome(candidate, null, 0L);
        }
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("Interrupted while waiting for {}", candidate.url());
            return new FetchOutcome(candidate, null, 0L);
        } catch (ExecutionException e) {
            log.warn("Fetch task {} for {} ended with an error", task.getId(), candidate.url(), e.getCause());
            return new FetchOutcome(candidate, null, 0L);
        }
    }

    private void logAggregate(List<FetchOutcome> outcomes) {
        int succeeded = 0;
        int failed = 0;
        long slowest = 0L;
        for (FetchOutcome o : outcomes) {
            if (o.isSuccess()) succeeded++;
            else failed++;
            slowest = Math.max(slowest, o.durationMs());
        }
        log.info("FetchManager ALL SETTLED: succeeded={}, failed={}, slowestMs={} (tasks={})",
                succeeded, failed, slowest, outcomes.size());
    }
}
