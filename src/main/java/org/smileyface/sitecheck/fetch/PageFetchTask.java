package org.smileyface.sitecheck.fetch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.sitecheck.model.LinkCandidate;
import org.smileyface.sitecheck.model.PageSignal;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Fetches a single selected subpage. A task never throws: an empty fetch or an unexpected error
 * both end in {@link FetchTaskState#FAILED} with an outcome that carries no page.
 */
public class PageFetchTask implements Callable<FetchOutcome> {

    private static final Logger log = LoggerFactory.getLogger(PageFetchTask.class);

    private final String id;
    private final LinkCandidate candidate;
    private final PageFetcher fetcher;

    private volatile FetchTaskState state = FetchTaskState.NEW;
    private volatile String lastError;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;

    public PageFetchTask(String id, LinkCandidate candidate, PageFetcher fetcher) {
        this.id = Objects.requireNonNull(id, "id");
        this.candidate = Objects.requireNonNull(candidate, "candidate");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
    }

    public String getId() { return id; }
    public LinkCandidate getCandidate() { return candidate; }
    public FetchTaskState getState() { return state; }
    public String getLastError() { return lastError; }

    @Override
    public FetchOutcome call() {
        transitionTo(FetchTaskState.RUNNING, null);
        PageSignal signal = null;
        try {
            Optional<PageSignal> page = fetcher.fetch(candidate.url());
            signal = page.orElse(null);
            transitionTo(signal != null ? FetchTaskState.COMPLETED : FetchTaskState.FAILED, null);
        } catch (RuntimeException e) {
            lastError = e.getMessage();
            transitionTo(FetchTaskState.FAILED, e);
        }
        return new FetchOutcome(candidate, signal, durationMs());
    }

    /**
     * Centralized state transition with structured logging; terminal states include the duration.
     */
    private void transitionTo(FetchTaskState newState, Throwable error) {
        FetchTaskState old = this.state;
        if (newState == FetchTaskState.RUNNING) {
            this.startedAt = Instant.now();
            this.state = newState;
            log.debug("Fetch {} state {} -> RUNNING (url={})", id, old, candidate.url());
            return;
        }
        this.finishedAt = Instant.now();
        this.state = newState;
        switch (newState) {
            case COMPLETED -> log.debug("Fetch {} state {} -> COMPLETED after {} ms (url={})", id, old, durationMs(), candidate.url());
            case FAILED -> {
                if (error != null) {
                    log.warn("Fetch {} state {} -> FAILED after {} ms (url={}, error={})", id, old, durationMs(), candidate.url(), lastError, error);
                } else {
                    log.info("Fetch {} state {} -> FAILED after {} ms (url={})", id, old, durationMs(), candidate.url());
                }
            }
            default -> log.debug("Fetch {} state {} -> {}", id, old, newState);
        }
    }

    private long durationMs() {
        if (startedAt == null) return 0L;
        Instant end = finishedAt != null ? finishedAt : Instant.now();
        return Math.max(0, end.toEpochMilli() - startedAt.toEpochMilli());
    }
}
