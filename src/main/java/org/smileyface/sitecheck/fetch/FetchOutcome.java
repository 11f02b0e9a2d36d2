package org.smileyface.sitecheck.fetch;

import org.smileyface.sitecheck.model.FetchStatus;
import org.smileyface.sitecheck.model.LinkCandidate;
import org.smileyface.sitecheck.model.PageSignal;

import java.util.Objects;
import java.util.Optional;

/**
 * Result of one subpage fetch, paired with the candidate it was issued for.
 *
 * @param signal the extracted page, or null when the fetch failed
 */
public record FetchOutcome(LinkCandidate candidate, PageSignal signal, long durationMs) {

    public FetchOutcome {
        Objects.requireNonNull(candidate, "candidate");
    }

    public boolean isSuccess() {
        return signal != null;
    }

    public FetchStatus status() {
        return isSuccess() ? FetchStatus.SUCCESS : FetchStatus.FAILED;
    }

    public Optional<PageSignal> page() {
        return Optional.ofNullable(signal);
    }
}
