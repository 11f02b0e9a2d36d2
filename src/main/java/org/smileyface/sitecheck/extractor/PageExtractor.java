package org.smileyface.sitecheck.extractor;

import org.smileyface.sitecheck.model.FetchedPage;
import org.smileyface.sitecheck.model.PageSignal;

/**
 * Extracts one category of signals from a fetched page. Implementations must not
 * throw for malformed markup; a signal that cannot be read keeps its default value.
 */
@FunctionalInterface
public interface PageExtractor {

    /**
     * Reads signals from {@code page} and records them on {@code signal}.
     *
     * @param page   the accepted page, with its parsed document
     * @param signal the builder collecting the page's signals
     */
    void extract(FetchedPage page, PageSignal.Builder signal);
}
