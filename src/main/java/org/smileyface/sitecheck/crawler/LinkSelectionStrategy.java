package org.smileyface.sitecheck.crawler;

import org.smileyface.sitecheck.model.LinkCandidate;
import org.smileyface.sitecheck.model.PageSignal;

import java.util.List;

/**
 * Chooses which of the homepage's internal links are worth fetching.
 */
public interface LinkSelectionStrategy {

    /**
     * @return the strategy this implementation provides
     */
    CrawlStrategy strategy();

    /**
     * Selects the subpages to fetch.
     *
     * @param internalLinks distinct internal links of the homepage, in discovery order
     * @param homepage      the fetched homepage
     * @return the selected candidates, at most the strategy's page budget
     */
    List<LinkCandidate> select(List<String> internalLinks, PageSignal homepage);
}
