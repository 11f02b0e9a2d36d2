package org.smileyface.sitecheck.crawler;

import java.util.Locale;

/**
 * How subpages are picked from the homepage's internal links.
 */
public enum CrawlStrategy {
    /** Keyword-weighted ranking of every internal link; the nine best are fetched. */
    BROAD,

    /** One link per named priority bucket, topped up from navigation links; four are fetched. */
    TARGETED;

    /**
     * Parses a strategy name case-insensitively; null or blank means {@link #BROAD}.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static CrawlStrategy fromValue(String value) {
        if (value == null || value.isBlank()) return BROAD;
        try {
            return CrawlStrategy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown crawl strategy: " + value);
        }
    }
}
