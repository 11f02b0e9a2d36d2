package org.smileyface.sitecheck.model;

/**
 * Per-page fetch status reported by the targeted crawl strategy.
 */
public record PageStatus(String url, String label, FetchStatus status) {
}
