package org.smileyface.sitecheck.model;

import org.jsoup.nodes.Document;

import java.util.Objects;

/**
 * A page body accepted by the fetcher, ready for signal extraction.
 *
 * @param url      final URL after redirects
 * @param markup   raw markup truncated to the configured ceiling
 * @param pageSize size of the full response body in bytes
 * @param document jsoup document parsed from {@code markup} with {@code url} as base URI
 */
public record FetchedPage(String url, String markup, long pageSize, Document document) {

    public FetchedPage {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(markup, "markup");
        Objects.requireNonNull(document, "document");
    }
}
