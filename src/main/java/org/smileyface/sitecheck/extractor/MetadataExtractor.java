package org.smileyface.sitecheck.extractor;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.smileyface.sitecheck.model.FetchedPage;
import org.smileyface.sitecheck.model.PageSignal;

/**
 * Title, meta description, viewport and canonical tags, and the page scheme.
 * <p>
 * Attribute values are matched case-insensitively and attribute order does not matter,
 * so {@code <meta content="..." name="Description">} is read like the usual order.
 */
public final class MetadataExtractor implements PageExtractor {

    @Override
    public void extract(FetchedPage page, PageSignal.Builder signal) {
        Document doc = page.document();
        signal.title(title(doc));
        signal.metaDescription(metaDescription(doc));
        signal.hasViewport(doc.selectFirst("meta[name=viewport]") != null);
        signal.hasCanonical(doc.selectFirst("link[rel=canonical]") != null);
        signal.https(page.url().startsWith("https://"));
    }

    /**
     * @return text of the first {@code <title>} element, trimmed, or "" when absent
     */
    static String title(Document doc) {
        Element title = doc.selectFirst("title");
        return title == null ? "" : title.text().trim();
    }

    /**
     * @return content of the first {@code <meta name="description">}, trimmed, or "" when absent
     */
    static String metaDescription(Document doc) {
        Element meta = doc.selectFirst("meta[name=description][content]");
        return meta == null ? "" : meta.attr("content").trim();
    }
}
