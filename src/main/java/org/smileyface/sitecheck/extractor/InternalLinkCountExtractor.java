package org.smileyface.sitecheck.extractor;

import org.jsoup.nodes.Element;
import org.smileyface.sitecheck.model.FetchedPage;
import org.smileyface.sitecheck.model.PageSignal;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Counts anchors pointing at the page's own host. Anchors whose href is empty or carries a
 * fragment are ignored; an href that cannot be resolved is a relative link and counts as internal.
 */
public final class InternalLinkCountExtractor implements PageExtractor {

    @Override
    public void extract(FetchedPage page, PageSignal.Builder signal) {
        signal.internalLinks(countInternalLinks(page));
    }

    static int countInternalLinks(FetchedPage page) {
        URI base;
        try {
            base = new URI(page.url());
        } catch (URISyntaxException e) {
            return 0;
        }
        String host = base.getHost();
        int internal = 0;
        for (Element a : page.document().select("a[href]")) {
            String href = a.attr("href").trim();
            if (href.isEmpty() || href.contains("#")) continue;
            try {
                URI resolved = base.resolve(new URI(href));
                if (host != null && host.equalsIgnoreCase(resolved.getHost())) internal++;
            } catch (URISyntaxException | IllegalArgumentException e) {
                internal++;
            }
        }
        return internal;
    }
}
