package org.smileyface.sitecheck.extractor;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.smileyface.sitecheck.model.FetchedPage;
import org.smileyface.sitecheck.model.PageSignal;

/**
 * Script, stylesheet and image counts, and the share of images with alt text.
 */
public final class ResourceCountExtractor implements PageExtractor {

    @Override
    public void extract(FetchedPage page, PageSignal.Builder signal) {
        Document doc = page.document();
        Elements images = doc.select("img");
        signal.scriptCount(doc.select("script").size());
        signal.stylesheetCount(doc.select("link[rel~=(?i)\\bstylesheet\\b]").size());
        signal.imageCount(images.size());
        signal.altTextRatio(altTextRatio(images));
    }

    /**
     * @return images with a non-empty alt attribute divided by all images; 1.0 when there are none
     */
    static double altTextRatio(Elements images) {
        if (images.isEmpty()) return 1.0;
        int withAlt = 0;
        for (Element img : images) {
            if (!img.attr("alt").isEmpty()) withAlt++;
        }
        return (double) withAlt / images.size();
    }
}
