package org.smileyface.sitecheck.extractor;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.smileyface.sitecheck.model.FetchedPage;
import org.smileyface.sitecheck.model.HeadingStructure;
import org.smileyface.sitecheck.model.HeadingText;
import org.smileyface.sitecheck.model.PageSignal;

/**
 * Counts h1/h2/h3 elements and keeps the first heading texts in document order.
 */
public final class HeadingExtractor implements PageExtractor {

    static final int MAX_HEADINGS = 30;
    static final int MAX_HEADING_CHARS = 150;

    @Override
    public void extract(FetchedPage page, PageSignal.Builder signal) {
        Document doc = page.document();
        signal.headingStructure(new HeadingStructure(
                doc.select("h1").size(),
                doc.select("h2").size(),
                doc.select("h3").size()));

        int kept = 0;
        for (Element h : doc.select("h1, h2, h3")) {
            if (kept >= MAX_HEADINGS) break;
            String text = h.text().trim();
            if (text.isEmpty()) continue;
            if (text.length() > MAX_HEADING_CHARS) {
                text = text.substring(0, MAX_HEADING_CHARS);
            }
            signal.addHeadingText(new HeadingText(h.normalName(), text));
            kept++;
        }
    }
}
