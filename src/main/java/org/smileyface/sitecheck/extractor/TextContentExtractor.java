package org.smileyface.sitecheck.extractor;

import org.smileyface.sitecheck.model.FetchedPage;
import org.smileyface.sitecheck.model.PageSignal;

/**
 * Visible text with scripts and styles removed and whitespace collapsed. The full length is
 * recorded; the text itself is cut to {@code maxChars}.
 */
public final class TextContentExtractor implements PageExtractor {

    private final int maxChars;

    public TextContentExtractor(int maxChars) {
        if (maxChars <= 0) {
            throw new IllegalArgumentException("maxChars must be positive: " + maxChars);
        }
        this.maxChars = maxChars;
    }

    @Override
    public void extract(FetchedPage page, PageSignal.Builder signal) {
        // script and style bodies are data nodes and never part of text()
        String text = page.document().text().trim();
        signal.contentLength(text.length());
        signal.textContent(text.length() > maxChars ? text.substring(0, maxChars) : text);
    }
}
