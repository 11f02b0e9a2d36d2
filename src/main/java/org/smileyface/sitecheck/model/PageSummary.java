package org.smileyface.sitecheck.model;

import java.util.List;

/**
 * Trimmed view of a classified page as handed to downstream consumers.
 */
public record PageSummary(String url,
                          PageCategory type,
                          String title,
                          int contentLength,
                          List<HeadingText> headingsText,
                          String textContent) {

    static final int MAX_HEADINGS = 10;
    static final int MAX_TEXT = 2000;

    public static PageSummary of(ClassifiedPage page) {
        PageSignal s = page.signal();
        List<HeadingText> headings = s.getHeadingsText();
        String text = s.getTextContent();
        return new PageSummary(
                s.getUrl(),
                page.category(),
                s.getTitle(),
                s.getContentLength(),
                List.copyOf(headings.subList(0, Math.min(MAX_HEADINGS, headings.size()))),
                text.length() > MAX_TEXT ? text.substring(0, MAX_TEXT) : text);
    }
}
