package org.smileyface.sitecheck.extractor;

import org.smileyface.sitecheck.model.FetchedPage;
import org.smileyface.sitecheck.model.PageSignal;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * First four-digit year following a "©" sign or the word "copyright" in the markup. When the raw
 * markup has none (the sign is usually written as {@code &copy;}), the decoded page text is searched.
 */
public final class CopyrightYearExtractor implements PageExtractor {

    static final Pattern COPYRIGHT = Pattern.compile("©\\s*(\\d{4})|copyright\\s*(\\d{4})", Pattern.CASE_INSENSITIVE);

    @Override
    public void extract(FetchedPage page, PageSignal.Builder signal) {
        Integer year = copyrightYear(page.markup());
        if (year == null) {
            year = copyrightYear(page.document().text());
        }
        signal.copyrightYear(year);
    }

    static Integer copyrightYear(String markup) {
        Matcher m = COPYRIGHT.matcher(markup);
        if (!m.find()) return null;
        String year = m.group(1) != null ? m.group(1) : m.group(2);
        return Integer.valueOf(year);
    }
}
