package org.smileyface.sitecheck.extractor;

import org.smileyface.sitecheck.model.ContentSignal;
import org.smileyface.sitecheck.model.FetchedPage;
import org.smileyface.sitecheck.model.PageSignal;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Flags language that points at FAQ, address, price, phone, company, testimonial and
 * privacy content. Patterns are matched case-insensitively against the raw markup.
 */
public final class ContentSignalExtractor implements PageExtractor {

    private final Map<ContentSignal, Pattern> patterns;

    public ContentSignalExtractor(Map<ContentSignal, Pattern> patterns) {
        this.patterns = new EnumMap<>(Objects.requireNonNull(patterns, "patterns"));
    }

    /**
     * Compiles a {signal key → regex} table such as the one found in the rules file.
     *
     * @throws IllegalArgumentException for an unknown signal key or an invalid regex
     */
    public static ContentSignalExtractor fromTable(Map<String, String> table) {
        Map<ContentSignal, Pattern> compiled = new EnumMap<>(ContentSignal.class);
        if (table != null) {
            for (Map.Entry<String, String> e : table.entrySet()) {
                if (e.getValue() == null || e.getValue().isBlank()) continue;
                compiled.put(ContentSignal.fromKey(e.getKey()),
                        Pattern.compile(e.getValue(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
            }
        }
        return new ContentSignalExtractor(compiled);
    }

    @Override
    public void extract(FetchedPage page, PageSignal.Builder signal) {
        String markup = page.markup();
        for (Map.Entry<ContentSignal, Pattern> e : patterns.entrySet()) {
            if (e.getValue().matcher(markup).find()) {
                signal.signal(e.getKey());
            }
        }
    }
}
