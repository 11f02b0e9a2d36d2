package org.smileyface.sitecheck.extractor;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.smileyface.sitecheck.crawler.CrawlerProperties;
import org.smileyface.sitecheck.model.FetchedPage;
import org.smileyface.sitecheck.model.PageSignal;
import org.smileyface.sitecheck.util.CrawlerUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

/**
 * Builds a {@link PageSignal} from a page body by running every configured {@link PageExtractor}
 * over one parsed document. The markup is cut to the configured ceiling before it is parsed.
 */
@Component
public class SignalExtractor {

    private final List<PageExtractor> extractors;
    private final int markupLimit;

    public SignalExtractor(List<PageExtractor> extractors, int markupLimit) {
        this.extractors = List.copyOf(Objects.requireNonNull(extractors, "extractors"));
        this.markupLimit = markupLimit;
    }

    /**
     * Spring-enabled constructor: wires the standard extractor set from the crawler properties.
     */
    @Autowired
    public SignalExtractor(CrawlerProperties properties, ObjectMapper mapper) {
        this(defaultExtractors(properties, mapper), properties.getMarkupLimit());
    }

    public static List<PageExtractor> defaultExtractors(CrawlerProperties properties, ObjectMapper mapper) {
        return List.of(
                new MetadataExtractor(),
                new StructuredDataExtractor(mapper),
                new HeadingExtractor(),
                new InternalLinkCountExtractor(),
                ContentSignalExtractor.fromTable(properties.getContentSignals()),
                new ResourceCountExtractor(),
                new CopyrightYearExtractor(),
                new TextContentExtractor(properties.getTextContentLimit()));
    }

    /**
     * Extracts every signal of one page.
     *
     * @param url      final URL of the page, used as base URI for relative links
     * @param body     the full response body (may be null)
     * @param pageSize size of the full body in bytes
     * @return the immutable signal record
     */
    public PageSignal extract(String url, String body, long pageSize) {
        String markup = CrawlerUtils.truncate(body, markupLimit);
        Document doc = Jsoup.parse(markup, url);
        FetchedPage page = new FetchedPage(url, markup, pageSize, doc);

        PageSignal.Builder signal = PageSignal.builder(url)
                .html(markup)
                .pageSize(pageSize);
        for (PageExtractor extractor : extractors) {
            extractor.extract(page, signal);
        }
        return signal.build();
    }
}
