package org.smileyface.sitecheck.crawler;

import org.smileyface.sitecheck.model.LinkCandidate;
import org.smileyface.sitecheck.model.PageSignal;
import org.smileyface.sitecheck.util.CrawlerUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Ranks links by an ordered keyword → weight table.
 * <p>
 * The first keyword (in table order) found in a link's lower-cased path decides its weight;
 * links matching no keyword get the default weight. Sorting is stable, so links of equal
 * weight keep their discovery order.
 */
@Component
public class BroadLinkPrioritizer implements LinkSelectionStrategy {

    private final List<KeywordWeight> weights;
    private final int defaultWeight;
    private final int pageLimit;

    public BroadLinkPrioritizer(List<KeywordWeight> weights, int defaultWeight, int pageLimit) {
        this.weights = List.copyOf(weights);
        this.defaultWeight = defaultWeight;
        this.pageLimit = Math.max(0, pageLimit);
    }

    @Autowired
    public BroadLinkPrioritizer(CrawlerProperties properties) {
        this(fromConfig(properties.getLinkWeights()), properties.getDefaultLinkWeight(), properties.getBroadPageLimit());
    }

    static List<KeywordWeight> fromConfig(List<CrawlerProperties.LinkWeightConfig> config) {
        List<KeywordWeight> out = new ArrayList<>();
        if (config == null) return out;
        for (CrawlerProperties.LinkWeightConfig c : config) {
            if (c == null || c.keyword == null || c.keyword.isBlank()) continue;
            out.add(new KeywordWeight(c.keyword.trim().toLowerCase(Locale.ROOT), c.weight));
        }
        return out;
    }

    @Override
    public CrawlStrategy strategy() {
        return CrawlStrategy.BROAD;
    }

    @Override
    public List<LinkCandidate> select(List<String> internalLinks, PageSignal homepage) {
        List<LinkCandidate> ranked = prioritize(internalLinks);
        return ranked.size() > pageLimit ? List.copyOf(ranked.subList(0, pageLimit)) : ranked;
    }

    /**
     * Weighs every link and sorts by weight, highest first; ties keep their input order.
     */
    public List<LinkCandidate> prioritize(List<String> links) {
        List<LinkCandidate> out = new ArrayList<>(links.size());
        for (String url : links) {
            out.add(LinkCandidate.weighted(url, weightOf(url)));
        }
        // List.sort is a stable merge sort
        out.sort(Comparator.comparingInt(LinkCandidate::weight).reversed());
        return out;
    }

    public int weightOf(String url) {
        String path = CrawlerUtils.lowerCasePath(url);
        for (KeywordWeight kw : weights) {
            if (path.contains(kw.keyword())) return kw.weight();
        }
        return defaultWeight;
    }

    public record KeywordWeight(String keyword, int weight) {
    }
}
