package org.smileyface.sitecheck.crawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.sitecheck.model.LinkCandidate;
import org.smileyface.sitecheck.model.PageSignal;
import org.smileyface.sitecheck.util.CrawlerUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Picks at most one link per named priority bucket, in bucket order, then fills the remaining
 * slots with navigation links in document order.
 * <p>
 * Bucket patterns are matched as substrings of the lower-cased, percent-decoded link, so both
 * path fragments ("/about") and words in the path ("会社概要") can be used.
 */
@Component
public class TargetedLinkSelector implements LinkSelectionStrategy {

    private static final Logger log = LoggerFactory.getLogger(TargetedLinkSelector.class);

    private final List<PriorityBucket> buckets;
    private final String fallbackLabel;
    private final int pageLimit;
    private final LinkExtractor linkExtractor;

    public TargetedLinkSelector(List<PriorityBucket> buckets, String fallbackLabel, int pageLimit,
                                LinkExtractor linkExtractor) {
        this.buckets = List.copyOf(buckets);
        this.fallbackLabel = Objects.requireNonNull(fallbackLabel, "fallbackLabel");
        this.pageLimit = Math.max(0, pageLimit);
        this.linkExtractor = Objects.requireNonNull(linkExtractor, "linkExtractor");
    }

    @Autowired
    public TargetedLinkSelector(CrawlerProperties properties, LinkExtractor linkExtractor) {
        this(fromConfig(properties.getPriorityBuckets()), properties.getNavigationFallbackLabel(),
                properties.getTargetedPageLimit(), linkExtractor);
    }

    static List<PriorityBucket> fromConfig(List<CrawlerProperties.PriorityBucketConfig> config) {
        List<PriorityBucket> out = new ArrayList<>();
        if (config == null) return out;
        for (CrawlerProperties.PriorityBucketConfig c : config) {
            if (c == null || c.label == null || c.patterns == null) continue;
            List<String> patterns = c.patterns.stream()
                    .filter(p -> p != null && !p.isBlank())
                    .map(p -> p.toLowerCase(Locale.ROOT))
                    .toList();
            out.add(new PriorityBucket(c.label, patterns));
        }
        return out;
    }

    @Override
    public CrawlStrategy strategy() {
        return CrawlStrategy.TARGETED;
    }

    @Override
    public List<LinkCandidate> select(List<String> internalLinks, PageSignal homepage) {
        List<LinkCandidate> selected = new ArrayList<>(pageLimit);
        Set<String> used = new HashSet<>();

        for (PriorityBucket bucket : buckets) {
            if (selected.size() >= pageLimit) break;
            for (String link : internalLinks) {
                if (used.contains(link)) continue;
                if (bucket.matches(link)) {
                    selected.add(LinkCandidate.labelled(link, bucket.label()));
                    used.add(link);
                    break;
                }
            }
        }

        if (selected.size() < pageLimit) {
            List<String> navLinks = linkExtractor.extractNavigationLinks(homepage.getHtml(), homepage.getUrl());
            for (String link : navLinks) {
                if (selected.size() >= pageLimit) break;
                if (!used.add(link)) continue;
                selected.add(LinkCandidate.labelled(link, fallbackLabel));
            }
            log.debug("Filled {} slot(s) from {} navigation link(s) of {}", selected.size(), navLinks.size(), homepage.getUrl());
        }
        return selected;
    }

    public record PriorityBucket(String label, List<String> patterns) {

        public PriorityBucket {
            Objects.requireNonNull(label, "label");
            patterns = List.copyOf(patterns);
        }

        boolean matches(String link) {
            String lower = link.toLowerCase(Locale.ROOT);
            String decoded = CrawlerUtils.decodeQuietly(link).toLowerCase(Locale.ROOT);
            for (String p : patterns) {
                if (lower.contains(p) || decoded.contains(p)) return true;
            }
            return false;
        }
    }
}
