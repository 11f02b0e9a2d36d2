package org.smileyface.sitecheck.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.sitecheck.classifier.PageClassifier;
import org.smileyface.sitecheck.crawler.CrawlStrategy;
import org.smileyface.sitecheck.crawler.CrawlerProperties;
import org.smileyface.sitecheck.crawler.LinkExtractor;
import org.smileyface.sitecheck.crawler.LinkSelectionStrategy;
import org.smileyface.sitecheck.fetch.FetchManager;
import org.smileyface.sitecheck.fetch.FetchOutcome;
import org.smileyface.sitecheck.fetch.PageFetcher;
import org.smileyface.sitecheck.model.ClassifiedPage;
import org.smileyface.sitecheck.model.CrawlResult;
import org.smileyface.sitecheck.model.FetchStatus;
import org.smileyface.sitecheck.model.LinkCandidate;
import org.smileyface.sitecheck.model.PageSignal;
import org.smileyface.sitecheck.model.PageStatus;
import org.smileyface.sitecheck.model.SiteProfile;
import org.smileyface.sitecheck.profile.CompanyNameExtractor;
import org.smileyface.sitecheck.profile.SiteProfileBuilder;
import org.smileyface.sitecheck.scoring.ScoringEngine;
import org.smileyface.sitecheck.scoring.SiteScore;
import org.smileyface.sitecheck.util.CrawlerUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Samples a business website: fetches the homepage, picks a bounded set of subpages by the
 * requested {@link CrawlStrategy}, fetches them concurrently, classifies every page and folds the
 * result into a {@link CrawlResult}.
 * <p>
 * Only an invalid URL or an unreachable homepage fails the crawl. A failed subpage is recorded in
 * the page statuses and otherwise contributes nothing.
 */
@Service
public class CrawlerService {

    private static final Logger log = LoggerFactory.getLogger(CrawlerService.class);

    static final String INVALID_URL_MESSAGE = "URLの形式が正しくありません。例：https://example.com";
    static final String HOMEPAGE_UNREACHABLE_MESSAGE = "サイトにアクセスできませんでした。URLが正しいか確認してください。";
    static final String GENERIC_FAILURE_MESSAGE = "サイトにアクセスできませんでした。";

    private final PageFetcher pageFetcher;
    private final FetchManager fetchManager;
    private final LinkExtractor linkExtractor;
    private final Map<CrawlStrategy, LinkSelectionStrategy> strategies = new EnumMap<>(CrawlStrategy.class);
    private final PageClassifier classifier;
    private final SiteProfileBuilder profileBuilder;
    private final CompanyNameExtractor companyNameExtractor;
    private final ScoringEngine scoringEngine;
    private final String homepageLabel;

    public CrawlerService(PageFetcher pageFetcher,
                          FetchManager fetchManager,
                          LinkExtractor linkExtractor,
                          List<LinkSelectionStrategy> strategies,
                          PageClassifier classifier,
                          SiteProfileBuilder profileBuilder,
                          CompanyNameExtractor companyNameExtractor,
                          ScoringEngine scoringEngine,
                          CrawlerProperties properties) {
        this.pageFetcher = pageFetcher;
        this.fetchManager = fetchManager;
        this.linkExtractor = linkExtractor;
        for (LinkSelectionStrategy s : strategies) {
            if (this.strategies.putIfAbsent(s.strategy(), s) != null) {
                throw new IllegalArgumentException("Duplicate link selection strategy: " + s.strategy());
            }
        }
        this.classifier = classifier;
        this.profileBuilder = profileBuilder;
        this.companyNameExtractor = companyNameExtractor;
        this.scoringEngine = scoringEngine;
        this.homepageLabel = properties.getHomepageLabel();
    }

    public CrawlResult crawl(String url) {
        return crawl(url, CrawlStrategy.BROAD);
    }

    /**
     * Crawls a site with the given strategy. Never throws; every failure is reported through
     * {@link CrawlResult#failure(String)}.
     *
     * @param url      user input, possibly without a scheme
     * @param strategy how subpages are chosen; null means {@link CrawlStrategy#BROAD}
     */
    public CrawlResult crawl(String url, CrawlStrategy strategy) {
        String start = CrawlerUtils.normalizeInputUrl(url);
        if (start == null) {
            log.warn("Invalid entry URL: {}", url);
            return CrawlResult.failure(INVALID_URL_MESSAGE);
        }
        CrawlStrategy effective = strategy == null ? CrawlStrategy.BROAD : strategy;
        try {
            return doCrawl(start, effective);
        } catch (RuntimeException e) {
            log.error("Crawl of {} failed unexpectedly", start, e);
            return CrawlResult.failure(GENERIC_FAILURE_MESSAGE);
        }
    }

    /**
     * Crawls and, on success, scores the site.
     */
    public SiteCheckReport diagnose(String url, CrawlStrategy strategy) {
        CrawlResult crawl = crawl(url, strategy);
        SiteScore score = crawl.isSuccess() ? scoringEngine.score(crawl) : null;
        return new SiteCheckReport(crawl, score);
    }

    private CrawlResult doCrawl(String start, CrawlStrategy strategy) {
        long t0 = System.currentTimeMillis();
        Optional<PageSignal> fetchedHome = pageFetcher.fetch(start);
        if (fetchedHome.isEmpty()) {
            log.info("Homepage {} could not be fetched", start);
            return CrawlResult.failure(HOMEPAGE_UNREACHABLE_MESSAGE);
        }
        PageSignal homepage = fetchedHome.get();

        List<String> links = linkExtractor.extractInternalLinks(homepage.getHtml(), homepage.getUrl());
        LinkSelectionStrategy selector = strategies.get(strategy);
        if (selector == null) {
            throw new IllegalStateException("No link selection strategy registered for " + strategy);
        }
        List<LinkCandidate> selected = selector.select(links, homepage);
        log.debug("{}: {} internal link(s), {} selected by {}", start, links.size(), selected.size(), strategy);

        List<FetchOutcome> outcomes = fetchManager.fetchAll(selected);

        List<ClassifiedPage> pages = new ArrayList<>(outcomes.size() + 1);
        pages.add(classifier.classify(homepage));
        for (FetchOutcome outcome : outcomes) {
            outcome.page().ifPresent(p -> pages.add(classifier.classify(p)));
        }

        SiteProfile profile = profileBuilder.build(pages);
        CrawlResult result = CrawlResult.success(homepage, pages, profile, profileBuilder.jsonLdTypes(pages));
        result.setCompanyName(companyNameExtractor.extract(homepage));

        if (strategy == CrawlStrategy.TARGETED) {
            List<PageStatus> statuses = new ArrayList<>(outcomes.size() + 1);
            statuses.add(new PageStatus(homepage.getUrl(), homepageLabel, FetchStatus.SUCCESS));
            for (FetchOutcome outcome : outcomes) {
                statuses.add(new PageStatus(outcome.candidate().url(), outcome.candidate().label(), outcome.status()));
            }
            result.setPageStatuses(statuses);
        }

        log.info("Crawled {} with {} strategy: {} page(s) in {} ms", start, strategy, pages.size(),
                System.currentTimeMillis() - t0);
        return result;
    }
}
