package org.smileyface.sitecheck.scoring;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.smileyface.sitecheck.classifier.PageClassifier;
import org.smileyface.sitecheck.crawler.CrawlerProperties;
import org.smileyface.sitecheck.extractor.SignalExtractor;
import org.smileyface.sitecheck.model.ClassifiedPage;
import org.smileyface.sitecheck.model.CrawlResult;
import org.smileyface.sitecheck.model.HeadingStructure;
import org.smileyface.sitecheck.model.PageCategory;
import org.smileyface.sitecheck.model.PageSignal;
import org.smileyface.sitecheck.model.SiteProfile;
import org.smileyface.sitecheck.profile.SiteProfileBuilder;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ScoringEngineTest {

    private static final Clock MID_2026 = Clock.fixed(Instant.parse("2026-06-15T00:00:00Z"), ZoneOffset.UTC);

    private final ScoringEngine engine = new ScoringEngine(MID_2026);

    /**
     * Mutable stand-in for the sixteen {@link SiteProfile} components.
     */
    private static final class Profile {
        boolean testimonials, faq, company, privacy, pricing, contact, blog, service, address, phone;
        long totalContentLength;
        int testimonialPages, blogPosts;
        List<String> pageTypes = new ArrayList<>(List.of("other"));

        SiteProfile build() {
            return new SiteProfile(testimonials, faq, company, privacy, pricing, contact, blog, service,
                    address, phone, totalContentLength, 0, 0.0, blogPosts, testimonialPages, pageTypes);
        }
    }

    private static PageSignal.Builder home() {
        return PageSignal.builder("https://example.com/");
    }

    private static CrawlResult crawl(PageSignal.Builder homepage, Profile profile) {
        PageSignal page = homepage.build();
        return CrawlResult.success(page, List.of(new ClassifiedPage(page, PageCategory.OTHER)),
                profile.build(), page.getJsonLdTypes());
    }

    private static CrawlResult crawl(PageSignal.Builder homepage) {
        return crawl(homepage, new Profile());
    }

    @Test
    void score_rejectsFailedCrawl() {
        assertThatThrownBy(() -> engine.score(CrawlResult.failure("x")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void score_categoriesHaveFixedMaximaAndSumToTotal() {
        SiteScore score = engine.score(crawl(home()));

        SiteScore.Categories c = score.categories();
        assertThat(List.of(c.content(), c.trust(), c.aiReadiness(), c.technical()))
                .allSatisfy(cat -> assertThat(cat.maxScore()).isEqualTo(25));
        assertThat(score.totalScore())
                .isEqualTo(c.content().total() + c.trust().total() + c.aiReadiness().total() + c.technical().total());
        assertThat(c.content().label()).isEqualTo("コンテンツの充実度");
        assertThat(c.content().details().keySet())
                .containsExactly("serviceClarity", "contentDepth", "diversity", "faq", "pricing");
        assertThat(c.technical().details().keySet())
                .containsExactly("security", "mobile", "speed", "accessibility", "freshness");
    }

    @ParameterizedTest(name = "total text {0} -> {1}")
    @CsvSource({"0, 0", "2000, 0", "2001, 1", "5000, 1", "5001, 2", "10000, 2", "10001, 4", "20000, 4", "20001, 6"})
    void contentDepthTiers(long totalLength, int expected) {
        Profile p = new Profile();
        p.totalContentLength = totalLength;
        assertThat(engine.score(crawl(home(), p)).categories().content().detail("contentDepth").score())
                .isEqualTo(expected);
    }

    @Test
    void contentDepthFallsBackToHomepageLength() {
        Profile p = new Profile();
        p.totalContentLength = 0;
        assertThat(engine.score(crawl(home().contentLength(6000), p)).categories().content().detail("contentDepth").score())
                .isEqualTo(2);
    }

    @ParameterizedTest(name = "{0} page types -> {1}")
    @CsvSource({"1, 0", "2, 1", "3, 3", "4, 4", "5, 4", "6, 6", "10, 6"})
    void diversityTiers(int typeCount, int expected) {
        Profile p = new Profile();
        p.pageTypes = new ArrayList<>();
        for (int i = 0; i < typeCount; i++) p.pageTypes.add("type" + i);
        assertThat(engine.score(crawl(home(), p)).categories().content().detail("diversity").score())
                .isEqualTo(expected);
    }

    @Test
    void serviceClarityThresholds() {
        Profile p = new Profile();
        p.service = true;
        CrawlResult justUnder = crawl(home().title("123456789").metaDescription("d".repeat(49)), p);
        CrawlResult atThreshold = crawl(home().title("1234567890").metaDescription("d".repeat(50)), p);

        assertThat(engine.score(justUnder).categories().content().detail("serviceClarity").score()).isEqualTo(3);
        assertThat(engine.score(atThreshold).categories().content().detail("serviceClarity").score()).isEqualTo(7);
    }

    @Test
    void trustCategory() {
        Profile p = new Profile();
        p.testimonials = true;
        p.testimonialPages = 2;
        p.company = true;
        p.address = true;
        p.privacy = true;
        p.blog = true;
        p.blogPosts = 2;

        ScoreCategory trust = engine.score(crawl(home(), p)).categories().trust();

        assertThat(trust.detail("testimonials").score()).isEqualTo(8);
        assertThat(trust.detail("company").score()).isEqualTo(5);
        assertThat(trust.detail("legal").score()).isEqualTo(4);
        assertThat(trust.detail("contact").score()).isZero();
        assertThat(trust.detail("freshContent").score()).isEqualTo(2);
        assertThat(trust.total()).isEqualTo(19);
    }

    @Test
    void trustCompanyBonusesNeedCompanyInfo() {
        Profile p = new Profile();
        p.address = true;
        p.phone = true;
        p.blogPosts = 5;

        ScoreCategory trust = engine.score(crawl(home(), p)).categories().trust();

        assertThat(trust.detail("company").score()).isZero();
        assertThat(trust.detail("freshContent").score()).isZero();
    }

    @Test
    void structuredDataPoints() {
        CrawlResult none = crawl(home());
        CrawlResult untyped = crawl(home().hasJsonLd(true));
        CrawlResult full = crawl(home().hasJsonLd(true)
                .addJsonLdType("LocalBusiness").addJsonLdType("FAQPage").addJsonLdType("Product"));

        assertThat(engine.score(none).categories().aiReadiness().detail("structured").score()).isZero();
        assertThat(engine.score(untyped).categories().aiReadiness().detail("structured").score()).isEqualTo(3);
        assertThat(engine.score(full).categories().aiReadiness().detail("structured").score()).isEqualTo(8);
    }

    @ParameterizedTest(name = "h1={0} h2={1} h3={2} -> {3}")
    @CsvSource({"0, 0, 0, 0", "1, 0, 0, 2", "1, 1, 1, 3", "1, 2, 2, 4", "1, 3, 2, 5", "2, 5, 1, 4"})
    void headingPoints(int h1, int h2, int h3, int expected) {
        CrawlResult c = crawl(home().headingStructure(new HeadingStructure(h1, h2, h3)));
        assertThat(engine.score(c).categories().aiReadiness().detail("headings").score()).isEqualTo(expected);
    }

    @ParameterizedTest(name = "{0} internal links -> {1}")
    @CsvSource({"0, 0", "2, 0", "3, 1", "7, 1", "8, 3", "14, 3", "15, 4", "100, 4"})
    void linkingTiers(int links, int expected) {
        CrawlResult c = crawl(home().internalLinks(links));
        assertThat(engine.score(c).categories().aiReadiness().detail("linking").score()).isEqualTo(expected);
    }

    @Test
    void clarityAndMeta() {
        Profile p = new Profile();
        p.address = true;
        p.phone = true;
        p.pricing = true;

        ScoreCategory ai = engine.score(crawl(home().hasCanonical(true).metaDescription("m".repeat(30)), p))
                .categories().aiReadiness();

        assertThat(ai.detail("clarity").score()).isEqualTo(5);
        assertThat(ai.detail("meta").score()).isEqualTo(3);
    }

    @ParameterizedTest(name = "{0} bytes, {1} scripts, {2} images -> {3}")
    @CsvSource({
            "149999, 5, 15, 5",
            "150000, 5, 15, 4",
            "299999, 6, 15, 3",
            "300000, 6, 16, 1",
            "499999, 0, 0, 3",
            "500000, 0, 0, 2",
            "900000, 9, 99, 0"
    })
    void speedTiers(long pageSize, int scripts, int images, int expected) {
        CrawlResult c = crawl(home().pageSize(pageSize).scriptCount(scripts).imageCount(images));
        assertThat(engine.score(c).categories().technical().detail("speed").score()).isEqualTo(expected);
    }

    @ParameterizedTest(name = "{0} images, alt ratio {1} -> {2}")
    @CsvSource({"0, 1.0, 3", "10, 1.0, 5", "10, 0.9, 5", "10, 0.89, 3", "10, 0.7, 3", "10, 0.4, 2", "10, 0.39, 0", "10, 0.0, 0"})
    void accessibilityTiers(int images, double ratio, int expected) {
        CrawlResult c = crawl(home().imageCount(images).altTextRatio(ratio));
        assertThat(engine.score(c).categories().technical().detail("accessibility").score()).isEqualTo(expected);
    }

    @ParameterizedTest(name = "copyright {0}, blog {1} -> {2}")
    @CsvSource({"2027, false, 3", "2026, false, 3", "2025, false, 2", "2024, false, 1", "2023, false, 0",
            ", false, 0", ", true, 2", "2026, true, 5"})
    void freshnessTiers(Integer year, boolean blog, int expected) {
        Profile p = new Profile();
        p.blog = blog;
        CrawlResult c = crawl(home().copyrightYear(year), p);
        assertThat(engine.score(c).categories().technical().detail("freshness").score()).isEqualTo(expected);
    }

    @Test
    void securityAndMobile() {
        ScoreCategory t = engine.score(crawl(home().https(true).hasViewport(true))).categories().technical();
        assertThat(t.detail("security").score()).isEqualTo(5);
        assertThat(t.detail("mobile").score()).isEqualTo(5);

        ScoreCategory none = engine.score(crawl(home())).categories().technical();
        assertThat(none.detail("security").score()).isZero();
        assertThat(none.detail("mobile").score()).isZero();
    }

    @Test
    void score_homepageFixtureEndToEnd() throws Exception {
        String html;
        try (var is = getClass().getResourceAsStream("/fixtures/homepage.html")) {
            assertThat(is).isNotNull();
            html = new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
        CrawlerProperties props = new CrawlerProperties();
        PageSignal homepage = new SignalExtractor(props, new ObjectMapper())
                .extract("https://example.co.jp/", html, html.getBytes(StandardCharsets.UTF_8).length);
        List<ClassifiedPage> pages = List.of(new PageClassifier(props).classify(homepage));
        SiteProfileBuilder profiles = new SiteProfileBuilder();
        CrawlResult crawl = CrawlResult.success(homepage, pages, profiles.build(pages), profiles.jsonLdTypes(pages));

        SiteScore score = engine.score(crawl);

        ScoreCategory content = score.categories().content();
        ScoreCategory ai = score.categories().aiReadiness();
        assertThat(content.detail("serviceClarity")).isEqualTo(new SubScore(7, 7, "サービス説明"));
        assertThat(content.detail("faq").score()).isEqualTo(3);
        assertThat(content.detail("pricing").score()).isEqualTo(3);
        assertThat(ai.detail("structured")).isEqualTo(new SubScore(5, 8, "構造化データ"));
        assertThat(ai.detail("headings").score()).isEqualTo(5);
        assertThat(ai.detail("meta").score()).isEqualTo(3);
        assertThat(score.categories().technical().detail("freshness").score()).isEqualTo(3);
        assertThat(score.categories().technical().detail("accessibility").score()).isEqualTo(2);
    }

    @Test
    void subScore_rejectsOutOfRange() {
        assertThatThrownBy(() -> new SubScore(6, 5, "x")).isInstanceOf(IllegalArgumentException.class);
    }
}
