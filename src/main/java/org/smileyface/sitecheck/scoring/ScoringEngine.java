package org.smileyface.sitecheck.scoring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.sitecheck.model.CrawlResult;
import org.smileyface.sitecheck.model.HeadingStructure;
import org.smileyface.sitecheck.model.SiteProfile;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Scores a successful crawl in four categories of 25 points each.
 * <p>
 * Every tier boundary is a hard threshold; there is no interpolation between tiers. Site-wide
 * criteria read the {@link SiteProfile}; page-level criteria read the flattened homepage fields of
 * the {@link CrawlResult}.
 */
@Component
public class ScoringEngine {

    private static final Logger log = LoggerFactory.getLogger(ScoringEngine.class);

    private final Clock clock;

    public ScoringEngine(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @throws IllegalArgumentException when the crawl did not succeed
     */
    public SiteScore score(CrawlResult crawl) {
        if (crawl == null || !crawl.isSuccess() || crawl.getSiteProfile() == null) {
            throw new IllegalArgumentException("Only a successful crawl can be scored");
        }
        SiteProfile sp = crawl.getSiteProfile();
        SiteScore score = SiteScore.of(
                scoreContent(crawl, sp),
                scoreTrust(sp),
                scoreAiReadiness(crawl, sp),
                scoreTechnical(crawl, sp));
        log.debug("Scored {}: total={}", crawl.getFinalUrl(), score.totalScore());
        return score;
    }

    ScoreCategory scoreContent(CrawlResult crawl, SiteProfile sp) {
        int serviceClarity = 0;
        if (sp.hasService() || sp.hasPricing()) serviceClarity += 3;
        if (length(crawl.getTitle()) >= 10) serviceClarity += 2;
        if (length(crawl.getMetaDescription()) >= 50) serviceClarity += 2;

        long totalLength = sp.totalContentLength() > 0 ? sp.totalContentLength() : crawl.getContentLength();
        int contentDepth;
        if (totalLength > 20_000) contentDepth = 6;
        else if (totalLength > 10_000) contentDepth = 4;
        else if (totalLength > 5_000) contentDepth = 2;
        else if (totalLength > 2_000) contentDepth = 1;
        else contentDepth = 0;

        int typeCount = sp.pageTypes().size();
        int diversity;
        if (typeCount >= 6) diversity = 6;
        else if (typeCount >= 4) diversity = 4;
        else if (typeCount >= 3) diversity = 3;
        else if (typeCount >= 2) diversity = 1;
        else diversity = 0;

        return ScoreCategory.builder("コンテンツの充実度")
                .add("serviceClarity", serviceClarity, 7, "サービス説明")
                .add("contentDepth", contentDepth, 6, "情報量")
                .add("diversity", diversity, 6, "ページの多様性")
                .add("faq", sp.hasFaq() ? 3 : 0, 3, "FAQ・Q&A")
                .add("pricing", sp.hasPricing() ? 3 : 0, 3, "料金情報")
                .build();
    }

    ScoreCategory scoreTrust(SiteProfile sp) {
        int testimonials = 0;
        if (sp.hasTestimonials()) {
            testimonials += 5;
            if (sp.testimonialPageCount() >= 2) testimonials += 3;
        }

        int company = 0;
        if (sp.hasCompanyInfo()) {
            company += 3;
            if (sp.hasAddress()) company += 2;
            if (sp.hasPhone()) company += 1;
        }

        int freshContent = 0;
        if (sp.hasBlog()) {
            freshContent += 2;
            if (sp.blogPostCount() >= 3) freshContent += 1;
        }

        return ScoreCategory.builder("信頼性・実績")
                .add("testimonials", testimonials, 8, "お客様の声・実績")
                .add("company", company, 6, "会社概要")
                .add("legal", sp.hasPrivacyPolicy() ? 4 : 0, 4, "プライバシーポリシー")
                .add("contact", sp.hasContact() ? 4 : 0, 4, "問い合わせ窓口")
                .add("freshContent", freshContent, 3, "更新コンテンツ")
                .build();
    }

    ScoreCategory scoreAiReadiness(CrawlResult crawl, SiteProfile sp) {
        int structured = 0;
        if (crawl.hasJsonLd()) {
            structured += 3;
            List<String> types = crawl.getJsonLdTypes();
            if (types.contains("Organization") || types.contains("LocalBusiness")) structured += 2;
            if (types.contains("FAQPage")) structured += 2;
            if (types.contains("Service") || types.contains("Product")) structured += 1;
        }

        HeadingStructure hs = crawl.getHeadingStructure() != null ? crawl.getHeadingStructure() : HeadingStructure.EMPTY;
        int headings = 0;
        if (hs.h1() >= 1) headings += 2;
        if (hs.h2() >= 3) headings += 2;
        else if (hs.h2() >= 1) headings += 1;
        if (hs.h3() >= 2) headings += 1;

        int clarity = 0;
        if (sp.hasAddress()) clarity += 2;
        if (sp.hasPhone()) clarity += 1;
        if (sp.hasPricing()) clarity += 2;

        int links = crawl.getInternalLinks();
        int linking;
        if (links >= 15) linking = 4;
        else if (links >= 8) linking = 3;
        else if (links >= 3) linking = 1;
        else linking = 0;

        int meta = 0;
        if (crawl.hasCanonical()) meta += 2;
        if (length(crawl.getMetaDescription()) >= 30) meta += 1;

        return ScoreCategory.builder("AI検索最適化")
                .add("structured", structured, 8, "構造化データ")
                .add("headings", headings, 5, "見出し構造")
                .add("clarity", clarity, 5, "情報の明確さ")
                .add("linking", linking, 4, "内部リンク")
                .add("meta", meta, 3, "メタ情報")
                .build();
    }

    ScoreCategory scoreTechnical(CrawlResult crawl, SiteProfile sp) {
        long size = crawl.getPageSize();
        int speed;
        if (size < 150_000) speed = 3;
        else if (size < 300_000) speed = 2;
        else if (size < 500_000) speed = 1;
        else speed = 0;
        if (crawl.getScriptCount() <= 5) speed += 1;
        if (crawl.getImageCount() <= 15) speed += 1;

        int accessibility;
        if (crawl.getImageCount() == 0) {
            accessibility = 3;
        } else {
            double ratio = crawl.getAltTextRatio();
            if (ratio >= 0.9) accessibility = 5;
            else if (ratio >= 0.7) accessibility = 3;
            else if (ratio >= 0.4) accessibility = 2;
            else accessibility = 0;
        }

        int freshness = 0;
        Integer year = crawl.getCopyrightYear();
        if (year != null) {
            int currentYear = LocalDate.now(clock).getYear();
            if (year >= currentYear) freshness += 3;
            else if (year >= currentYear - 1) freshness += 2;
            else if (year >= currentYear - 2) freshness += 1;
        }
        if (sp.hasBlog()) freshness += 2;

        return ScoreCategory.builder("技術品質")
                .add("security", crawl.isHttps() ? 5 : 0, 5, "HTTPS")
                .add("mobile", crawl.hasViewport() ? 5 : 0, 5, "モバイル対応")
                .add("speed", speed, 5, "表示速度")
                .add("accessibility", accessibility, 5, "画像の説明文")
                .add("freshness", freshness, 5, "更新性")
                .build();
    }

    private static int length(String s) {
        return s == null ? 0 : s.length();
    }
}
