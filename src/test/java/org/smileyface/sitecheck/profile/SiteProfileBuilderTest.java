package org.smileyface.sitecheck.profile;

import org.junit.jupiter.api.Test;
import org.smileyface.sitecheck.model.ClassifiedPage;
import org.smileyface.sitecheck.model.ContentSignal;
import org.smileyface.sitecheck.model.PageCategory;
import org.smileyface.sitecheck.model.PageSignal;
import org.smileyface.sitecheck.model.SiteProfile;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SiteProfileBuilderTest {

    private final SiteProfileBuilder builder = new SiteProfileBuilder();

    private static ClassifiedPage page(PageCategory category, PageSignal.Builder b) {
        return new ClassifiedPage(b.build(), category);
    }

    private static PageSignal.Builder signal(String path) {
        return PageSignal.builder("https://example.com" + path);
    }

    @Test
    void build_aggregatesFlagsFromCategoriesAndSignals() {
        List<ClassifiedPage> pages = List.of(
                page(PageCategory.OTHER, signal("/")
                        .signal(ContentSignal.FAQ)
                        .signal(ContentSignal.PHONE)
                        .contentLength(1200)
                        .imageCount(4).altTextRatio(0.5)),
                page(PageCategory.TESTIMONIALS, signal("/voice")
                        .contentLength(800)),
                page(PageCategory.BLOG, signal("/blog/1")
                        .signal(ContentSignal.ADDRESS)
                        .contentLength(3000)
                        .imageCount(2).altTextRatio(1.0)),
                page(PageCategory.BLOG, signal("/blog/2")
                        .contentLength(1000)));

        SiteProfile p = builder.build(pages);

        assertThat(p.hasTestimonials()).isTrue();
        assertThat(p.hasFaq()).isTrue();
        assertThat(p.hasPhone()).isTrue();
        assertThat(p.hasAddress()).isTrue();
        assertThat(p.hasBlog()).isTrue();
        assertThat(p.hasCompanyInfo()).isFalse();
        assertThat(p.hasPrivacyPolicy()).isFalse();
        assertThat(p.hasPricing()).isFalse();
        assertThat(p.hasContact()).isFalse();
        assertThat(p.hasService()).isFalse();
        assertThat(p.totalContentLength()).isEqualTo(6000);
        assertThat(p.totalImages()).isEqualTo(6);
        assertThat(p.avgAltText()).isEqualTo(0.75);
        assertThat(p.blogPostCount()).isEqualTo(2);
        assertThat(p.testimonialPageCount()).isEqualTo(1);
        assertThat(p.pageTypes()).containsExactly("other", "testimonials", "blog");
    }

    @Test
    void build_contactBlogAndServiceNeedTheCategory() {
        // language signals alone never establish contact, blog or service presence
        SiteProfile p = builder.build(List.of(
                page(PageCategory.OTHER, signal("/")
                        .signal(ContentSignal.COMPANY_INFO)
                        .signal(ContentSignal.PRIVACY_POLICY)
                        .signal(ContentSignal.PRICE)
                        .signal(ContentSignal.TESTIMONIAL))));

        assertThat(p.hasCompanyInfo()).isTrue();
        assertThat(p.hasPrivacyPolicy()).isTrue();
        assertThat(p.hasPricing()).isTrue();
        assertThat(p.hasTestimonials()).isTrue();
        assertThat(p.hasContact()).isFalse();
        assertThat(p.hasBlog()).isFalse();
        assertThat(p.hasService()).isFalse();
    }

    @Test
    void build_categoryAloneSetsPresence() {
        SiteProfile p = builder.build(List.of(
                page(PageCategory.COMPANY, signal("/company")),
                page(PageCategory.PRIVACY, signal("/privacy")),
                page(PageCategory.PRICING, signal("/price")),
                page(PageCategory.CONTACT, signal("/contact")),
                page(PageCategory.SERVICE, signal("/service")),
                page(PageCategory.FAQ, signal("/faq"))));

        assertThat(p.hasCompanyInfo()).isTrue();
        assertThat(p.hasPrivacyPolicy()).isTrue();
        assertThat(p.hasPricing()).isTrue();
        assertThat(p.hasContact()).isTrue();
        assertThat(p.hasService()).isTrue();
        assertThat(p.hasFaq()).isTrue();
        assertThat(p.hasAddress()).isFalse();
        assertThat(p.pageTypes()).hasSize(6);
    }

    @Test
    void build_noImagesAnywhereGivesZeroAverage() {
        SiteProfile p = builder.build(List.of(page(PageCategory.OTHER, signal("/"))));

        assertThat(p.totalImages()).isZero();
        assertThat(p.avgAltText()).isZero();
    }

    @Test
    void jsonLdTypes_unionInDiscoveryOrder() {
        List<ClassifiedPage> pages = List.of(
                page(PageCategory.OTHER, signal("/").hasJsonLd(true).addJsonLdType("WebSite").addJsonLdType("Organization")),
                page(PageCategory.FAQ, signal("/faq").hasJsonLd(true).addJsonLdType("FAQPage").addJsonLdType("Organization")));

        assertThat(builder.jsonLdTypes(pages)).containsExactly("WebSite", "Organization", "FAQPage");
    }
}
