package org.smileyface.sitecheck.model;

import java.util.List;

/**
 * Site-level aggregate over every successfully fetched page of one crawl.
 *
 * @param pageTypes distinct category labels in the order they were first seen
 */
public record SiteProfile(boolean hasTestimonials,
                          boolean hasFaq,
                          boolean hasCompanyInfo,
                          boolean hasPrivacyPolicy,
                          boolean hasPricing,
                          boolean hasContact,
                          boolean hasBlog,
                          boolean hasService,
                          boolean hasAddress,
                          boolean hasPhone,
                          long totalContentLength,
                          int totalImages,
                          double avgAltText,
                          int blogPostCount,
                          int testimonialPageCount,
                          List<String> pageTypes) {

    public SiteProfile {
        pageTypes = pageTypes == null ? List.of() : List.copyOf(pageTypes);
    }
}
