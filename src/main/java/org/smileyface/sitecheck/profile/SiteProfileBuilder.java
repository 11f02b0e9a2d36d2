package org.smileyface.sitecheck.profile;

import org.smileyface.sitecheck.model.ClassifiedPage;
import org.smileyface.sitecheck.model.PageCategory;
import org.smileyface.sitecheck.model.PageSignal;
import org.smileyface.sitecheck.model.SiteProfile;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Folds the classified pages of one crawl into a {@link SiteProfile}.
 * <p>
 * A presence flag is set when any page either carries the matching category or shows the matching
 * language signal. Contact, blog and service presence come from categories only; address and phone
 * from signals only.
 */
@Component
public class SiteProfileBuilder {

    public SiteProfile build(List<ClassifiedPage> pages) {
        boolean testimonials = false, faq = false, company = false, privacy = false, pricing = false;
        boolean contact = false, blog = false, service = false, address = false, phone = false;
        long totalContentLength = 0;
        int totalImages = 0;
        double altSum = 0;
        int pagesWithImages = 0;
        int blogPosts = 0;
        int testimonialPages = 0;
        Set<String> pageTypes = new LinkedHashSet<>();

        for (ClassifiedPage page : pages) {
            PageSignal s = page.signal();
            PageCategory type = page.category();
            pageTypes.add(type.label());

            testimonials |= type == PageCategory.TESTIMONIALS || s.hasTestimonials();
            faq |= type == PageCategory.FAQ || s.hasFaq();
            company |= type == PageCategory.COMPANY || s.hasCompanyInfo();
            privacy |= type == PageCategory.PRIVACY || s.hasPrivacyPolicy();
            pricing |= type == PageCategory.PRICING || s.hasPrice();
            contact |= type == PageCategory.CONTACT;
            blog |= type == PageCategory.BLOG;
            service |= type == PageCategory.SERVICE;
            address |= s.hasAddress();
            phone |= s.hasPhone();

            totalContentLength += s.getContentLength();
            totalImages += s.getImageCount();
            if (s.getImageCount() > 0) {
                altSum += s.getAltTextRatio();
                pagesWithImages++;
            }
            if (type == PageCategory.BLOG) blogPosts++;
            if (type == PageCategory.TESTIMONIALS) testimonialPages++;
        }

        double avgAltText = pagesWithImages == 0 ? 0.0 : altSum / pagesWithImages;
        return new SiteProfile(testimonials, faq, company, privacy, pricing,
                contact, blog, service, address, phone,
                totalContentLength, totalImages, avgAltText,
                blogPosts, testimonialPages, new ArrayList<>(pageTypes));
    }

    /**
     * Union of the structured-data types of all pages, in the order they were first seen.
     */
    public List<String> jsonLdTypes(List<ClassifiedPage> pages) {
        Set<String> types = new LinkedHashSet<>();
        for (ClassifiedPage page : pages) {
            types.addAll(page.signal().getJsonLdTypes());
        }
        return new ArrayList<>(types);
    }
}
