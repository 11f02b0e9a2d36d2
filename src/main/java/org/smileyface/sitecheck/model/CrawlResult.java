package org.smileyface.sitecheck.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

/**
 * Top-level output of one site crawl. On success the homepage signals are flattened
 * to the top level next to the aggregated {@link SiteProfile}; on failure only
 * {@code success=false} and {@code error} are set.
 *
 * Field names are the JSON property names consumed by the narrative-generation step.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonAutoDetect(fieldVisibility = Visibility.ANY,
        getterVisibility = Visibility.NONE,
        isGetterVisibility = Visibility.NONE)
public class CrawlResult {

    private boolean success;
    private String error;

    // Homepage, flattened
    private String finalUrl;
    private String title;
    private String metaDescription;
    private Boolean isHttps;
    private Boolean hasViewport;
    private HeadingStructure headingStructure;
    private Boolean hasCanonical;
    private Integer internalLinks;
    private Long pageSize;
    private Integer copyrightYear;
    private Integer contentLength;
    private Integer scriptCount;
    private Integer stylesheetCount;
    private Integer imageCount;
    private Double hasAltText;
    private String textContent;
    private List<HeadingText> headingsText;

    // Site-wide signals
    private Boolean hasJsonLd;
    private List<String> jsonLdTypes;
    private Boolean hasFaq;
    private Boolean hasAddress;
    private Boolean hasPrice;
    private Boolean hasPhone;
    private Boolean hasCompanyInfo;

    private Integer totalPages;
    private List<PageSummary> pages;
    private SiteProfile siteProfile;
    private List<PageStatus> pageStatuses;
    private String companyName;

    public CrawlResult() {
        // default
    }

    public static CrawlResult failure(String error) {
        CrawlResult r = new CrawlResult();
        r.success = false;
        r.error = error;
        return r;
    }

    /**
     * Assembles a successful result.
     *
     * @param homepage      the homepage signals, flattened to the top level
     * @param pages         every fetched page, homepage first
     * @param profile       aggregate built from {@code pages}
     * @param jsonLdTypes   union of structured-data types over {@code pages}
     */
    public static CrawlResult success(PageSignal homepage,
                                      List<ClassifiedPage> pages,
                                      SiteProfile profile,
                                      List<String> jsonLdTypes) {
        CrawlResult r = new CrawlResult();
        r.success = true;
        r.finalUrl = homepage.getUrl();
        r.title = homepage.getTitle();
        r.metaDescription = homepage.getMetaDescription();
        r.isHttps = homepage.isHttps();
        r.hasViewport = homepage.hasViewport();
        r.headingStructure = homepage.getHeadingStructure();
        r.hasCanonical = homepage.hasCanonical();
        r.internalLinks = homepage.getInternalLinks();
        r.pageSize = homepage.getPageSize();
        r.copyrightYear = homepage.getCopyrightYear();
        r.contentLength = homepage.getContentLength();
        r.scriptCount = homepage.getScriptCount();
        r.stylesheetCount = homepage.getStylesheetCount();
        r.imageCount = homepage.getImageCount();
        r.hasAltText = homepage.getAltTextRatio();
        r.textContent = homepage.getTextContent();
        r.headingsText = homepage.getHeadingsText();

        r.hasJsonLd = pages.stream().anyMatch(p -> p.signal().hasJsonLd());
        r.jsonLdTypes = List.copyOf(jsonLdTypes);
        r.hasFaq = profile.hasFaq();
        r.hasAddress = profile.hasAddress();
        r.hasPrice = profile.hasPricing();
        r.hasPhone = profile.hasPhone();
        r.hasCompanyInfo = profile.hasCompanyInfo();

        r.totalPages = pages.size();
        List<PageSummary> summaries = new ArrayList<>(pages.size());
        for (ClassifiedPage p : pages) {
            summaries.add(PageSummary.of(p));
        }
        r.pages = summaries;
        r.siteProfile = profile;
        return r;
    }

    public boolean isSuccess() { return success; }
    public String getError() { return error; }
    public String getFinalUrl() { return finalUrl; }
    public String getTitle() { return title; }
    public String getMetaDescription() { return metaDescription; }
    public boolean isHttps() { return Boolean.TRUE.equals(isHttps); }
    public boolean hasViewport() { return Boolean.TRUE.equals(hasViewport); }
    public HeadingStructure getHeadingStructure() { return headingStructure; }
    public boolean hasCanonical() { return Boolean.TRUE.equals(hasCanonical); }
    public int getInternalLinks() { return internalLinks == null ? 0 : internalLinks; }
    public long getPageSize() { return pageSize == null ? 0L : pageSize; }
    public Integer getCopyrightYear() { return copyrightYear; }
    public int getContentLength() { return contentLength == null ? 0 : contentLength; }
    public int getScriptCount() { return scriptCount == null ? 0 : scriptCount; }
    public int getStylesheetCount() { return stylesheetCount == null ? 0 : stylesheetCount; }
    public int getImageCount() { return imageCount == null ? 0 : imageCount; }
    public double getAltTextRatio() { return hasAltText == null ? 0.0 : hasAltText; }
    public String getTextContent() { return textContent; }
    public List<HeadingText> getHeadingsText() { return headingsText; }
    public boolean hasJsonLd() { return Boolean.TRUE.equals(hasJsonLd); }
    public List<String> getJsonLdTypes() { return jsonLdTypes == null ? List.of() : jsonLdTypes; }
    public int getTotalPages() { return totalPages == null ? 0 : totalPages; }
    public List<PageSummary> getPages() { return pages == null ? List.of() : pages; }
    public SiteProfile getSiteProfile() { return siteProfile; }
    public List<PageStatus> getPageStatuses() { return pageStatuses; }
    public String getCompanyName() { return companyName; }

    public void setPageStatuses(List<PageStatus> pageStatuses) {
        this.pageStatuses = pageStatuses != null ? List.copyOf(pageStatuses) : null;
    }

    public void setCompanyName(String companyName) { this.companyName = companyName; }

    @Override
    public String toString() {
        if (!success) {
            return "CrawlResult{success=false, error='" + error + "'}";
        }
        return "CrawlResult{" +
                "success=true" +
                ", finalUrl='" + finalUrl + '\'' +
                ", title='" + title + '\'' +
                ", totalPages=" + totalPages +
                ", pageTypes=" + (siteProfile != null ? siteProfile.pageTypes() : List.of()) +
                ", pageStatuses=" + (pageStatuses != null ? pageStatuses.size() : 0) +
                '}';
    }
}
