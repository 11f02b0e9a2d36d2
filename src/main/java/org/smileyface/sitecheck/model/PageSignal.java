package org.smileyface.sitecheck.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Structural and content signals extracted from one fetched page. Instances are
 * immutable; extractors populate a {@link Builder} and the fetcher builds the
 * final record once every extractor has run.
 */
public final class PageSignal {

    private final String url;
    private final String html;                 // raw markup, already truncated
    private final long pageSize;               // full body size in bytes
    private final String title;
    private final String metaDescription;
    private final boolean hasViewport;
    private final boolean hasJsonLd;
    private final List<String> jsonLdTypes;
    private final boolean hasCanonical;
    private final boolean https;
    private final HeadingStructure headingStructure;
    private final int internalLinks;
    private final Set<ContentSignal> contentSignals;
    private final int scriptCount;
    private final int stylesheetCount;
    private final int imageCount;
    private final double altTextRatio;
    private final Integer copyrightYear;
    private final String textContent;          // truncated plain text
    private final int contentLength;           // length of the full plain text
    private final List<HeadingText> headingsText;

    private PageSignal(Builder b) {
        this.url = Objects.requireNonNull(b.url, "url");
        this.html = b.html == null ? "" : b.html;
        this.pageSize = b.pageSize;
        this.title = b.title == null ? "" : b.title;
        this.metaDescription = b.metaDescription == null ? "" : b.metaDescription;
        this.hasViewport = b.hasViewport;
        this.hasJsonLd = b.hasJsonLd;
        this.jsonLdTypes = List.copyOf(b.jsonLdTypes);
        this.hasCanonical = b.hasCanonical;
        this.https = b.https;
        this.headingStructure = b.headingStructure == null ? HeadingStructure.EMPTY : b.headingStructure;
        this.internalLinks = b.internalLinks;
        this.contentSignals = b.contentSignals.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(b.contentSignals));
        this.scriptCount = b.scriptCount;
        this.stylesheetCount = b.stylesheetCount;
        this.imageCount = b.imageCount;
        this.altTextRatio = b.altTextRatio;
        this.copyrightYear = b.copyrightYear;
        this.textContent = b.textContent == null ? "" : b.textContent;
        this.contentLength = b.contentLength;
        this.headingsText = List.copyOf(b.headingsText);
    }

    public static Builder builder(String url) {
        return new Builder(url);
    }

    public String getUrl() { return url; }
    public String getHtml() { return html; }
    public long getPageSize() { return pageSize; }
    public String getTitle() { return title; }
    public String getMetaDescription() { return metaDescription; }
    public boolean hasViewport() { return hasViewport; }
    public boolean hasJsonLd() { return hasJsonLd; }
    public List<String> getJsonLdTypes() { return jsonLdTypes; }
    public boolean hasCanonical() { return hasCanonical; }
    public boolean isHttps() { return https; }
    public HeadingStructure getHeadingStructure() { return headingStructure; }
    public int getInternalLinks() { return internalLinks; }
    public Set<ContentSignal> getContentSignals() { return contentSignals; }
    public int getScriptCount() { return scriptCount; }
    public int getStylesheetCount() { return stylesheetCount; }
    public int getImageCount() { return imageCount; }
    public Integer getCopyrightYear() { return copyrightYear; }
    public String getTextContent() { return textContent; }
    public int getContentLength() { return contentLength; }
    public List<HeadingText> getHeadingsText() { return headingsText; }

    /**
     * Share of images carrying a non-empty alt attribute, in [0.0, 1.0]; 1.0 when the page has no images.
     */
    public double getAltTextRatio() { return altTextRatio; }

    public boolean has(ContentSignal signal) {
        return contentSignals.contains(signal);
    }

    public boolean hasFaq() { return has(ContentSignal.FAQ); }
    public boolean hasAddress() { return has(ContentSignal.ADDRESS); }
    public boolean hasPrice() { return has(ContentSignal.PRICE); }
    public boolean hasPhone() { return has(ContentSignal.PHONE); }
    public boolean hasCompanyInfo() { return has(ContentSignal.COMPANY_INFO); }
    public boolean hasTestimonials() { return has(ContentSignal.TESTIMONIAL); }
    public boolean hasPrivacyPolicy() { return has(ContentSignal.PRIVACY_POLICY); }

    @Override
    public String toString() {
        return "PageSignal{" +
                "url='" + url + '\'' +
                ", pageSize=" + pageSize +
                ", title='" + title + '\'' +
                ", headingStructure=" + headingStructure +
                ", internalLinks=" + internalLinks +
                ", contentSignals=" + contentSignals +
                ", imageCount=" + imageCount +
                ", contentLength=" + contentLength +
                '}';
    }

    /**
     * Mutable accumulator filled in by the page extractors.
     */
    public static final class Builder {
        private final String url;
        private String html;
        private long pageSize;
        private String title;
        private String metaDescription;
        private boolean hasViewport;
        private boolean hasJsonLd;
        private final List<String> jsonLdTypes = new ArrayList<>();
        private boolean hasCanonical;
        private boolean https;
        private HeadingStructure headingStructure;
        private int internalLinks;
        private final Set<ContentSignal> contentSignals = EnumSet.noneOf(ContentSignal.class);
        private int scriptCount;
        private int stylesheetCount;
        private int imageCount;
        private double altTextRatio = 1.0;
        private Integer copyrightYear;
        private String textContent;
        private int contentLength;
        private final List<HeadingText> headingsText = new ArrayList<>();

        private Builder(String url) {
            this.url = url;
        }

        public String url() { return url; }

        public Builder html(String html) { this.html = html; return this; }
        public Builder pageSize(long pageSize) { this.pageSize = pageSize; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder metaDescription(String metaDescription) { this.metaDescription = metaDescription; return this; }
        public Builder hasViewport(boolean hasViewport) { this.hasViewport = hasViewport; return this; }
        public Builder hasJsonLd(boolean hasJsonLd) { this.hasJsonLd = hasJsonLd; return this; }
        public Builder addJsonLdType(String type) { this.jsonLdTypes.add(type); return this; }
        public Builder hasCanonical(boolean hasCanonical) { this.hasCanonical = hasCanonical; return this; }
        public Builder https(boolean https) { this.https = https; return this; }
        public Builder headingStructure(HeadingStructure headingStructure) { this.headingStructure = headingStructure; return this; }
        public Builder internalLinks(int internalLinks) { this.internalLinks = internalLinks; return this; }
        public Builder signal(ContentSignal signal) { this.contentSignals.add(signal); return this; }
        public Builder scriptCount(int scriptCount) { this.scriptCount = scriptCount; return this; }
        public Builder stylesheetCount(int stylesheetCount) { this.stylesheetCount = stylesheetCount; return this; }
        public Builder imageCount(int imageCount) { this.imageCount = imageCount; return this; }
        public Builder copyrightYear(Integer copyrightYear) { this.copyrightYear = copyrightYear; return this; }
        public Builder textContent(String textContent) { this.textContent = textContent; return this; }
        public Builder contentLength(int contentLength) { this.contentLength = contentLength; return this; }
        public Builder addHeadingText(HeadingText heading) { this.headingsText.add(heading); return this; }

        public Builder altTextRatio(double altTextRatio) {
            if (Double.isNaN(altTextRatio) || altTextRatio < 0.0 || altTextRatio > 1.0) {
                throw new IllegalArgumentException("altTextRatio must be within [0.0, 1.0]: " + altTextRatio);
            }
            this.altTextRatio = altTextRatio;
            return this;
        }

        public PageSignal build() {
            return new PageSignal(this);
        }
    }
}
