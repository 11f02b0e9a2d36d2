package org.smileyface.sitecheck.crawler;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration properties for fetching, link selection, classification and signal detection.
 * <p>
 * Defaults, including the keyword tables, are loaded from the classpath resource
 * {@value #DEFAULT_RULES_RESOURCE}. Spring still binds/overrides values from application
 * properties as usual, and {@link #setRulesResource(String)} swaps the rule set for another
 * classpath resource. A value set through its setter always wins over a rules file, whichever
 * is applied first.
 */
@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {

    public static final String DEFAULT_RULES_RESOURCE = "SiteCheckRules.json";

    Logger log = LogManager.getLogger(CrawlerProperties.class);

    /** User agent sent with every network fetch. */
    private String userAgent = "Mozilla/5.0 (compatible; SmileyfaceSiteCheck/1.0)";

    /** Per-page fetch timeout in milliseconds. */
    private int requestTimeoutMs = 15000;

    /** Largest response body read from the network, in bytes. */
    private int maxBodySizeBytes = 5 * 1024 * 1024;

    /** Raw markup is cut to this many characters before any extraction. */
    private int markupLimit = 500_000;

    /** Plain text kept per page, in characters. */
    private int textContentLimit = 5000;

    /** Hosts served from the bundled static assets instead of the network. */
    private List<String> selfHosts = new ArrayList<>();

    /** Classpath directory holding the static assets of the self hosts. */
    private String staticAssetRoot = "static";

    /** Size of the worker pool fetching subpages. */
    private int workerCount = 9;

    /** Subpages fetched by the broad ranking strategy. */
    private int broadPageLimit = 9;

    /** Subpages fetched by the bucketed targeting strategy. */
    private int targetedPageLimit = 4;

    private String rulesResource = DEFAULT_RULES_RESOURCE;
    private int defaultLinkWeight = 3;
    private List<LinkWeightConfig> linkWeights = new ArrayList<>();
    private String homepageLabel = "トップページ";
    private String navigationFallbackLabel = "その他";
    private List<PriorityBucketConfig> priorityBuckets = new ArrayList<>();
    private List<ClassificationRuleConfig> classificationRules = new ArrayList<>();
    private Map<String, String> contentSignals = new LinkedHashMap<>();

    // names of the properties set explicitly; rules files leave them alone
    private final Set<String> explicitlySet = new HashSet<>();

    public CrawlerProperties() {
        loadRules(DEFAULT_RULES_RESOURCE);
    }

    /**
     * Applies the values of a rules file found on the classpath. Values absent from the file keep
     * their current setting.
     */
    private void loadRules(String resource) {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                log.warn("Site check rules resource {} not found on classpath; keeping current rules", resource);
                return;
            }
            ObjectMapper mapper = new ObjectMapper()
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            SiteCheckRules cfg = mapper.readValue(in, SiteCheckRules.class);
            if (fromFile("userAgent") && cfg.userAgent != null && !cfg.userAgent.isBlank()) this.userAgent = cfg.userAgent;
            if (fromFile("requestTimeoutMs") && cfg.requestTimeoutMs != null && cfg.requestTimeoutMs > 0) this.requestTimeoutMs = cfg.requestTimeoutMs;
            if (fromFile("markupLimit") && cfg.markupLimit != null && cfg.markupLimit > 0) this.markupLimit = cfg.markupLimit;
            if (fromFile("textContentLimit") && cfg.textContentLimit != null && cfg.textContentLimit > 0) this.textContentLimit = cfg.textContentLimit;
            if (fromFile("broadPageLimit") && cfg.broadPageLimit != null) this.broadPageLimit = cfg.broadPageLimit;
            if (fromFile("targetedPageLimit") && cfg.targetedPageLimit != null) this.targetedPageLimit = cfg.targetedPageLimit;
            if (fromFile("defaultLinkWeight") && cfg.defaultLinkWeight != null) this.defaultLinkWeight = cfg.defaultLinkWeight;
            if (fromFile("linkWeights") && cfg.linkWeights != null) this.linkWeights = new ArrayList<>(cfg.linkWeights);
            if (fromFile("homepageLabel") && cfg.homepageLabel != null) this.homepageLabel = cfg.homepageLabel;
            if (fromFile("navigationFallbackLabel") && cfg.navigationFallbackLabel != null) this.navigationFallbackLabel = cfg.navigationFallbackLabel;
            if (fromFile("priorityBuckets") && cfg.priorityBuckets != null) this.priorityBuckets = new ArrayList<>(cfg.priorityBuckets);
            if (fromFile("classificationRules") && cfg.classificationRules != null) this.classificationRules = new ArrayList<>(cfg.classificationRules);
            if (fromFile("contentSignals") && cfg.contentSignals != null) this.contentSignals = new LinkedHashMap<>(cfg.contentSignals);
            log.debug("Loaded site check rules from {}: {} link weights, {} buckets, {} classification rules",
                    resource, linkWeights.size(), priorityBuckets.size(), classificationRules.size());
        } catch (Exception e) {
            // Keep the current rules when the file is malformed; do not fail application startup
            log.error("Failed to load site check rules from classpath resource {}", resource, e);
        }
    }

    private boolean fromFile(String property) {
        return !explicitlySet.contains(property);
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        explicitlySet.add("userAgent");
        this.userAgent = userAgent;
    }

    public int getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(int requestTimeoutMs) {
        explicitlySet.add("requestTimeoutMs");
        this.requestTimeoutMs = requestTimeoutMs;
    }

    public int getMaxBodySizeBytes() {
        return maxBodySizeBytes;
    }

    public void setMaxBodySizeBytes(int maxBodySizeBytes) {
        this.maxBodySizeBytes = maxBodySizeBytes;
    }

    public int getMarkupLimit() {
        return markupLimit;
    }

    public void setMarkupLimit(int markupLimit) {
        explicitlySet.add("markupLimit");
        this.markupLimit = markupLimit;
    }

    public int getTextContentLimit() {
        return textContentLimit;
    }

    public void setTextContentLimit(int textContentLimit) {
        explicitlySet.add("textContentLimit");
        this.textContentLimit = textContentLimit;
    }

    public List<String> getSelfHosts() {
        return selfHosts;
    }

    public void setSelfHosts(List<String> selfHosts) {
        this.selfHosts = selfHosts != null ? selfHosts : new ArrayList<>();
    }

    public String getStaticAssetRoot() {
        return staticAssetRoot;
    }

    public void setStaticAssetRoot(String staticAssetRoot) {
        this.staticAssetRoot = (staticAssetRoot == null || staticAssetRoot.isBlank()) ? "static" : staticAssetRoot;
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public void setWorkerCount(int workerCount) {
        this.workerCount = workerCount;
    }

    public int getBroadPageLimit() {
        return broadPageLimit;
    }

    public void setBroadPageLimit(int broadPageLimit) {
        explicitlySet.add("broadPageLimit");
        this.broadPageLimit = broadPageLimit;
    }

    public int getTargetedPageLimit() {
        return targetedPageLimit;
    }

    public void setTargetedPageLimit(int targetedPageLimit) {
        explicitlySet.add("targetedPageLimit");
        this.targetedPageLimit = targetedPageLimit;
    }

    public String getRulesResource() {
        return rulesResource;
    }

    /**
     * Replaces the keyword tables (and any other values present) with those of another
     * classpath resource. Properties already set through their setters are kept.
     */
    public void setRulesResource(String rulesResource) {
        if (rulesResource == null || rulesResource.isBlank() || rulesResource.equals(this.rulesResource)) {
            return;
        }
        this.rulesResource = rulesResource;
        loadRules(rulesResource);
    }

    public int getDefaultLinkWeight() {
        return defaultLinkWeight;
    }

    public void setDefaultLinkWeight(int defaultLinkWeight) {
        explicitlySet.add("defaultLinkWeight");
        this.defaultLinkWeight = defaultLinkWeight;
    }

    public List<LinkWeightConfig> getLinkWeights() {
        return linkWeights;
    }

    public void setLinkWeights(List<LinkWeightConfig> linkWeights) {
        explicitlySet.add("linkWeights");
        this.linkWeights = linkWeights != null ? linkWeights : new ArrayList<>();
    }

    public String getHomepageLabel() {
        return homepageLabel;
    }

    public void setHomepageLabel(String homepageLabel) {
        explicitlySet.add("homepageLabel");
        this.homepageLabel = homepageLabel;
    }

    public String getNavigationFallbackLabel() {
        return navigationFallbackLabel;
    }

    public void setNavigationFallbackLabel(String navigationFallbackLabel) {
        explicitlySet.add("navigationFallbackLabel");
        this.navigationFallbackLabel = navigationFallbackLabel;
    }

    public List<PriorityBucketConfig> getPriorityBuckets() {
        return priorityBuckets;
    }

    public void setPriorityBuckets(List<PriorityBucketConfig> priorityBuckets) {
        explicitlySet.add("priorityBuckets");
        this.priorityBuckets = priorityBuckets != null ? priorityBuckets : new ArrayList<>();
    }

    public List<ClassificationRuleConfig> getClassificationRules() {
        return classificationRules;
    }

    public void setClassificationRules(List<ClassificationRuleConfig> classificationRules) {
        explicitlySet.add("classificationRules");
        this.classificationRules = classificationRules != null ? classificationRules : new ArrayList<>();
    }

    public Map<String, String> getContentSignals() {
        return contentSignals;
    }

    public void setContentSignals(Map<String, String> contentSignals) {
        explicitlySet.add("contentSignals");
        this.contentSignals = contentSignals != null ? contentSignals : new LinkedHashMap<>();
    }

    // --------- Nested config DTOs for JSON mapping ---------
    public static class SiteCheckRules {
        public String userAgent;
        public Integer requestTimeoutMs;
        public Integer markupLimit;
        public Integer textContentLimit;
        public Integer broadPageLimit;
        public Integer targetedPageLimit;
        public Integer defaultLinkWeight;
        public List<LinkWeightConfig> linkWeights;
        public String homepageLabel;
        public String navigationFallbackLabel;
        public List<PriorityBucketConfig> priorityBuckets;
        public List<ClassificationRuleConfig> classificationRules;
        public Map<String, String> contentSignals;
    }

    public static class LinkWeightConfig {

        public LinkWeightConfig() {} // for JSON mapping
        public LinkWeightConfig(String keyword, int weight) {
            this.keyword = keyword;
            this.weight = weight;
        }
        public String keyword;
        public int weight;
    }

    public static class PriorityBucketConfig {

        public PriorityBucketConfig() {} // for JSON mapping
        public PriorityBucketConfig(String label, List<String> patterns) {
            this.label = label;
            this.patterns = patterns;
        }
        public String label;
        public List<String> patterns;
    }

    public static class ClassificationRuleConfig {

        public ClassificationRuleConfig() {} // for JSON mapping
        public ClassificationRuleConfig(String category, List<String> urlKeywords, List<String> textKeywords) {
            this.category = category;
            this.urlKeywords = urlKeywords;
            this.textKeywords = textKeywords;
        }
        /** One of the lower-case {@link org.smileyface.sitecheck.model.PageCategory} labels. */
        public String category;
        public List<String> urlKeywords;
        public List<String> textKeywords;
    }
}
