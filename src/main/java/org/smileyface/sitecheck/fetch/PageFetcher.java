package org.smileyface.sitecheck.fetch;

import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.sitecheck.crawler.CrawlerProperties;
import org.smileyface.sitecheck.extractor.SignalExtractor;
import org.smileyface.sitecheck.model.PageSignal;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Fetches one page and extracts its signals. Every failure (bad URL, network error, timeout,
 * non-2xx status, non-HTML payload) is reported as an empty result; nothing is thrown to the caller
 * and nothing is retried.
 */
@Component
public class PageFetcher {

    private static final Logger log = LoggerFactory.getLogger(PageFetcher.class);

    static final String ACCEPT = "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";
    static final String ACCEPT_LANGUAGE = "ja,en;q=0.9";

    private final CrawlerProperties properties;
    private final SignalExtractor signalExtractor;
    private final StaticAssetSource staticAssets;
    private final Set<String> selfHosts;

    public PageFetcher(CrawlerProperties properties, SignalExtractor signalExtractor, StaticAssetSource staticAssets) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.signalExtractor = Objects.requireNonNull(signalExtractor, "signalExtractor");
        this.staticAssets = Objects.requireNonNull(staticAssets, "staticAssets");
        this.selfHosts = properties.getSelfHosts().stream()
                .filter(h -> h != null && !h.isBlank())
                .map(h -> h.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * Fetches {@code url} and extracts its signals.
     *
     * @param url absolute http(s) URL
     * @return the page signals, or empty when the page could not be used
     */
    public Optional<PageSignal> fetch(String url) {
        if (url == null || url.isBlank()) return Optional.empty();
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            log.debug("Skipping malformed URL {}", url);
            return Optional.empty();
        }
        String host = uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
        if (selfHosts.contains(host)) {
            return fetchSelf(uri, url);
        }
        return fetchRemote(url);
    }

    public boolean isSelfHost(String host) {
        return host != null && selfHosts.contains(host.toLowerCase(Locale.ROOT));
    }

    private Optional<PageSignal> fetchSelf(URI uri, String url) {
        Optional<StaticAssetSource.StaticAsset> asset = staticAssets.load(uri);
        if (asset.isEmpty()) {
            log.debug("No static asset for self-hosted page {}", url);
            return Optional.empty();
        }
        return Optional.of(signalExtractor.extract(url, asset.get().body(), asset.get().size()));
    }

    private Optional<PageSignal> fetchRemote(String url) {
        long start = System.nanoTime();
        try {
            Connection conn = Jsoup.connect(url)
                    .userAgent(Objects.toString(properties.getUserAgent(), "Mozilla/5.0 (compatible; SmileyfaceSiteCheck/1.0)"))
                    .header("Accept", ACCEPT)
                    .header("Accept-Language", ACCEPT_LANGUAGE)
                    .timeout(Math.max(0, properties.getRequestTimeoutMs()))
                    .maxBodySize(Math.max(0, properties.getMaxBodySizeBytes()))
                    .followRedirects(true)
                    .ignoreHttpErrors(true)
                    .ignoreContentType(true);

            Connection.Response res = conn.execute();
            int status = res.statusCode();
            if (status < 200 || status >= 300) {
                log.debug("Rejecting {}: HTTP {}", url, status);
                return Optional.empty();
            }
            String contentType = res.contentType();
            if (contentType == null || !contentType.toLowerCase(Locale.ROOT).contains("text/html")) {
                log.debug("Rejecting {}: content type {}", url, contentType);
                return Optional.empty();
            }
            long size = res.bodyAsBytes().length;
            String body = res.body();
            String finalUrl = res.url() != null ? res.url().toExternalForm() : url;
            PageSignal signal = signalExtractor.extract(finalUrl, body, size);
            log.debug("Fetched {} ({} bytes) in {} ms", finalUrl, size, elapsedMs(start));
            return Optional.of(signal);
        } catch (IOException e) {
            log.debug("Failed to fetch {} after {} ms: {}", url, elapsedMs(start), e.toString());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Unexpected error fetching {}: {}", url, e.toString());
            return Optional.empty();
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }
}
