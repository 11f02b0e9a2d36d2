package org.smileyface.sitecheck.crawler;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.net.MalformedURLException;
import java.net.URL;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Finds same-host page links in a page's markup.
 * <p>
 * A link is kept when it resolves against the page URL to the same host, points at a different
 * path than the page itself, and its last path segment has no extension or one of
 * {@code html}, {@code htm}, {@code php}. Fragment and query are dropped, so every link is
 * reported as {@code origin + path}, with characters illegal in a URI path percent-encoded.
 * Malformed hrefs are skipped.
 */
@Component
public class LinkExtractor {

    static final int NAVIGATION_FALLBACK_CHARS = 50_000;
    private static final Set<String> PAGE_EXTENSIONS = Set.of("html", "htm", "php");
    private static final String ILLEGAL_PATH_CHARS = "\"<>\\^`{|}";
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    /**
     * All distinct internal page links of a page, in discovery order.
     *
     * @param markup  the page's raw markup
     * @param pageUrl the page's own URL, used as the resolution base
     */
    public List<String> extractInternalLinks(String markup, String pageUrl) {
        if (markup == null || markup.isBlank()) return List.of();
        return collect(Jsoup.parse(markup, pageUrl), pageUrl, false);
    }

    /**
     * Internal page links found inside the page's navigation: the first {@code <nav>}, else the first
     * {@code <header>}, else the leading part of the markup. The site root is excluded as well.
     */
    public List<String> extractNavigationLinks(String markup, String pageUrl) {
        if (markup == null || markup.isBlank()) return List.of();
        Document doc = Jsoup.parse(markup, pageUrl);
        Element scope = doc.selectFirst("nav");
        if (scope == null) {
            scope = doc.selectFirst("header");
        }
        if (scope == null) {
            String head = markup.length() > NAVIGATION_FALLBACK_CHARS
                    ? markup.substring(0, NAVIGATION_FALLBACK_CHARS)
                    : markup;
            scope = Jsoup.parse(head, pageUrl);
        }
        return collect(scope, pageUrl, true);
    }

    private List<String> collect(Element scope, String pageUrl, boolean excludeRoot) {
        URL base;
        try {
            base = new URL(pageUrl);
        } catch (MalformedURLException e) {
            return List.of();
        }
        Set<String> links = new LinkedHashSet<>();
        for (Element a : scope.select("a[href]")) {
            toInternalPageUrl(a.attr("href"), base, excludeRoot).ifPresent(links::add);
        }
        return new ArrayList<>(links);
    }

    /**
     * Resolves one href and applies the internal-page filters.
     *
     * @return {@code origin + path} of the link, or empty when it is filtered out or malformed
     */
    static Optional<String> toInternalPageUrl(String href, URL base, boolean excludeRoot) {
        if (href == null) return Optional.empty();
        String h = href.trim();
        if (h.isEmpty() || h.startsWith("#")) return Optional.empty();
        URL link;
        try {
            link = new URL(base, h);
        } catch (MalformedURLException e) {
            return Optional.empty();
        }
        String protocol = link.getProtocol().toLowerCase(Locale.ROOT);
        if (!protocol.equals("http") && !protocol.equals("https")) return Optional.empty();
        if (!link.getHost().equalsIgnoreCase(base.getHost())) return Optional.empty();

        String path = pathOf(link);
        if (path.equals(pathOf(base))) return Optional.empty();
        if (excludeRoot && path.equals("/")) return Optional.empty();
        if (!isPagePath(path)) return Optional.empty();

        return Optional.of(originOf(link) + path);
    }

    static boolean isPagePath(String path) {
        String lastSegment = path.substring(path.lastIndexOf('/') + 1);
        int dot = lastSegment.lastIndexOf('.');
        if (dot < 0) return true;
        String ext = lastSegment.substring(dot + 1).toLowerCase(Locale.ROOT);
        return ext.isEmpty() || PAGE_EXTENSIONS.contains(ext);
    }

    private static String pathOf(URL url) {
        String path = url.getPath();
        return (path == null || path.isEmpty()) ? "/" : quotePath(path);
    }

    /**
     * Percent-encodes the ASCII characters a URI path may not hold (spaces, quotes, brackets and the
     * like) and stray {@code %} signs. Valid escapes and non-ASCII characters are left as they are.
     */
    static String quotePath(String path) {
        StringBuilder sb = null;
        for (int i = 0; i < path.length(); i++) {
            char c = path.charAt(i);
            boolean quote = c < 0x80 && (ILLEGAL_PATH_CHARS.indexOf(c) >= 0 || c <= 0x20 || c == 0x7f
                    || (c == '%' && !isEscape(path, i)));
            if (quote && sb == null) {
                sb = new StringBuilder(path.length() + 16).append(path, 0, i);
            }
            if (sb == null) continue;
            if (quote) {
                sb.append('%').append(HEX[c >> 4]).append(HEX[c & 0xF]);
            } else {
                sb.append(c);
            }
        }
        return sb == null ? path : sb.toString();
    }

    private static boolean isEscape(String s, int percentAt) {
        return percentAt + 2 < s.length()
                && Character.digit(s.charAt(percentAt + 1), 16) >= 0
                && Character.digit(s.charAt(percentAt + 2), 16) >= 0;
    }

    private static String originOf(URL url) {
        String protocol = url.getProtocol().toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder();
        sb.append(protocol).append("://").append(url.getHost().toLowerCase(Locale.ROOT));
        int port = url.getPort();
        if (port != -1 && port != url.getDefaultPort()) {
            sb.append(':').append(port);
        }
        return sb.toString();
    }
}
