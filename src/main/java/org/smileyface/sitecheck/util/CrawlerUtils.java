package org.smileyface.sitecheck.util;

import java.net.IDN;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

public class CrawlerUtils {

    private CrawlerUtils() {
        // No instanciation
    }

    /**
     * Turns user input into an absolute http(s) URL. Input that does not start with "http" gets an
     * {@code https://} prefix. Internationalized hosts are converted to their ASCII (punycode) form.
     * Returns null when the result is not a valid URL with a host.
     */
    public static String normalizeInputUrl(String raw) {
        if (raw == null || raw.isBlank()) return null;
        String url = raw.trim();
        if (!url.startsWith("http")) {
            url = "https://" + url;
        }
        try {
            URL parsed = new URL(url);
            String protocol = parsed.getProtocol().toLowerCase(Locale.ROOT);
            if (!protocol.equals("http") && !protocol.equals("https")) return null;
            String host = parsed.getHost();
            if (host == null || host.isBlank() || host.chars().anyMatch(Character::isWhitespace)) return null;
            String asciiHost = IDN.toASCII(host, IDN.ALLOW_UNASSIGNED);
            if (asciiHost.isEmpty()) return null;
            if (asciiHost.equals(host)) return url;
            String file = parsed.getFile() + (parsed.getRef() != null ? "#" + parsed.getRef() : "");
            return new URL(parsed.getProtocol(), asciiHost, parsed.getPort(), file).toExternalForm();
        } catch (MalformedURLException | IllegalArgumentException e) {
            // IDN.toASCII throws IllegalArgumentException for labels it cannot convert
            return null;
        }
    }

    /**
     * Lower-cased path of an absolute URL, "/" for an empty path. Falls back to the lower-cased
     * input when it cannot be parsed.
     */
    public static String lowerCasePath(String url) {
        if (url == null) return "";
        try {
            String path = new URI(url).getPath();
            if (path == null || path.isEmpty()) return "/";
            return path.toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            return url.toLowerCase(Locale.ROOT);
        }
    }

    /**
     * Percent-decodes a URL as UTF-8, returning the input unchanged when it holds a malformed escape.
     */
    public static String decodeQuietly(String url) {
        if (url == null) return null;
        try {
            return URLDecoder.decode(url.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return url;
        }
    }

    public static String truncate(String input, int maxChars) {
        if (input == null) return "";
        if (maxChars < 0 || input.length() <= maxChars) return input;
        return input.substring(0, maxChars);
    }
}
