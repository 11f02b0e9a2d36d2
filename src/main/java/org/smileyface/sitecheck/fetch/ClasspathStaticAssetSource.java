package org.smileyface.sitecheck.fetch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.sitecheck.crawler.CrawlerProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link StaticAssetSource} reading from a classpath directory. A path ending in "/" maps to its
 * {@code index.html}; any other path is tried as-is and then with an ".html" suffix.
 */
@Component
public class ClasspathStaticAssetSource implements StaticAssetSource {

    private static final Logger log = LoggerFactory.getLogger(ClasspathStaticAssetSource.class);

    private final String root;

    public ClasspathStaticAssetSource(String root) {
        String r = (root == null || root.isBlank()) ? "static" : root.trim();
        this.root = r.endsWith("/") ? r.substring(0, r.length() - 1) : r;
    }

    @Autowired
    public ClasspathStaticAssetSource(CrawlerProperties properties) {
        this(properties.getStaticAssetRoot());
    }

    @Override
    public Optional<StaticAsset> load(URI url) {
        String path = url.getPath();
        if (path == null || path.isEmpty()) path = "/";
        if (path.contains("..")) {
            return Optional.empty();
        }
        for (String candidate : candidates(path)) {
            ClassPathResource resource = new ClassPathResource(root + candidate);
            if (!resource.exists() || !resource.isReadable()) continue;
            try (InputStream in = resource.getInputStream()) {
                byte[] bytes = in.readAllBytes();
                return Optional.of(new StaticAsset(new String(bytes, StandardCharsets.UTF_8), bytes.length));
            } catch (IOException e) {
                log.warn("Failed to read static asset {}{}: {}", root, candidate, e.getMessage());
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    static List<String> candidates(String path) {
        List<String> out = new ArrayList<>(2);
        if (path.endsWith("/")) {
            out.add(path + "index.html");
        } else {
            out.add(path);
            out.add(path + ".html");
        }
        return out;
    }
}
