package org.smileyface.sitecheck.fetch;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ClasspathStaticAssetSourceTest {

    private final ClasspathStaticAssetSource source = new ClasspathStaticAssetSource("static-test/");

    @Test
    void candidates() {
        assertThat(ClasspathStaticAssetSource.candidates("/")).isEqualTo(List.of("/index.html"));
        assertThat(ClasspathStaticAssetSource.candidates("/docs/")).isEqualTo(List.of("/docs/index.html"));
        assertThat(ClasspathStaticAssetSource.candidates("/pricing")).isEqualTo(List.of("/pricing", "/pricing.html"));
    }

    @Test
    void load_resolvesIndexAndHtmlSuffix() {
        assertThat(source.load(URI.create("https://sitecheck.test"))).hasValueSatisfying(a -> {
            assertThat(a.body()).contains("<title>Self site</title>");
            assertThat(a.size()).isPositive();
        });
        assertThat(source.load(URI.create("https://sitecheck.test/pricing"))).isPresent();
        assertThat(source.load(URI.create("https://sitecheck.test/pricing.html"))).isPresent();
    }

    @Test
    void load_missingOrEscapingPaths() {
        assertThat(source.load(URI.create("https://sitecheck.test/nope"))).isEmpty();
        assertThat(source.load(URI.create("https://sitecheck.test/docs/../../application-test.yml"))).isEmpty();
    }

    @Test
    void bundledSiteIsOnTheDefaultRoot() {
        assertThat(new ClasspathStaticAssetSource((String) null).load(URI.create("https://self/"))).isPresent();
    }
}
