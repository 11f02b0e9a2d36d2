package org.smileyface.sitecheck.extractor;

import org.junit.jupiter.api.Test;
import org.smileyface.sitecheck.model.PageSignal;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class InternalLinkCountExtractorTest {

    private final SignalExtractor extractor =
            new SignalExtractor(List.of(new InternalLinkCountExtractor()), 500_000);

    @Test
    void countsSameHostAndRelativeLinks() {
        String html = """
                <a href="/about">a</a>
                <a href="contact.html">b</a>
                <a href="https://EXAMPLE.com/faq">c</a>
                <a href="https://other.com/">external</a>
                <a href="/page#section">fragment</a>
                <a href="#top">fragment only</a>
                <a href="">empty</a>
                """;
        PageSignal s = extractor.extract("https://example.com/", html, html.length());
        assertEquals(3, s.getInternalLinks());
    }
}
