package org.smileyface.sitecheck.classifier;

import org.smileyface.sitecheck.crawler.CrawlerProperties;
import org.smileyface.sitecheck.model.ClassifiedPage;
import org.smileyface.sitecheck.model.PageCategory;
import org.smileyface.sitecheck.model.PageSignal;
import org.smileyface.sitecheck.util.CrawlerUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Assigns exactly one {@link PageCategory} to a page.
 * <p>
 * Rules are tried in table order and the first one that matches wins. A rule matches when one of
 * its URL keywords occurs in the lower-cased URL path, or one of its text keywords occurs in the
 * lower-cased title followed by the first {@value #TEXT_PREFIX_CHARS} characters of body text.
 * A page matching no rule is {@link PageCategory#OTHER}.
 */
@Component
public class PageClassifier {

    static final int TEXT_PREFIX_CHARS = 500;

    private final List<ClassificationRule> rules;

    public PageClassifier(List<ClassificationRule> rules) {
        this.rules = List.copyOf(rules);
    }

    @Autowired
    public PageClassifier(CrawlerProperties properties) {
        this(fromConfig(properties.getClassificationRules()));
    }

    static List<ClassificationRule> fromConfig(List<CrawlerProperties.ClassificationRuleConfig> config) {
        List<ClassificationRule> out = new ArrayList<>();
        if (config == null) return out;
        for (CrawlerProperties.ClassificationRuleConfig c : config) {
            if (c == null) continue;
            out.add(new ClassificationRule(PageCategory.fromLabel(c.category),
                    lowerCased(c.urlKeywords), lowerCased(c.textKeywords)));
        }
        return out;
    }

    private static List<String> lowerCased(List<String> keywords) {
        if (keywords == null) return List.of();
        return keywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .map(k -> k.toLowerCase(Locale.ROOT))
                .toList();
    }

    public ClassifiedPage classify(PageSignal page) {
        return new ClassifiedPage(page, classify(page.getUrl(), page.getTitle(), page.getTextContent()));
    }

    public PageCategory classify(String url, String title, String text) {
        String path = CrawlerUtils.lowerCasePath(url);
        String haystack = ((title == null ? "" : title) + " "
                + CrawlerUtils.truncate(text, TEXT_PREFIX_CHARS)).toLowerCase(Locale.ROOT);
        for (ClassificationRule rule : rules) {
            if (rule.matches(path, haystack)) {
                return rule.category();
            }
        }
        return PageCategory.OTHER;
    }

    public record ClassificationRule(PageCategory category, List<String> urlKeywords, List<String> textKeywords) {

        public ClassificationRule {
            Objects.requireNonNull(category, "category");
            urlKeywords = List.copyOf(urlKeywords);
            textKeywords = List.copyOf(textKeywords);
        }

        boolean matches(String lowerPath, String lowerText) {
            for (String k : urlKeywords) {
                if (lowerPath.contains(k)) return true;
            }
            for (String k : textKeywords) {
                if (lowerText.contains(k)) return true;
            }
            return false;
        }
    }
}
