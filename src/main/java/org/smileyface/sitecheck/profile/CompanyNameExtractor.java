package org.smileyface.sitecheck.profile;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.sitecheck.model.PageSignal;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best guess of the business name behind a homepage, used to address the report.
 * <p>
 * Sources are tried in order: organization-like structured data, any short structured-data name,
 * the title's parts, a legal-entity token in the text, the raw title, and the host.
 */
@Component
public class CompanyNameExtractor {

    private static final Logger log = LoggerFactory.getLogger(CompanyNameExtractor.class);

    static final String UNKNOWN_COMPANY = "不明な会社";
    private static final int MAX_NAME_LENGTH = 50;
    private static final Pattern TITLE_SEPARATORS = Pattern.compile("[|｜\\-－—]");
    private static final List<String> LEGAL_ENTITY_KEYWORDS =
            List.of("株式会社", "（株）", "(株)", "有限会社", "合同会社", "Inc", "Corp", "Co.", "LLC");
    private static final Pattern TEXT_COMPANY =
            Pattern.compile("([\\u3000-\\u9FFF\\w]+株式会社|株式会社[\\u3000-\\u9FFF\\w]+)", Pattern.UNICODE_CHARACTER_CLASS);

    private final ObjectMapper mapper;

    public CompanyNameExtractor(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String extract(PageSignal homepage) {
        List<JsonNode> blocks = structuredDataBlocks(homepage.getHtml());

        for (JsonNode ld : blocks) {
            String name = text(ld, "name");
            if (isOrganization(ld.get("@type")) && name != null) return name;
            String provider = text(ld.path("provider"), "name");
            if (provider != null) return provider;
            String author = text(ld.path("author"), "name");
            if (author != null) return author;
        }
        for (JsonNode ld : blocks) {
            String name = text(ld, "name");
            if (name != null && name.length() < MAX_NAME_LENGTH) return name;
        }

        String title = homepage.getTitle() == null ? "" : homepage.getTitle();
        String[] parts = TITLE_SEPARATORS.split(title, -1);
        if (parts.length > 1) {
            for (String part : parts) {
                String trimmed = part.trim();
                if (isPlausibleName(trimmed) && LEGAL_ENTITY_KEYWORDS.stream().anyMatch(trimmed::contains)) {
                    return trimmed;
                }
            }
            String last = parts[parts.length - 1].trim();
            if (isPlausibleName(last)) return last;
        }

        String text = homepage.getTextContent();
        if (text != null && !text.isEmpty()) {
            Matcher m = TEXT_COMPANY.matcher(text);
            if (m.find()) return m.group(1);
        }

        if (!title.isEmpty()) return title;
        return hostOf(homepage.getUrl());
    }

    private List<JsonNode> structuredDataBlocks(String html) {
        List<JsonNode> blocks = new ArrayList<>();
        if (html == null || html.isEmpty()) return blocks;
        for (Element script : Jsoup.parse(html).select("script[type=application/ld+json]")) {
            try {
                JsonNode node = mapper.readTree(script.data());
                if (node != null && node.isObject()) {
                    blocks.add(node);
                }
            } catch (Exception e) {
                log.debug("Skipping unparsable JSON-LD block while looking for a company name: {}", e.getMessage());
            }
        }
        return blocks;
    }

    private static boolean isOrganization(JsonNode type) {
        if (type == null) return false;
        if (type.isTextual()) {
            String t = type.asText();
            return t.contains("Organization") || t.contains("LocalBusiness") || t.equals("Corporation");
        }
        if (type.isArray()) {
            for (JsonNode t : type) {
                if (t.isTextual() && (t.asText().equals("Organization") || t.asText().equals("LocalBusiness"))) {
                    return true;
                }
            }
        }
        return false;
    }

    private static String text(JsonNode node, String field) {
        if (node == null) return null;
        JsonNode v = node.get(field);
        if (v == null || !v.isTextual() || v.asText().isEmpty()) return null;
        return v.asText();
    }

    private static boolean isPlausibleName(String s) {
        return s.length() > 1 && s.length() < MAX_NAME_LENGTH;
    }

    private static String hostOf(String url) {
        try {
            String host = url == null ? null : new URI(url).getHost();
            return host != null ? host : UNKNOWN_COMPANY;
        } catch (URISyntaxException e) {
            return UNKNOWN_COMPANY;
        }
    }
}
