package org.smileyface.sitecheck.extractor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.sitecheck.model.FetchedPage;
import org.smileyface.sitecheck.model.PageSignal;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Detects JSON-LD blocks and collects their {@code @type} names. Every block is parsed on its
 * own; a block that is not valid JSON is skipped without affecting the others.
 */
public final class StructuredDataExtractor implements PageExtractor {

    private static final Logger log = LoggerFactory.getLogger(StructuredDataExtractor.class);

    static final String JSON_LD_SELECTOR = "script[type=application/ld+json]";

    private final ObjectMapper mapper;

    public StructuredDataExtractor(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public void extract(FetchedPage page, PageSignal.Builder signal) {
        Elements blocks = page.document().select(JSON_LD_SELECTOR);
        signal.hasJsonLd(!blocks.isEmpty());
        for (JsonNode node : parseBlocks(blocks, page.url())) {
            for (String type : typesOf(node)) {
                signal.addJsonLdType(type);
            }
        }
    }

    /**
     * Parses each JSON-LD block, dropping the ones that fail to parse.
     */
    List<JsonNode> parseBlocks(Elements blocks, String url) {
        List<JsonNode> out = new ArrayList<>(blocks.size());
        for (Element block : blocks) {
            try {
                JsonNode node = mapper.readTree(block.data());
                if (node != null && !node.isMissingNode()) {
                    out.add(node);
                }
            } catch (JsonProcessingException e) {
                log.debug("Discarding unparsable JSON-LD block on {}: {}", url, e.getOriginalMessage());
            }
        }
        return out;
    }

    /**
     * Type names declared by a JSON-LD value: the {@code @type} of an object (a string or an array of
     * strings), or of every object of a top-level array.
     */
    static List<String> typesOf(JsonNode node) {
        List<String> types = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode item : node) {
                if (item.isObject()) collectType(item, types);
            }
        } else if (node.isObject()) {
            collectType(node, types);
        }
        return types;
    }

    private static void collectType(JsonNode object, List<String> out) {
        JsonNode type = object.get("@type");
        if (type == null) return;
        if (type.isTextual()) {
            out.add(type.asText());
        } else if (type.isArray()) {
            for (JsonNode t : type) {
                if (t.isTextual()) out.add(t.asText());
            }
        }
    }
}
