package org.smileyface.sitecheck.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Fixed, mutually exclusive content-purpose labels assigned to crawled pages.
 */
public enum PageCategory {
    COMPANY,
    TESTIMONIALS,
    FAQ,
    PRIVACY,
    TERMS,
    BLOG,
    CONTACT,
    PRICING,
    SERVICE,
    OTHER;

    /**
     * @return the lower-case label used in configuration files and JSON output
     */
    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a category from its label (case-insensitive).
     *
     * @throws IllegalArgumentException when the label is unknown
     */
    public static PageCategory fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("category label must not be null/blank");
        }
        return PageCategory.valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
