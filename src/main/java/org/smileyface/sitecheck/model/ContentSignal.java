package org.smileyface.sitecheck.model;

import java.util.Locale;

/**
 * Page-level language detectors. Each one is backed by a configurable pattern
 * that is matched against the raw markup of a page.
 */
public enum ContentSignal {
    FAQ,
    ADDRESS,
    PRICE,
    PHONE,
    COMPANY_INFO,
    TESTIMONIAL,
    PRIVACY_POLICY;

    public static ContentSignal fromKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("content signal key must not be null/blank");
        }
        return ContentSignal.valueOf(key.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
