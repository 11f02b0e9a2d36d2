package org.smileyface.sitecheck.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of fetching one selected page.
 */
public enum FetchStatus {
    /** Fetched, accepted as HTML and extracted. */
    SUCCESS,

    /** Network error, timeout, non-2xx status or non-HTML payload. */
    FAILED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
