package org.smileyface.sitecheck.model;

import java.util.Objects;

/**
 * A discovered same-host URL together with the reason it was selected: a numeric
 * priority weight (broad ranking) or a semantic label (bucketed targeting).
 */
public record LinkCandidate(String url, Integer weight, String label) {

    public LinkCandidate {
        Objects.requireNonNull(url, "url");
    }

    public static LinkCandidate weighted(String url, int weight) {
        return new LinkCandidate(url, weight, null);
    }

    public static LinkCandidate labelled(String url, String label) {
        return new LinkCandidate(url, null, label);
    }
}
