package org.smileyface.sitecheck.scoring;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A scored category: the sum of its criteria, their combined maximum, a display label and the
 * per-criterion breakdown in the order the criteria were scored.
 */
public record ScoreCategory(int total, int maxScore, String label, Map<String, SubScore> details) {

    public ScoreCategory {
        details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public SubScore detail(String name) {
        return details.get(name);
    }

    static Builder builder(String label) {
        return new Builder(label);
    }

    static final class Builder {
        private final String label;
        private final Map<String, SubScore> details = new LinkedHashMap<>();

        private Builder(String label) {
            this.label = label;
        }

        Builder add(String name, int score, int max, String label) {
            details.put(name, new SubScore(score, max, label));
            return this;
        }

        ScoreCategory build() {
            int total = 0;
            int max = 0;
            for (SubScore s : details.values()) {
                total += s.score();
                max += s.max();
            }
            return new ScoreCategory(total, max, label, details);
        }
    }
}
