package org.smileyface.sitecheck.scoring;

/**
 * One scored criterion inside a {@link ScoreCategory}.
 */
public record SubScore(int score, int max, String label) {

    public SubScore {
        if (score < 0 || score > max) {
            throw new IllegalArgumentException("score " + score + " outside [0, " + max + "] for " + label);
        }
    }
}
