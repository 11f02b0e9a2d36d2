package org.smileyface.sitecheck.scoring;

/**
 * Result of scoring one crawl: four independent categories and their sum.
 */
public record SiteScore(int totalScore, Categories categories) {

    public record Categories(ScoreCategory content,
                             ScoreCategory trust,
                             ScoreCategory aiReadiness,
                             ScoreCategory technical) {
    }

    static SiteScore of(ScoreCategory content, ScoreCategory trust, ScoreCategory aiReadiness, ScoreCategory technical) {
        int total = content.total() + trust.total() + aiReadiness.total() + technical.total();
        return new SiteScore(total, new Categories(content, trust, aiReadiness, technical));
    }
}
