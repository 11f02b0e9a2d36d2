package org.smileyface.sitecheck.service;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.smileyface.sitecheck.model.CrawlResult;
import org.smileyface.sitecheck.scoring.SiteScore;

/**
 * A crawl and, when the crawl succeeded, its score.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SiteCheckReport(CrawlResult crawl, SiteScore score) {

    @JsonIgnore
    public boolean isSuccess() {
        return crawl != null && crawl.isSuccess();
    }
}
