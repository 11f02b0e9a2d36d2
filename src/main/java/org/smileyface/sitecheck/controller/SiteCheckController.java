package org.smileyface.sitecheck.controller;

import org.smileyface.sitecheck.crawler.CrawlStrategy;
import org.smileyface.sitecheck.service.CrawlerService;
import org.smileyface.sitecheck.service.SiteCheckReport;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api")
class SiteCheckController {

    static final String MISSING_URL_MESSAGE = "URLを入力してください";

    private final CrawlerService crawlerService;

    SiteCheckController(CrawlerService crawlerService) {
        this.crawlerService = crawlerService;
    }

    @PostMapping("/site-check")
    public ResponseEntity<?> check(@RequestBody SiteCheckRequest request) {
        if (request == null || request.url() == null || request.url().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", MISSING_URL_MESSAGE));
        }
        CrawlStrategy strategy = CrawlStrategy.fromValue(request.strategy());
        SiteCheckReport report = crawlerService.diagnose(request.url(), strategy);
        if (!report.isSuccess()) {
            return ResponseEntity.badRequest().body(Map.of("error", report.crawl().getError()));
        }
        return ResponseEntity.ok(report);
    }
}
