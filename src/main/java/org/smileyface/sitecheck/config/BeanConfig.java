package org.smileyface.sitecheck.config;

import org.smileyface.sitecheck.crawler.CrawlerProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the subpage fetch pool and the clock used for copyright-year freshness.
 * <p>
 * The pool size comes from {@code crawler.worker-count} (default 9).
 */
@Configuration
public class BeanConfig {

    @Bean(name = "fetchExecutor", destroyMethod = "shutdownNow")
    public ExecutorService fetchExecutor(CrawlerProperties properties) {
        int workers = Math.max(1, properties.getWorkerCount());
        CustomizableThreadFactory threads = new CustomizableThreadFactory("page-fetch-");
        threads.setDaemon(true);
        return Executors.newFixedThreadPool(workers, threads);
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
