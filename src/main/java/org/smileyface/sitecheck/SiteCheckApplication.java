package org.smileyface.sitecheck;

import org.smileyface.sitecheck.crawler.CrawlerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(CrawlerProperties.class)
public class SiteCheckApplication {

	public static void main(String[] args) {
		SpringApplication.run(SiteCheckApplication.class, args);
	}
}
