package org.smileyface.sitecheck.controller;

/**
 * Body of a site check request. {@code strategy} is {@code broad} (default) or {@code targeted}.
 */
public record SiteCheckRequest(String url, String strategy) {
}
