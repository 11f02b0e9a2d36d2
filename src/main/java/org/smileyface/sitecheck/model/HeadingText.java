package org.smileyface.sitecheck.model;

/**
 * Text of a single h1-h3 heading, with its level ("h1", "h2" or "h3").
 */
public record HeadingText(String level, String text) {
}
