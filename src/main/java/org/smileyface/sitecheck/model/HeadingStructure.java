package org.smileyface.sitecheck.model;

/**
 * Number of h1/h2/h3 elements found on a page.
 */
public record HeadingStructure(int h1, int h2, int h3) {

    public static final HeadingStructure EMPTY = new HeadingStructure(0, 0, 0);
}
