package org.smileyface.sitecheck.model;

import java.util.Objects;

/**
 * A fetched page and the single category the classifier assigned to it.
 */
public record ClassifiedPage(PageSignal signal, PageCategory category) {

    public ClassifiedPage {
        Objects.requireNonNull(signal, "signal");
        Objects.requireNonNull(category, "category");
    }
}
