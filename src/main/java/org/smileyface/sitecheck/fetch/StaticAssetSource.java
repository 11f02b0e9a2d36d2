package org.smileyface.sitecheck.fetch;

import java.net.URI;
import java.util.Optional;

/**
 * Serves pages of the hosts that belong to this deployment without a network round-trip.
 */
public interface StaticAssetSource {

    /**
     * Loads the asset addressed by the path of {@code url}.
     *
     * @return the asset body, or empty when there is no asset for that path
     */
    Optional<StaticAsset> load(URI url);

    /**
     * A served asset and its size in bytes.
     */
    record StaticAsset(String body, long size) {
    }
}
