package org.timberline.pipeline.api.resources.storage;

import java.util.Optional;

import org.timberline.pipeline.api.grid.GridDataset;
import org.timberline.pipeline.api.grid.TileSpec;

/**
 * Contents of an artifact file.
 *
 * @param name          artifact name (tile name, chunk label, surface name)
 * @param formatVersion format version the artifact was written with
 * @param tile          the tile the artifact covers, null for non-tile artifacts
 * @param dataset       the stored dataset
 */
public record DecodedArtifact(String name, int formatVersion, TileSpec tile, GridDataset dataset) {

    public Optional<TileSpec> tileSpec() {
        return Optional.ofNullable(tile);
    }
}
