package org.timberline.pipeline.api.resources.storage;

import java.nio.file.Path;
import java.util.Objects;

import org.timberline.pipeline.api.grid.TileSpec;

/**
 * Location of one persisted tile result and the tile it covers.
 *
 * @param tile the tile
 * @param path absolute path of the temporary artifact
 */
public record TileArtifactHandle(TileSpec tile, Path path) {

    public TileArtifactHandle {
        Objects.requireNonNull(tile, "tile");
        Objects.requireNonNull(path, "path");
    }
}
