package org.timberline.pipeline.tiling;

import java.util.List;

import org.timberline.pipeline.api.grid.TimeChunk;
import org.timberline.pipeline.api.resources.storage.TileArtifactHandle;

/**
 * Successful tile phase of one chunk. Holds the tile artifacts until it is closed;
 * merge them inside a try-with-resources block:
 * <pre>{@code
 * try (TileRun run = scheduler.runChunk(...)) {
 *     GridDataset merged = merger.merge(run.handles(), extent);
 * }
 * }</pre>
 */
public final class TileRun implements AutoCloseable {

    private final TimeChunk chunk;
    private final List<TileArtifactHandle> handles;
    private final TileArtifactScope scope;

    TileRun(TimeChunk chunk, List<TileArtifactHandle> handles, TileArtifactScope scope) {
        this.chunk = chunk;
        this.handles = List.copyOf(handles);
        this.scope = scope;
    }

    public TimeChunk chunk() {
        return chunk;
    }

    /**
     * Handles in tile order.
     */
    public List<TileArtifactHandle> handles() {
        return handles;
    }

    /**
     * Deletes the tile artifacts.
     */
    @Override
    public void close() {
        scope.close();
    }
}
