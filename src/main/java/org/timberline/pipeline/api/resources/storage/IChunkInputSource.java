package org.timberline.pipeline.api.resources.storage;

import java.io.IOException;

import org.timberline.pipeline.api.grid.GridDataset;
import org.timberline.pipeline.api.grid.TimeChunk;

/**
 * Provides the full-domain input of one time chunk.
 */
@FunctionalInterface
public interface IChunkInputSource {

    /**
     * Loads the input covering every time unit of the chunk.
     *
     * @param chunk the time chunk
     * @return full-domain input with the chunk's complete time axis
     * @throws IOException if any part of the chunk cannot be read
     */
    GridDataset load(TimeChunk chunk) throws IOException;
}
