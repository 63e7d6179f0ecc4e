package org.timberline.pipeline.tiling;

import org.timberline.pipeline.api.grid.TimeChunk;

/**
 * Result of one chunk: where its output went, or why it has none.
 *
 * @param start          first time unit of the chunk
 * @param end            last time unit of the chunk (inclusive)
 * @param status         final status
 * @param output         absolute path of the chunk output, null on failure
 * @param error          first error message, null on success
 * @param tileCount      number of tiles the chunk was split into, 0 if it failed before tiling
 * @param durationMillis wall-clock time spent on the chunk
 */
public record ChunkOutcome(int start, int end, ChunkStatus status, String output, String error,
                           int tileCount, long durationMillis) {

    public static ChunkOutcome succeeded(TimeChunk chunk, String output, int tileCount, long durationMillis) {
        return new ChunkOutcome(chunk.start(), chunk.endInclusive(), ChunkStatus.SUCCEEDED, output, null,
            tileCount, durationMillis);
    }

    public static ChunkOutcome failed(TimeChunk chunk, String error, int tileCount, long durationMillis) {
        return new ChunkOutcome(chunk.start(), chunk.endInclusive(), ChunkStatus.FAILED, null, error,
            tileCount, durationMillis);
    }

    public boolean isSuccess() {
        return status == ChunkStatus.SUCCEEDED;
    }
}
