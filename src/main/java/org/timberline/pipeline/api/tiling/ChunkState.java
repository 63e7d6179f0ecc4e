package org.timberline.pipeline.api.tiling;

/**
 * Lifecycle of one chunk inside the tile scheduler.
 */
public enum ChunkState {
    PENDING,
    RUNNING,
    ALL_SUCCEEDED,
    PARTIALLY_FAILED
}
