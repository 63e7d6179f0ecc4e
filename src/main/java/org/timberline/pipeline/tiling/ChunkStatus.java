package org.timberline.pipeline.tiling;

/**
 * Final status of one chunk in a run.
 */
public enum ChunkStatus {
    SUCCEEDED,
    FAILED
}
