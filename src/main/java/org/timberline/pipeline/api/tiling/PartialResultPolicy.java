package org.timberline.pipeline.api.tiling;

/**
 * Engine-level policy for Calculator results that failed individually.
 */
public enum PartialResultPolicy {
    /**
     * Keep the results the Calculator did produce. The failed result is absent from
     * the tile and filled with the missing-value sentinel over that tile's region
     * when the chunk is merged.
     */
    KEEP_PARTIAL,

    /** Any failed result fails the whole tile, and therefore the chunk. */
    FAIL_TILE
}
