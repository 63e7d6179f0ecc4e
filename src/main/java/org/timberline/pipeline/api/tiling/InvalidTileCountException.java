package org.timberline.pipeline.api.tiling;

import java.util.Set;

/**
 * Thrown before a run starts when the requested tile count is not supported.
 */
public class InvalidTileCountException extends IllegalArgumentException {

    private final int tileCount;

    public InvalidTileCountException(int tileCount, Set<Integer> supported) {
        super("Unsupported tile count " + tileCount + ", must be one of " + supported);
        this.tileCount = tileCount;
    }

    public int getTileCount() {
        return tileCount;
    }
}
