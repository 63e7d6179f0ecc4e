package org.timberline.pipeline.api.tiling;

/**
 * Thrown when a single tile could not be computed.
 * <p>
 * Recovered at chunk level: the scheduler collects all tile failures of a chunk and
 * fails the whole chunk with a {@link ChunkProcessingException}.
 */
public class TileComputationFailedException extends Exception {

    private final String tileName;

    public TileComputationFailedException(String tileName, Throwable cause) {
        super("Tile '" + tileName + "' failed: " + describe(cause), cause);
        this.tileName = tileName;
    }

    public TileComputationFailedException(String tileName, String message) {
        super("Tile '" + tileName + "' failed: " + message);
        this.tileName = tileName;
    }

    public String getTileName() {
        return tileName;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown cause";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
