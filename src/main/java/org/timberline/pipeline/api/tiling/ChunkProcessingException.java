package org.timberline.pipeline.api.tiling;

import java.util.List;

import org.timberline.pipeline.api.grid.TimeChunk;

/**
 * Thrown when a time chunk could not be produced.
 * <p>
 * Aggregates every tile failure of the chunk: the first one is the cause, the others
 * are attached as suppressed exceptions and available through {@link #getFailures()}.
 */
public class ChunkProcessingException extends Exception {

    private final TimeChunk chunk;
    private final List<Throwable> failures;

    public ChunkProcessingException(TimeChunk chunk, String message) {
        super("Chunk " + chunk + " failed: " + message);
        this.chunk = chunk;
        this.failures = List.of();
    }

    public ChunkProcessingException(TimeChunk chunk, List<? extends Throwable> failures) {
        super("Chunk " + chunk + " failed: " + failures.size() + " tile(s) failed, first: "
            + (failures.isEmpty() ? "none" : failures.get(0).getMessage()),
            failures.isEmpty() ? null : failures.get(0));
        this.chunk = chunk;
        this.failures = List.copyOf(failures);
        for (int i = 1; i < this.failures.size(); i++) {
            addSuppressed(this.failures.get(i));
        }
    }

    public TimeChunk getChunk() {
        return chunk;
    }

    public List<Throwable> getFailures() {
        return failures;
    }

    /**
     * Returns true if any aggregated failure is a {@link DimensionMismatchException}.
     */
    public boolean hasDimensionMismatch() {
        return failures.stream().anyMatch(DimensionMismatchException.class::isInstance);
    }
}
