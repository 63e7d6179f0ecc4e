package org.timberline.pipeline.api.grid;

/**
 * Contiguous half-open range of time units (years) processed as one unit of work.
 *
 * @param start        first time unit (inclusive)
 * @param endExclusive first time unit after the chunk
 */
public record TimeChunk(int start, int endExclusive) {

    public TimeChunk {
        if (endExclusive <= start) {
            throw new IllegalArgumentException(
                "Chunk end must be after start, got [" + start + ", " + endExclusive + ")");
        }
    }

    public int endInclusive() {
        return endExclusive - 1;
    }

    public int length() {
        return endExclusive - start;
    }

    /**
     * Label used in file names and log lines, e.g. {@code 1981_1983}.
     */
    public String label() {
        return start + "_" + endInclusive();
    }

    @Override
    public String toString() {
        return start == endInclusive() ? String.valueOf(start) : start + "-" + endInclusive();
    }
}
