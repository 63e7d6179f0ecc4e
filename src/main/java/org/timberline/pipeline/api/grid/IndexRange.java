package org.timberline.pipeline.api.grid;

/**
 * Half-open index range {@code [start, end)} along one grid axis.
 *
 * @param start first index (inclusive), never negative
 * @param end   last index (exclusive), always greater than {@code start}
 */
public record IndexRange(int start, int end) {

    public IndexRange {
        if (start < 0) {
            throw new IllegalArgumentException("Range start must be >= 0, got " + start);
        }
        if (end <= start) {
            throw new IllegalArgumentException("Range end must be > start, got [" + start + ", " + end + ")");
        }
    }

    /**
     * Creates a range from a start index and a length.
     *
     * @param start  first index
     * @param length number of indices, must be positive
     * @return the range {@code [start, start + length)}
     */
    public static IndexRange ofLength(int start, int length) {
        return new IndexRange(start, start + length);
    }

    public int length() {
        return end - start;
    }

    public boolean overlaps(IndexRange other) {
        return start < other.end && other.start < end;
    }

    public boolean contains(int index) {
        return index >= start && index < end;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
