package org.timberline.pipeline.api.grid;

/**
 * Spatial size of the full lat/lon domain. Fixed for the lifetime of a run.
 *
 * @param latCount number of latitude cells, always positive
 * @param lonCount number of longitude cells, always positive
 */
public record GridExtent(int latCount, int lonCount) {

    public GridExtent {
        if (latCount <= 0 || lonCount <= 0) {
            throw new IllegalArgumentException(
                "Grid extent must be positive in both axes, got lat=" + latCount + ", lon=" + lonCount);
        }
    }

    public long cellCount() {
        return (long) latCount * lonCount;
    }

    public IndexRange latRange() {
        return new IndexRange(0, latCount);
    }

    public IndexRange lonRange() {
        return new IndexRange(0, lonCount);
    }

    @Override
    public String toString() {
        return latCount + "x" + lonCount;
    }
}
