package org.timberline.pipeline.api.grid;

import java.util.Objects;

/**
 * A named rectangular sub-region of the full grid.
 * <p>
 * The tiles produced for one tile count and {@link GridExtent} partition the extent
 * exactly: no gaps, no overlaps.
 *
 * @param name     compass-style tile name (e.g. {@code northwest}, {@code se2})
 * @param latRange latitude index range
 * @param lonRange longitude index range
 */
public record TileSpec(String name, IndexRange latRange, IndexRange lonRange) {

    public TileSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(latRange, "latRange");
        Objects.requireNonNull(lonRange, "lonRange");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Tile name must not be blank");
        }
    }

    public GridExtent extent() {
        return new GridExtent(latRange.length(), lonRange.length());
    }

    public long cellCount() {
        return extent().cellCount();
    }

    public boolean overlaps(TileSpec other) {
        return latRange.overlaps(other.latRange) && lonRange.overlaps(other.lonRange);
    }

    public boolean fitsWithin(GridExtent extent) {
        return latRange.end() <= extent.latCount() && lonRange.end() <= extent.lonCount();
    }

    @Override
    public String toString() {
        return name + " lat" + latRange + " lon" + lonRange;
    }
}
