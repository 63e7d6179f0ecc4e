package org.timberline.pipeline.tiling;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.timberline.pipeline.api.grid.GridExtent;
import org.timberline.pipeline.api.grid.IndexRange;
import org.timberline.pipeline.api.grid.TileSpec;
import org.timberline.pipeline.api.tiling.InvalidTileCountException;

/**
 * Splits a spatial extent into named, non-overlapping tiles that exactly cover it.
 * <p>
 * Latitude index 0 is the northern edge. When an axis does not divide evenly, the
 * first partitions receive one extra index each, so partition sizes differ by at most
 * one. All methods are pure.
 */
public final class DomainGrid {

    public static final Set<Integer> SUPPORTED_TILE_COUNTS = Set.of(2, 4, 8);

    public static final String FULL_DOMAIN_TILE = "full";

    private static final List<String> HALVES = List.of("west", "east");
    private static final List<String> QUADRANTS = List.of("northwest", "northeast", "southwest", "southeast");
    private static final List<String> OCTANTS = List.of("nw1", "nw2", "ne1", "ne2", "sw1", "sw2", "se1", "se2");

    private DomainGrid() {
    }

    /**
     * Throws {@link InvalidTileCountException} unless {@code tileCount} is supported.
     */
    public static void validateTileCount(int tileCount) {
        if (!SUPPORTED_TILE_COUNTS.contains(tileCount)) {
            throw new InvalidTileCountException(tileCount, SUPPORTED_TILE_COUNTS);
        }
    }

    /**
     * Computes the tiles for an extent.
     * <ul>
     *   <li>2: longitude halves {@code west, east}</li>
     *   <li>4: 2x2 quadrants {@code northwest, northeast, southwest, southeast}</li>
     *   <li>8: 2 latitude bands by 4 longitude strips, {@code nw1, nw2, ne1, ne2, sw1, ...}</li>
     * </ul>
     *
     * @param extent    the full spatial extent
     * @param tileCount 2, 4 or 8
     * @return tiles in row-major order (north to south, west to east)
     * @throws InvalidTileCountException if the tile count is not supported
     * @throws IllegalArgumentException  if an axis has fewer indices than partitions
     */
    public static List<TileSpec> computeTiles(GridExtent extent, int tileCount) {
        validateTileCount(tileCount);
        return switch (tileCount) {
            case 2 -> layout(extent, 1, 2, HALVES);
            case 4 -> layout(extent, 2, 2, QUADRANTS);
            default -> layout(extent, 2, 4, OCTANTS);
        };
    }

    /**
     * Returns the single tile covering the whole extent.
     */
    public static List<TileSpec> fullDomain(GridExtent extent) {
        return List.of(new TileSpec(FULL_DOMAIN_TILE, extent.latRange(), extent.lonRange()));
    }

    private static List<TileSpec> layout(GridExtent extent, int latParts, int lonParts, List<String> names) {
        List<IndexRange> latRanges = partition("latitude", extent.latCount(), latParts);
        List<IndexRange> lonRanges = partition("longitude", extent.lonCount(), lonParts);
        List<TileSpec> tiles = new ArrayList<>(latParts * lonParts);
        for (int row = 0; row < latParts; row++) {
            for (int col = 0; col < lonParts; col++) {
                tiles.add(new TileSpec(names.get(row * lonParts + col), latRanges.get(row), lonRanges.get(col)));
            }
        }
        return List.copyOf(tiles);
    }

    static List<IndexRange> partition(String axis, int length, int parts) {
        if (length < parts) {
            throw new IllegalArgumentException("Cannot split " + axis + " axis of length " + length
                + " into " + parts + " partitions");
        }
        int base = length / parts;
        int remainder = length % parts;
        List<IndexRange> ranges = new ArrayList<>(parts);
        int start = 0;
        for (int i = 0; i < parts; i++) {
            int size = base + (i < remainder ? 1 : 0);
            ranges.add(IndexRange.ofLength(start, size));
            start += size;
        }
        return ranges;
    }
}
