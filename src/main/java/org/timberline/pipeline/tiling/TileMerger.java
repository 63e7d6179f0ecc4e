package org.timberline.pipeline.tiling;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.timberline.pipeline.api.grid.Axis;
import org.timberline.pipeline.api.grid.GridDataset;
import org.timberline.pipeline.api.grid.GridExtent;
import org.timberline.pipeline.api.grid.IndexRange;
import org.timberline.pipeline.api.grid.TileSpec;
import org.timberline.pipeline.api.resources.storage.ArtifactIOException;
import org.timberline.pipeline.api.resources.storage.DecodedArtifact;
import org.timberline.pipeline.api.resources.storage.IArtifactStore;
import org.timberline.pipeline.api.resources.storage.TileArtifactHandle;
import org.timberline.pipeline.api.tiling.DimensionMismatchException;

/**
 * Reassembles tile artifacts into the full spatial domain.
 * <p>
 * Tiles are grouped into latitude bands, each band is concatenated along longitude
 * and the bands are then concatenated along latitude. Every step is validated: a tile
 * whose stored shape differs from its {@link TileSpec}, a gap or overlap between tiles,
 * or a final shape different from the expected extent raises
 * {@link DimensionMismatchException}. The result is never padded or truncated.
 */
public class TileMerger {

    private static final Logger log = LoggerFactory.getLogger(TileMerger.class);

    private final IArtifactStore store;

    public TileMerger(IArtifactStore store) {
        this.store = store;
    }

    /**
     * Loads and merges tile artifacts.
     *
     * @param handles  tile artifacts of one chunk, in any order
     * @param expected the full extent the tiles must cover
     * @return the merged dataset, owning all of its arrays
     * @throws ArtifactIOException        if an artifact cannot be read
     * @throws DimensionMismatchException if the tiles do not assemble into {@code expected}
     */
    public GridDataset merge(List<TileArtifactHandle> handles, GridExtent expected) throws ArtifactIOException {
        if (handles.isEmpty()) {
            throw new DimensionMismatchException("merge", expected.toString(), "no tiles");
        }

        Map<Integer, List<LoadedTile>> bands = new TreeMap<>();
        for (TileArtifactHandle handle : handles) {
            LoadedTile tile = load(handle);
            bands.computeIfAbsent(tile.spec().latRange().start(), key -> new ArrayList<>()).add(tile);
        }

        List<GridDataset> rows = new ArrayList<>(bands.size());
        int nextLat = 0;
        for (List<LoadedTile> band : bands.values()) {
            IndexRange latRange = band.get(0).spec().latRange();
            requireContiguous("latitude band", nextLat, latRange);
            band.sort(Comparator.comparingInt(tile -> tile.spec().lonRange().start()));

            List<GridDataset> parts = new ArrayList<>(band.size());
            int nextLon = 0;
            for (LoadedTile tile : band) {
                if (!tile.spec().latRange().equals(latRange)) {
                    throw new DimensionMismatchException("latitude band at " + latRange.start(),
                        "tiles spanning lat" + latRange, tile.spec().toString());
                }
                requireContiguous("band lat" + latRange, nextLon, tile.spec().lonRange());
                nextLon = tile.spec().lonRange().end();
                parts.add(tile.dataset());
            }
            rows.add(GridDataset.concat(parts, Axis.LON));
            nextLat = latRange.end();
        }

        GridDataset merged = GridDataset.concat(rows, Axis.LAT);
        if (!merged.extent().equals(expected)) {
            throw new DimensionMismatchException("merged chunk", expected, merged.extent());
        }
        log.debug("Merged {} tile(s) into {}", handles.size(), merged);
        return merged;
    }

    private LoadedTile load(TileArtifactHandle handle) throws ArtifactIOException {
        TileSpec spec = handle.tile();
        DecodedArtifact artifact = store.read(handle.path());
        artifact.tileSpec().ifPresent(stored -> {
            if (!stored.equals(spec)) {
                throw new DimensionMismatchException("tile artifact " + handle.path().getFileName(),
                    spec.toString(), stored.toString());
            }
        });
        GridExtent actual = artifact.dataset().extent();
        if (!actual.equals(spec.extent())) {
            throw new DimensionMismatchException("tile " + spec.name(), spec.extent(), actual);
        }
        return new LoadedTile(spec, artifact.dataset());
    }

    private static void requireContiguous(String context, int expectedStart, IndexRange range) {
        if (range.start() != expectedStart) {
            throw new DimensionMismatchException(context,
                "next range starting at " + expectedStart, "range " + range);
        }
    }

    private record LoadedTile(TileSpec spec, GridDataset dataset) {
    }
}
