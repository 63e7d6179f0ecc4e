package org.timberline.pipeline.tiling;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.timberline.pipeline.api.grid.GridExtent;
import org.timberline.pipeline.api.grid.TileSpec;
import org.timberline.pipeline.api.reference.IReferenceSource;
import org.timberline.pipeline.api.reference.ReferenceSurface;
import org.timberline.pipeline.api.reference.SurfaceLayout;
import org.timberline.pipeline.api.tiling.DimensionMismatchException;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Named reference surfaces shared read-only by all tile workers of a run.
 * <p>
 * Only the surfaces named at {@link #load} time are opened, and only their layout is
 * read eagerly. Values are read lazily in day blocks through a bounded Caffeine cache,
 * so a surface that is larger than memory can still be subset tile by tile.
 * <p>
 * {@link #subset} is thread-safe and pure: it never changes state visible to callers,
 * and each call returns surfaces backed by fresh arrays.
 */
public final class ReferenceCache {

    private static final Logger log = LoggerFactory.getLogger(ReferenceCache.class);

    private static final long DEFAULT_MAXIMUM_SIZE = 256;
    private static final Duration DEFAULT_EXPIRE_AFTER_ACCESS = Duration.ofMinutes(30);

    private record BlockKey(String name, int block) {
    }

    private final Map<String, SurfaceLayout> layouts;
    private final LoadingCache<BlockKey, ReferenceSurface> blocks;

    private ReferenceCache(Map<String, SurfaceLayout> layouts, LoadingCache<BlockKey, ReferenceSurface> blocks) {
        this.layouts = layouts;
        this.blocks = blocks;
    }

    /**
     * Opens the named surfaces.
     *
     * @param source       backing store
     * @param names        surfaces to open, may be empty
     * @param cacheOptions {@code maximum-size} (day blocks) and {@code expire-after-access}
     * @return the cache
     * @throws IOException if a surface does not exist or cannot be described
     */
    public static ReferenceCache load(IReferenceSource source, Set<String> names, Config cacheOptions)
            throws IOException {
        Map<String, SurfaceLayout> layouts = new LinkedHashMap<>();
        for (String name : names) {
            SurfaceLayout layout = source.describe(name);
            if (!layout.name().equals(name)) {
                throw new IOException("Reference surface '" + name + "' describes itself as '" + layout.name() + "'");
            }
            layouts.put(name, layout);
        }

        Config options = cacheOptions == null ? ConfigFactory.empty() : cacheOptions;
        long maximumSize = options.hasPath("maximum-size") ? options.getLong("maximum-size") : DEFAULT_MAXIMUM_SIZE;
        Duration expireAfterAccess = options.hasPath("expire-after-access")
            ? options.getDuration("expire-after-access")
            : DEFAULT_EXPIRE_AFTER_ACCESS;

        LoadingCache<BlockKey, ReferenceSurface> blocks = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfterAccess(expireAfterAccess)
            .recordStats()
            .build(key -> {
                try {
                    return source.readBlock(key.name(), key.block());
                } catch (IOException e) {
                    throw new UncheckedIOException("Failed to read block " + key.block()
                        + " of reference surface '" + key.name() + "'", e);
                }
            });

        if (!layouts.isEmpty()) {
            log.info("Opened reference surfaces {}", layouts.keySet());
        }
        return new ReferenceCache(Collections.unmodifiableMap(layouts), blocks);
    }

    /**
     * Returns a cache without surfaces, for Calculators that need none.
     */
    public static ReferenceCache empty() {
        return new ReferenceCache(Map.of(), Caffeine.newBuilder().maximumSize(0).build(key -> null));
    }

    public Set<String> names() {
        return layouts.keySet();
    }

    public SurfaceLayout layout(String name) {
        return layouts.get(name);
    }

    /**
     * Checks that every surface covers exactly the given spatial extent.
     *
     * @throws DimensionMismatchException if a surface has a different extent
     */
    public void requireExtent(GridExtent extent) {
        for (SurfaceLayout layout : layouts.values()) {
            GridExtent actual = new GridExtent(layout.latCount(), layout.lonCount());
            if (!actual.equals(extent)) {
                throw new DimensionMismatchException("reference surface '" + layout.name() + "'", extent, actual);
            }
        }
    }

    /**
     * Returns tile-local copies of all surfaces.
     *
     * @param tile the tile window
     * @return surfaces by name, each restricted to the tile and owning its values
     * @throws DimensionMismatchException if the tile lies outside a surface
     * @throws UncheckedIOException       if a day block cannot be read
     */
    public Map<String, ReferenceSurface> subset(TileSpec tile) {
        if (layouts.isEmpty()) {
            return Map.of();
        }
        Map<String, ReferenceSurface> result = new LinkedHashMap<>();
        for (SurfaceLayout layout : layouts.values()) {
            if (!tile.fitsWithin(new GridExtent(layout.latCount(), layout.lonCount()))) {
                throw new DimensionMismatchException("reference subset for tile " + tile.name(),
                    "window within " + layout.latCount() + "x" + layout.lonCount(), tile.toString());
            }
            result.put(layout.name(), assemble(layout, tile));
        }
        return result;
    }

    private ReferenceSurface assemble(SurfaceLayout layout, TileSpec tile) {
        int cells = tile.latRange().length() * tile.lonRange().length();
        float[] values = new float[layout.dayCount() * cells];
        for (int block = 0; block < layout.blockCount(); block++) {
            ReferenceSurface data = blocks.get(new BlockKey(layout.name(), block));
            int first = layout.firstDayOf(block);
            for (int d = 0; d < layout.daysInBlock(block); d++) {
                data.copyWindow(d, tile.latRange(), tile.lonRange(), values, first + d);
            }
        }
        return new ReferenceSurface(layout.name(), layout.dayCount(), tile.latRange().length(),
            tile.lonRange().length(), values, layout.units());
    }

    CacheStats stats() {
        return blocks.stats();
    }
}
