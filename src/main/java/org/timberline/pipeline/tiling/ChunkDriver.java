package org.timberline.pipeline.tiling;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.timberline.pipeline.api.calculator.ICalculator;
import org.timberline.pipeline.api.grid.GridDataset;
import org.timberline.pipeline.api.grid.GridExtent;
import org.timberline.pipeline.api.grid.TileSpec;
import org.timberline.pipeline.api.grid.TimeChunk;
import org.timberline.pipeline.api.resources.storage.IArtifactStore;
import org.timberline.pipeline.api.resources.storage.IChunkInputSource;
import org.timberline.pipeline.api.tiling.ChunkProcessingException;
import org.timberline.pipeline.api.tiling.DimensionMismatchException;

/**
 * Drives a run over a range of years, one chunk after the other.
 * <p>
 * A failing chunk is logged and recorded in the {@link RunSummary}; the run then moves on
 * to the next chunk. Only an unsupported tile count or invalid range aborts the run, and
 * it does so before the first chunk starts.
 */
public class ChunkDriver {

    private static final Logger log = LoggerFactory.getLogger(ChunkDriver.class);

    public static final String SOFTWARE = "Timberline";

    public static final String ATTR_SOURCE_TIME_RANGE = "source_time_range";
    public static final String ATTR_TILE_COUNT = "tile_count";
    public static final String ATTR_CREATION_DATE = "creation_date";
    public static final String ATTR_SOFTWARE = "software";
    public static final String ATTR_CALCULATOR = "calculator";
    public static final String ATTR_INDICES_COUNT = "indices_count";

    private final IChunkInputSource inputSource;
    private final ReferenceCache references;
    private final ICalculator calculator;
    private final TileScheduler scheduler;
    private final TileMerger merger;
    private final IArtifactStore outputStore;
    private final String outputPrefix;
    private final int workerCount;
    private final Clock clock;

    private GridExtent tiledExtent;
    private List<TileSpec> tiles;

    public ChunkDriver(IChunkInputSource inputSource, ReferenceCache references, ICalculator calculator,
                       TileScheduler scheduler, TileMerger merger, IArtifactStore outputStore,
                       String outputPrefix, int workerCount) {
        this(inputSource, references, calculator, scheduler, merger, outputStore, outputPrefix, workerCount,
            Clock.systemUTC());
    }

    ChunkDriver(IChunkInputSource inputSource, ReferenceCache references, ICalculator calculator,
                TileScheduler scheduler, TileMerger merger, IArtifactStore outputStore,
                String outputPrefix, int workerCount, Clock clock) {
        this.inputSource = inputSource;
        this.references = references;
        this.calculator = calculator;
        this.scheduler = scheduler;
        this.merger = merger;
        this.outputStore = outputStore;
        this.outputPrefix = outputPrefix;
        this.workerCount = workerCount;
        this.clock = clock;
    }

    /**
     * Splits {@code [start, end]} into chunks of {@code chunkSize} years, the last one
     * truncated at {@code end}.
     */
    public static List<TimeChunk> chunks(int start, int end, int chunkSize) {
        if (end < start) {
            throw new IllegalArgumentException("end (" + end + ") must not be before start (" + start + ")");
        }
        if (chunkSize < 1) {
            throw new IllegalArgumentException("chunk size must be at least 1, got " + chunkSize);
        }
        List<TimeChunk> chunks = new ArrayList<>();
        for (int s = start; s <= end; s += chunkSize) {
            chunks.add(new TimeChunk(s, Math.min(s + chunkSize, end + 1)));
        }
        return chunks;
    }

    public String outputKey(TimeChunk chunk) {
        return outputPrefix + "_" + chunk.start() + "_" + chunk.endInclusive() + ".grid";
    }

    /**
     * Runs all chunks of {@code [start, end]}.
     *
     * @throws org.timberline.pipeline.api.tiling.InvalidTileCountException if the tile count is unsupported
     * @throws IllegalArgumentException if the range or chunk size is invalid
     */
    public RunSummary run(int start, int end, int chunkSize, int tileCount) {
        DomainGrid.validateTileCount(tileCount);
        List<TimeChunk> chunks = chunks(start, end, chunkSize);
        tiles = null;
        tiledExtent = null;
        log.info("Processing {}-{} in {} chunk(s) of {} year(s), {} tiles, calculator {}",
            start, end, chunks.size(), chunkSize, tileCount, calculator.name());

        List<ChunkOutcome> outcomes = new ArrayList<>(chunks.size());
        for (TimeChunk chunk : chunks) {
            outcomes.add(processChunk(chunk, tileCount));
        }
        RunSummary summary = RunSummary.of(outcomes);
        log.info("Run finished: {} chunk(s) succeeded, {} failed", summary.succeeded(), summary.failed());
        return summary;
    }

    ChunkOutcome processChunk(TimeChunk chunk, int tileCount) {
        long startNanos = System.nanoTime();
        int tileTotal = 0;
        try {
            GridDataset input = inputSource.load(chunk);
            GridExtent extent = input.extent();
            List<TileSpec> chunkTiles = tilesFor(extent, tileCount);
            tileTotal = chunkTiles.size();
            references.requireExtent(extent);

            GridDataset merged;
            try (TileRun run = scheduler.runChunk(chunk, input, chunkTiles, references, calculator, workerCount)) {
                merged = merger.merge(run.handles(), extent);
            }
            if (merged.variableNames().isEmpty()) {
                String message = "No indices calculated for chunk " + chunk.label();
                log.warn("Chunk {} failed: {}; nothing written", chunk, message);
                return ChunkOutcome.failed(chunk, message, tileTotal, elapsedMillis(startNanos));
            }

            GridDataset output = merged.withAttributes(
                outputAttributes(chunk, tileTotal, merged.variableNames().size()));
            Path path = outputStore.write(outputKey(chunk), chunk.label(), output, null);
            long millis = elapsedMillis(startNanos);
            log.info("Chunk {} done in {}ms: {}", chunk, millis, path);
            return ChunkOutcome.succeeded(chunk, path.toString(), tileTotal, millis);
        } catch (ChunkProcessingException e) {
            String message = e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
            log.warn("Chunk {} failed: {}", chunk, e.getMessage());
            log.debug("Chunk failure", e);
            return ChunkOutcome.failed(chunk, message, tileTotal, elapsedMillis(startNanos));
        } catch (DimensionMismatchException e) {
            log.error("Chunk {} failed: {}", chunk, e.getMessage());
            log.debug("Chunk failure", e);
            return ChunkOutcome.failed(chunk, e.getMessage(), tileTotal, elapsedMillis(startNanos));
        } catch (IOException e) {
            log.warn("Chunk {} failed: {}", chunk, e.getMessage());
            log.debug("Chunk failure", e);
            return ChunkOutcome.failed(chunk, e.getMessage(), tileTotal, elapsedMillis(startNanos));
        } catch (RuntimeException e) {
            log.error("Chunk {} failed unexpectedly: {}", chunk, e.toString(), e);
            return ChunkOutcome.failed(chunk, e.toString(), tileTotal, elapsedMillis(startNanos));
        }
    }

    private List<TileSpec> tilesFor(GridExtent extent, int tileCount) {
        if (tiles == null) {
            tiles = DomainGrid.computeTiles(extent, tileCount);
            tiledExtent = extent;
            log.debug("Tiles for extent {}: {}", extent, tiles);
        } else if (!tiledExtent.equals(extent)) {
            throw new DimensionMismatchException("chunk input extent", tiledExtent, extent);
        }
        return tiles;
    }

    private Map<String, String> outputAttributes(TimeChunk chunk, int tileCount, int indicesCount) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put(ATTR_SOURCE_TIME_RANGE, chunk.start() + "-" + chunk.endInclusive());
        attributes.put(ATTR_TILE_COUNT, Integer.toString(tileCount));
        attributes.put(ATTR_CREATION_DATE, Instant.now(clock).toString());
        attributes.put(ATTR_SOFTWARE, SOFTWARE);
        attributes.put(ATTR_CALCULATOR, calculator.name());
        attributes.put(ATTR_INDICES_COUNT, Integer.toString(indicesCount));
        attributes.putAll(calculator.globalAttributes());
        return attributes;
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
