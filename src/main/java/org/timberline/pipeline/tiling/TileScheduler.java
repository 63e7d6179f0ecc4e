package org.timberline.pipeline.tiling;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.timberline.pipeline.api.calculator.ICalculator;
import org.timberline.pipeline.api.grid.GridDataset;
import org.timberline.pipeline.api.grid.TileSpec;
import org.timberline.pipeline.api.grid.TimeChunk;
import org.timberline.pipeline.api.reference.ReferenceSurface;
import org.timberline.pipeline.api.resources.storage.IArtifactStore;
import org.timberline.pipeline.api.resources.storage.TileArtifactHandle;
import org.timberline.pipeline.api.tiling.ChunkProcessingException;
import org.timberline.pipeline.api.tiling.ChunkState;
import org.timberline.pipeline.api.tiling.DimensionMismatchException;
import org.timberline.pipeline.api.tiling.TileComputationFailedException;

/**
 * Runs the tiles of one chunk in parallel on a fixed pool created for that chunk.
 * <p>
 * Either every tile succeeds and the caller receives a {@link TileRun} owning the tile
 * artifacts, or the chunk fails with a {@link ChunkProcessingException} that carries every
 * tile failure and no artifact survives. The chunk timeout is a deadline for the whole
 * chunk; tasks still running when it passes are abandoned, not interrupted, and their
 * late writes are refused by the closed scope.
 */
public class TileScheduler {

    private static final Logger log = LoggerFactory.getLogger(TileScheduler.class);

    private final TileWorker worker;
    private final IArtifactStore tileStore;
    private final int maxWorkers;
    private final Duration chunkTimeout;
    private final AtomicReference<ChunkState> state = new AtomicReference<>(ChunkState.PENDING);
    private final AtomicInteger threadCounter = new AtomicInteger();
    private final ThreadFactory threadFactory;

    public TileScheduler(TileWorker worker, IArtifactStore tileStore, int maxWorkers, Duration chunkTimeout) {
        this(worker, tileStore, maxWorkers, chunkTimeout, null);
    }

    TileScheduler(TileWorker worker, IArtifactStore tileStore, int maxWorkers, Duration chunkTimeout,
                  ThreadFactory threadFactory) {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be at least 1, got " + maxWorkers);
        }
        if (chunkTimeout.isNegative() || chunkTimeout.isZero()) {
            throw new IllegalArgumentException("chunkTimeout must be positive, got " + chunkTimeout);
        }
        this.worker = worker;
        this.tileStore = tileStore;
        this.maxWorkers = maxWorkers;
        this.chunkTimeout = chunkTimeout;
        this.threadFactory = threadFactory != null ? threadFactory : daemonThreads();
    }

    /**
     * State of the most recent chunk.
     */
    public ChunkState getState() {
        return state.get();
    }

    public TileWorker getWorker() {
        return worker;
    }

    /**
     * Resolves the pool size: the requested count, or one thread per tile when the
     * request is 0, capped at {@code maxWorkers}.
     */
    public int resolveWorkerCount(int requested, int tileCount) {
        if (requested < 0) {
            throw new IllegalArgumentException("workers must not be negative, got " + requested);
        }
        int wanted = requested > 0 ? requested : tileCount;
        return Math.max(1, Math.min(wanted, maxWorkers));
    }

    /**
     * Computes all tiles of a chunk.
     *
     * @param chunk       the chunk
     * @param input       full-domain chunk input
     * @param tiles       tiles covering the input's extent
     * @param references  shared reference surfaces
     * @param calculator  the Calculator
     * @param workerCount requested pool size, 0 for one thread per tile
     * @return the successful run; close it after merging to delete the tile artifacts
     * @throws ChunkProcessingException if any tile fails or the chunk times out
     */
    public TileRun runChunk(TimeChunk chunk, GridDataset input, List<TileSpec> tiles, ReferenceCache references,
                            ICalculator calculator, int workerCount) throws ChunkProcessingException {
        if (tiles.isEmpty()) {
            throw new IllegalArgumentException("No tiles for chunk " + chunk);
        }
        int threads = resolveWorkerCount(workerCount, tiles.size());
        state.set(ChunkState.PENDING);
        TileArtifactScope scope = new TileArtifactScope(tileStore, chunk);
        ExecutorService pool = Executors.newFixedThreadPool(threads, threadFactory);
        boolean handedOff = false;
        try {
            log.info("Chunk {}: running {} tile(s) on {} worker(s)", chunk, tiles.size(), threads);
            long startNanos = System.nanoTime();
            state.set(ChunkState.RUNNING);

            List<Future<TileArtifactHandle>> futures = new ArrayList<>(tiles.size());
            for (TileSpec tile : tiles) {
                futures.add(pool.submit(() -> computeTile(tile, input, references, calculator, scope)));
            }
            pool.shutdown();

            List<TileArtifactHandle> handles = new ArrayList<>(tiles.size());
            List<Throwable> failures = new ArrayList<>();
            long deadline = startNanos + chunkTimeout.toNanos();
            try {
                for (int i = 0; i < futures.size(); i++) {
                    TileSpec tile = tiles.get(i);
                    long remaining = Math.max(0, deadline - System.nanoTime());
                    try {
                        handles.add(futures.get(i).get(remaining, TimeUnit.NANOSECONDS));
                    } catch (TimeoutException e) {
                        failures.add(new TileComputationFailedException(tile.name(),
                            new TimeoutException("chunk timeout of " + chunkTimeout + " exceeded")));
                    } catch (ExecutionException e) {
                        failures.add(unwrap(tile, e.getCause()));
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pool.shutdownNow();
                throw new ChunkProcessingException(chunk, "interrupted while waiting for tiles");
            }

            if (!failures.isEmpty()) {
                scope.close();
                for (Throwable failure : failures) {
                    if (failure instanceof DimensionMismatchException) {
                        log.error("Chunk {}: {}", chunk, failure.getMessage());
                    } else {
                        log.warn("Chunk {}: {}", chunk, failure.getMessage());
                    }
                    log.debug("Tile failure", failure);
                }
                throw new ChunkProcessingException(chunk, failures);
            }

            log.debug("Chunk {}: all {} tile(s) done in {}ms", chunk, tiles.size(),
                TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
            TileRun run = new TileRun(chunk, handles, scope);
            state.set(ChunkState.ALL_SUCCEEDED);
            handedOff = true;
            return run;
        } finally {
            if (!handedOff) {
                // Timed-out tasks are abandoned, not interrupted; only an unexpected exit stops them.
                if (!pool.isShutdown()) {
                    pool.shutdownNow();
                }
                scope.close();
                state.set(ChunkState.PARTIALLY_FAILED);
            }
        }
    }

    private TileArtifactHandle computeTile(TileSpec tile, GridDataset input, ReferenceCache references,
                                           ICalculator calculator, TileArtifactScope scope)
            throws TileComputationFailedException {
        Map<String, ReferenceSurface> tileReferences;
        try {
            tileReferences = references.subset(tile);
        } catch (DimensionMismatchException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TileComputationFailedException(tile.name(), e);
        }
        return worker.process(tile, input, tileReferences, calculator, scope);
    }

    private static Throwable unwrap(TileSpec tile, Throwable cause) {
        if (cause instanceof TileComputationFailedException || cause instanceof DimensionMismatchException) {
            return cause;
        }
        return new TileComputationFailedException(tile.name(), cause);
    }

    private ThreadFactory daemonThreads() {
        return runnable -> {
            Thread thread = new Thread(runnable, "tile-worker-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
