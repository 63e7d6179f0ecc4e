package org.timberline.pipeline.tiling;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.timberline.pipeline.api.grid.GridDataset;
import org.timberline.pipeline.api.grid.TileSpec;
import org.timberline.pipeline.api.grid.TimeChunk;
import org.timberline.pipeline.api.resources.storage.ArtifactIOException;
import org.timberline.pipeline.api.resources.storage.IArtifactStore;
import org.timberline.pipeline.api.resources.storage.TileArtifactHandle;

/**
 * Owns the temporary tile artifacts of one chunk.
 * <p>
 * Every artifact written through the scope is registered before {@link #write} returns,
 * and {@link #close()} deletes each registered artifact exactly once together with the
 * scope directory. After close, further writes are refused, so a task that outlives its
 * chunk (timeout) cannot leave a file behind.
 * <p>
 * Writes from worker threads run concurrently with each other under the read side of a
 * read/write lock; close takes the write side, so it waits for in-progress writes and
 * never races a registration.
 */
public final class TileArtifactScope implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TileArtifactScope.class);

    private final IArtifactStore store;
    private final String directoryKey;
    private final String runId;
    private final List<Path> artifacts = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private boolean closed;

    public TileArtifactScope(IArtifactStore store, TimeChunk chunk) {
        this.store = store;
        this.runId = ProcessHandle.current().pid() + "_" + UUID.randomUUID().toString().substring(0, 8);
        this.directoryKey = "chunk_" + chunk.label() + "_" + runId;
    }

    /**
     * Persists one tile result and registers it for cleanup.
     *
     * @throws ArtifactIOException if the scope is closed or the write fails
     */
    public TileArtifactHandle write(TileSpec tile, GridDataset dataset) throws ArtifactIOException {
        String key = directoryKey + "/tile_" + runId + "_" + tile.name() + ".grid";
        lock.readLock().lock();
        try {
            if (closed) {
                throw new ArtifactIOException("Scope " + directoryKey + " is closed; discarding tile "
                    + tile.name(), false);
            }
            Path path = store.write(key, tile.name(), dataset, tile);
            synchronized (artifacts) {
                artifacts.add(path);
            }
            return new TileArtifactHandle(tile, path);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isClosed() {
        lock.readLock().lock();
        try {
            return closed;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the artifacts currently registered.
     */
    public List<Path> artifacts() {
        synchronized (artifacts) {
            return List.copyOf(artifacts);
        }
    }

    public String directoryKey() {
        return directoryKey;
    }

    /**
     * Deletes all registered artifacts and the scope directory. Idempotent; failures are
     * logged and never thrown.
     */
    @Override
    public void close() {
        List<Path> toDelete;
        lock.writeLock().lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            synchronized (artifacts) {
                toDelete = List.copyOf(artifacts);
                artifacts.clear();
            }
        } finally {
            lock.writeLock().unlock();
        }

        int deleted = 0;
        for (Path path : toDelete) {
            try {
                if (store.delete(path)) {
                    deleted++;
                }
            } catch (ArtifactIOException e) {
                log.warn("Failed to delete tile artifact {}: {}", path, e.getMessage());
                log.debug("Deletion failure", e);
            }
        }
        store.deleteDirectoryIfEmpty(directoryKey);
        log.debug("Closed tile scope {}: deleted {}/{} artifact(s)", directoryKey, deleted, toDelete.size());
    }
}
