package org.timberline.pipeline.api.resources.storage;

import java.nio.file.Path;

import org.timberline.pipeline.api.grid.GridDataset;
import org.timberline.pipeline.api.grid.TileSpec;

/**
 * Persists gridded datasets as self-describing artifact files under a root directory.
 * <p>
 * The underlying writer is not safe for concurrent use; implementations serialize
 * writes internally, holding the lock only for the duration of a single write.
 * Reads and deletes may run concurrently.
 */
public interface IArtifactStore {

    /**
     * Writes an artifact atomically (temporary file, then rename).
     *
     * @param key     path relative to the store root, using {@code /} separators
     * @param name    artifact name recorded inside the file
     * @param dataset data to store
     * @param tile    tile the data covers, or null
     * @return absolute path of the written artifact
     * @throws ArtifactIOException if the write fails after all retries
     */
    Path write(String key, String name, GridDataset dataset, TileSpec tile) throws ArtifactIOException;

    /**
     * Reads an artifact fully into memory.
     *
     * @param path absolute path returned by {@link #write}
     * @return the decoded artifact, owning all of its arrays
     * @throws ArtifactIOException if the file is missing, unreadable or corrupt
     */
    DecodedArtifact read(Path path) throws ArtifactIOException;

    /**
     * Deletes an artifact if it exists.
     *
     * @param path absolute path of the artifact
     * @return true if a file was deleted
     * @throws ArtifactIOException if the file exists but cannot be deleted
     */
    boolean delete(Path path) throws ArtifactIOException;

    /**
     * Removes a directory below the root if it is empty. Missing or non-empty
     * directories are left alone.
     *
     * @param key directory path relative to the store root
     */
    void deleteDirectoryIfEmpty(String key);

    /**
     * Returns the absolute root directory of this store.
     */
    Path root();
}
