package org.timberline.pipeline.resources.storage;

import java.io.IOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.timberline.pipeline.api.grid.GridDataset;
import org.timberline.pipeline.api.grid.TileSpec;
import org.timberline.pipeline.api.resources.storage.ArtifactIOException;
import org.timberline.pipeline.api.resources.storage.DecodedArtifact;
import org.timberline.pipeline.api.resources.storage.IArtifactStore;

import com.typesafe.config.Config;

/**
 * Artifact store on the local file system.
 * <p>
 * Writes go to a {@code .UUID.tmp} sibling and are then moved into place atomically, so
 * readers never observe a partially written artifact. All writes of one store share a
 * single {@link ReentrantLock}; encoding and compression happen before the lock is taken
 * and the lock is released between retry attempts.
 * <p>
 * Options:
 * <ul>
 *   <li>{@code rootDirectory} (required, absolute)</li>
 *   <li>{@code compression}: {@code zstd} (default) or {@code none}</li>
 *   <li>{@code compressionLevel}: zstd level, default 3</li>
 *   <li>{@code writeAttempts}: attempts for transient write failures, default 3</li>
 *   <li>{@code retryBackoff}: pause between attempts, doubled each time, default 250ms</li>
 * </ul>
 */
public class FileSystemArtifactStore implements IArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemArtifactStore.class);

    private final String name;
    private final Path rootDirectory;
    private final ArtifactCodec codec;
    private final int writeAttempts;
    private final Duration retryBackoff;
    private final ReentrantLock writeLock = new ReentrantLock();

    public FileSystemArtifactStore(String name, Config options) {
        this.name = name;
        if (!options.hasPath("rootDirectory")) {
            throw new IllegalArgumentException("rootDirectory is required for FileSystemArtifactStore '" + name + "'");
        }
        String rootPath = options.getString("rootDirectory");
        this.rootDirectory = Paths.get(rootPath);
        if (!rootDirectory.isAbsolute()) {
            throw new IllegalArgumentException("rootDirectory must be an absolute path: " + rootPath);
        }
        try {
            Files.createDirectories(rootDirectory);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot create rootDirectory: " + rootPath, e);
        }
        if (!Files.isWritable(rootDirectory)) {
            throw new IllegalArgumentException("rootDirectory is not writable: " + rootPath);
        }

        ArtifactCodec.Compression compression = options.hasPath("compression")
            ? ArtifactCodec.Compression.parse(options.getString("compression"))
            : ArtifactCodec.Compression.ZSTD;
        int level = options.hasPath("compressionLevel") ? options.getInt("compressionLevel") : 3;
        this.codec = new ArtifactCodec(compression, level);
        this.writeAttempts = options.hasPath("writeAttempts") ? options.getInt("writeAttempts") : 3;
        this.retryBackoff = options.hasPath("retryBackoff") ? options.getDuration("retryBackoff") : Duration.ofMillis(250);
        if (writeAttempts < 1) {
            throw new IllegalArgumentException("writeAttempts must be at least 1, got " + writeAttempts);
        }
        log.debug("Artifact store '{}' at {} (compression={}, writeAttempts={})",
            name, rootDirectory, compression, writeAttempts);
    }

    @Override
    public Path write(String key, String artifactName, GridDataset dataset, TileSpec tile) throws ArtifactIOException {
        validateKey(key);
        Path target = rootDirectory.resolve(key);
        byte[] data = codec.encode(artifactName, dataset, tile);

        Duration pause = retryBackoff;
        for (int attempt = 1; ; attempt++) {
            writeLock.lock();
            try {
                writeRaw(target, data);
                return target;
            } catch (IOException e) {
                ArtifactIOException failure = ArtifactIOException.wrap("Failed to write artifact " + key, e);
                if (!failure.isRetryable() || attempt >= writeAttempts) {
                    throw failure;
                }
                log.warn("Write of artifact {} failed (attempt {}/{}), retrying in {}ms: {}",
                    key, attempt, writeAttempts, pause.toMillis(), e.getMessage());
            } finally {
                writeLock.unlock();
            }
            sleep(pause, key);
            pause = pause.multipliedBy(2);
        }
    }

    /**
     * Writes bytes to {@code target} through a temporary file and an atomic move.
     * Called with the write lock held.
     *
     * @param target final location of the artifact
     * @param data   encoded artifact
     * @throws IOException if the write or the move fails
     */
    protected void writeRaw(Path target, byte[] data) throws IOException {
        Path parentDir = target.getParent();
        Files.createDirectories(parentDir);

        Path tempFile = parentDir.resolve(target.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            writeTemp(tempFile, data);
            Files.move(tempFile, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException cleanupEx) {
                log.warn("Failed to clean up temp file after failed write: {}", tempFile);
                log.debug("Cleanup failure", cleanupEx);
            }
            throw e;
        }
    }

    /**
     * Writes the encoded bytes to the temporary sibling of the final artifact.
     *
     * @param tempFile temporary file next to the target
     * @param data     encoded artifact
     * @throws IOException if the write fails, possibly after part of the data reached disk
     */
    protected void writeTemp(Path tempFile, byte[] data) throws IOException {
        Files.write(tempFile, data);
    }

    @Override
    public DecodedArtifact read(Path path) throws ArtifactIOException {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            throw new ArtifactIOException("Artifact does not exist: " + path, e, false);
        } catch (IOException e) {
            throw ArtifactIOException.wrap("Failed to read artifact " + path, e);
        }
        try {
            return codec.decode(bytes);
        } catch (ArtifactIOException e) {
            throw new ArtifactIOException(e.getMessage() + " (" + path + ")", e, false);
        }
    }

    @Override
    public boolean delete(Path path) throws ArtifactIOException {
        try {
            return Files.deleteIfExists(path);
        } catch (IOException e) {
            throw ArtifactIOException.wrap("Failed to delete artifact " + path, e);
        }
    }

    @Override
    public void deleteDirectoryIfEmpty(String key) {
        validateKey(key);
        Path directory = rootDirectory.resolve(key);
        if (!Files.isDirectory(directory)) {
            return;
        }
        try {
            Files.delete(directory);
        } catch (DirectoryNotEmptyException e) {
            log.debug("Directory {} not empty, leaving it in place", directory);
        } catch (IOException e) {
            log.warn("Failed to delete directory {}: {}", directory, e.getMessage());
            log.debug("Directory deletion failure", e);
        }
    }

    @Override
    public Path root() {
        return rootDirectory;
    }

    public String getName() {
        return name;
    }

    private static void sleep(Duration pause, String key) throws ArtifactIOException {
        try {
            Thread.sleep(pause.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ArtifactIOException("Interrupted while retrying write of " + key, e, false);
        }
    }

    private static void validateKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Key cannot be null or empty");
        }
        if (key.contains("..")) {
            throw new IllegalArgumentException("Key cannot contain '..' (path traversal attempt): " + key);
        }
        if (key.startsWith("/") || key.startsWith("\\")) {
            throw new IllegalArgumentException("Key cannot be an absolute path: " + key);
        }
        if (key.length() >= 2 && key.charAt(1) == ':') {
            throw new IllegalArgumentException("Key cannot contain Windows drive letter: " + key);
        }
        for (char c : "<>\"?*|".toCharArray()) {
            if (key.indexOf(c) >= 0) {
                throw new IllegalArgumentException("Key contains invalid character '" + c + "': " + key);
            }
        }
    }
}
