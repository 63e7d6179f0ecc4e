package org.timberline.pipeline.resources.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.timberline.pipeline.TestGrids;
import org.timberline.pipeline.api.grid.GridDataset;
import org.timberline.pipeline.api.grid.IndexRange;
import org.timberline.pipeline.api.grid.TileSpec;
import org.timberline.pipeline.api.resources.storage.ArtifactIOException;
import org.timberline.pipeline.api.resources.storage.DecodedArtifact;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

@Tag("unit")
class FileSystemArtifactStoreTest {

    @TempDir
    Path tempDir;

    private final GridDataset dataset = TestGrids.dataset(TestGrids.firstDays(1990, 2), 3, 4,
        Map.of("x", (t, la, lo) -> t + la + lo));
    private final TileSpec tile = new TileSpec("west", new IndexRange(0, 3), new IndexRange(0, 4));

    @Test
    void writeThenReadReturnsTheStoredArtifact() throws IOException {
        FileSystemArtifactStore store = new FileSystemArtifactStore("tiles", TestGrids.storeOptions(tempDir));

        Path path = store.write("chunk_1990_1990/tile_west.grid", "west", dataset, tile);
        DecodedArtifact artifact = store.read(path);

        assertThat(path).isEqualTo(tempDir.resolve("chunk_1990_1990/tile_west.grid"));
        assertThat(artifact.tileSpec()).contains(tile);
        assertThat(artifact.dataset().variable("x").sameValues(dataset.variable("x"))).isTrue();
        try (Stream<Path> files = Files.list(path.getParent())) {
            assertThat(files).containsExactly(path);
        }
    }

    @Test
    void defaultCompressionIsZstd() throws IOException {
        Config options = ConfigFactory.parseMap(Map.of("rootDirectory", tempDir.toString()));
        FileSystemArtifactStore store = new FileSystemArtifactStore("output", options);

        Path path = store.write("out.grid", "out", dataset, null);

        assertThat(Files.readAllBytes(path)[4]).isEqualTo((byte) 1);
        assertThat(store.read(path).dataset().extent()).isEqualTo(dataset.extent());
    }

    @Test
    void transientWriteFailuresAreRetried() throws IOException {
        AtomicInteger attempts = new AtomicInteger();
        FileSystemArtifactStore store = new FileSystemArtifactStore("tiles", TestGrids.storeOptions(tempDir)) {
            @Override
            protected void writeRaw(Path target, byte[] data) throws IOException {
                if (attempts.incrementAndGet() < 3) {
                    throw new IOException("temporary hiccup");
                }
                super.writeRaw(target, data);
            }
        };

        Path path = store.write("retry.grid", "retry", dataset, null);

        assertThat(attempts.get()).isEqualTo(3);
        assertThat(path).exists();
    }

    @Test
    void writeFailsAfterTheConfiguredAttempts() {
        Map<String, Object> options = new HashMap<>(TestGrids.storeOptions(tempDir).root().unwrapped());
        options.put("writeAttempts", 2);
        AtomicInteger attempts = new AtomicInteger();
        FileSystemArtifactStore store = new FileSystemArtifactStore("tiles", ConfigFactory.parseMap(options)) {
            @Override
            protected void writeRaw(Path target, byte[] data) throws IOException {
                attempts.incrementAndGet();
                throw new IOException("still failing");
            }
        };

        assertThatThrownBy(() -> store.write("fail.grid", "fail", dataset, null))
            .isInstanceOf(ArtifactIOException.class)
            .hasMessageContaining("still failing");
        assertThat(attempts.get()).isEqualTo(2);
    }

    @Test
    void permanentFailuresAreNotRetried() {
        AtomicInteger attempts = new AtomicInteger();
        FileSystemArtifactStore store = new FileSystemArtifactStore("tiles", TestGrids.storeOptions(tempDir)) {
            @Override
            protected void writeRaw(Path target, byte[] data) throws IOException {
                attempts.incrementAndGet();
                throw new AccessDeniedException(target.toString());
            }
        };

        assertThatThrownBy(() -> store.write("denied.grid", "denied", dataset, null))
            .isInstanceOf(ArtifactIOException.class)
            .satisfies(e -> assertThat(((ArtifactIOException) e).isRetryable()).isFalse());
        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    void partiallyWrittenTempFilesAreRemovedOnEveryAttempt() throws IOException {
        AtomicInteger attempts = new AtomicInteger();
        FileSystemArtifactStore store = new FileSystemArtifactStore("tiles", TestGrids.storeOptions(tempDir)) {
            @Override
            protected void writeTemp(Path tempFile, byte[] data) throws IOException {
                attempts.incrementAndGet();
                Files.write(tempFile, Arrays.copyOf(data, data.length / 2));
                throw new IOException("File too large");
            }
        };

        assertThatThrownBy(() -> store.write("chunk_1990_1990/tile_west.grid", "west", dataset, tile))
            .isInstanceOf(ArtifactIOException.class)
            .hasMessageContaining("File too large");
        assertThat(attempts.get()).isEqualTo(3);
        try (Stream<Path> files = Files.list(tempDir.resolve("chunk_1990_1990"))) {
            assertThat(files).isEmpty();
        }

        store.deleteDirectoryIfEmpty("chunk_1990_1990");
        assertThat(tempDir.resolve("chunk_1990_1990")).doesNotExist();
    }

    @Test
    void writesAreSerialized() throws Exception {
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        FileSystemArtifactStore store = new FileSystemArtifactStore("tiles", TestGrids.storeOptions(tempDir)) {
            @Override
            protected void writeRaw(Path target, byte[] data) throws IOException {
                int now = inside.incrementAndGet();
                maxInside.accumulateAndGet(now, Math::max);
                try {
                    Thread.sleep(5);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                super.writeRaw(target, data);
                inside.decrementAndGet();
            }
        };

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Future<Path>> futures = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                String key = "parallel/tile_" + i + ".grid";
                futures.add(pool.submit(() -> store.write(key, "t", dataset, null)));
            }
            for (Future<Path> future : futures) {
                assertThat(future.get()).exists();
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(maxInside.get()).isEqualTo(1);
    }

    @Test
    void readingAMissingArtifactFails() throws IOException {
        FileSystemArtifactStore store = new FileSystemArtifactStore("tiles", TestGrids.storeOptions(tempDir));

        assertThatThrownBy(() -> store.read(tempDir.resolve("missing.grid")))
            .isInstanceOf(ArtifactIOException.class)
            .hasMessageContaining("does not exist");
    }

    @Test
    void deleteAndDirectoryCleanup() throws IOException {
        FileSystemArtifactStore store = new FileSystemArtifactStore("tiles", TestGrids.storeOptions(tempDir));
        Path path = store.write("scope/a.grid", "a", dataset, null);

        store.deleteDirectoryIfEmpty("scope");
        assertThat(tempDir.resolve("scope")).isDirectory();

        assertThat(store.delete(path)).isTrue();
        assertThat(store.delete(path)).isFalse();
        store.deleteDirectoryIfEmpty("scope");
        assertThat(tempDir.resolve("scope")).doesNotExist();
    }

    @Test
    void keysMustStayBelowTheRoot() {
        FileSystemArtifactStore store = new FileSystemArtifactStore("tiles", TestGrids.storeOptions(tempDir));

        assertThatThrownBy(() -> store.write("../escape.grid", "x", dataset, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.write("/abs.grid", "x", dataset, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rootDirectoryMustBeAbsolute() {
        assertThatThrownBy(() -> new FileSystemArtifactStore("tiles",
            ConfigFactory.parseMap(Map.of("rootDirectory", "relative/dir"))))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("absolute");
        assertThatThrownBy(() -> new FileSystemArtifactStore("tiles", ConfigFactory.empty()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("rootDirectory");
    }
}
