package org.timberline.pipeline.tiling;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.timberline.pipeline.TestGrids;
import org.timberline.pipeline.api.calculator.CalculationException;
import org.timberline.pipeline.api.grid.GridDataset;
import org.timberline.pipeline.api.grid.TileSpec;
import org.timberline.pipeline.api.grid.TimeChunk;
import org.timberline.pipeline.api.resources.storage.TileArtifactHandle;
import org.timberline.pipeline.api.tiling.ChunkProcessingException;
import org.timberline.pipeline.api.tiling.PartialResultPolicy;
import org.timberline.pipeline.api.tiling.TileComputationFailedException;
import org.timberline.pipeline.resources.storage.FileSystemArtifactStore;

@Tag("unit")
class TileWorkerTest {

    private static final TimeChunk CHUNK = new TimeChunk(1990, 1991);

    @TempDir
    Path tempDir;

    private FileSystemArtifactStore store;
    private GridDataset input;
    private List<TileSpec> tiles;

    @BeforeEach
    void setUp() {
        store = new FileSystemArtifactStore("tiles", TestGrids.storeOptions(tempDir));
        input = TestGrids.dataset(TestGrids.firstDays(1990, 3), 6, 8, Map.of("v", (t, la, lo) -> t + la + lo));
        tiles = DomainGrid.computeTiles(input.extent(), 4);
    }

    @Test
    void writesTileResultOnTileCoordinates() throws Exception {
        TileWorker worker = new TileWorker(PartialResultPolicy.KEEP_PARTIAL);
        TileSpec southeast = tiles.get(3);

        try (TileArtifactScope scope = new TileArtifactScope(store, CHUNK)) {
            TileArtifactHandle handle = worker.process(southeast, input, Map.of(), new TestCalculator(), scope);

            GridDataset stored = store.read(handle.path()).dataset();
            assertThat(handle.tile()).isEqualTo(southeast);
            assertThat(stored.extent()).isEqualTo(southeast.extent());
            assertThat(stored.lat()).containsExactly(47.0, 46.0, 45.0);
            assertThat(stored.lon()).containsExactly(14.0, 15.0, 16.0, 17.0);
            assertThat(stored.time()).containsExactly(input.time()[0]);
            // v = t + 3 + 4 at the tile's first cell, summed over three days
            assertThat(stored.variable("total").get(0, 0, 0)).isEqualTo(24f);
            assertThat(stored.variable("peak").get(0, 0, 0)).isEqualTo(9f);
        }
    }

    @Test
    void keepPartialStoresTheResultsThatWereProduced() throws Exception {
        TileWorker worker = new TileWorker(PartialResultPolicy.KEEP_PARTIAL);
        TestCalculator calculator = new TestCalculator(tileInput -> { }, Set.of("total"));

        try (TileArtifactScope scope = new TileArtifactScope(store, CHUNK)) {
            TileArtifactHandle north = worker.process(tiles.get(0), input, Map.of(), calculator, scope);
            TileArtifactHandle south = worker.process(tiles.get(2), input, Map.of(), calculator, scope);

            assertThat(store.read(north.path()).dataset().variableNames()).containsExactly("peak");
            assertThat(store.read(south.path()).dataset().variableNames()).containsExactly("total", "peak");
        }
    }

    @Test
    void failTileRejectsPartialResults() {
        TileWorker worker = new TileWorker(PartialResultPolicy.FAIL_TILE);
        TestCalculator calculator = new TestCalculator(tileInput -> { }, Set.of("total", "peak"));

        try (TileArtifactScope scope = new TileArtifactScope(store, CHUNK)) {
            assertThatThrownBy(() -> worker.process(tiles.get(1), input, Map.of(), calculator, scope))
                .isInstanceOfSatisfying(TileComputationFailedException.class, e -> {
                    assertThat(e.getTileName()).isEqualTo("northeast");
                    assertThat(e.getMessage()).contains("total: not available in the north", "peak");
                });
            assertThat(scope.artifacts()).isEmpty();
        }
    }

    @Test
    void calculatorExceptionBecomesTileFailure() {
        TileWorker worker = new TileWorker(PartialResultPolicy.KEEP_PARTIAL);
        TestCalculator calculator = new TestCalculator(tileInput -> {
            throw new CalculationException("no data");
        });

        try (TileArtifactScope scope = new TileArtifactScope(store, CHUNK)) {
            assertThatThrownBy(() -> worker.process(tiles.get(0), input, Map.of(), calculator, scope))
                .isInstanceOf(TileComputationFailedException.class)
                .hasRootCauseInstanceOf(CalculationException.class)
                .hasRootCauseMessage("no data");
        }
    }

    @Test
    void closedScopeRejectsTheWrite() {
        TileWorker worker = new TileWorker(PartialResultPolicy.KEEP_PARTIAL);
        TileArtifactScope scope = new TileArtifactScope(store, CHUNK);
        scope.close();

        assertThatThrownBy(() -> worker.process(tiles.get(0), input, Map.of(), new TestCalculator(), scope))
            .isInstanceOf(TileComputationFailedException.class)
            .hasMessageContaining("closed");
    }

    @Test
    void mergedChunkKeepsPartialResultsWithFillValueOverFailedTiles() throws Exception {
        TileScheduler scheduler = new TileScheduler(new TileWorker(PartialResultPolicy.KEEP_PARTIAL), store, 4,
            Duration.ofMinutes(1));
        TestCalculator calculator = new TestCalculator(tileInput -> { }, Set.of("total"));

        GridDataset merged;
        try (TileRun run = scheduler.runChunk(CHUNK, input, tiles, ReferenceCache.empty(), calculator, 0)) {
            merged = new TileMerger(store).merge(run.handles(), input.extent());
        }

        assertThat(merged.variableNames()).containsExactlyInAnyOrder("total", "peak");
        for (int la = 0; la < 6; la++) {
            for (int lo = 0; lo < 8; lo++) {
                assertThat(merged.variable("peak").get(0, la, lo)).isEqualTo(2f + la + lo);
                if (la < 3) {
                    assertThat(merged.variable("total").get(0, la, lo)).isNaN();
                } else {
                    assertThat(merged.variable("total").get(0, la, lo)).isEqualTo(3f + 3 * (la + lo));
                }
            }
        }
    }

    @Test
    void failTilePolicyFailsTheChunk() {
        TileScheduler scheduler = new TileScheduler(new TileWorker(PartialResultPolicy.FAIL_TILE), store, 4,
            Duration.ofMinutes(1));
        TestCalculator calculator = new TestCalculator(tileInput -> { }, Set.of("total"));

        assertThatThrownBy(() -> scheduler.runChunk(CHUNK, input, tiles, ReferenceCache.empty(), calculator, 0))
            .isInstanceOfSatisfying(ChunkProcessingException.class, e ->
                assertThat(e.getFailures()).hasSize(2));
    }
}
