package org.timberline.pipeline.tiling;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.timberline.pipeline.TestGrids;
import org.timberline.pipeline.api.calculator.ICalculator;
import org.timberline.pipeline.api.grid.GridDataset;
import org.timberline.pipeline.api.grid.TileSpec;
import org.timberline.pipeline.api.grid.TimeChunk;
import org.timberline.pipeline.api.tiling.PartialResultPolicy;
import org.timberline.pipeline.calculators.TemperatureIndexCalculator;
import org.timberline.pipeline.resources.storage.FileSystemArtifactStore;
import org.timberline.pipeline.resources.storage.FileSystemReferenceSource;

import com.typesafe.config.ConfigFactory;

/**
 * Tiled runs must reproduce the untiled result exactly.
 */
@Tag("integration")
class TilingEquivalenceTest {

    private static final TimeChunk CHUNK = new TimeChunk(2001, 2002);

    @TempDir
    Path tempDir;

    private FileSystemArtifactStore tileStore;
    private ReferenceCache references;
    private ICalculator calculator;
    private GridDataset input;

    @BeforeEach
    void setUp() throws IOException {
        tileStore = new FileSystemArtifactStore("tiles", TestGrids.storeOptions(tempDir.resolve("tiles")));
        FileSystemReferenceSource referenceSource = new FileSystemReferenceSource("references",
            TestGrids.storeOptions(tempDir.resolve("references")));
        referenceSource.write(TestGrids.surface(TemperatureIndexCalculator.TX90P_THRESHOLD, 366, 6, 8,
            (d, la, lo) -> 18f + la + 0.25f * lo), 100);
        referenceSource.write(TestGrids.surface(TemperatureIndexCalculator.TN10P_THRESHOLD, 366, 6, 8,
            (d, la, lo) -> -5f + la - 0.25f * lo), 100);

        calculator = new TemperatureIndexCalculator(ConfigFactory.empty());
        references = ReferenceCache.load(referenceSource, calculator.requiredReferences(), ConfigFactory.empty());
        input = TestGrids.temperatureYear(2001, 6, 8);
    }

    private GridDataset runTiled(List<TileSpec> tiles) throws Exception {
        TileScheduler scheduler = new TileScheduler(new TileWorker(PartialResultPolicy.KEEP_PARTIAL), tileStore, 8,
            Duration.ofMinutes(1));
        TileMerger merger = new TileMerger(tileStore);
        try (TileRun run = scheduler.runChunk(CHUNK, input, tiles, references, calculator, 0)) {
            return merger.merge(run.handles(), input.extent());
        }
    }

    @ParameterizedTest
    @ValueSource(ints = {2, 4, 8})
    void tiledResultEqualsFullDomainResult(int tileCount) throws Exception {
        GridDataset untiled = runTiled(DomainGrid.fullDomain(input.extent()));
        GridDataset tiled = runTiled(DomainGrid.computeTiles(input.extent(), tileCount));

        assertThat(tiled.variableNames()).containsExactly("tg_mean", "frost_days", "summer_days", "tx90p", "tn10p");
        assertThat(tiled.variableNames()).containsExactlyElementsOf(untiled.variableNames());
        assertThat(tiled.lat()).containsExactly(untiled.lat());
        assertThat(tiled.lon()).containsExactly(untiled.lon());
        assertThat(tiled.time()).containsExactly(untiled.time());
        for (String name : untiled.variableNames()) {
            assertThat(tiled.variable(name).sameValues(untiled.variable(name)))
                .as("variable %s with %d tiles", name, tileCount)
                .isTrue();
            assertThat(tiled.variable(name).attributes()).isEqualTo(untiled.variable(name).attributes());
        }
    }

    @ParameterizedTest
    @ValueSource(ints = {2, 4, 8})
    void tiledResultEqualsFullDomainResultForSimpleSums(int tileCount) throws Exception {
        Map<String, TestGrids.CellValue> variables = new HashMap<>();
        variables.put("v", (t, la, lo) -> (t % 7) * 0.5f + la * 3 - lo);
        input = TestGrids.dataset(TestGrids.firstDays(2001, 40), 6, 8, variables);
        calculator = new TestCalculator();
        references = ReferenceCache.empty();

        GridDataset untiled = runTiled(DomainGrid.fullDomain(input.extent()));
        GridDataset tiled = runTiled(DomainGrid.computeTiles(input.extent(), tileCount));

        assertThat(tiled.variable("total").sameValues(untiled.variable("total"))).isTrue();
        assertThat(tiled.variable("peak").sameValues(untiled.variable("peak"))).isTrue();
    }
}
