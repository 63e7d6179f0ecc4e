package org.timberline.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.timberline.pipeline.api.calculator.ICalculator;
import org.timberline.pipeline.api.resources.storage.ArtifactIOException;
import org.timberline.pipeline.api.tiling.PartialResultPolicy;
import org.timberline.pipeline.calculators.TemperatureIndexCalculator;
import org.timberline.pipeline.resources.storage.FileSystemArtifactStore;
import org.timberline.pipeline.resources.storage.FileSystemChunkInputSource;
import org.timberline.pipeline.resources.storage.FileSystemReferenceSource;
import org.timberline.pipeline.tiling.ChunkDriver;
import org.timberline.pipeline.tiling.RunSummary;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

@Tag("unit")
class TilingPipelineFactoryTest {

    @TempDir
    Path tempDir;

    private Config config(Map<String, Object> overrides) {
        Map<String, Object> values = new HashMap<>(overrides);
        values.put("pipeline.dataBaseDir", tempDir.toString());
        return ConfigFactory.parseMap(values).withFallback(ConfigFactory.defaultReference()).resolve();
    }

    private Config config() {
        return config(Map.of());
    }

    @Test
    void defaultsComeFromTheBundledReferenceConfiguration() {
        TilingPipelineFactory factory = new TilingPipelineFactory(config());

        assertThat(factory.defaultTileCount()).isEqualTo(4);
        assertThat(factory.defaultWorkers()).isZero();
        assertThat(factory.defaultChunkSize()).isEqualTo(1);
        assertThat(factory.defaultStart()).isEqualTo(1981);
        assertThat(factory.defaultEnd()).isEqualTo(2024);
        assertThat(factory.partialResultPolicy()).isEqualTo(PartialResultPolicy.KEEP_PARTIAL);
    }

    @Test
    void relativeDirectoriesResolveAgainstTheDataBaseDirectory() {
        TilingPipelineFactory factory = new TilingPipelineFactory(config());
        Path absolute = tempDir.resolve("elsewhere").toAbsolutePath();

        assertThat(factory.resolveDirectory("output")).isEqualTo(tempDir.toAbsolutePath().resolve("output").normalize());
        assertThat(factory.resolveDirectory(absolute.toString())).isEqualTo(absolute);
    }

    @Test
    void partialResultPolicyIsParsedCaseInsensitively() {
        assertThat(new TilingPipelineFactory(config(Map.of("pipeline.tiling.partialResults", "fail_tile")))
            .partialResultPolicy()).isEqualTo(PartialResultPolicy.FAIL_TILE);
        assertThatThrownBy(() -> new TilingPipelineFactory(config(Map.of("pipeline.tiling.partialResults", "maybe")))
            .partialResultPolicy())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maybe");
    }

    @Test
    void missingPipelineSectionIsRejected() {
        assertThatThrownBy(() -> new TilingPipelineFactory(ConfigFactory.empty()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void calculatorIsInstantiatedWithItsOptions() {
        ICalculator calculator = new TilingPipelineFactory(
            config(Map.of("pipeline.calculator.options.indices", List.of("tg_mean")))).createCalculator();

        assertThat(calculator).isInstanceOf(TemperatureIndexCalculator.class);
        assertThat(calculator.requiredReferences()).isEmpty();
        assertThat(calculator.globalAttributes()).containsEntry("indices", "tg_mean");
    }

    @Test
    void unusableCalculatorClassIsRejected() {
        assertThatThrownBy(() -> new TilingPipelineFactory(
            config(Map.of("pipeline.calculator.className", "org.timberline.NoSuchCalculator"))).createCalculator())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("not found");
        assertThatThrownBy(() -> new TilingPipelineFactory(
            config(Map.of("pipeline.calculator.className", "java.lang.String"))).createCalculator())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("does not implement");
        assertThatThrownBy(() -> new TilingPipelineFactory(
            config(Map.of("pipeline.calculator.options.indices", List.of("hot_nights")))).createCalculator())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("hot_nights");
    }

    @Test
    void missingReferenceSurfaceFailsDriverCreation() {
        TilingPipelineFactory factory = new TilingPipelineFactory(config());

        assertThatThrownBy(() -> factory.createDriver(0))
            .isInstanceOf(ArtifactIOException.class)
            .hasMessageContaining("tx90p_threshold");
    }

    @Test
    void driverRunsAgainstTheConfiguredDirectories() throws IOException {
        FileSystemArtifactStore input = new FileSystemArtifactStore("input",
            TestGrids.storeOptions(tempDir.resolve("input")));
        for (int year = 2001; year <= 2002; year++) {
            input.write(FileSystemChunkInputSource.fileNameFor(year), Integer.toString(year),
                TestGrids.temperatureYear(year, 4, 4), null);
        }
        FileSystemReferenceSource references = new FileSystemReferenceSource("reference",
            TestGrids.storeOptions(tempDir.resolve("reference")));
        references.write(TestGrids.surface(TemperatureIndexCalculator.TX90P_THRESHOLD, 366, 4, 4,
            (d, la, lo) -> 20f), 183);
        references.write(TestGrids.surface(TemperatureIndexCalculator.TN10P_THRESHOLD, 366, 4, 4,
            (d, la, lo) -> 0f), 183);

        ChunkDriver driver = new TilingPipelineFactory(config()).createDriver(2);
        RunSummary summary = driver.run(2001, 2002, 2, 8);

        assertThat(summary.allSucceeded()).isTrue();
        assertThat(Path.of(summary.chunks().get(0).output()))
            .isEqualTo(tempDir.resolve("output").resolve("indices_2001_2002.grid").toAbsolutePath().normalize())
            .exists();
        assertThat(tempDir.resolve("tmp")).isEmptyDirectory();
    }
}
