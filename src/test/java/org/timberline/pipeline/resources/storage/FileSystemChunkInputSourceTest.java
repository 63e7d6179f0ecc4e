package org.timberline.pipeline.resources.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.timberline.pipeline.TestGrids;
import org.timberline.pipeline.api.grid.GridDataset;
import org.timberline.pipeline.api.grid.TimeChunk;
import org.timberline.pipeline.api.resources.storage.ArtifactIOException;

import com.typesafe.config.ConfigFactory;

@Tag("unit")
class FileSystemChunkInputSourceTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void writeInput() throws IOException {
        FileSystemArtifactStore store = new FileSystemArtifactStore("input", TestGrids.storeOptions(tempDir));
        for (int year = 1981; year <= 1983; year++) {
            GridDataset dataset = TestGrids.temperatureYear(year, 3, 4);
            store.write(FileSystemChunkInputSource.fileNameFor(year), Integer.toString(year), dataset, null);
        }
    }

    @Test
    void singleYearChunkLoadsOneFile() throws IOException {
        FileSystemChunkInputSource source = new FileSystemChunkInputSource("input", TestGrids.storeOptions(tempDir));

        GridDataset input = source.load(new TimeChunk(1981, 1982));

        assertThat(input.timeCount()).isEqualTo(365);
        assertThat(input.variableNames()).containsExactlyInAnyOrder("tmax", "tmin");
    }

    @Test
    void multiYearChunkIsConcatenatedAlongTime() throws IOException {
        FileSystemChunkInputSource source = new FileSystemChunkInputSource("input", TestGrids.storeOptions(tempDir));

        GridDataset input = source.load(new TimeChunk(1982, 1984));

        assertThat(input.timeCount()).isEqualTo(365 + 365);
        assertThat(input.time()[0]).isEqualTo(TestGrids.daysOfYear(1982)[0]);
        assertThat(input.time()[729]).isEqualTo(TestGrids.daysOfYear(1983)[364]);
    }

    @Test
    void variableFilterRestrictsTheInput() throws IOException {
        Map<String, Object> options = new HashMap<>(TestGrids.storeOptions(tempDir).root().unwrapped());
        options.put("variables", List.of("tmin"));
        FileSystemChunkInputSource source = new FileSystemChunkInputSource("input", ConfigFactory.parseMap(options));

        assertThat(source.load(new TimeChunk(1981, 1982)).variableNames()).containsExactly("tmin");
    }

    @Test
    void missingVariableOrYearFails() {
        Map<String, Object> options = new HashMap<>(TestGrids.storeOptions(tempDir).root().unwrapped());
        options.put("variables", List.of("precip"));
        FileSystemChunkInputSource filtered = new FileSystemChunkInputSource("input", ConfigFactory.parseMap(options));
        FileSystemChunkInputSource source = new FileSystemChunkInputSource("input", TestGrids.storeOptions(tempDir));

        assertThatThrownBy(() -> filtered.load(new TimeChunk(1981, 1982)))
            .isInstanceOf(ArtifactIOException.class)
            .hasMessageContaining("precip");
        assertThatThrownBy(() -> source.load(new TimeChunk(1983, 1985)))
            .isInstanceOf(ArtifactIOException.class)
            .hasMessageContaining("1984");
    }
}
