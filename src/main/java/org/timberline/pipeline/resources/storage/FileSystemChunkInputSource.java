package org.timberline.pipeline.resources.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.timberline.pipeline.api.grid.Axis;
import org.timberline.pipeline.api.grid.GridDataset;
import org.timberline.pipeline.api.grid.GridVariable;
import org.timberline.pipeline.api.grid.TimeChunk;
import org.timberline.pipeline.api.resources.storage.ArtifactIOException;
import org.timberline.pipeline.api.resources.storage.IChunkInputSource;

import com.typesafe.config.Config;

/**
 * Reads chunk input from one artifact per year, {@code {rootDirectory}/{year}.grid}.
 * Multi-year chunks are concatenated along time in year order.
 * <p>
 * Options: {@code rootDirectory} (required, absolute) and {@code variables}, an optional
 * list restricting which input variables are loaded. An empty list loads everything.
 */
public class FileSystemChunkInputSource implements IChunkInputSource {

    private static final Logger log = LoggerFactory.getLogger(FileSystemChunkInputSource.class);

    public static final String FILE_SUFFIX = ".grid";

    private final Path rootDirectory;
    private final Set<String> variables;
    private final ArtifactCodec codec = ArtifactCodec.uncompressed();

    public FileSystemChunkInputSource(String name, Config options) {
        if (!options.hasPath("rootDirectory")) {
            throw new IllegalArgumentException("rootDirectory is required for input source '" + name + "'");
        }
        this.rootDirectory = Paths.get(options.getString("rootDirectory"));
        if (!rootDirectory.isAbsolute()) {
            throw new IllegalArgumentException("rootDirectory must be an absolute path: " + rootDirectory);
        }
        this.variables = options.hasPath("variables")
            ? new LinkedHashSet<>(options.getStringList("variables"))
            : Set.of();
    }

    public Path root() {
        return rootDirectory;
    }

    public Set<String> variables() {
        return variables;
    }

    public static String fileNameFor(int year) {
        return year + FILE_SUFFIX;
    }

    @Override
    public GridDataset load(TimeChunk chunk) throws IOException {
        List<GridDataset> years = new ArrayList<>(chunk.length());
        for (int year = chunk.start(); year < chunk.endExclusive(); year++) {
            years.add(loadYear(year));
        }
        log.debug("Loaded input for chunk {} from {} file(s)", chunk, years.size());
        return years.size() == 1 ? years.get(0) : GridDataset.concat(years, Axis.TIME);
    }

    private GridDataset loadYear(int year) throws IOException {
        Path file = rootDirectory.resolve(fileNameFor(year));
        if (!Files.isRegularFile(file)) {
            throw new ArtifactIOException("Input for year " + year + " not found: " + file, false);
        }
        GridDataset dataset = codec.decode(Files.readAllBytes(file)).dataset();
        if (variables.isEmpty()) {
            return dataset;
        }
        List<GridVariable> selected = new ArrayList<>(variables.size());
        for (String name : variables) {
            GridVariable variable = dataset.variable(name);
            if (variable == null) {
                throw new ArtifactIOException("Input for year " + year + " lacks variable '" + name + "'", false);
            }
            selected.add(variable);
        }
        return new GridDataset(dataset.lat(), dataset.lon(), dataset.time(), dataset.fillValue(),
            selected, dataset.attributes());
    }
}
