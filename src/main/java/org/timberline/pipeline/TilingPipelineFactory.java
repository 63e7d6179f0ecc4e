package org.timberline.pipeline;

import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.timberline.pipeline.api.calculator.ICalculator;
import org.timberline.pipeline.api.tiling.PartialResultPolicy;
import org.timberline.pipeline.resources.storage.FileSystemArtifactStore;
import org.timberline.pipeline.resources.storage.FileSystemChunkInputSource;
import org.timberline.pipeline.resources.storage.FileSystemReferenceSource;
import org.timberline.pipeline.tiling.ChunkDriver;
import org.timberline.pipeline.tiling.ReferenceCache;
import org.timberline.pipeline.tiling.TileMerger;
import org.timberline.pipeline.tiling.TileScheduler;
import org.timberline.pipeline.tiling.TileWorker;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValueFactory;

/**
 * Builds a {@link ChunkDriver} and its collaborators from the {@code pipeline} section of
 * the application configuration.
 * <p>
 * Relative directories are resolved against {@code pipeline.dataBaseDir}, which itself is
 * resolved against the working directory.
 */
public class TilingPipelineFactory {

    private static final Logger log = LoggerFactory.getLogger(TilingPipelineFactory.class);

    private final Config pipeline;
    private final Path dataBaseDir;

    /**
     * @param config the application configuration, containing a {@code pipeline} section
     */
    public TilingPipelineFactory(Config config) {
        if (!config.hasPath("pipeline")) {
            throw new IllegalArgumentException("Configuration has no 'pipeline' section");
        }
        this.pipeline = config.getConfig("pipeline");
        this.dataBaseDir = Paths.get(pipeline.hasPath("dataBaseDir") ? pipeline.getString("dataBaseDir") : ".")
            .toAbsolutePath().normalize();
    }

    public int defaultTileCount() {
        return pipeline.getInt("tiling.tiles");
    }

    public int defaultWorkers() {
        return pipeline.getInt("tiling.workers");
    }

    public int defaultChunkSize() {
        return pipeline.getInt("chunk.size");
    }

    public int defaultStart() {
        return pipeline.getInt("chunk.start");
    }

    public int defaultEnd() {
        return pipeline.getInt("chunk.end");
    }

    public PartialResultPolicy partialResultPolicy() {
        String value = pipeline.hasPath("tiling.partialResults") ? pipeline.getString("tiling.partialResults") : "KEEP_PARTIAL";
        try {
            return PartialResultPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown pipeline.tiling.partialResults '" + value
                + "', expected KEEP_PARTIAL or FAIL_TILE");
        }
    }

    /**
     * Resolves a configured directory to an absolute path.
     */
    public Path resolveDirectory(String configured) {
        Path path = Paths.get(configured);
        return (path.isAbsolute() ? path : dataBaseDir.resolve(path)).normalize();
    }

    /**
     * Instantiates the Calculator named by {@code pipeline.calculator.className} through
     * its {@code (Config options)} constructor.
     *
     * @throws IllegalArgumentException if the class cannot be loaded or instantiated
     */
    public ICalculator createCalculator() {
        Config calculatorConfig = pipeline.getConfig("calculator");
        String className = calculatorConfig.getString("className");
        Config options = calculatorConfig.hasPath("options")
            ? calculatorConfig.getConfig("options")
            : ConfigFactory.empty();
        try {
            Class<?> type = Class.forName(className);
            if (!ICalculator.class.isAssignableFrom(type)) {
                throw new IllegalArgumentException("Class " + className + " does not implement ICalculator");
            }
            ICalculator calculator = (ICalculator) type.getConstructor(Config.class).newInstance(options);
            log.debug("Instantiated calculator '{}' of type {}", calculator.name(), className);
            return calculator;
        } catch (ClassNotFoundException e) {
            throw new IllegalArgumentException("Calculator class not found: " + className, e);
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException("Calculator " + className + " has no public (Config) constructor", e);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IllegalArgumentException("Failed to create calculator " + className + ": "
                + cause.getMessage(), cause);
        } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException("Failed to create calculator " + className + ": " + e.getMessage(), e);
        }
    }

    /**
     * Builds a driver with the configured Calculator and tile settings.
     *
     * @param workers requested worker count, 0 for one per tile
     * @throws IOException if a required reference surface cannot be opened
     */
    public ChunkDriver createDriver(int workers) throws IOException {
        return createDriver(createCalculator(), workers);
    }

    public ChunkDriver createDriver(ICalculator calculator, int workers) throws IOException {
        Config storage = pipeline.hasPath("storage") ? pipeline.getConfig("storage") : ConfigFactory.empty();

        FileSystemChunkInputSource input = new FileSystemChunkInputSource("input",
            withRoot(pipeline.getConfig("input"), pipeline.getString("input.rootDirectory")));

        Set<String> required = new LinkedHashSet<>(calculator.requiredReferences());
        ReferenceCache references;
        if (required.isEmpty()) {
            references = ReferenceCache.empty();
        } else {
            FileSystemReferenceSource referenceSource = new FileSystemReferenceSource("reference",
                withRoot(storage, pipeline.getString("reference.rootDirectory")));
            Config cacheOptions = pipeline.hasPath("reference.cache")
                ? pipeline.getConfig("reference.cache")
                : ConfigFactory.empty();
            references = ReferenceCache.load(referenceSource, required, cacheOptions);
        }

        FileSystemArtifactStore tileStore = new FileSystemArtifactStore("tiles",
            withRoot(storage, pipeline.getString("tiling.tempDirectory")));
        FileSystemArtifactStore outputStore = new FileSystemArtifactStore("output",
            withRoot(storage, pipeline.getString("output.rootDirectory")));

        Duration chunkTimeout = pipeline.getDuration("tiling.chunkTimeout");
        TileScheduler scheduler = new TileScheduler(new TileWorker(partialResultPolicy()), tileStore,
            pipeline.getInt("tiling.maxWorkers"), chunkTimeout);

        log.info("Input {}, output {}, tile artifacts {}", input.root(), outputStore.root(), tileStore.root());
        return new ChunkDriver(input, references, calculator, scheduler, new TileMerger(tileStore), outputStore,
            pipeline.getString("output.prefix"), workers);
    }

    private Config withRoot(Config options, String directory) {
        return options.withValue("rootDirectory",
            ConfigValueFactory.fromAnyRef(resolveDirectory(directory).toString()));
    }
}
