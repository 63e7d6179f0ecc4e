package org.timberline.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.timberline.cli.CommandLineInterface;
import org.timberline.pipeline.TilingPipelineFactory;
import org.timberline.pipeline.tiling.ChunkDriver;
import org.timberline.pipeline.tiling.DomainGrid;
import org.timberline.pipeline.tiling.RunSummary;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Processes a range of years and prints the run summary as JSON on standard output.
 * Options left out fall back to {@code pipeline.chunk.*} and {@code pipeline.tiling.*}.
 */
@Command(
    name = "run",
    description = "Compute the configured indices for a range of years, chunk by chunk"
)
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Option(names = {"--start"}, description = "First year (default: pipeline.chunk.start)")
    private Integer start;

    @Option(names = {"--end"}, description = "Last year, inclusive (default: pipeline.chunk.end)")
    private Integer end;

    @Option(names = {"--chunk-size"}, description = "Years per chunk (default: pipeline.chunk.size)")
    private Integer chunkSize;

    @Option(names = {"--tiles"}, description = "Spatial tiles per chunk: 2, 4 or 8 (default: pipeline.tiling.tiles)")
    private Integer tiles;

    @Option(names = {"--workers"}, description = "Worker threads, 0 for one per tile (default: pipeline.tiling.workers)")
    private Integer workers;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        ChunkDriver driver;
        int first;
        int last;
        int size;
        int tileCount;
        try {
            Config config = parent.getConfig();
            TilingPipelineFactory factory = new TilingPipelineFactory(config);
            first = start != null ? start : factory.defaultStart();
            last = end != null ? end : factory.defaultEnd();
            size = chunkSize != null ? chunkSize : factory.defaultChunkSize();
            tileCount = tiles != null ? tiles : factory.defaultTileCount();
            int workerCount = workers != null ? workers : factory.defaultWorkers();
            if (workerCount < 0) {
                throw new IllegalArgumentException("--workers must not be negative, got " + workerCount);
            }

            DomainGrid.validateTileCount(tileCount);
            ChunkDriver.chunks(first, last, size);
            driver = factory.createDriver(workerCount);
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Error: " + e.getMessage());
            log.debug("Invalid configuration or arguments", e);
            return CommandLineInterface.EXIT_INVALID;
        } catch (IOException e) {
            err.println("Error: cannot open reference data: " + e.getMessage());
            log.debug("Reference data failure", e);
            return CommandLineInterface.EXIT_INVALID;
        }

        RunSummary summary = driver.run(first, last, size, tileCount);
        out.println(summary.toJson());
        out.flush();
        return summary.allSucceeded() ? CommandLineInterface.EXIT_OK : CommandLineInterface.EXIT_CHUNK_FAILED;
    }
}
