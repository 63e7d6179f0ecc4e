package org.timberline.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

import org.timberline.cli.CommandLineInterface;
import org.timberline.pipeline.api.grid.GridDataset;
import org.timberline.pipeline.api.grid.GridVariable;
import org.timberline.pipeline.api.resources.storage.DecodedArtifact;
import org.timberline.pipeline.resources.storage.ArtifactCodec;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Prints the dimensions, variables and attributes of an artifact file.
 */
@Command(
    name = "inspect",
    description = "Show the contents of a chunk output or tile artifact"
)
public class InspectCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Artifact file (.grid)")
    private Path file;

    @Option(names = {"--json"}, description = "Print as JSON")
    private boolean json;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (!Files.isRegularFile(file)) {
            err.println("Error: file not found: " + file);
            return CommandLineInterface.EXIT_INVALID;
        }
        DecodedArtifact artifact;
        try {
            artifact = ArtifactCodec.uncompressed().decode(Files.readAllBytes(file));
        } catch (IOException e) {
            err.println("Error: cannot read " + file + ": " + e.getMessage());
            return CommandLineInterface.EXIT_CHUNK_FAILED;
        }

        if (json) {
            Gson gson = new GsonBuilder().setPrettyPrinting().create();
            out.println(gson.toJson(describe(artifact)));
        } else {
            printText(artifact, out);
        }
        out.flush();
        return CommandLineInterface.EXIT_OK;
    }

    private static Map<String, Object> describe(DecodedArtifact artifact) {
        GridDataset dataset = artifact.dataset();
        Map<String, Object> description = new LinkedHashMap<>();
        description.put("name", artifact.name());
        description.put("formatVersion", artifact.formatVersion());
        artifact.tileSpec().ifPresent(tile -> description.put("tile", tile.toString()));
        description.put("dimensions", Map.of(
            "time", dataset.timeCount(),
            "lat", dataset.extent().latCount(),
            "lon", dataset.extent().lonCount()));
        description.put("fillValue", Float.toString(dataset.fillValue()));
        description.put("attributes", dataset.attributes());
        Map<String, Object> variables = new LinkedHashMap<>();
        for (GridVariable variable : dataset.variables()) {
            variables.put(variable.name(), variable.attributes());
        }
        description.put("variables", variables);
        return description;
    }

    private static void printText(DecodedArtifact artifact, PrintWriter out) {
        GridDataset dataset = artifact.dataset();
        out.println("Artifact:   " + artifact.name() + " (format " + artifact.formatVersion() + ")");
        artifact.tileSpec().ifPresent(tile -> out.println("Tile:       " + tile));
        out.println("Dimensions: time=" + dataset.timeCount() + ", lat=" + dataset.extent().latCount()
            + ", lon=" + dataset.extent().lonCount());
        long[] time = dataset.time();
        if (time.length > 0) {
            out.println("Time:       " + LocalDate.ofEpochDay(time[0]) + " .. "
                + LocalDate.ofEpochDay(time[time.length - 1]));
        }
        double[] lat = dataset.lat();
        double[] lon = dataset.lon();
        out.println("Lat:        " + lat[0] + " .. " + lat[lat.length - 1]);
        out.println("Lon:        " + lon[0] + " .. " + lon[lon.length - 1]);
        out.println("Fill value: " + dataset.fillValue());
        if (!dataset.attributes().isEmpty()) {
            out.println("Attributes:");
            dataset.attributes().forEach((key, value) -> out.println("  " + key + " = " + value));
        }
        out.println("Variables:");
        for (GridVariable variable : dataset.variables()) {
            List<String> attributes = variable.attributes().entrySet().stream()
                .map(entry -> entry.getKey() + "=" + entry.getValue())
                .collect(Collectors.toList());
            out.println("  " + variable.name() + (attributes.isEmpty() ? "" : " " + attributes));
        }
    }
}
