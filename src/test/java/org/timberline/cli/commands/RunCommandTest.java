package org.timberline.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.timberline.cli.CommandLineInterface;
import org.timberline.pipeline.TestGrids;
import org.timberline.pipeline.resources.storage.FileSystemArtifactStore;
import org.timberline.pipeline.resources.storage.FileSystemChunkInputSource;
import org.timberline.pipeline.tiling.ChunkStatus;
import org.timberline.pipeline.tiling.RunSummary;

import picocli.CommandLine;

@Tag("integration")
class RunCommandTest {

    @TempDir
    Path tempDir;

    private Path configFile;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws IOException {
        FileSystemArtifactStore input = new FileSystemArtifactStore("input",
            TestGrids.storeOptions(tempDir.resolve("input")));
        for (int year = 2001; year <= 2002; year++) {
            input.write(FileSystemChunkInputSource.fileNameFor(year), Integer.toString(year),
                TestGrids.temperatureYear(year, 4, 6), null);
        }
        configFile = tempDir.resolve("timberline.conf");
        Files.writeString(configFile, String.join("\n",
            "pipeline {",
            "  dataBaseDir = \"" + tempDir.toAbsolutePath().toString().replace("\\", "\\\\") + "\"",
            "  calculator.options.indices = [tg_mean, frost_days, summer_days]",
            "  storage.compression = none",
            "  chunk { start = 2001, end = 2002 }",
            "}",
            "logging.levels { \"org.timberline\" = WARN }",
            ""));
        out = new StringWriter();
        err = new StringWriter();
    }

    private int execute(String... args) {
        CommandLine commandLine = CommandLineInterface.createCommandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    @Test
    void successfulRunPrintsSummaryAndExitsZero() {
        int exitCode = execute("-c", configFile.toString(), "run", "--tiles", "4", "--workers", "2");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        RunSummary summary = RunSummary.fromJson(out.toString());
        assertThat(summary.succeeded()).isEqualTo(2);
        assertThat(summary.failed()).isZero();
        assertThat(tempDir.resolve("output").resolve("indices_2001_2001.grid")).exists();
        assertThat(tempDir.resolve("output").resolve("indices_2002_2002.grid")).exists();
    }

    @Test
    void optionsOverrideConfiguredRange() {
        int exitCode = execute("-c", configFile.toString(), "run", "--start", "2002", "--end", "2002",
            "--tiles", "2");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_OK);
        assertThat(RunSummary.fromJson(out.toString()).chunks()).singleElement()
            .satisfies(chunk -> {
                assertThat(chunk.start()).isEqualTo(2002);
                assertThat(chunk.tileCount()).isEqualTo(2);
            });
    }

    @Test
    void failedChunkExitsOneAndStillReportsTheOthers() {
        int exitCode = execute("-c", configFile.toString(), "run", "--end", "2003", "--tiles", "8");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_CHUNK_FAILED);
        RunSummary summary = RunSummary.fromJson(out.toString());
        assertThat(summary.succeeded()).isEqualTo(2);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.chunks().get(2).status()).isEqualTo(ChunkStatus.FAILED);
        assertThat(summary.chunks().get(2).error()).contains("2003");
    }

    @Test
    void unsupportedTileCountExitsTwoWithoutRunning() {
        int exitCode = execute("-c", configFile.toString(), "run", "--tiles", "3");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_INVALID);
        assertThat(err.toString()).contains("Unsupported tile count 3");
        assertThat(out.toString()).isEmpty();
        assertThat(tempDir.resolve("output")).doesNotExist();
    }

    @Test
    void invalidRangeOrWorkersExitTwo() {
        assertThat(execute("-c", configFile.toString(), "run", "--start", "2002", "--end", "2001"))
            .isEqualTo(CommandLineInterface.EXIT_INVALID);
        assertThat(execute("-c", configFile.toString(), "run", "--workers=-1"))
            .isEqualTo(CommandLineInterface.EXIT_INVALID);
        assertThat(err.toString()).contains("must not be before start", "--workers must not be negative");
    }

    @Test
    void missingConfigurationFileExitsTwo() {
        int exitCode = execute("-c", tempDir.resolve("missing.conf").toString(), "run");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_INVALID);
        assertThat(err.toString()).contains("missing.conf");
    }

    @Test
    void missingReferenceSurfacesExitTwo() throws IOException {
        Files.writeString(configFile, Files.readString(configFile).replace("[tg_mean, frost_days, summer_days]",
            "[tg_mean, tx90p]"));

        int exitCode = execute("-c", configFile.toString(), "run");

        assertThat(exitCode).isEqualTo(CommandLineInterface.EXIT_INVALID);
        assertThat(err.toString()).contains("tx90p_threshold");
    }
}
