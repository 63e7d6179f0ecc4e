package org.timberline.cli;

import java.io.File;
import java.net.URL;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.timberline.cli.commands.InspectCommand;
import org.timberline.cli.commands.RunCommand;
import org.timberline.cli.config.ConfigLoader;
import org.timberline.cli.config.LoggingConfigurator;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;

import com.typesafe.config.Config;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
    name = "timberline",
    mixinStandardHelpOptions = true,
    version = "Timberline 1.0",
    description = "Timberline - tiled parallel processing of gridded climate time series",
    subcommands = {
        RunCommand.class,
        InspectCommand.class,
        CommandLine.HelpCommand.class
    },
    footer = {
        "",
        "Exit codes: 0 all chunks succeeded, 1 at least one chunk failed, 2 invalid configuration or arguments."
    }
)
public class CommandLineInterface implements Callable<Integer> {

    public static final int EXIT_OK = 0;
    public static final int EXIT_CHUNK_FAILED = 1;
    public static final int EXIT_INVALID = 2;

    static final String LOGGING_FORMAT_PROPERTY = "timberline.logging.format";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/timberline.conf)"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return EXIT_OK;
    }

    public static void main(final String[] args) {
        final int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }

    /**
     * Creates the command line as the entry point uses it. Tests call this to run commands
     * in-process.
     */
    public static CommandLine createCommandLine() {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("timberline");
        return commandLine;
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @return the resolved configuration
     * @throws IllegalArgumentException                if an explicitly named file does not exist
     * @throws com.typesafe.config.ConfigException     if the configuration is invalid
     */
    public Config getConfig() {
        if (config == null) {
            final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);
            Config loaded = ConfigLoader.resolve(configFile, (level, message) -> {
                switch (level) {
                    case INFO -> logger.info(message);
                    case WARN -> logger.warn(message);
                }
            });
            if (loaded.hasPath("logging.format")) {
                String format = loaded.getString("logging.format");
                System.setProperty(LOGGING_FORMAT_PROPERTY, "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT");
                reconfigureLogback();
            }
            LoggingConfigurator.configure(loaded);
            config = loaded;
        }
        return config;
    }

    private static void reconfigureLogback() {
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        try {
            JoranConfigurator configurator = new JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            configurator.doConfigure(configUrl);
        } catch (Exception e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }
}
