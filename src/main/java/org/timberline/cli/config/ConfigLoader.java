package org.timberline.cli.config;

import java.io.File;
import java.net.URISyntaxException;
import java.security.CodeSource;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Loads the HOCON configuration for the command line.
 * <p>
 * The first configuration file found wins:
 * <ol>
 *   <li>the file given with {@code --config}</li>
 *   <li>the file named by {@code -Dconfig.file}</li>
 *   <li>{@code config/timberline.conf} in the working directory</li>
 *   <li>{@code config/timberline.conf} in the installation directory (parent of the jar's directory)</li>
 *   <li>none: classpath {@code reference.conf} only</li>
 * </ol>
 * Whatever file is chosen, system properties override environment variables, which
 * override the file, which overrides {@code reference.conf}. Substitutions are resolved
 * once, after all layers are stacked, so substitutions in {@code reference.conf} see
 * user overrides.
 */
public final class ConfigLoader {

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "timberline.conf";

    private ConfigLoader() {
    }

    /**
     * Severity of a resolution message.
     */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives a message about which configuration source was selected.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {
        void log(MessageLevel level, String message);
    }

    /**
     * Resolves the configuration.
     *
     * @param explicitConfigFile file from {@code --config}, or null
     * @param handler            receives one message naming the selected source
     * @return the resolved configuration
     * @throws IllegalArgumentException                if an explicitly named file does not exist
     * @throws com.typesafe.config.ConfigException     if a file cannot be parsed or resolved
     */
    public static Config resolve(File explicitConfigFile, ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            return fromRequiredFile(explicitConfigFile, "--config", handler);
        }

        String property = System.getProperty("config.file");
        if (property != null && !property.isBlank()) {
            return fromRequiredFile(new File(property).getAbsoluteFile(), "-Dconfig.file", handler);
        }

        File workingDirectoryFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (workingDirectoryFile.isFile()) {
            handler.log(MessageLevel.INFO, "Using configuration file " + workingDirectoryFile.getAbsolutePath());
            return loadFromFile(workingDirectoryFile);
        }

        File installationFile = installationConfigFile();
        if (installationFile != null) {
            handler.log(MessageLevel.INFO, "Using installation configuration file " + installationFile.getAbsolutePath());
            return loadFromFile(installationFile);
        }

        handler.log(MessageLevel.WARN, "No " + CONFIG_DIR + "/" + CONFIG_FILE_NAME
            + " found, using built-in defaults");
        return loadDefaults();
    }

    private static Config fromRequiredFile(File file, String origin, ConfigMessageHandler handler) {
        if (!file.isFile()) {
            throw new IllegalArgumentException("Configuration file given via " + origin + " not found: "
                + file.getAbsolutePath());
        }
        handler.log(MessageLevel.INFO, "Using configuration file given via " + origin + ": " + file.getAbsolutePath());
        return loadFromFile(file);
    }

    static Config loadFromFile(File configFile) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * Returns {@code APP_HOME/config/timberline.conf} when running from {@code APP_HOME/lib/*.jar}
     * and the file exists, otherwise null.
     */
    private static File installationConfigFile() {
        CodeSource codeSource = ConfigLoader.class.getProtectionDomain().getCodeSource();
        if (codeSource == null || codeSource.getLocation() == null) {
            return null;
        }
        File location;
        try {
            location = new File(codeSource.getLocation().toURI());
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
        if (!location.isFile() || location.getParentFile() == null) {
            return null;
        }
        File appHome = location.getParentFile().getParentFile();
        if (appHome == null) {
            return null;
        }
        File candidate = new File(new File(appHome, CONFIG_DIR), CONFIG_FILE_NAME);
        return candidate.isFile() ? candidate : null;
    }
}
