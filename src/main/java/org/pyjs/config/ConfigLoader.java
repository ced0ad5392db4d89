package org.pyjs.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.pyjs.compiler.api.CompilerOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the HOCON configuration that compiler options are read from.
 * <p>
 * Sources, highest precedence first:
 * <ol>
 *   <li>Java system properties ({@code -Dpyjs.compiler.strictness=batch})</li>
 *   <li>Environment variables</li>
 *   <li>A configuration file: the one passed to {@link #load(File)}, else {@code -Dconfig.file},
 *       else {@code config/pyjs.conf} in the working directory</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * Substitutions are resolved after all layers are composed, so an override of a referenced
 * value propagates to every key that refers to it.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "pyjs.conf";

    private ConfigLoader() {
    }

    /**
     * Discovers a configuration file and composes it with the other layers.
     *
     * @return the resolved configuration.
     * @throws IllegalArgumentException if {@code -Dconfig.file} names a missing file.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved.
     */
    public static Config load() {
        return load(null);
    }

    /**
     * Composes the configuration layers around an explicit file.
     *
     * @param explicitConfigFile the file to use, or {@code null} to discover one.
     * @return the resolved configuration.
     * @throws IllegalArgumentException if the explicit file or {@code -Dconfig.file} does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved.
     */
    public static Config load(final File explicitConfigFile) {
        if (explicitConfigFile != null) {
            if (!explicitConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file not found: " + explicitConfigFile.getAbsolutePath());
            }
            LOG.debug("Using configuration file {}", explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file specified via -Dconfig.file not found: "
                                + systemConfigFile.getAbsolutePath());
            }
            LOG.debug("Using configuration file specified via -Dconfig.file: {}", systemConfigFile);
            return loadFromFile(systemConfigFile);
        }

        final File cwdConfigFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            LOG.debug("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
            return loadFromFile(cwdConfigFile);
        }

        LOG.debug("No {}/{} found, using classpath defaults", CONFIG_DIR, CONFIG_FILE_NAME);
        return loadDefaults();
    }

    /**
     * Loads compiler options from the discovered configuration.
     *
     * @return the options in the {@code pyjs.compiler} block.
     */
    public static CompilerOptions loadOptions() {
        return CompilerOptions.fromConfig(load());
    }

    static Config loadFromFile(final File configFile) {
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
}
