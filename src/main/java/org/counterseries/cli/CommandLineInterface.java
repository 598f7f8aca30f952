package org.counterseries.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.counterseries.cli.commands.RenderCommand;
import org.counterseries.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "counter-series",
    mixinStandardHelpOptions = true,
    version = "counter-series 1.0",
    description = "Turns cumulative counter snapshots into anomaly-flagged time series, summaries and charts.",
    subcommands = {
        RenderCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(CommandLineInterface.class);

    public static final String CONFIG_FILE_NAME = "counter-series.conf";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + CONFIG_FILE_NAME + ")"
    )
    private File configFile;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("counter-series");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @return the resolved configuration
     * @throws ConfigException if a configuration file is missing or cannot be parsed
     */
    public synchronized Config getConfig() {
        if (config == null) {
            config = loadConfig();
            applyLogging(config);
        }
        return config;
    }

    /**
     * Resolves the configuration file in this order:
     * <ol>
     *   <li>{@code --config}</li>
     *   <li>{@code -Dconfig.file}</li>
     *   <li>{@value #CONFIG_FILE_NAME} in the working directory</li>
     *   <li>classpath defaults only</li>
     * </ol>
     * In every case system properties and environment variables take precedence over the file.
     */
    private Config loadConfig() {
        if (configFile != null) {
            if (!configFile.exists()) {
                throw new ConfigException.Generic(
                        "Configuration file specified via --config was not found: " + configFile.getAbsolutePath());
            }
            LOGGER.info("Using configuration file specified via --config: {}", configFile.getAbsolutePath());
            return withFile(configFile);
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new ConfigException.Generic(
                        "Configuration file specified via -Dconfig.file was not found: " + systemConfigFile);
            }
            LOGGER.info("Using configuration file specified via -Dconfig.file: {}", systemConfigFile);
            return withFile(systemConfigFile);
        }

        final File cwdConfigFile = new File(CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            LOGGER.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
            return withFile(cwdConfigFile);
        }

        LOGGER.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
        // Config load order: System Props > Env Vars > Classpath defaults
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(ConfigFactory.defaultReference())
                .resolve();
    }

    private static Config withFile(final File file) {
        // Config load order: System Props > Env Vars > File > Classpath defaults
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(ConfigFactory.parseFile(file))
                .withFallback(ConfigFactory.defaultReference())
                .resolve();
    }

    private static void applyLogging(final Config config) {
        final String previousFormat = System.getProperty(LoggingConfigurator.FORMAT_PROPERTY);
        LoggingConfigurator.configure(config);
        final String selectedFormat = System.getProperty(LoggingConfigurator.FORMAT_PROPERTY);
        if (selectedFormat != null && !selectedFormat.equals(previousFormat)) {
            reconfigureLogback();
            // Reloading logback.xml resets logger levels, so apply the configured levels again.
            LoggingConfigurator.reset();
            LoggingConfigurator.configure(config);
        }
    }

    private static void reconfigureLogback() {
        try {
            final ch.qos.logback.classic.LoggerContext context =
                    (ch.qos.logback.classic.LoggerContext) LoggerFactory.getILoggerFactory();
            final ch.qos.logback.classic.joran.JoranConfigurator configurator =
                    new ch.qos.logback.classic.joran.JoranConfigurator();
            configurator.setContext(context);
            context.reset();
            final java.net.URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
            if (configUrl != null) {
                configurator.doConfigure(configUrl);
            }
        } catch (ch.qos.logback.core.joran.spi.JoranException e) {
            System.err.println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }
}
