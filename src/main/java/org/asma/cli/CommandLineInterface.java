package org.asma.cli;

import ch.qos.logback.classic.BasicConfigurator;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigOriginFactory;
import org.asma.cli.commands.AssembleCommand;
import org.asma.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.net.URL;
import java.util.concurrent.Callable;

@Command(
    name = "asma",
    mixinStandardHelpOptions = true,
    version = "ASMA 0.1.0",
    description = "ASMA - cross-assembler for S/370, ESA/390 and z/Architecture load images",
    subcommands = {
        AssembleCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    /** Exit code for invalid usage, configuration or I/O problems. */
    public static final int EXIT_USAGE = 2;

    private static final String CONFIG_FILE_NAME = "asma.conf";

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: asma.conf)"
    )
    private File configFile;

    private Config config;
    private boolean initialized = false;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("asma");
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration. Precedence, highest first: {@code --config},
     * {@code -Dconfig.file}, {@code asma.conf} in the working directory, classpath
     * defaults. System properties and environment variables override every file.
     *
     * @throws ConfigException if a configuration file is missing or malformed.
     */
    private void initialize() {
        if (initialized) {
            return;
        }

        final Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);

        File file = null;
        if (this.configFile != null) {
            // 1) Highest precedence: explicit CLI option --config
            if (!this.configFile.exists()) {
                throw new ConfigException.IO(ConfigOriginFactory.newFile(this.configFile.getAbsolutePath()),
                        "configuration file specified via --config was not found");
            }
            logger.info("Using configuration file specified via --config: {}", this.configFile.getAbsolutePath());
            file = this.configFile;
        } else {
            // 2) Next: standard Typesafe Config system property -Dconfig.file
            final String systemConfigPath = System.getProperty("config.file");
            if (systemConfigPath != null && !systemConfigPath.isBlank()) {
                final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
                if (!systemConfigFile.exists()) {
                    throw new ConfigException.IO(ConfigOriginFactory.newFile(systemConfigFile.getPath()),
                            "configuration file specified via -Dconfig.file was not found");
                }
                logger.info("Using configuration file specified via -Dconfig.file: {}", systemConfigFile);
                file = systemConfigFile;
            } else {
                // 3) Then: asma.conf in the current working directory
                final File cwdConfigFile = new File(CONFIG_FILE_NAME);
                if (cwdConfigFile.exists()) {
                    logger.info("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
                    file = cwdConfigFile;
                } else {
                    // 4) Finally: classpath defaults only
                    logger.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
                }
            }
        }

        // Config load order: System Props > Env Vars > File > Classpath defaults
        Config loaded = ConfigFactory.systemProperties().withFallback(ConfigFactory.systemEnvironment());
        if (file != null) {
            loaded = loaded.withFallback(ConfigFactory.parseFile(file));
        }
        this.config = loaded.withFallback(ConfigFactory.load()).resolve();

        // Logging setup
        if (config.hasPath("logging.format")) {
            System.setProperty(LoggingConfigurator.FORMAT_PROPERTY,
                    LoggingConfigurator.appenderFor(config.getString("logging.format")));
            reconfigureLogback();
        }
        LoggingConfigurator.configure(config);

        initialized = true;
    }

    private void reconfigureLogback() {
        reconfigureLogback((LoggerContext) LoggerFactory.getILoggerFactory(),
                CommandLineInterface.class.getClassLoader().getResource("logback.xml"));
    }

    /**
     * Reloads {@code logback.xml} so a changed appender property takes effect. If the file
     * cannot be applied the context falls back to Logback's basic console setup.
     *
     * @param context   The context to reconfigure.
     * @param configUrl The configuration to load, may be {@code null}.
     * @return {@code true} if the configuration was applied.
     */
    static boolean reconfigureLogback(final LoggerContext context, final URL configUrl) {
        if (configUrl == null) {
            return false;
        }
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(configUrl);
            return true;
        } catch (final JoranException e) {
            context.reset();
            final BasicConfigurator fallback = new BasicConfigurator();
            fallback.setContext(context);
            fallback.configure(context);
            context.getLogger(CommandLineInterface.class).warn("Failed to reconfigure Logback from {}", configUrl, e);
            return false;
        }
    }

    /**
     * @return The resolved configuration, loaded on first access.
     * @throws ConfigException if the configuration cannot be loaded.
     */
    public Config getConfig() {
        if (!initialized) {
            initialize();
        }
        return config;
    }
}
