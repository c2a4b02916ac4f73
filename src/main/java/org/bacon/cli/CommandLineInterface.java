package org.bacon.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigOriginFactory;
import org.bacon.cli.commands.ParseCommand;
import org.bacon.cli.commands.ReplCommand;
import org.bacon.cli.commands.TokensCommand;
import org.bacon.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "bacon",
    mixinStandardHelpOptions = true,
    version = "Bacon 1.0",
    description = "Bacon - scanner and parser for the Bacon programming language",
    subcommands = {
        ReplCommand.class,
        TokensCommand.class,
        ParseCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CommandLineInterface.class);

    @Option(names = {"-c", "--config"}, description = "Path to a HOCON configuration file layered over the defaults.")
    File configFile;

    @Option(names = "-D", mapFallbackValue = "", description = "Override a HOCON configuration value. For example: -Dbacon.repl.mode=tokens")
    Map<String, String> hoconOverrides;

    private Config config;

    @Override
    public Integer call() {
        // If no subcommand is specified, show the help message.
        CommandLine.usage(this, System.out);
        return 0;
    }

    public static void main(final String[] args) {
        final CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("bacon");
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Returns the resolved configuration, loading it and applying its logging settings on first use.
     *
     * @return The fully resolved and merged {@link Config} object.
     * @throws ConfigException if the configuration file cannot be read or parsed.
     */
    public Config getConfig() {
        if (config == null) {
            config = loadConfiguration();
            LoggingConfigurator.configure(config);
        }
        return config;
    }

    /**
     * Loads and merges configurations. Precedence, highest first: system properties,
     * {@code -D} overrides, the {@code --config} file, {@code reference.conf}.
     *
     * @return The fully resolved and merged {@link Config} object.
     */
    Config loadConfiguration() {
        Config defaultConfig = ConfigFactory.defaultReference();

        Config fileConfig = ConfigFactory.empty();
        if (configFile != null) {
            if (!configFile.exists()) {
                throw new ConfigException.IO(ConfigOriginFactory.newFile(configFile.getPath()),
                        "Configuration file not found: " + configFile.getAbsolutePath());
            }
            log.info("Using configuration file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        }

        Config cliConfig = hoconOverrides != null
                ? ConfigFactory.parseMap(hoconOverrides)
                : ConfigFactory.empty();

        return ConfigFactory.systemProperties()
                .withFallback(cliConfig)
                .withFallback(fileConfig)
                .withFallback(defaultConfig)
                .resolve();
    }
}
