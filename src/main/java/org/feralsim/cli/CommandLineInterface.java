package org.feralsim.cli;

import com.typesafe.config.Config;
import org.feralsim.cli.commands.RunCommand;
import org.feralsim.cli.commands.TraceCommand;
import org.feralsim.cli.commands.WeightsCommand;
import org.feralsim.cli.config.LoggingConfigurator;
import org.feralsim.config.SimulationConfigLoader;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.concurrent.Callable;

@Command(
    name = "feralsim",
    mixinStandardHelpOptions = true,
    version = "feralsim 1.0",
    description = "Monte-Carlo damage simulator for a feral cat",
    subcommands = {
        RunCommand.class,
        WeightsCommand.class,
        TraceCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: " + SimulationConfigLoader.CONFIG_FILE_NAME + ")"
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
        commandLine.setCommandName("feralsim");
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        final int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    /**
     * Loads the configuration on first use and applies its logging section.
     *
     * @return the resolved configuration
     * @throws org.feralsim.config.ConfigurationException if the configuration cannot be loaded
     */
    public Config getConfig() {
        if (config == null) {
            config = SimulationConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
        }
        return config;
    }
}
