package org.feralsim.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.feralsim.cli.CommandLineInterface;
import org.feralsim.config.ConfigurationException;
import org.feralsim.config.SimulationConfigLoader;
import org.feralsim.config.SimulationSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Options and configuration handling shared by the simulation subcommands.
 */
abstract class AbstractSimulationCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractSimulationCommand.class);

    enum OutputFormat { TEXT, JSON }

    @Option(
        names = {"-n", "--replicates"},
        description = "Number of trials (default: simulation.replicates)"
    )
    Integer replicates;

    @Option(
        names = {"-w", "--workers"},
        description = "Worker threads, 0 for one per processor (default: simulation.workers)"
    )
    Integer workers;

    @Option(
        names = {"--seed"},
        description = "Batch seed (default: simulation.seed)"
    )
    Long seed;

    @Option(
        names = {"-f", "--format"},
        description = "Output format: ${COMPLETION-CANDIDATES} (default: text)"
    )
    OutputFormat format = OutputFormat.TEXT;

    @ParentCommand
    CommandLineInterface parent;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        try {
            return execute(loadSettings());
        } catch (ConfigurationException e) {
            LOG.error("Invalid configuration: {}", e.getMessage());
            return 1;
        }
    }

    /**
     * Runs the command.
     *
     * @param settings the loaded settings with command line overrides applied
     * @return the exit code
     */
    protected abstract int execute(SimulationSettings settings);

    SimulationSettings loadSettings() {
        SimulationSettings settings = SimulationConfigLoader.toSettings(parent.getConfig());
        if (replicates != null) {
            settings = settings.withReplicates(replicates);
        }
        if (workers != null) {
            settings = settings.withWorkers(workers);
        }
        if (seed != null) {
            settings = settings.withSeed(seed);
        }
        return settings;
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    void printJson(Object value) {
        Gson gson = new GsonBuilder()
                .setPrettyPrinting()
                .serializeSpecialFloatingPointValues()
                .create();
        out().println(gson.toJson(value));
        out().flush();
    }

    static String fmt(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
