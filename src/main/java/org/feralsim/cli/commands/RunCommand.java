package org.feralsim.cli.commands;

import org.feralsim.analysis.ReplicateRunner;
import org.feralsim.analysis.ReplicateSummary;
import org.feralsim.config.SimulationSettings;
import org.feralsim.runtime.Simulation;
import picocli.CommandLine.Command;

import java.io.PrintWriter;
import java.util.Map;

@Command(
    name = "run",
    description = "Run a batch of trials and print the DPS summary"
)
public class RunCommand extends AbstractSimulationCommand {

    @Override
    protected int execute(SimulationSettings settings) {
        ReplicateRunner runner = new ReplicateRunner(settings.effectiveWorkers());
        ReplicateSummary summary = runner.run(new Simulation(settings.setup())::run, settings.seed(),
                settings.replicates());
        if (format == OutputFormat.JSON) {
            printJson(summary);
        } else {
            printText(summary);
        }
        return summary.trials() > 0 ? 0 : 1;
    }

    private void printText(ReplicateSummary summary) {
        PrintWriter out = out();
        out.println(fmt("Trials:     %d (%d failed)", summary.trials(), summary.failedTrials()));
        out.println(fmt("DPS:        %.2f mean, %.2f std, %.2f median", summary.meanDps(), summary.stdDps(),
                summary.medianDps()));
        if (summary.resourceExhaustionRate() > 0) {
            out.println(fmt("Out of mana: %.1f%% of trials, mean %.1f s (std %.1f s)",
                    100 * summary.resourceExhaustionRate(), summary.meanTimeToResourceExhaustion(),
                    summary.stdTimeToResourceExhaustion()));
        }
        out.println();
        out.println(fmt("%-22s %8s %8s %10s %10s", "Ability", "Casts", "CPM", "DPS", "Dmg/cast"));
        for (Map.Entry<String, ReplicateSummary.AbilitySummary> entry : summary.abilities().entrySet()) {
            ReplicateSummary.AbilitySummary ability = entry.getValue();
            if (ability.casts() == 0 && ability.damage() == 0) {
                continue;
            }
            out.println(fmt("%-22s %8.1f %8.2f %10.2f %10.1f", entry.getKey(), ability.casts(),
                    ability.castsPerMinute(), ability.dps(), ability.damagePerCast()));
        }
        if (!summary.effects().isEmpty()) {
            out.println();
            out.println(fmt("%-22s %8s %8s", "Effect", "Procs", "Uptime"));
            summary.effects().forEach((name, effect) -> out.println(fmt("%-22s %8.2f %7.1f%%", name,
                    effect.procs(), 100 * effect.uptime())));
        }
        out.flush();
    }
}
