package org.feralsim.cli.commands;

import org.feralsim.config.SimulationSettings;
import org.feralsim.runtime.CombatLogEntry;
import org.feralsim.runtime.Simulation;
import org.feralsim.runtime.TrialRecord;
import org.feralsim.runtime.internal.services.SeededRandomProvider;
import picocli.CommandLine.Command;

import java.io.PrintWriter;

@Command(
    name = "trace",
    description = "Run one trial over the nominal fight length and print its combat log"
)
public class TraceCommand extends AbstractSimulationCommand {

    @Override
    protected int execute(SimulationSettings settings) {
        TrialRecord record = new Simulation(settings.setup())
                .runSingleTraceWithLog(new SeededRandomProvider(settings.seed()));
        if (format == OutputFormat.JSON) {
            printJson(record.combatLog());
            return 0;
        }
        PrintWriter out = out();
        out.println(fmt("%9s  %-22s %-24s %6s %3s %7s %4s", "Time", "Event", "Outcome", "Energy", "CP", "Mana",
                "Rage"));
        for (CombatLogEntry entry : record.combatLog()) {
            out.println(entry.format());
        }
        out.println();
        out.println(fmt("%.2f DPS over %.1f s", record.dps(), record.fightLength()));
        out.flush();
        return 0;
    }
}
