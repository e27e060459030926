package org.feralsim.cli.commands;

import org.feralsim.analysis.AggregateStatistics;
import org.feralsim.analysis.ErrorBarProjection;
import org.feralsim.analysis.ReplicateRunner;
import org.feralsim.analysis.StatWeight;
import org.feralsim.analysis.StatWeightEstimator;
import org.feralsim.analysis.StatWeightReport;
import org.feralsim.config.SimulationSettings;
import org.feralsim.runtime.internal.services.SeededRandomProvider;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.Map;

@Command(
    name = "weights",
    description = "Estimate stat weights relative to Attack Power"
)
public class WeightsCommand extends AbstractSimulationCommand {

    @Option(
        names = {"--mana"},
        description = "Also estimate mana, Spirit, Intellect and mp5 weights"
    )
    boolean mana;

    @Option(
        names = {"--agility-modifier"},
        description = "Multiplier on primary attributes from raid buffs (default: 1.0)"
    )
    double agilityModifier = 1.0;

    @Option(
        names = {"--project"},
        description = "Project the error bars to this many production trials"
    )
    Integer projectionTrials;

    @Option(
        names = {"--bootstrap"},
        description = "Use bootstrap resampling instead of the normal approximation for --project"
    )
    boolean bootstrap;

    @Override
    protected int execute(SimulationSettings settings) {
        ReplicateRunner runner = new ReplicateRunner(settings.effectiveWorkers());
        StatWeightEstimator estimator = new StatWeightEstimator(runner, settings.setup(), settings.seed(),
                settings.replicates()).withAgilityModifier(agilityModifier);
        if (projectionTrials != null) {
            estimator.withProjection(new ErrorBarProjection(projectionTrials,
                    bootstrap ? ErrorBarProjection.Mode.BOOTSTRAP : ErrorBarProjection.Mode.NORMAL,
                    new SeededRandomProvider(settings.seed()).deriveFor("bootstrap", 0)));
        }

        AggregateStatistics baseline = estimator.runBaseline();
        StatWeightReport combat = estimator.calcStatWeights(baseline);
        Map<String, StatWeightReport> reports = new LinkedHashMap<>();
        reports.put("combat", combat);
        if (mana) {
            reports.put("mana", estimator.calcManaWeights(baseline, combat.dpsPerAttackPower()));
        }

        if (format == OutputFormat.JSON) {
            printJson(reports);
            return 0;
        }
        PrintWriter out = out();
        out.println(fmt("Base DPS: %.2f", combat.baseDps()));
        out.println();
        out.println(fmt("%-20s %12s %10s %10s %10s", "Stat", "DPS/unit", "Std err", "Weight", "Projected"));
        for (StatWeightReport report : reports.values()) {
            for (StatWeight weight : report.weights().values()) {
                out.println(fmt("%-20s %12.4f %10.4f %10.3f %10s", weight.stat().getLabel(), weight.dpsPerUnit(),
                        weight.standardError(), weight.relativeWeight(),
                        weight.projectedError() == null ? "-" : fmt("%.4f", weight.projectedError())));
            }
        }
        out.flush();
        return 0;
    }
}
