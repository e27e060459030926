package org.feralsim.analysis;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.feralsim.runtime.TrialRecord;
import org.feralsim.runtime.model.Ability;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Running aggregate over the trials of one batch.
 * <p>
 * Per-trial DPS is kept by trial index so that two batches run from the same seeds can be
 * compared pair by pair. Ability and effect figures are kept as running means. Spreads are
 * population standard deviations over the completed trials. The class is
 * not thread-safe; the replicate runner folds all trials in from a single thread.
 * </p>
 */
public final class AggregateStatistics {

    private final double[] dpsByTrial;
    private final Mean[] abilityCasts = means(Ability.values().length);
    private final Mean[] abilityDamage = means(Ability.values().length);
    private final Mean[] abilityDps = means(Ability.values().length);
    private final Map<String, Mean[]> effects = new LinkedHashMap<>();
    private final SummaryStatistics exhaustionTimes = new SummaryStatistics();
    private final Mean fightLengths = new Mean();

    private int completed;
    private int failed;
    private int exhausted;

    /**
     * @param trials number of trials in the batch
     */
    public AggregateStatistics(int trials) {
        this.dpsByTrial = new double[trials];
        Arrays.fill(dpsByTrial, Double.NaN);
    }

    /**
     * Folds one completed trial into the aggregate.
     *
     * @param index  the trial index
     * @param record the trial result
     */
    public void add(int index, TrialRecord record) {
        completed++;
        dpsByTrial[index] = record.dps();
        fightLengths.increment(record.fightLength());

        for (Map.Entry<Ability, TrialRecord.AbilityTotals> entry : record.abilities().entrySet()) {
            int i = entry.getKey().ordinal();
            TrialRecord.AbilityTotals totals = entry.getValue();
            abilityCasts[i].increment(totals.casts());
            abilityDamage[i].increment(totals.damage());
            abilityDps[i].increment(totals.damage() / record.fightLength());
        }
        for (Map.Entry<String, TrialRecord.EffectTotals> entry : record.effects().entrySet()) {
            Mean[] means = effects.computeIfAbsent(entry.getKey(), k -> means(2));
            means[0].increment(entry.getValue().procs());
            means[1].increment(entry.getValue().uptime());
        }

        exhaustionTimes.addValue(record.resourceExhaustionOrFightLength());
        if (record.timeToResourceExhaustion() != null) {
            exhausted++;
        }
    }

    /**
     * Counts a trial that failed. Its DPS stays undefined.
     *
     * @param index the trial index
     */
    public void markFailed(int index) {
        failed++;
        dpsByTrial[index] = Double.NaN;
    }

    private static Mean[] means(int count) {
        Mean[] means = new Mean[count];
        for (int i = 0; i < count; i++) {
            means[i] = new Mean();
        }
        return means;
    }

    private static double valueOf(Mean mean) {
        return mean.getN() > 0 ? mean.getResult() : 0.0;
    }

    public int getCompletedTrials() {
        return completed;
    }

    public int getFailedTrials() {
        return failed;
    }

    /**
     * @return per-trial DPS by trial index, NaN for failed trials
     */
    public double[] getDpsByTrial() {
        return dpsByTrial.clone();
    }

    /**
     * @return the DPS of every completed trial, in trial order
     */
    public double[] getDpsValues() {
        return Arrays.stream(dpsByTrial).filter(v -> !Double.isNaN(v)).toArray();
    }

    public double getMeanDps() {
        return dpsStatistics().getMean();
    }

    private DescriptiveStatistics dpsStatistics() {
        return new DescriptiveStatistics(getDpsValues());
    }

    /**
     * @return an immutable summary of the batch
     */
    public ReplicateSummary toSummary() {
        DescriptiveStatistics dps = dpsStatistics();
        double std = dps.getN() > 1 ? new StandardDeviation(false).evaluate(dps.getValues()) : 0.0;
        double meanFightLength = valueOf(fightLengths);

        Map<String, ReplicateSummary.AbilitySummary> abilities = new LinkedHashMap<>();
        for (Ability ability : Ability.values()) {
            int i = ability.ordinal();
            double casts = valueOf(abilityCasts[i]);
            double damage = valueOf(abilityDamage[i]);
            double castsPerMinute = meanFightLength > 0 ? casts / meanFightLength * 60.0 : 0.0;
            double damagePerCast = casts > 0 ? damage / casts : 0.0;
            abilities.put(ability.getDisplayName(), new ReplicateSummary.AbilitySummary(casts,
                    damage, valueOf(abilityDps[i]), castsPerMinute, damagePerCast));
        }

        Map<String, ReplicateSummary.EffectSummary> effectSummaries = new LinkedHashMap<>();
        effects.forEach((name, means) -> effectSummaries.put(name,
                new ReplicateSummary.EffectSummary(valueOf(means[0]), valueOf(means[1]))));

        double exhaustionStd = exhaustionTimes.getN() > 1
                ? Math.sqrt(exhaustionTimes.getPopulationVariance()) : 0.0;
        return new ReplicateSummary(completed, failed, dps.getMean(), std, dps.getPercentile(50),
                meanFightLength, Collections.unmodifiableMap(abilities), Collections.unmodifiableMap(effectSummaries),
                exhaustionTimes.getMean(), exhaustionStd,
                completed > 0 ? (double) exhausted / completed : 0.0);
    }
}
