package org.feralsim.analysis;

import org.feralsim.runtime.TrialRecord;
import org.feralsim.runtime.model.Ability;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class AggregateStatisticsTest {

    private static TrialRecord trial(double fightLength, double damage, int shreds, double shredDamage,
                                     double potionUptime, Double exhaustion) {
        Map<Ability, TrialRecord.AbilityTotals> abilities = new EnumMap<>(Ability.class);
        abilities.put(Ability.SHRED, new TrialRecord.AbilityTotals(shreds, shredDamage));
        abilities.put(Ability.RIP, new TrialRecord.AbilityTotals(0, 0.0));
        Map<String, TrialRecord.EffectTotals> effects = new LinkedHashMap<>();
        effects.put("Haste Potion", new TrialRecord.EffectTotals(1, potionUptime));
        return new TrialRecord(fightLength, damage, List.of(), abilities, effects, exhaustion, List.of());
    }

    @Test
    void toSummary_computesDpsStatistics() {
        AggregateStatistics aggregate = new AggregateStatistics(3);
        aggregate.add(0, trial(100, 100_000, 10, 20_000, 0.1, null));
        aggregate.add(1, trial(100, 200_000, 20, 40_000, 0.3, 50.0));
        aggregate.add(2, trial(100, 600_000, 30, 60_000, 0.2, null));

        ReplicateSummary summary = aggregate.toSummary();

        assertThat(summary.trials()).isEqualTo(3);
        assertThat(summary.failedTrials()).isZero();
        assertThat(summary.meanDps()).isCloseTo(3000.0, within(1e-9));
        assertThat(summary.medianDps()).isCloseTo(2000.0, within(1e-9));
        assertThat(summary.stdDps()).isCloseTo(Math.sqrt(14_000_000.0 / 3), within(1e-6));
        assertThat(summary.meanFightLength()).isCloseTo(100.0, within(1e-9));
        assertThat(summary.resourceExhaustionRate()).isCloseTo(1.0 / 3, within(1e-12));
        assertThat(summary.meanTimeToResourceExhaustion()).isCloseTo(250.0 / 3, within(1e-9));
    }

    @Test
    void toSummary_reportsAbilitiesAndEffects() {
        AggregateStatistics aggregate = new AggregateStatistics(2);
        aggregate.add(0, trial(120, 100_000, 10, 20_000, 0.1, null));
        aggregate.add(1, trial(120, 100_000, 20, 40_000, 0.3, null));

        ReplicateSummary summary = aggregate.toSummary();
        ReplicateSummary.AbilitySummary shred = summary.abilities().get("Shred");

        assertThat(shred.casts()).isCloseTo(15.0, within(1e-9));
        assertThat(shred.damage()).isCloseTo(30_000.0, within(1e-9));
        assertThat(shred.dps()).isCloseTo(250.0, within(1e-9));
        assertThat(shred.castsPerMinute()).isCloseTo(7.5, within(1e-9));
        assertThat(shred.damagePerCast()).isCloseTo(2000.0, within(1e-9));
        assertThat(summary.abilities().get("Rip").damagePerCast()).isZero();
        assertThat(summary.abilities()).hasSize(Ability.values().length);
        assertThat(summary.effects().get("Haste Potion").uptime()).isCloseTo(0.2, within(1e-12));
        assertThat(summary.effects().get("Haste Potion").procs()).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void markFailed_leavesTrialOutOfStatistics() {
        AggregateStatistics aggregate = new AggregateStatistics(3);
        aggregate.add(0, trial(100, 100_000, 10, 20_000, 0.1, null));
        aggregate.markFailed(1);
        aggregate.add(2, trial(100, 300_000, 10, 20_000, 0.1, null));

        assertThat(aggregate.getDpsByTrial()).hasSize(3);
        assertThat(aggregate.getDpsByTrial()[1]).isNaN();
        assertThat(aggregate.getDpsValues()).containsExactly(1000.0, 3000.0);
        assertThat(aggregate.toSummary().failedTrials()).isEqualTo(1);
        assertThat(aggregate.toSummary().meanDps()).isCloseTo(2000.0, within(1e-9));
    }

    @Test
    void toSummary_spreadIsPopulationStandardDeviation() {
        AggregateStatistics aggregate = new AggregateStatistics(2);
        aggregate.add(0, trial(100, 10_000, 10, 5_000, 0.1, 40.0));
        aggregate.add(1, trial(100, 20_000, 10, 5_000, 0.1, 60.0));

        ReplicateSummary summary = aggregate.toSummary();

        assertThat(summary.meanDps()).isCloseTo(150.0, within(1e-9));
        assertThat(summary.stdDps()).isCloseTo(50.0, within(1e-9));
        assertThat(summary.meanTimeToResourceExhaustion()).isCloseTo(50.0, within(1e-9));
        assertThat(summary.stdTimeToResourceExhaustion()).isCloseTo(10.0, within(1e-9));
    }

    @Test
    void toSummary_singleTrialHasZeroSpread() {
        AggregateStatistics aggregate = new AggregateStatistics(1);
        aggregate.add(0, trial(100, 100_000, 10, 20_000, 0.1, null));

        ReplicateSummary summary = aggregate.toSummary();

        assertThat(summary.stdDps()).isZero();
        assertThat(summary.stdTimeToResourceExhaustion()).isZero();
    }
}
