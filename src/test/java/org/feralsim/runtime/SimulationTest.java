package org.feralsim.runtime;

import org.feralsim.runtime.internal.services.SeededRandomProvider;
import org.feralsim.runtime.model.Ability;
import org.feralsim.runtime.rotation.RotationConfig;
import org.feralsim.testutils.TestSetups;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class SimulationTest {

    @Test
    @DisplayName("The same seed reproduces a trial exactly")
    void run_isDeterministicForSeed() {
        Simulation simulation = new Simulation(TestSetups.setup(180, RotationConfig.defaults(),
                TestSetups.hasteCooldowns()));

        TrialRecord first = simulation.run(new SeededRandomProvider(99L));
        TrialRecord second = simulation.run(new SeededRandomProvider(99L));
        TrialRecord other = simulation.run(new SeededRandomProvider(100L));

        assertThat(second.totalDamage()).isEqualTo(first.totalDamage());
        assertThat(second.fightLength()).isEqualTo(first.fightLength());
        assertThat(second.samples()).isEqualTo(first.samples());
        assertThat(other.totalDamage()).isNotEqualTo(first.totalDamage());
    }

    @Test
    void run_producesPlausibleTrial() {
        Simulation simulation = new Simulation(TestSetups.setup(180, RotationConfig.defaults(),
                TestSetups.hasteCooldowns()));

        TrialRecord trial = simulation.run(new SeededRandomProvider(5L));

        assertThat(trial.fightLength()).isBetween(170.0, 190.0);
        assertThat(trial.dps()).isGreaterThan(1000.0);
        assertThat(trial.abilities().get(Ability.MANGLE_CAT).casts()).isPositive();
        assertThat(trial.abilities().get(Ability.RIP).damage()).isPositive();
        assertThat(trial.abilities().get(Ability.MELEE).casts()).isGreaterThan(100);
        assertThat(trial.effects()).containsOnlyKeys("Bloodlust", "Haste Potion");
        assertThat(trial.effects().get("Bloodlust").procs()).isEqualTo(1);
        assertThat(trial.effects().get("Bloodlust").uptime()).isCloseTo(40.0 / trial.fightLength(), within(0.01));
        assertThat(trial.combatLog()).isEmpty();
    }

    @Test
    void run_damageIsFullyAttributedToAbilities() {
        Simulation simulation = new Simulation(TestSetups.setup(120));

        TrialRecord trial = simulation.run(new SeededRandomProvider(8L));

        double attributed = trial.abilities().values().stream().mapToDouble(TrialRecord.AbilityTotals::damage).sum();
        double sampled = trial.samples().stream().mapToDouble(TrialRecord.DamageSample::damage).sum();
        assertThat(attributed).isCloseTo(trial.totalDamage(), within(1e-6 * trial.totalDamage()));
        assertThat(sampled).isCloseTo(trial.totalDamage(), within(1e-6 * trial.totalDamage()));
        assertThat(trial.samples()).isSortedAccordingTo((a, b) -> Double.compare(a.time(), b.time()));
    }

    @Test
    @DisplayName("Tracing a trial does not change its outcome")
    void runTrial_logDoesNotAffectResults() {
        Simulation simulation = new Simulation(TestSetups.setup(180));

        TrialRecord traced = simulation.runTrial(new SeededRandomProvider(12L), 180, CombatLog.enabled());
        TrialRecord plain = simulation.runTrial(new SeededRandomProvider(12L), 180, CombatLog.disabled());

        assertThat(traced.totalDamage()).isEqualTo(plain.totalDamage());
        assertThat(traced.combatLog()).isNotEmpty();
        assertThat(plain.combatLog()).isEmpty();
    }

    @Test
    void runSingleTraceWithLog_recordsResourcesWithinBounds() {
        Simulation simulation = new Simulation(TestSetups.setup(60));

        TrialRecord trial = simulation.runSingleTraceWithLog(new SeededRandomProvider(4L));

        assertThat(trial.fightLength()).isEqualTo(60.0);
        assertThat(trial.combatLog()).allSatisfy(entry -> {
            assertThat(entry.energy()).isBetween(0.0, Config.ENERGY_CAP);
            assertThat(entry.rage()).isBetween(0.0, Config.RAGE_CAP);
            assertThat(entry.mana()).isGreaterThanOrEqualTo(0.0);
            assertThat(entry.comboPoints()).isBetween(0, Config.MAX_COMBO_POINTS);
            assertThat(entry.time()).isLessThanOrEqualTo(60.0 + Config.EPSILON);
        });
        assertThat(trial.combatLog()).extracting(CombatLogEntry::event).contains("Melee", "Rip tick");
    }

    @Test
    void run_bearweaveRotationCompletes() {
        RotationConfig weave = RotationConfig.defaults().with(Map.of("bearweave", true, "powerbear", true,
                "laceratePrio", true));
        Simulation simulation = new Simulation(TestSetups.setup(180, weave, TestSetups.hasteCooldowns()));

        for (long seed = 0; seed < 5; seed++) {
            TrialRecord trial = simulation.run(new SeededRandomProvider(seed));
            assertThat(trial.dps()).isPositive();
            if (trial.timeToResourceExhaustion() != null) {
                assertThat(trial.timeToResourceExhaustion()).isBetween(0.0, trial.fightLength());
            }
        }
    }

    @Test
    void run_flowershiftRotationCompletes() {
        RotationConfig flower = RotationConfig.defaults().with(Map.of("flowershift", true));
        Simulation simulation = new Simulation(TestSetups.setup(120, flower, TestSetups.hasteCooldowns()));

        TrialRecord trial = simulation.run(new SeededRandomProvider(1L));

        assertThat(trial.dps()).isPositive();
        assertThat(trial.resourceExhaustionOrFightLength()).isLessThanOrEqualTo(trial.fightLength());
    }
}
