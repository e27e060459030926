package org.feralsim.analysis;

import org.feralsim.junit.extensions.logging.AllowLog;
import org.feralsim.junit.extensions.logging.LogLevel;
import org.feralsim.junit.extensions.logging.LogWatchExtension;
import org.feralsim.runtime.CombatLog;
import org.feralsim.runtime.SimulationSetup;
import org.feralsim.runtime.internal.services.SeededRandomProvider;
import org.feralsim.runtime.model.Actor;
import org.feralsim.runtime.model.ActorConfig;
import org.feralsim.runtime.model.EncounterState;
import org.feralsim.runtime.model.StatTarget;
import org.feralsim.testutils.TestSetups;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
@AllowLog(level = LogLevel.WARN, messagePattern = "The baseline never runs out of mana.*")
class StatWeightEstimatorTest {

    private static StatWeightEstimator estimator(SimulationSetup setup) {
        return new StatWeightEstimator(new ReplicateRunner(2), setup, 11L, 8);
    }

    private static Actor actorFor(ActorConfig config, SimulationSetup setup) {
        return new Actor(config, new EncounterState(setup.encounter()), new SeededRandomProvider(1L),
                CombatLog.disabled());
    }

    @Test
    void pairedDifference_skipsTrialsMissingFromEitherBatch() {
        double[] baseline = {100.0, 110.0, Double.NaN, 120.0};
        double[] perturbed = {102.0, 113.0, 200.0, Double.NaN};

        double[] difference = StatWeightEstimator.pairedDifference(baseline, perturbed);

        assertThat(difference[0]).isCloseTo(2.5, within(1e-12));
        assertThat(difference[1]).isCloseTo(0.5, within(1e-12));
    }

    @Test
    void pairedDifference_singleCommonTrialHasNoStandardError() {
        double[] difference = StatWeightEstimator.pairedDifference(new double[]{100.0, Double.NaN},
                new double[]{104.0, 90.0});

        assertThat(difference[0]).isCloseTo(4.0, within(1e-12));
        assertThat(difference[1]).isZero();
    }

    @Test
    void pairedDifference_requiresACommonTrial() {
        assertThatThrownBy(() -> StatWeightEstimator.pairedDifference(new double[]{Double.NaN}, new double[]{1.0}))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void perturbation_scalesAttackPowerByModifier() {
        SimulationSetup setup = TestSetups.setup(60);
        ActorConfig base = setup.actorConfig();

        StatWeightEstimator.Perturbation perturbation = estimator(setup).perturbation(WeightedStat.ATTACK_POWER);

        assertThat(perturbation.scale()).isEqualTo(1.0 / 80);
        assertThat(perturbation.config().getStat(StatTarget.ATTACK_POWER))
                .isCloseTo(base.getStat(StatTarget.ATTACK_POWER) + 80 * base.getApMod(), within(1e-9));
    }

    @Test
    void perturbation_hitShiftsMissChanceAwayFromZero() {
        SimulationSetup nearCap = TestSetups.setup(60);
        StatWeightEstimator.Perturbation up = estimator(nearCap).perturbation(WeightedStat.HIT);

        assertThat(up.config().getStat(StatTarget.MISS_CHANCE)).isCloseTo(0.02, within(1e-12));
        assertThat(up.config().getStat(StatTarget.HIT_CHANCE)).isEqualTo(0.07);
        assertThat(up.scale()).isEqualTo(-0.5);

        SimulationSetup noHit = nearCap.withActorConfig(nearCap.actorConfig().toBuilder()
                .stat(StatTarget.HIT_CHANCE, 0.0).build());
        StatWeightEstimator.Perturbation down = estimator(noHit).perturbation(WeightedStat.HIT);

        assertThat(down.config().getStat(StatTarget.MISS_CHANCE)).isCloseTo(-0.02, within(1e-12));
        assertThat(down.scale()).isEqualTo(0.5);
    }

    @Test
    void perturbation_hitChangesMissChanceWhenHitIsCapped() {
        SimulationSetup setup = TestSetups.setup(60);
        setup = setup.withActorConfig(setup.actorConfig().toBuilder()
                .stat(StatTarget.HIT_CHANCE, 0.08)
                .stat(StatTarget.EXPERTISE_RATING, 0)
                .build());

        StatWeightEstimator.Perturbation perturbation = estimator(setup).perturbation(WeightedStat.HIT);

        double baselineMiss = actorFor(setup.actorConfig(), setup).getMissChance();
        double perturbedMiss = actorFor(perturbation.config(), setup).getMissChance();
        assertThat(baselineMiss).isCloseTo(0.04, within(1e-12));
        assertThat(perturbedMiss).isCloseTo(0.02, within(1e-12));
        assertThat(perturbation.scale()).isEqualTo(0.5);
    }

    @Test
    void perturbation_agilityAlsoRaisesAttackPowerAndCrit() {
        SimulationSetup setup = TestSetups.setup(60);
        ActorConfig base = setup.actorConfig();

        StatWeightEstimator.Perturbation perturbation = estimator(setup).withAgilityModifier(1.1)
                .perturbation(WeightedStat.AGILITY);

        ActorConfig perturbed = perturbation.config();
        assertThat(perturbed.getStat(StatTarget.AGILITY) - base.getStat(StatTarget.AGILITY))
                .isCloseTo(44.0, within(1e-9));
        assertThat(perturbed.getStat(StatTarget.ATTACK_POWER) - base.getStat(StatTarget.ATTACK_POWER))
                .isCloseTo(44.0 * base.getApMod(), within(1e-9));
        assertThat(perturbed.getStat(StatTarget.CRIT_CHANCE) - base.getStat(StatTarget.CRIT_CHANCE))
                .isCloseTo(0.011, within(1e-12));
        assertThat(perturbation.scale()).isEqualTo(1.0 / 40);
    }

    @Test
    void perturbation_hasteShortensSwingTimer() {
        SimulationSetup setup = TestSetups.setup(60);

        StatWeightEstimator.Perturbation perturbation = estimator(setup).perturbation(WeightedStat.HASTE);

        assertThat(perturbation.config().getStat(StatTarget.SWING_TIMER))
                .isLessThan(setup.actorConfig().getStat(StatTarget.SWING_TIMER));
        assertThat(perturbation.scale()).isEqualTo(0.25);
    }

    @Test
    void perturbation_intellectIsDerived() {
        assertThatThrownBy(() -> estimator(TestSetups.setup(60)).perturbation(WeightedStat.INTELLECT))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void calcStatWeights_normalizesToAttackPower() {
        StatWeightEstimator estimator = estimator(TestSetups.setup(60));

        StatWeightReport report = estimator.calcStatWeights();

        assertThat(report.baseDps()).isPositive();
        assertThat(report.weights()).containsOnlyKeys(WeightedStat.ATTACK_POWER, WeightedStat.HIT,
                WeightedStat.CRIT, WeightedStat.AGILITY, WeightedStat.HASTE, WeightedStat.ARMOR_PEN,
                WeightedStat.WEAPON_DAMAGE);
        assertThat(report.dpsPerAttackPower()).isPositive();
        assertThat(report.weights().get(WeightedStat.ATTACK_POWER).relativeWeight()).isCloseTo(1.0, within(1e-12));
        assertThat(report.weights().get(WeightedStat.ATTACK_POWER).projectedError()).isNull();
    }

    @Test
    void calcManaWeights_derivesIntellect() {
        StatWeightEstimator estimator = estimator(TestSetups.setup(60));
        AggregateStatistics baseline = estimator.runBaseline();

        StatWeightReport report = estimator.calcManaWeights(baseline, 2.0);

        assertThat(report.weights()).containsOnlyKeys(WeightedStat.MANA, WeightedStat.SPIRIT,
                WeightedStat.INTELLECT, WeightedStat.MP5);
        StatWeight mana = report.weights().get(WeightedStat.MANA);
        StatWeight spirit = report.weights().get(WeightedStat.SPIRIT);
        double spiritShare = 200.0 / (2 * 300.0);
        assertThat(report.weights().get(WeightedStat.INTELLECT).dpsPerUnit())
                .isCloseTo(15 * mana.dpsPerUnit() + spiritShare * spirit.dpsPerUnit(), within(1e-9));
        assertThat(mana.relativeWeight()).isCloseTo(mana.dpsPerUnit() / 2.0, within(1e-12));
    }
}
