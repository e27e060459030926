package org.feralsim.analysis;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;
import org.feralsim.runtime.CombatLog;
import org.feralsim.runtime.Simulation;
import org.feralsim.runtime.SimulationSetup;
import org.feralsim.runtime.combat.HasteMath;
import org.feralsim.runtime.internal.services.SeededRandomProvider;
import org.feralsim.runtime.model.Actor;
import org.feralsim.runtime.model.ActorConfig;
import org.feralsim.runtime.model.EncounterState;
import org.feralsim.runtime.model.StatTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Estimates the DPS value of stats by finite differences.
 * <p>
 * Every stat is raised by an increment large enough to stand out from the simulation noise and
 * the DPS difference is scaled back down to one reporting unit. Baseline and perturbed batches use
 * the same batch seed, so trial {@code i} of both batches shares its random stream and the
 * difference is estimated pair by pair. Some increments are coupled: Agility also raises Attack
 * Power and crit, and the hit increment shifts the miss chance itself, in whichever direction
 * keeps it away from zero.
 * </p>
 */
public class StatWeightEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(StatWeightEstimator.class);

    private static final List<WeightedStat> COMBAT_STATS = List.of(WeightedStat.ATTACK_POWER, WeightedStat.HIT,
            WeightedStat.CRIT, WeightedStat.AGILITY, WeightedStat.HASTE, WeightedStat.ARMOR_PEN,
            WeightedStat.WEAPON_DAMAGE);

    private static final double HIT_CAP_MARGIN = 0.02;
    private static final double HASTE_RATING_INCREMENT = 63.08;

    private final ReplicateRunner runner;
    private final SimulationSetup setup;
    private final long seed;
    private final int trials;
    private double agilityModifier = 1.0;
    private ErrorBarProjection projection;

    /**
     * @param runner runs the batches
     * @param setup  the unperturbed simulation input
     * @param seed   the batch seed shared by all batches
     * @param trials trials per batch
     */
    public StatWeightEstimator(ReplicateRunner runner, SimulationSetup setup, long seed, int trials) {
        this.runner = runner;
        this.setup = setup;
        this.seed = seed;
        this.trials = trials;
    }

    /**
     * @param agilityModifier multiplier on primary attributes from raid buffs
     * @return this estimator
     */
    public StatWeightEstimator withAgilityModifier(double agilityModifier) {
        this.agilityModifier = agilityModifier;
        return this;
    }

    /**
     * @param projection projects error bars to a production trial count, null for none
     * @return this estimator
     */
    public StatWeightEstimator withProjection(ErrorBarProjection projection) {
        this.projection = projection;
        return this;
    }

    /**
     * @return the aggregate of an unperturbed batch
     */
    public AggregateStatistics runBaseline() {
        return runner.runAggregate(new Simulation(setup)::run, seed, trials);
    }

    /**
     * Runs a baseline batch and estimates the combat stat weights against it.
     *
     * @return the weights, normalized to Attack Power
     */
    public StatWeightReport calcStatWeights() {
        return calcStatWeights(runBaseline());
    }

    /**
     * Estimates the combat stat weights against an existing baseline.
     *
     * @param baseline an unperturbed batch run with this estimator's seed and trial count
     * @return the weights, normalized to Attack Power
     */
    public StatWeightReport calcStatWeights(AggregateStatistics baseline) {
        Map<WeightedStat, StatWeight> raw = new EnumMap<>(WeightedStat.class);
        for (WeightedStat stat : COMBAT_STATS) {
            raw.put(stat, calcStatWeight(stat, baseline));
        }
        double dpsPerAttackPower = raw.get(WeightedStat.ATTACK_POWER).dpsPerUnit();
        Map<WeightedStat, StatWeight> weights = new EnumMap<>(WeightedStat.class);
        raw.forEach((stat, weight) -> weights.put(stat, weight.normalizedTo(dpsPerAttackPower)));
        return new StatWeightReport(baseline.getMeanDps(), Collections.unmodifiableMap(weights));
    }

    /**
     * Estimates the mana stat weights. These are only meaningful when the baseline runs out of
     * mana before the fight ends.
     *
     * @param baseline          an unperturbed batch run with this estimator's seed and trial count
     * @param dpsPerAttackPower DPS per Attack Power used for normalization
     * @return the weights of mana, Spirit, Intellect and mp5
     */
    public StatWeightReport calcManaWeights(AggregateStatistics baseline, double dpsPerAttackPower) {
        if (baseline.toSummary().resourceExhaustionRate() == 0.0) {
            LOG.warn("The baseline never runs out of mana, mana weights will be close to zero");
        }
        StatWeight mana = calcStatWeight(WeightedStat.MANA, baseline);
        StatWeight spirit = calcStatWeight(WeightedStat.SPIRIT, baseline);
        StatWeight mp5 = calcStatWeight(WeightedStat.MP5, baseline);

        // Intellect adds 15 mana per point and raises the regeneration of existing Spirit
        double intellect = setup.actorConfig().getStat(StatTarget.INTELLECT);
        double spiritShare = setup.actorConfig().getStat(StatTarget.SPIRIT) / (2 * intellect);
        double intellectDps = 15 * mana.dpsPerUnit() + spiritShare * spirit.dpsPerUnit();
        double intellectError = Math.hypot(15 * mana.standardError(), spiritShare * spirit.standardError());
        Double intellectProjection = mana.projectedError() == null || spirit.projectedError() == null ? null
                : Math.hypot(15 * mana.projectedError(), spiritShare * spirit.projectedError());
        StatWeight intellectWeight = new StatWeight(WeightedStat.INTELLECT, intellectDps, intellectError,
                Double.NaN, intellectProjection);

        Map<WeightedStat, StatWeight> weights = new EnumMap<>(WeightedStat.class);
        for (StatWeight weight : List.of(mana, spirit, intellectWeight, mp5)) {
            weights.put(weight.stat(), weight.normalizedTo(dpsPerAttackPower));
        }
        return new StatWeightReport(baseline.getMeanDps(), Collections.unmodifiableMap(weights));
    }

    /**
     * Runs one perturbed batch and estimates the weight of a single stat. The relative weight of
     * the result is left at NaN.
     *
     * @param stat     the stat to estimate, not {@link WeightedStat#INTELLECT}
     * @param baseline an unperturbed batch run with this estimator's seed and trial count
     * @return the weight in DPS per unit
     */
    public StatWeight calcStatWeight(WeightedStat stat, AggregateStatistics baseline) {
        Perturbation perturbation = perturbation(stat);
        AggregateStatistics perturbed = runner.runAggregate(
                new Simulation(setup.withActorConfig(perturbation.config()))::run, seed, trials);

        double[] difference = pairedDifference(baseline.getDpsByTrial(), perturbed.getDpsByTrial());
        double scale = perturbation.scale();
        Double projected = projection == null ? null
                : Math.abs(scale) * projection.project(baseline.getDpsValues(), perturbed.getDpsValues());
        StatWeight weight = new StatWeight(stat, scale * difference[0], Math.abs(scale) * difference[1], Double.NaN,
                projected);
        if (LOG.isDebugEnabled()) {
            LOG.debug("{}: {} DPS per unit (+/- {})", stat.getLabel(), weight.dpsPerUnit(), weight.standardError());
        }
        return weight;
    }

    /**
     * Builds the perturbed character for one stat.
     *
     * @param stat the stat
     * @return the perturbed character and the factor converting the DPS difference to one unit
     * @throws IllegalArgumentException for {@link WeightedStat#INTELLECT}, which is derived
     */
    Perturbation perturbation(WeightedStat stat) {
        ActorConfig config = setup.actorConfig();
        switch (stat) {
            case ATTACK_POWER -> {
                return new Perturbation(config.withAdded(StatTarget.ATTACK_POWER, 80 * config.getApMod()), 1.0 / 80);
            }
            case HIT -> {
                // shift the miss chance directly, upwards when it is within 2% of zero
                double sign = unbuffedActor().getMissChance() > HIT_CAP_MARGIN ? -1.0 : 1.0;
                return new Perturbation(config.withAdded(StatTarget.MISS_CHANCE, sign * HIT_CAP_MARGIN),
                        -0.5 * sign);
            }
            case CRIT -> {
                return new Perturbation(config.withAdded(StatTarget.CRIT_CHANCE, 0.02), 0.5);
            }
            case AGILITY -> {
                double increment = 40 * agilityModifier;
                ActorConfig perturbed = config.withAdded(StatTarget.AGILITY, increment)
                        .withAdded(StatTarget.ATTACK_POWER, config.getApMod() * increment)
                        .withAdded(StatTarget.CRIT_CHANCE, increment / 40 / 100);
                return new Perturbation(perturbed, 1.0 / 40);
            }
            case HASTE -> {
                double swingTimer = config.getStat(StatTarget.SWING_TIMER);
                double baseRating = HasteMath.hasteRating(swingTimer, setup.hasteMultiplier(), true);
                double swingDelta = swingTimer - HasteMath.swingTimer(baseRating + HASTE_RATING_INCREMENT,
                        setup.hasteMultiplier(), true);
                return new Perturbation(config.withAdded(StatTarget.SWING_TIMER, -swingDelta), 0.25);
            }
            case ARMOR_PEN -> {
                return new Perturbation(config.withAdded(StatTarget.ARMOR_PEN_RATING, 50), 1.0 / 50);
            }
            case WEAPON_DAMAGE -> {
                return new Perturbation(config.withAdded(StatTarget.WEAPON_DAMAGE, 12), 1.0 / 12);
            }
            case MANA -> {
                double shiftCost = unbuffedActor().getShiftCost();
                return new Perturbation(config.withAdded(StatTarget.MANA_POOL, shiftCost), 1.0 / shiftCost);
            }
            case SPIRIT -> {
                Actor actor = unbuffedActor();
                if (actor.getRegenFactor() <= 0) {
                    throw new IllegalStateException("Spirit has no value without Intellect");
                }
                // Spirit that regenerates one extra shift over an Innervate
                double increment = actor.getShiftCost() / 10 / 5 / actor.getRegenFactor();
                return new Perturbation(config.withAdded(StatTarget.SPIRIT, increment), 1.0 / increment);
            }
            case MP5 -> {
                double increment = Math.ceil(unbuffedActor().getShiftCost() / (setup.fightLength() / 5));
                return new Perturbation(config.withAdded(StatTarget.MP5, increment), 1.0 / increment);
            }
            default -> throw new IllegalArgumentException(stat + " is derived and cannot be perturbed directly");
        }
    }

    private Actor unbuffedActor() {
        return new Actor(setup.actorConfig(), new EncounterState(setup.encounter()), new SeededRandomProvider(seed),
                CombatLog.disabled());
    }

    /**
     * Mean and standard error of the per-trial DPS difference over the trials that completed in
     * both batches.
     *
     * @param baseline  per-trial DPS without the perturbation, NaN for failed trials
     * @param perturbed per-trial DPS with the perturbation, NaN for failed trials
     * @return {@code {mean, standardError}}
     */
    static double[] pairedDifference(double[] baseline, double[] perturbed) {
        SummaryStatistics differences = new SummaryStatistics();
        for (int i = 0; i < Math.min(baseline.length, perturbed.length); i++) {
            if (!Double.isNaN(baseline[i]) && !Double.isNaN(perturbed[i])) {
                differences.addValue(perturbed[i] - baseline[i]);
            }
        }
        long n = differences.getN();
        if (n == 0) {
            throw new IllegalStateException("No trial completed in both batches");
        }
        double standardError = n > 1 ? differences.getStandardDeviation() / Math.sqrt(n) : 0.0;
        return new double[]{differences.getMean(), standardError};
    }

    /**
     * @param config the perturbed character
     * @param scale  factor converting the DPS difference to DPS per unit
     */
    record Perturbation(ActorConfig config, double scale) {
    }
}
