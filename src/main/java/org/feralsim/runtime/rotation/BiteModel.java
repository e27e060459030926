package org.feralsim.runtime.rotation;

import org.feralsim.runtime.Config;
import org.feralsim.runtime.model.Actor;
import org.feralsim.runtime.model.DamageParameters;

/**
 * Closed-form lookahead used by the rotation policy: cooldown predictions, expected finisher
 * costs and the decision whether a Ferocious Bite fits in before Rip has to be refreshed.
 * <p>
 * None of the methods draw random numbers or change state.
 * </p>
 */
public final class BiteModel {

    private static final double AVERAGE_BUILDER_COST = (42.0 + 42.0 + 35.0) / 3.0;
    private static final double REVITALIZE_CHANCE = 0.15;
    private static final double REVITALIZE_ENERGY = 8.0;
    private static final double OMEN_RATE = 3.5 / 60;

    private final RotationConfig rotation;
    private final double revitalizeFrequency;

    /**
     * @param rotation            the rotation tunables
     * @param revitalizeFrequency seconds between two Revitalize rolls
     */
    public BiteModel(RotationConfig rotation, double revitalizeFrequency) {
        this.rotation = rotation;
        this.revitalizeFrequency = revitalizeFrequency;
    }

    /**
     * Predicts whether Berserk will be active at a future time.
     *
     * @param state      the trial state
     * @param time       the current time
     * @param futureTime the time to predict for
     * @return true if Berserk is expected to be up
     */
    public boolean berserkExpectedAt(SimulationState state, double time, double futureTime) {
        Actor actor = state.actor();
        if (actor.isBerserk()) {
            return futureTime < state.getBerserkEnd() || futureTime > time + actor.getBerserkCooldown();
        }
        if (actor.getBerserkCooldown() > Config.EPSILON) {
            return futureTime > time + actor.getBerserkCooldown();
        }
        if (actor.isTigersFury() && rotation.isUseBerserk()) {
            return futureTime > state.getTigersFuryEnd();
        }
        return false;
    }

    /**
     * Predicts whether Tiger's Fury will be used before a future time.
     *
     * @param state      the trial state
     * @param time       the current time
     * @param futureTime the time to predict for
     * @return true if Tiger's Fury is expected before {@code futureTime}
     */
    public boolean tigersFuryExpectedBefore(SimulationState state, double time, double futureTime) {
        Actor actor = state.actor();
        if (actor.getTigersFuryCooldown() > Config.EPSILON) {
            return time + actor.getTigersFuryCooldown() < futureTime;
        }
        if (actor.isBerserk()) {
            return state.getBerserkEnd() < futureTime;
        }
        return true;
    }

    /**
     * Decides whether there is enough time left on Rip to fit in a Ferocious Bite, using the
     * fixed {@code biteTime} when configured and the analytical energy budget otherwise.
     *
     * @param state the trial state
     * @param time  the current time
     * @return true if Biting now is preferable
     */
    public boolean canBite(SimulationState state, double time) {
        Double biteTime = rotation.getBiteTime();
        if (biteTime != null) {
            return state.getRipEnd() - time >= biteTime;
        }
        return canBiteAnalytical(state, time);
    }

    /**
     * Compares the energy expected until Rip runs out against the cost of Biting now, rebuilding
     * combo points and refreshing Rip, discounted by the Rip downtime a Bite is worth.
     *
     * @param state the trial state
     * @param time  the current time
     * @return true if the expected energy covers the effective cost
     */
    public boolean canBiteAnalytical(SimulationState state, double time) {
        Actor actor = state.actor();
        double maxRipEnd = state.getRip().getStart() + actor.getRipDuration()
                + (actor.getConfig().isShredGlyph() ? Config.SHRED_GLYPH_MAX_EXTENSION : 0.0);
        double ripRemaining = maxRipEnd - time;
        double expectedGain = Config.ENERGY_PER_SECOND * ripRemaining;

        if (tigersFuryExpectedBefore(state, time, state.getRipEnd())) {
            expectedGain += Config.TIGERS_FURY_ENERGY;
        }
        if (actor.getConfig().isOmen()) {
            expectedGain += ripRemaining / state.getSwingTimer().getPeriod()
                    * (OMEN_RATE * (1 - actor.getMissChance()) * 42.0);
        }
        expectedGain += ripRemaining / revitalizeFrequency * REVITALIZE_CHANCE * REVITALIZE_ENERGY;
        double available = actor.getEnergy() + expectedGain;

        FinisherCosts costs = finisherCosts(state, time);
        double comboPointsPerBuilder = 1 + actor.getCritChance();
        double costPerBuilder = AVERAGE_BUILDER_COST * (1 + 0.2 * actor.getMissChance());
        double cost = costs.bite() + 5.0 / comboPointsPerBuilder * costPerBuilder + costs.rip();

        double allowedDowntime = allowedRipDowntime(state, time);
        // discount for losses at the end of the fight
        double maxDuration = maxRipEnd - state.getRip().getStart();
        allowedDowntime = maxDuration * (1 - 1 / (1 + allowedDowntime / maxDuration));
        cost -= Config.ENERGY_PER_SECOND * allowedDowntime;

        return available > cost;
    }

    /**
     * Expected energy cost of the next Rip refresh and of a Bite cast now.
     *
     * @param state the trial state
     * @param time  the current time
     * @return the costs
     */
    public FinisherCosts finisherCosts(SimulationState state, double time) {
        Actor actor = state.actor();
        double ripEnd = state.isRipUp() ? state.getRipEnd() : time;
        double ripCost = berserkExpectedAt(state, time, ripEnd) ? actor.getBaseRipCost() / 2 : actor.getBaseRipCost();
        double biteCost;
        if (actor.getEnergy() >= actor.getBiteCost()) {
            biteCost = Math.min(actor.getBiteCost() + 30, actor.getEnergy());
        } else {
            biteCost = actor.getBiteCost() + Config.ENERGY_PER_SECOND * state.getLatency();
        }
        return new FinisherCosts(ripCost, biteCost);
    }

    /**
     * Seconds of Rip uptime worth giving up for one Ferocious Bite.
     *
     * @param state the trial state
     * @param time  the current time
     * @return the allowed Rip downtime
     */
    public double allowedRipDowntime(SimulationState state, double time) {
        Actor actor = state.actor();
        DamageParameters damage = actor.getDamage();
        int ripCp = rotation.getMinCombosForRip();
        int biteCp = rotation.getMinCombosForBite();
        FinisherCosts costs = finisherCosts(state, time);
        double critFactor = 2.2 * (1 + (actor.getConfig().isMetaGem() ? 0.03 : 0.0)) - 1;
        double crit = actor.getCritChance();

        double biteBase = 0.5 * (damage.biteLow(biteCp) + damage.biteHigh(biteCp));
        double biteBonus = (costs.bite() - actor.getBiteCost()) * (3.4 + actor.getAttackPower() / 410.0)
                * damage.biteMultiplier();
        double bitePerCast = (biteBase + biteBonus) * (1 + critFactor * (crit + 0.25));
        double ripTick = damage.ripTick(ripCp) * Config.MANGLE_MULTIPLIER
                * (1 + critFactor * crit * (actor.getConfig().isPrimalGore() ? 1 : 0));
        double shredPerCast = 0.5 * (damage.shredLow() + damage.shredHigh()) * Config.MANGLE_MULTIPLIER
                * (1 + critFactor * crit);
        return (bitePerCast - (costs.bite() - costs.rip()) * shredPerCast / 42.0) / ripTick
                * Config.RIP_TICK_INTERVAL;
    }

    /**
     * @param rip  expected energy cost of the next Rip
     * @param bite expected energy cost of a Bite now, including the energy it converts
     */
    public record FinisherCosts(double rip, double bite) {
    }
}
