package org.feralsim.runtime;

import org.feralsim.runtime.model.Ability;

import java.util.List;
import java.util.Map;

/**
 * The result of one trial, handed to the aggregator and then discarded.
 *
 * @param fightLength              the jittered fight length of this trial
 * @param totalDamage              damage dealt over the whole fight
 * @param samples                  every step that dealt damage, in time order
 * @param abilities                casts and damage per ability
 * @param effects                  procs and uptime per effect, in configuration order
 * @param timeToResourceExhaustion when mana first ran out, or null if it never did
 * @param combatLog                the combat log, empty unless the trial was traced
 */
public record TrialRecord(double fightLength, double totalDamage, List<DamageSample> samples,
                          Map<Ability, AbilityTotals> abilities, Map<String, EffectTotals> effects,
                          Double timeToResourceExhaustion, List<CombatLogEntry> combatLog) {

    /**
     * @return damage per second over the trial
     */
    public double dps() {
        return totalDamage / fightLength;
    }

    /**
     * @return the time mana ran out, or the fight length if it never did
     */
    public double resourceExhaustionOrFightLength() {
        return timeToResourceExhaustion == null ? fightLength : timeToResourceExhaustion;
    }

    /**
     * Damage dealt at one simulation step.
     * @param time   step time
     * @param damage damage dealt at that time
     */
    public record DamageSample(double time, double damage) {
    }

    /**
     * @param casts  number of casts
     * @param damage total damage including periodic damage
     */
    public record AbilityTotals(int casts, double damage) {
    }

    /**
     * @param procs  number of activations
     * @param uptime fraction of the fight the effect was active
     */
    public record EffectTotals(int procs, double uptime) {
    }
}
