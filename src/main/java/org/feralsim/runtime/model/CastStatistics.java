package org.feralsim.runtime.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-trial tally of casts and damage for every {@link Ability}.
 */
public final class CastStatistics {

    private final int[] casts = new int[Ability.values().length];
    private final double[] damage = new double[Ability.values().length];

    /**
     * Counts one cast and adds its damage.
     * @param ability the ability cast
     * @param amount damage dealt by the cast
     */
    public void recordCast(Ability ability, double amount) {
        casts[ability.ordinal()]++;
        damage[ability.ordinal()] += amount;
    }

    /**
     * Adds damage without counting a cast (periodic ticks, Savage Roar share).
     * @param ability the ability credited
     * @param amount damage to add
     */
    public void addDamage(Ability ability, double amount) {
        damage[ability.ordinal()] += amount;
    }

    public int getCasts(Ability ability) {
        return casts[ability.ordinal()];
    }

    public double getDamage(Ability ability) {
        return damage[ability.ordinal()];
    }

    /**
     * @return an immutable snapshot of cast counts in ability order
     */
    public Map<Ability, Integer> castsByAbility() {
        Map<Ability, Integer> result = new EnumMap<>(Ability.class);
        for (Ability ability : Ability.values()) {
            result.put(ability, casts[ability.ordinal()]);
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * @return an immutable snapshot of damage totals in ability order
     */
    public Map<Ability, Double> damageByAbility() {
        Map<Ability, Double> result = new EnumMap<>(Ability.class);
        for (Ability ability : Ability.values()) {
            result.put(ability, damage[ability.ordinal()]);
        }
        return Collections.unmodifiableMap(result);
    }
}
