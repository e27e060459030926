package org.feralsim.runtime.combat;

/**
 * The result of a single damage roll.
 *
 * @param damage damage dealt, 0 on a miss
 * @param miss   whether the attack was avoided
 * @param crit   whether the attack was a critical strike
 */
public record RollOutcome(double damage, boolean miss, boolean crit) {

    private static final RollOutcome MISS = new RollOutcome(0.0, true, false);

    /**
     * @return the shared outcome of an avoided attack
     */
    public static RollOutcome missed() {
        return MISS;
    }

    /**
     * Returns a copy of this outcome with the damage scaled.
     *
     * @param factor multiplier applied to the damage
     * @return the scaled outcome
     */
    public RollOutcome scaled(double factor) {
        return new RollOutcome(damage * factor, miss, crit);
    }
}
