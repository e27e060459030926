package org.feralsim.runtime.combat;

import org.feralsim.runtime.Config;
import org.feralsim.runtime.spi.IRandomProvider;

/**
 * Stateless roll tables converting a damage range and outcome chances into a sampled
 * {@link RollOutcome}. Every decision consumes its own uniform draw from the supplied
 * {@link IRandomProvider}; no draw is reused.
 * <p>
 * The thresholds of the white table are evaluated in order (miss, glance, crit). When
 * {@code missChance + 0.24 + critChance} exceeds one the crit band is truncated by the
 * end of the unit interval and ordinary hits disappear; the table is not renormalized.
 * </p>
 */
public final class DamageRoller {

    /** Cumulative thresholds of the level-based spell partial resist table. */
    private static final double[] SPELL_RESIST_THRESHOLDS = {0.55, 0.85, 0.99};
    private static final double[] SPELL_RESIST_FACTORS = {1.0, 0.75, 0.5, 0.25};

    private DamageRoller() {}

    /**
     * Executes the single-roll table of a melee auto attack.
     *
     * @param rng            the random source
     * @param low            low end base damage
     * @param high           high end base damage
     * @param missChance     probability that the swing is avoided
     * @param critChance     probability of a critical strike
     * @param critMultiplier damage multiplier on crits
     * @return the sampled outcome
     */
    public static RollOutcome rollWhite(IRandomProvider rng, double low, double high,
                                        double missChance, double critChance, double critMultiplier) {
        double outcomeRoll = rng.nextDouble();
        if (outcomeRoll < missChance) {
            return RollOutcome.missed();
        }

        double baseDamage = low + rng.nextDouble() * (high - low);

        if (outcomeRoll < missChance + Config.GLANCE_BAND) {
            double reduction = Config.GLANCE_MIN_REDUCTION + rng.nextDouble() * Config.GLANCE_REDUCTION_RANGE;
            return new RollOutcome((1.0 - reduction) * baseDamage, false, false);
        }
        if (outcomeRoll < missChance + Config.GLANCE_BAND + critChance) {
            return new RollOutcome(critMultiplier * baseDamage, false, true);
        }
        return new RollOutcome(baseDamage, false, false);
    }

    /**
     * Executes the two-roll table of a special ability: a miss roll, then a crit roll.
     * Yellow attacks cannot glance.
     *
     * @param rng            the random source
     * @param low            low end base damage
     * @param high           high end base damage
     * @param missChance     probability that the ability is avoided
     * @param critChance     probability of a critical strike
     * @param critMultiplier damage multiplier on crits
     * @return the sampled outcome
     */
    public static RollOutcome rollYellow(IRandomProvider rng, double low, double high,
                                         double missChance, double critChance, double critMultiplier) {
        if (rng.nextDouble() < missChance) {
            return RollOutcome.missed();
        }

        double baseDamage = low + rng.nextDouble() * (high - low);

        if (rng.nextDouble() < critChance) {
            return new RollOutcome(critMultiplier * baseDamage, false, true);
        }
        return new RollOutcome(baseDamage, false, false);
    }

    /**
     * Executes a yellow roll followed by a partial resist roll. A landed spell deals full
     * damage 55% of the time, 75% damage 30% of the time, half damage 14% of the time and
     * a quarter 1% of the time.
     *
     * @param rng            the random source
     * @param low            low end base damage
     * @param high           high end base damage
     * @param missChance     probability that the spell misses
     * @param critChance     probability of a critical strike
     * @param critMultiplier damage multiplier on crits
     * @return the sampled outcome
     */
    public static RollOutcome rollSpell(IRandomProvider rng, double low, double high,
                                        double missChance, double critChance, double critMultiplier) {
        RollOutcome outcome = rollYellow(rng, low, high, missChance, critChance, critMultiplier);
        if (outcome.miss()) {
            return outcome;
        }
        return outcome.scaled(resistFactor(rng.nextDouble()));
    }

    /**
     * Maps a uniform draw onto the spell partial resist table.
     *
     * @param roll a value in [0, 1)
     * @return the damage factor after partial resists
     */
    static double resistFactor(double roll) {
        for (int i = 0; i < SPELL_RESIST_THRESHOLDS.length; i++) {
            if (roll < SPELL_RESIST_THRESHOLDS[i]) {
                return SPELL_RESIST_FACTORS[i];
            }
        }
        return SPELL_RESIST_FACTORS[SPELL_RESIST_FACTORS.length - 1];
    }
}
