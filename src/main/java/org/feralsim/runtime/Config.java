package org.feralsim.runtime;

/**
 * Provides centralized combat constants for the simulation engine.
 * This final class contains static constants that define resource caps, timer lengths and
 * fixed multipliers shared by the actor, the effects and the event loop. It is not meant to
 * be instantiated. Tunable values (stats, talents, rotation choices) are loaded from HOCON
 * configuration at runtime instead.
 */
public final class Config {

    /**
     * Private constructor to prevent instantiation of this utility class.
     */
    private Config() {}

    /**
     * Tolerance used for every "has this timer expired" comparison.
     */
    public static final double EPSILON = 1e-9;

    // Resources

    /**
     * The maximum energy the actor can hold in Cat form.
     */
    public static final double ENERGY_CAP = 100.0;

    /**
     * The maximum rage the actor can hold in Bear form.
     */
    public static final double RAGE_CAP = 100.0;

    /**
     * The maximum number of combo points on the target.
     */
    public static final int MAX_COMBO_POINTS = 5;

    /**
     * Energy regenerated per second.
     */
    public static final double ENERGY_PER_SECOND = 10.0;

    /**
     * Rage trickle per second while Enrage is active.
     */
    public static final double ENRAGE_RAGE_PER_SECOND = 1.0;

    // Roll tables

    /**
     * Width of the glancing-blow band in the white-damage roll table.
     */
    public static final double GLANCE_BAND = 0.24;

    /**
     * Minimum damage reduction of a glancing blow.
     */
    public static final double GLANCE_MIN_REDUCTION = 0.15;

    /**
     * Width of the uniform glancing-blow reduction range.
     */
    public static final double GLANCE_REDUCTION_RANGE = 0.2;

    /**
     * Crit suppression applied to the configured melee crit chance against a boss.
     */
    public static final double CRIT_SUPPRESSION = 0.048;

    /**
     * Additional crit suppression for Bear form attacks.
     */
    public static final double BEAR_CRIT_PENALTY = 0.04;

    // Debuffs and buffs

    /**
     * Damage multiplier applied to bleeds and builders while Mangle is on the target.
     */
    public static final double MANGLE_MULTIPLIER = 1.3;

    /**
     * Duration of the Mangle debuff in seconds.
     */
    public static final double MANGLE_DURATION = 60.0;

    /**
     * Bear damage multiplier while Enrage (King of the Jungle) is active.
     */
    public static final double ENRAGE_MULTIPLIER = 1.15;

    public static final double TIGERS_FURY_ENERGY = 60.0;
    public static final double TIGERS_FURY_BONUS_DAMAGE = 80.0;
    public static final double TIGERS_FURY_DURATION = 6.0;
    public static final double TIGERS_FURY_COOLDOWN = 30.0;

    public static final double BERSERK_DURATION = 15.0;
    public static final double BERSERK_COOLDOWN = 180.0;

    public static final double ENRAGE_RAGE = 20.0;
    public static final double ENRAGE_COOLDOWN = 60.0;

    /**
     * Savage Roar durations in seconds, indexed by combo points (index 0 unused).
     */
    public static final double[] ROAR_DURATIONS = {0.0, 14.0, 19.0, 24.0, 29.0, 34.0};

    /**
     * Additional Savage Roar duration from the tier 8 four-piece bonus.
     */
    public static final double ROAR_T8_BONUS = 8.0;

    // Damage over time

    public static final double RIP_TICK_INTERVAL = 2.0;
    public static final double RAKE_TICK_INTERVAL = 3.0;
    public static final double LACERATE_TICK_INTERVAL = 3.0;
    public static final double LACERATE_DURATION = 15.0;
    public static final int LACERATE_MAX_STACKS = 5;

    /**
     * Rip extension per landed Shred with Glyph of Shred.
     */
    public static final double SHRED_GLYPH_EXTENSION = 2.0;

    /**
     * Maximum total Rip extension from Glyph of Shred.
     */
    public static final double SHRED_GLYPH_MAX_EXTENSION = 6.0;

    // Mana

    /**
     * Length of the reduced-regeneration window after a shapeshift or spell cast.
     */
    public static final double FIVE_SECOND_RULE = 5.0;

    public static final double RUNE_COOLDOWN = 900.0;
    public static final double RUNE_MIN_MANA = 900.0;
    public static final double RUNE_MANA_RANGE = 600.0;

    /**
     * The rune is only used when at least this much mana is missing from the pool.
     */
    public static final double RUNE_MANA_DEFICIT = 1500.0;

    public static final double GIFT_OF_THE_WILD_COST = 1119.0;

    // Timing

    public static final double CAT_GCD = 1.0;
    public static final double SHIFT_GCD = 1.5;
    public static final double BEAR_GCD = 1.5;
    public static final double MANGLE_BEAR_COOLDOWN = 6.0;
    public static final double FAERIE_FIRE_COOLDOWN = 6.0;
    public static final double ILOTP_COOLDOWN = 6.0;

    /**
     * Remaining fight time under which Rip is no longer applied and Bite is used instead.
     */
    public static final double END_OF_FIGHT_THRESHOLD = 10.0;

    /**
     * Upper bound of the random offset of the first melee swing.
     */
    public static final double FIRST_SWING_JITTER = 0.1;

    /**
     * Number of consecutive loop iterations without time advancing before a trial is aborted.
     */
    public static final int MAX_STALLED_STEPS = 10_000;
}
