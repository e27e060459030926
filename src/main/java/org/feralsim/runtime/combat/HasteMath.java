package org.feralsim.runtime.combat;

/**
 * Conversions between haste rating, haste multipliers and timer lengths.
 */
public final class HasteMath {

    /** Haste rating per 1% melee haste. */
    public static final double MELEE_HASTE_RATING = 25.21;

    /** Haste rating per 1% spell haste. */
    public static final double SPELL_HASTE_RATING = 32.79;

    private static final double CAT_BASE_SWING = 1.0;
    private static final double BEAR_BASE_SWING = 2.5;
    private static final double BASE_SPELL_GCD = 1.5;
    private static final double MIN_SPELL_GCD = 1.0;

    private HasteMath() {}

    /**
     * Calculates the swing timer for a total haste rating.
     *
     * @param hasteRating total haste rating
     * @param multiplier  product of multiplicative haste buffs
     * @param catForm     true for the Cat form base timer, false for Bear
     * @return hasted swing timer in seconds
     */
    public static double swingTimer(double hasteRating, double multiplier, boolean catForm) {
        double base = catForm ? CAT_BASE_SWING : BEAR_BASE_SWING;
        return base / (multiplier * (1 + hasteRating / (MELEE_HASTE_RATING * 100)));
    }

    /**
     * Calculates the haste rating consistent with a given swing timer.
     *
     * @param swingTimer hasted swing timer in seconds
     * @param multiplier product of multiplicative haste buffs
     * @param catForm    true if the timer is a Cat form timer
     * @return unrounded haste rating
     */
    public static double hasteRating(double swingTimer, double multiplier, boolean catForm) {
        double base = catForm ? CAT_BASE_SWING : BEAR_BASE_SWING;
        return MELEE_HASTE_RATING * 100 * (base / (swingTimer * multiplier) - 1);
    }

    /**
     * Calculates the global cooldown of a spell cast, floored at one second.
     *
     * @param hasteRating total haste rating
     * @param multiplier  product of multiplicative spell haste buffs
     * @return hasted GCD in seconds
     */
    public static double spellGcd(double hasteRating, double multiplier) {
        return Math.max(BASE_SPELL_GCD / (multiplier * (1 + hasteRating / (SPELL_HASTE_RATING * 100))),
                MIN_SPELL_GCD);
    }
}
