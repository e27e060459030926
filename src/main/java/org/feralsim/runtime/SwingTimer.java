package org.feralsim.runtime;

import org.feralsim.runtime.combat.HasteMath;

/**
 * The melee swing schedule of one trial: the current hasted swing period and the time of the
 * next swing.
 * <p>
 * A haste change keeps the fraction of the current swing that is still outstanding, so a
 * swing half way done when a haste buff lands is still half way done afterwards. A shapeshift
 * changes the period but not the time of the next swing.
 * </p>
 */
public final class SwingTimer {

    private double period;
    private double nextSwing;
    private double hasteMultiplier;

    /**
     * @param period          the unbuffed Cat form swing period
     * @param hasteMultiplier the product of multiplicative haste buffs present for the whole fight
     */
    public SwingTimer(double period, double hasteMultiplier) {
        this.period = period;
        this.hasteMultiplier = hasteMultiplier;
    }

    /**
     * Schedules the first swing.
     * @param time the time of the first swing
     */
    public void start(double time) {
        this.nextSwing = time;
    }

    /**
     * Marks the pending swing as resolved and schedules the next one.
     */
    public void advance() {
        nextSwing += period;
    }

    /**
     * Changes the swing period for a shapeshift. The next swing keeps its time.
     * @param toCat true when entering Cat form, false when entering Bear form
     */
    public void onShift(boolean toCat) {
        period = toCat ? period / 2.5 : period * 2.5;
    }

    /**
     * Adds haste rating and rescales the outstanding part of the current swing.
     *
     * @param time    the current simulation time
     * @param rating  signed haste rating change
     * @param catForm the current form
     */
    public void addHasteRating(double time, double rating, boolean catForm) {
        double current = HasteMath.hasteRating(period, hasteMultiplier, catForm);
        rescale(time, HasteMath.swingTimer(current + rating, hasteMultiplier, catForm));
    }

    /**
     * Multiplies the haste multiplier by a factor and rescales the outstanding part of the swing.
     *
     * @param time   the current simulation time
     * @param factor the haste factor, below one to remove haste
     */
    public void multiplyHaste(double time, double factor) {
        hasteMultiplier *= factor;
        rescale(time, period / factor);
    }

    private void rescale(double time, double newPeriod) {
        double remaining = (nextSwing - time) / period;
        nextSwing = time + remaining * newPeriod;
        period = newPeriod;
    }

    /**
     * @param catForm the current form
     * @return the hasted global cooldown of a spell cast in caster form
     */
    public double spellGcd(boolean catForm) {
        return HasteMath.spellGcd(HasteMath.hasteRating(period, hasteMultiplier, catForm), hasteMultiplier);
    }

    public double getPeriod() { return period; }
    public double getNextSwing() { return nextSwing; }
    public double getHasteMultiplier() { return hasteMultiplier; }
}
