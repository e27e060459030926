package org.feralsim.runtime.rotation;

import org.feralsim.runtime.CombatLog;
import org.feralsim.runtime.Config;
import org.feralsim.runtime.SwingTimer;
import org.feralsim.runtime.effects.EffectContext;
import org.feralsim.runtime.effects.StatDelta;
import org.feralsim.runtime.model.Actor;
import org.feralsim.runtime.model.DamageOverTime;
import org.feralsim.runtime.model.Form;
import org.feralsim.runtime.spi.IRandomProvider;

/**
 * Everything that changes during one trial apart from the actor itself: running bleeds, buff
 * end times, the swing schedule, the next decision time and the resource exhaustion marker.
 * <p>
 * The event loop and the rotation policy both read and write this state; neither keeps
 * trial state of its own. It is also the {@link EffectContext} handed to effects, so stat
 * changes that touch the swing schedule are routed here.
 * </p>
 */
public final class SimulationState implements EffectContext {

    private final Actor actor;
    private final SwingTimer swingTimer;
    private final IRandomProvider rng;
    private final CombatLog log;
    private final double fightLength;
    private final double latency;

    private DamageOverTime rip;
    private DamageOverTime rake;
    private DamageOverTime lacerate;
    private double ripExtension;

    private boolean mangleDebuff;
    private double mangleEnd = Double.NEGATIVE_INFINITY;
    private double tigersFuryEnd = Double.NEGATIVE_INFINITY;
    private double berserkEnd = Double.NEGATIVE_INFINITY;
    private double roarEnd = Double.NEGATIVE_INFINITY;

    private double nextAction;
    private Double timeToResourceExhaustion;

    /**
     * @param actor       the trial's actor
     * @param swingTimer  the trial's swing schedule
     * @param rng         the trial's random source
     * @param log         the combat log
     * @param fightLength the (jittered) length of this trial
     * @param latency     the modelled input delay
     */
    public SimulationState(Actor actor, SwingTimer swingTimer, IRandomProvider rng, CombatLog log,
                           double fightLength, double latency) {
        this.actor = actor;
        this.swingTimer = swingTimer;
        this.rng = rng;
        this.log = log;
        this.fightLength = fightLength;
        this.latency = latency;
    }

    // ---------------------------------------------------------------------
    // EffectContext
    // ---------------------------------------------------------------------

    @Override
    public Actor actor() {
        return actor;
    }

    @Override
    public void applyStat(StatDelta delta, double scale, double time) {
        switch (delta.target()) {
            case HASTE_RATING -> {
                swingTimer.addHasteRating(time, delta.amount() * scale, actor.getForm() != Form.BEAR);
                actor.setSpellGcd(swingTimer.spellGcd(actor.getForm() != Form.BEAR));
            }
            case HASTE_MULTIPLIER -> {
                swingTimer.multiplyHaste(time, Math.pow(delta.amount(), scale));
                actor.setSpellGcd(swingTimer.spellGcd(actor.getForm() != Form.BEAR));
            }
            default -> actor.applyDelta(delta.target(), delta.amount() * scale);
        }
    }

    @Override
    public IRandomProvider rng() {
        return rng;
    }

    @Override
    public CombatLog log() {
        return log;
    }

    // ---------------------------------------------------------------------
    // Bleeds
    // ---------------------------------------------------------------------

    public DamageOverTime getRip() { return rip; }
    public DamageOverTime getRake() { return rake; }
    public DamageOverTime getLacerate() { return lacerate; }

    public boolean isRipUp() { return rip != null; }
    public boolean isRakeUp() { return rake != null; }
    public boolean isLacerateUp() { return lacerate != null; }

    /**
     * Starts a new Rip, replacing any running one.
     * @param bleed the new application
     */
    public void startRip(DamageOverTime bleed) {
        this.rip = bleed;
        this.ripExtension = 0.0;
    }

    public void startRake(DamageOverTime bleed) {
        this.rake = bleed;
    }

    public void startLacerate(DamageOverTime bleed) {
        this.lacerate = bleed;
    }

    public void clearRip() { this.rip = null; }
    public void clearRake() { this.rake = null; }
    public void clearLacerate() { this.lacerate = null; }

    /**
     * Extends the running Rip by one tick for a landed Shred, up to the glyph limit.
     * @return true if Rip was extended
     */
    public boolean extendRipFromShred() {
        if (rip == null || ripExtension >= Config.SHRED_GLYPH_MAX_EXTENSION - Config.EPSILON) {
            return false;
        }
        rip.extend(Config.SHRED_GLYPH_EXTENSION);
        ripExtension += Config.SHRED_GLYPH_EXTENSION;
        return true;
    }

    public double getRipEnd() {
        return rip == null ? Double.NEGATIVE_INFINITY : rip.getEnd();
    }

    public double getRakeEnd() {
        return rake == null ? Double.NEGATIVE_INFINITY : rake.getEnd();
    }

    public double getLacerateEnd() {
        return lacerate == null ? Double.NEGATIVE_INFINITY : lacerate.getEnd();
    }

    public int getLacerateStacks() {
        return lacerate == null ? 0 : lacerate.getStacks();
    }

    // ---------------------------------------------------------------------
    // Buffs and debuffs tracked by end time
    // ---------------------------------------------------------------------

    public boolean isMangleUp() { return mangleDebuff; }
    public double getMangleEnd() { return mangleEnd; }

    /**
     * @param end the new end time of the Mangle debuff, positive infinity for a permanent debuff
     */
    public void applyMangle(double end) {
        this.mangleDebuff = true;
        this.mangleEnd = end;
    }

    public void clearMangle() {
        this.mangleDebuff = false;
    }

    public double getTigersFuryEnd() { return tigersFuryEnd; }
    public void setTigersFuryEnd(double tigersFuryEnd) { this.tigersFuryEnd = tigersFuryEnd; }
    public double getBerserkEnd() { return berserkEnd; }
    public void setBerserkEnd(double berserkEnd) { this.berserkEnd = berserkEnd; }
    public double getRoarEnd() { return roarEnd; }
    public void setRoarEnd(double roarEnd) { this.roarEnd = roarEnd; }

    // ---------------------------------------------------------------------
    // Scheduling
    // ---------------------------------------------------------------------

    public SwingTimer getSwingTimer() { return swingTimer; }
    public double getFightLength() { return fightLength; }
    public double getLatency() { return latency; }
    public double getNextAction() { return nextAction; }
    public void setNextAction(double nextAction) { this.nextAction = nextAction; }

    /**
     * Records the first moment a mana-gated action had to be skipped.
     * @param time the current simulation time
     */
    public void markResourceExhaustion(double time) {
        if (timeToResourceExhaustion == null) {
            timeToResourceExhaustion = time;
        }
    }

    /**
     * @return the time mana first ran out, or null if it never did
     */
    public Double getTimeToResourceExhaustion() {
        return timeToResourceExhaustion;
    }
}
