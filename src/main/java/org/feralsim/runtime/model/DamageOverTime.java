package org.feralsim.runtime.model;

import org.feralsim.runtime.Config;
import org.feralsim.runtime.combat.DamageRoller;
import org.feralsim.runtime.combat.RollOutcome;
import org.feralsim.runtime.spi.IRandomProvider;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * One application of a bleed: its remaining tick times, per-tick damage and the crit chance
 * captured when it was applied. Later changes to the actor's crit chance do not affect ticks
 * of an application that is already running.
 */
public final class DamageOverTime {

    private final Ability ability;
    private final double interval;
    private final boolean canCrit;
    private final Deque<Double> ticks = new ArrayDeque<>();
    private final double start;
    private double end;
    private double tickDamage;
    private double critChance;
    private double critMultiplier;
    private double lastTick;
    private int stacks = 1;

    private DamageOverTime(Ability ability, double start, double duration, double interval, double tickDamage,
                           boolean canCrit, double critChance, double critMultiplier) {
        this.ability = ability;
        this.start = start;
        this.end = start + duration;
        this.interval = interval;
        this.tickDamage = tickDamage;
        this.canCrit = canCrit;
        this.critChance = critChance;
        this.critMultiplier = critMultiplier;
        this.lastTick = start;
        scheduleTicks(start + interval);
    }

    /**
     * Applies a new bleed with ticks every {@code interval} seconds up to and including the end time.
     *
     * @param ability        the ability the damage is credited to
     * @param time           application time
     * @param duration       bleed duration
     * @param interval       time between ticks
     * @param tickDamage     base damage per tick
     * @param canCrit        whether ticks roll for critical strikes
     * @param critChance     crit chance snapshot
     * @param critMultiplier crit damage multiplier snapshot
     * @return the running bleed
     */
    public static DamageOverTime apply(Ability ability, double time, double duration, double interval,
                                       double tickDamage, boolean canCrit, double critChance, double critMultiplier) {
        return new DamageOverTime(ability, time, duration, interval, tickDamage, canCrit, critChance, critMultiplier);
    }

    private void scheduleTicks(double first) {
        for (double t = first; t < end + Config.EPSILON; t += interval) {
            ticks.addLast(t);
        }
    }

    /**
     * @return the time of the next tick, or positive infinity if no tick remains
     */
    public double nextTickTime() {
        Double next = ticks.peekFirst();
        return next == null ? Double.POSITIVE_INFINITY : next;
    }

    /**
     * @param time current simulation time
     * @return true if a tick is scheduled at or before {@code time}
     */
    public boolean isTickDue(double time) {
        Double next = ticks.peekFirst();
        return next != null && time >= next - Config.EPSILON;
    }

    /**
     * Resolves the next scheduled tick.
     *
     * @param rng    the random source
     * @param factor live multiplier such as the Mangle debuff, applied before the crit roll
     * @return the tick outcome
     */
    public RollOutcome rollTick(IRandomProvider rng, double factor) {
        Double tick = ticks.pollFirst();
        if (tick != null) {
            lastTick = tick;
        }
        double amount = tickDamage * factor;
        if (!canCrit) {
            return new RollOutcome(amount, false, false);
        }
        return DamageRoller.rollYellow(rng, amount, amount, 0.0, critChance, critMultiplier);
    }

    /**
     * @param time current simulation time
     * @return true once the bleed has run out
     */
    public boolean isExpired(double time) {
        return time > end - Config.EPSILON;
    }

    /**
     * Extends the bleed by one extra tick, as Glyph of Shred does for Rip.
     * @param seconds the extension, equal to the tick interval
     */
    public void extend(double seconds) {
        end += seconds;
        ticks.addLast(end);
    }

    /**
     * Refreshes a stacking bleed. The tick rhythm is kept: new ticks are appended after the last
     * scheduled (or last resolved) tick up to the new end time.
     *
     * @param time           refresh time
     * @param duration       new duration from {@code time}
     * @param maxStacks      stack limit
     * @param critChance     new crit chance snapshot
     * @param critMultiplier new crit multiplier snapshot
     */
    public void refreshStacking(double time, double duration, int maxStacks, double critChance, double critMultiplier) {
        end = time + duration;
        Double last = ticks.peekLast();
        scheduleTicks((last == null ? lastTick : last) + interval);
        stacks = Math.min(stacks + 1, maxStacks);
        this.critChance = critChance;
        this.critMultiplier = critMultiplier;
    }

    public void setTickDamage(double tickDamage) {
        this.tickDamage = tickDamage;
    }

    public Ability getAbility() { return ability; }
    public double getStart() { return start; }
    public double getEnd() { return end; }
    public double getTickDamage() { return tickDamage; }
    public double getCritChance() { return critChance; }
    public int getStacks() { return stacks; }
    public double getLastTick() { return lastTick; }
    public int getRemainingTicks() { return ticks.size(); }
}
