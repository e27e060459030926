package org.feralsim.runtime;

import org.feralsim.runtime.model.Actor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Ordered record of combat events for a single traced trial.
 * <p>
 * The log never draws random numbers and never feeds back into the simulation, so a trial
 * produces the same results whether it is enabled or not. Use {@link #disabled()} for
 * replicate runs; every recording call on a disabled log returns immediately.
 * </p>
 */
public final class CombatLog {

    private static final CombatLog DISABLED = new CombatLog(false);

    private final boolean enabled;
    private final List<CombatLogEntry> entries = new ArrayList<>();
    private double currentTime;

    private CombatLog(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * @return a new log that records entries
     */
    public static CombatLog enabled() {
        return new CombatLog(true);
    }

    /**
     * @return the shared no-op log
     */
    public static CombatLog disabled() {
        return DISABLED;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Sets the time stamped on entries recorded without an explicit time.
     * @param time the current simulation time
     */
    public void advanceTo(double time) {
        if (enabled) {
            currentTime = time;
        }
    }

    /**
     * Records an event at the current time with the actor's resources.
     * @param event event name
     * @param outcome outcome description
     * @param actor the actor whose resources are captured
     */
    public void record(String event, String outcome, Actor actor) {
        if (enabled) {
            record(currentTime, event, outcome, actor);
        }
    }

    /**
     * Records an event at an explicit time, used for buffs whose expiry falls between steps.
     * @param time event time
     * @param event event name
     * @param outcome outcome description
     * @param actor the actor whose resources are captured
     */
    public void record(double time, String event, String outcome, Actor actor) {
        if (!enabled) {
            return;
        }
        entries.add(new CombatLogEntry(time, event, outcome, actor.getEnergy(), actor.getComboPoints(),
                actor.getMana(), actor.getRage()));
    }

    /**
     * Formats the outcome of a damaging event.
     * @param damage damage dealt
     * @param miss whether the event missed
     * @param crit whether the event was a critical strike
     * @param clearcast whether the event was free
     * @return the outcome text
     */
    public static String describe(double damage, boolean miss, boolean crit, boolean clearcast) {
        if (miss) {
            return clearcast ? "miss (clearcast)" : "miss";
        }
        String text = String.format(Locale.ROOT, "%d", (long) damage);
        if (crit && clearcast) {
            return text + " (crit, clearcast)";
        }
        if (crit) {
            return text + " (crit)";
        }
        return clearcast ? text + " (clearcast)" : text;
    }

    /**
     * @return the recorded entries in insertion order
     */
    public List<CombatLogEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }
}
