package org.feralsim.runtime;

import java.util.Locale;

/**
 * One line of the combat log: what happened at a given time and the resources left afterwards.
 *
 * @param time        simulation time in seconds
 * @param event       the ability, tick or buff the line refers to
 * @param outcome     damage dealt or a short description such as {@code applied} or {@code falls off}
 * @param energy      energy after the event
 * @param comboPoints combo points after the event
 * @param mana        mana after the event
 * @param rage        rage after the event
 */
public record CombatLogEntry(double time, String event, String outcome, double energy, int comboPoints,
                             double mana, double rage) {

    /**
     * @return the entry formatted as a fixed-width table row
     */
    public String format() {
        return String.format(Locale.ROOT, "%9.3f  %-22s %-24s %6.1f %3d %7d %4d",
                time, event, outcome, energy, comboPoints, (long) mana, (long) rage);
    }
}
