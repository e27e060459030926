package org.feralsim.runtime.effects;

import org.feralsim.runtime.CombatLog;
import org.feralsim.runtime.model.Actor;
import org.feralsim.runtime.spi.IRandomProvider;

/**
 * What an {@link Effect} may touch while it updates: the actor, stat changes that may also
 * affect timers owned by the event loop, the random source and the combat log.
 */
public interface EffectContext {

    Actor actor();

    /**
     * Applies a stat change. Haste changes rescale the remaining swing time.
     *
     * @param delta the change
     * @param scale signed number of applications, e.g. {@code -3} to remove three stacks
     * @param time  the current simulation time
     */
    void applyStat(StatDelta delta, double scale, double time);

    IRandomProvider rng();

    CombatLog log();
}
