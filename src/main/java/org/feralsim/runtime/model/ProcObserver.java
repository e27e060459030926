package org.feralsim.runtime.model;

import org.feralsim.runtime.spi.IRandomProvider;

/**
 * Receives every landed attack of the actor so that chance-based effects can pre-roll a proc.
 * The roll is only recorded here; the effect consumes it on its next update.
 */
public interface ProcObserver {

    /**
     * Rolls for a proc after a landed attack.
     *
     * @param trigger the kind of attack that landed
     * @param crit    whether the attack was a critical strike
     * @param yellow  whether the attack was a special ability rather than an auto attack
     * @param rng     the trial's random source
     */
    void checkForProc(ProcTrigger trigger, boolean crit, boolean yellow, IRandomProvider rng);
}
