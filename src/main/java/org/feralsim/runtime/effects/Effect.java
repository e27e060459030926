package org.feralsim.runtime.effects;

import org.feralsim.runtime.model.ProcObserver;

/**
 * A timed buff, proc or cooldown driven by the event loop.
 * <p>
 * Each trial owns its own instances. The event loop calls {@link #reset()} before the trial,
 * {@link #update(double, EffectContext)} at every step and {@link #finish(double, EffectContext)}
 * once at the fight end. An effect only ever changes the actor through its context and never
 * touches another effect.
 * </p>
 */
public interface Effect extends ProcObserver {

    String getName();

    /**
     * Returns the effect to a fresh, inactive state.
     */
    void reset();

    /**
     * Performs uptime bookkeeping, expiry, cooldown readiness and activation, in that order.
     *
     * @param time the current simulation time
     * @param context access to the actor and the event loop
     * @return damage dealt by the effect at this time
     */
    double update(double time, EffectContext context);

    /**
     * Final update at the fight end: books the remaining uptime and removes the buff if active.
     *
     * @param time the fight end
     * @param context access to the actor and the event loop
     */
    void finish(double time, EffectContext context);

    int getProcCount();

    /**
     * @return fraction of the elapsed fight the effect was active
     */
    double getUptime();

    boolean isActive();

    /**
     * @param time the current simulation time
     * @return the next time the effect needs an update of its own, positive infinity if none
     */
    double nextEventTime(double time);
}
