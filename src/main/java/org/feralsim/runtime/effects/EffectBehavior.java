package org.feralsim.runtime.effects;

/**
 * The activation strategies of a {@link BuffEffect}.
 */
public enum EffectBehavior {
    /** Used as soon as its cooldown allows, optionally after an initial delay. */
    FIXED_USE,
    /** Activates when a landed attack rolled a proc and the internal cooldown is ready. */
    CHANCE_PROC,
    /** An aura that, once up, gains one stack per proc up to a limit. */
    STACKING_PROC,
    /** Like {@link #CHANCE_PROC}, but a proc while active restarts the buff instead of stacking. */
    REFRESHING_PROC
}
