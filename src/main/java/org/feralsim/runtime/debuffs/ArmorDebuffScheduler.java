package org.feralsim.runtime.debuffs;

import org.feralsim.runtime.CombatLog;
import org.feralsim.runtime.Config;
import org.feralsim.runtime.model.Actor;
import org.feralsim.runtime.model.EncounterState;

/**
 * Ramps up Sunder Armor on the boss: one stack per tank global cooldown until the stack limit
 * is reached. Every new stack refreshes the actor's damage parameters.
 */
public final class ArmorDebuffScheduler {

    /** Time between two Sunder Armor applications. */
    public static final double STACK_INTERVAL = 1.5;

    private final EncounterState encounter;
    private final boolean enabled;

    /**
     * @param encounter the per-trial encounter state receiving the stacks
     */
    public ArmorDebuffScheduler(EncounterState encounter) {
        this.encounter = encounter;
        this.enabled = encounter.getParameters().sunder();
    }

    /**
     * Removes all stacks at the start of a trial.
     */
    public void reset() {
        encounter.reset();
    }

    /**
     * Adds a stack if the next one is due.
     *
     * @param time  the current simulation time
     * @param actor the actor whose damage parameters depend on boss armor
     * @param log   the combat log
     * @return true if a stack was added
     */
    public boolean update(double time, Actor actor, CombatLog log) {
        int stacks = encounter.getSunderStacks();
        if (!enabled || stacks >= EncounterState.MAX_SUNDER_STACKS
                || time < STACK_INTERVAL * stacks - Config.EPSILON) {
            return false;
        }
        encounter.addSunderStack();
        log.record(time, "Sunder Armor", "applied", actor);
        actor.recalculateDamage();
        return true;
    }

    /**
     * @return the time the next stack is due, positive infinity once the debuff is complete
     */
    public double nextEventTime() {
        int stacks = encounter.getSunderStacks();
        if (!enabled || stacks >= EncounterState.MAX_SUNDER_STACKS) {
            return Double.POSITIVE_INFINITY;
        }
        return STACK_INTERVAL * stacks;
    }
}
