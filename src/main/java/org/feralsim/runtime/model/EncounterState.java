package org.feralsim.runtime.model;

/**
 * Mutable per-trial view of the encounter: the fixed {@link EncounterParameters} plus the
 * debuff stacks that ramp up during the fight.
 */
public final class EncounterState {

    public static final int MAX_SUNDER_STACKS = 5;

    private final EncounterParameters parameters;
    private int sunderStacks;

    public EncounterState(EncounterParameters parameters) {
        this.parameters = parameters;
    }

    public EncounterParameters getParameters() {
        return parameters;
    }

    public int getSunderStacks() {
        return sunderStacks;
    }

    /**
     * Adds one Sunder Armor stack, up to the maximum.
     */
    public void addSunderStack() {
        sunderStacks = Math.min(sunderStacks + 1, MAX_SUNDER_STACKS);
    }

    /**
     * Removes all ramped debuff stacks.
     */
    public void reset() {
        sunderStacks = 0;
    }
}
