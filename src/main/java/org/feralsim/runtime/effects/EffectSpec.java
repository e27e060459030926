package org.feralsim.runtime.effects;

import org.feralsim.config.ConfigurationException;
import org.feralsim.runtime.model.ProcTrigger;

import java.util.List;

/**
 * Immutable parameters of an effect, shared read-only by the instances of every trial.
 *
 * @param name      buff name used in statistics and the combat log
 * @param stats     stat changes per activation, or per stack for stacking effects
 * @param duration  buff duration in seconds
 * @param cooldown  internal cooldown in seconds, measured from the last activation
 * @param delay     earliest first use of a fixed-use effect
 * @param rates     proc rates, or the per-stack rates of a stacking effect
 * @param trigger   which landed attacks are offered to the effect
 * @param maxStacks stack limit of a stacking effect
 * @param stackName name of the stacking buff, logged for each stack
 * @param auraRates proc rates of the aura of a stacking effect; null if the aura is used on cooldown
 * @param maxProcs  activation limit per fight, 0 for unlimited
 */
public record EffectSpec(String name, List<StatDelta> stats, double duration, double cooldown, double delay,
                         ProcRates rates, ProcTrigger trigger, int maxStacks, String stackName,
                         ProcRates auraRates, int maxProcs) {

    public EffectSpec {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("effects.name", "must not be empty");
        }
        stats = List.copyOf(stats);
        if (duration < 0) {
            throw new ConfigurationException("effects." + name + ".duration", "must not be negative");
        }
        if (cooldown < 0) {
            throw new ConfigurationException("effects." + name + ".cooldown", "must not be negative");
        }
        if (trigger == null) {
            trigger = ProcTrigger.ANY;
        }
    }

    /**
     * @return true if the stacking aura is used on cooldown rather than gained from a proc
     */
    public boolean isActivatedAura() {
        return auraRates == null;
    }
}
