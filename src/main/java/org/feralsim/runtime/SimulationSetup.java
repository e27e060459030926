package org.feralsim.runtime;

import org.feralsim.config.ConfigurationException;
import org.feralsim.runtime.effects.EffectTemplate;
import org.feralsim.runtime.model.ActorConfig;
import org.feralsim.runtime.model.EncounterParameters;
import org.feralsim.runtime.rotation.RotationConfig;

import java.util.List;

/**
 * The complete, immutable input of a simulation. It is shared read-only by every trial and
 * every worker; each trial builds its own mutable actor and effect instances from it.
 *
 * @param actorConfig     the buffed character
 * @param encounter       boss armor and debuffs
 * @param rotation        rotation tunables
 * @param effects         trinkets, consumables and other timed effects
 * @param fightLength     nominal fight length in seconds
 * @param latency         modelled input delay in seconds
 * @param hasteMultiplier product of multiplicative haste buffs present for the whole fight
 * @param hotUptime       fraction of the fight the actor has healing-over-time effects on it
 */
public record SimulationSetup(ActorConfig actorConfig, EncounterParameters encounter, RotationConfig rotation,
                              List<EffectTemplate> effects, double fightLength, double latency,
                              double hasteMultiplier, double hotUptime) {

    public SimulationSetup {
        if (actorConfig == null) {
            throw new ConfigurationException("actor", "is required");
        }
        if (encounter == null) {
            throw new ConfigurationException("encounter", "is required");
        }
        rotation = rotation == null ? RotationConfig.defaults() : rotation;
        effects = effects == null ? List.of() : List.copyOf(effects);
        if (!(fightLength > 0)) {
            throw new ConfigurationException("simulation.fightLength", "must be positive, was " + fightLength);
        }
        if (latency < 0) {
            throw new ConfigurationException("simulation.latency", "must not be negative, was " + latency);
        }
        if (!(hasteMultiplier > 0)) {
            throw new ConfigurationException("simulation.hasteMultiplier", "must be positive, was " + hasteMultiplier);
        }
        if (hotUptime < 0 || hotUptime > 1) {
            throw new ConfigurationException("simulation.hotUptime", "must be between 0 and 1, was " + hotUptime);
        }
    }

    /**
     * @param config the replacement character
     * @return a copy of this setup with a different character, used for stat perturbations
     */
    public SimulationSetup withActorConfig(ActorConfig config) {
        return new SimulationSetup(config, encounter, rotation, effects, fightLength, latency, hasteMultiplier,
                hotUptime);
    }

    /**
     * @return seconds between two Revitalize rolls
     */
    public double revitalizeFrequency() {
        return 15.0 / (8 * Math.max(hotUptime, 1e-9));
    }
}
