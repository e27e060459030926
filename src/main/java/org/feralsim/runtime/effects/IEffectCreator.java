package org.feralsim.runtime.effects;

import java.util.Map;

/**
 * A functional interface for creating effect templates from configuration parameters.
 */
@FunctionalInterface
public interface IEffectCreator {
    /**
     * Creates an effect template.
     * @param name The display name of the effect.
     * @param params The parameters of the effect.
     * @return The created template.
     */
    EffectTemplate create(String name, Map<String, Object> params);
}
