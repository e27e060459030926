package org.feralsim.runtime.effects;

import java.util.function.Function;

/**
 * A configured effect type from which each trial creates its own mutable instance.
 *
 * @param type    the registered effect type
 * @param spec    the effect parameters
 * @param creator builds an instance from the parameters
 */
public record EffectTemplate(String type, EffectSpec spec, Function<EffectSpec, Effect> creator) {

    /**
     * @return a fresh, reset effect instance
     */
    public Effect newInstance() {
        Effect effect = creator.apply(spec);
        effect.reset();
        return effect;
    }

    public String name() {
        return spec.name();
    }
}
