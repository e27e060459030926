package org.feralsim.runtime.effects;

import org.feralsim.runtime.model.StatTarget;

/**
 * A stat change applied by an effect.
 *
 * @param target the stat to change
 * @param amount the change per activation or per stack; for {@link StatTarget#HASTE_MULTIPLIER}
 *               the factor to multiply by
 */
public record StatDelta(StatTarget target, double amount) {
}
