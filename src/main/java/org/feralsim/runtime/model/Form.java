package org.feralsim.runtime.model;

/**
 * Shapeshift form of the actor. {@link #CASTER} is transient: it is only entered by a
 * buff-application cast and is left again on the next rotation decision.
 */
public enum Form {
    CAT,
    BEAR,
    CASTER
}
