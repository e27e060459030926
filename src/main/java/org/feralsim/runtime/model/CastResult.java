package org.feralsim.runtime.model;

/**
 * The outcome of an ability call on the {@link Actor}.
 *
 * @param accepted   false if the actor refused the cast because it could not pay for it;
 *                   a refused cast leaves the actor untouched
 * @param damage     immediate damage dealt, including any Savage Roar share
 * @param landed     whether the ability hit
 * @param crit       whether the ability was a critical strike
 * @param clearcast  whether a free-cast proc paid for the ability
 * @param tickDamage per-tick base damage for abilities that apply a periodic effect
 */
public record CastResult(boolean accepted, double damage, boolean landed, boolean crit,
                         boolean clearcast, double tickDamage) {

    private static final CastResult REJECTED = new CastResult(false, 0.0, false, false, false, 0.0);

    /**
     * @return the shared result of a refused cast
     */
    public static CastResult rejected() {
        return REJECTED;
    }

    static CastResult of(double damage, boolean landed, boolean crit, boolean clearcast) {
        return new CastResult(true, damage, landed, crit, clearcast, 0.0);
    }
}
