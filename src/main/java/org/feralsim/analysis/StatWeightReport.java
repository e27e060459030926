package org.feralsim.analysis;

import java.util.Map;

/**
 * @param baseDps mean DPS of the unperturbed baseline
 * @param weights the estimated weights in {@link WeightedStat} order
 */
public record StatWeightReport(double baseDps, Map<WeightedStat, StatWeight> weights) {

    /**
     * @return DPS gained per Attack Power, NaN if Attack Power was not estimated
     */
    public double dpsPerAttackPower() {
        StatWeight weight = weights.get(WeightedStat.ATTACK_POWER);
        return weight == null ? Double.NaN : weight.dpsPerUnit();
    }
}
