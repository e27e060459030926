package org.feralsim.analysis;

/**
 * The estimated value of one unit of a stat.
 *
 * @param stat           the stat
 * @param dpsPerUnit     mean DPS gained per unit
 * @param standardError  standard error of {@code dpsPerUnit} from the paired trials
 * @param relativeWeight {@code dpsPerUnit} divided by the DPS gained per Attack Power
 * @param projectedError projected standard error of {@code dpsPerUnit} for a production run,
 *                       or null if no projection was requested
 */
public record StatWeight(WeightedStat stat, double dpsPerUnit, double standardError, double relativeWeight,
                         Double projectedError) {

    /**
     * @param attackPowerDps DPS gained per Attack Power
     * @return a copy with the relative weight set
     */
    public StatWeight normalizedTo(double attackPowerDps) {
        return new StatWeight(stat, dpsPerUnit, standardError, dpsPerUnit / attackPowerDps, projectedError);
    }
}
