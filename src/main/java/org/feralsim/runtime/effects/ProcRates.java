package org.feralsim.runtime.effects;

/**
 * Proc probabilities of an effect. Either split by hit type (normal hit vs. critical strike) or
 * by attack type (white swing vs. yellow special).
 *
 * @param first          chance on a normal hit, or on a white swing
 * @param second         chance on a critical strike, or on a yellow special
 * @param separateYellow whether the rates are split by attack type
 */
public record ProcRates(double first, double second, boolean separateYellow) {

    /**
     * @param onHit chance on a normal hit
     * @param onCrit chance on a critical strike
     * @return rates split by hit type
     */
    public static ProcRates hitCrit(double onHit, double onCrit) {
        return new ProcRates(onHit, onCrit, false);
    }

    /**
     * @param white chance on a white swing
     * @param yellow chance on a yellow special
     * @return rates split by attack type
     */
    public static ProcRates whiteYellow(double white, double yellow) {
        return new ProcRates(white, yellow, true);
    }

    /**
     * @param crit whether the attack was a critical strike
     * @param yellow whether the attack was a special ability
     * @return the proc chance for that attack
     */
    public double rate(boolean crit, boolean yellow) {
        if (separateYellow) {
            return yellow ? second : first;
        }
        return crit ? second : first;
    }
}
