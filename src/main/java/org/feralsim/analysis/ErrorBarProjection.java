package org.feralsim.analysis;

import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.feralsim.runtime.spi.IRandomProvider;

/**
 * Projects the standard error a stat-weight estimate would have in a production run with more
 * trials, from a smaller pilot sample of baseline and perturbed DPS values.
 * <p>
 * The normal mode treats both samples as independent normal distributions. The bootstrap mode
 * resamples both pilot samples with replacement at the production size and reports the spread
 * of the resulting mean differences.
 * </p>
 */
public final class ErrorBarProjection {

    /** Lower bound on bootstrap iterations. */
    public static final int MIN_BOOTSTRAP_ITERATIONS = 100_000;

    /**
     * How the projection is computed.
     */
    public enum Mode {
        NORMAL,
        BOOTSTRAP
    }

    private final int productionTrials;
    private final Mode mode;
    private final IRandomProvider rng;

    /**
     * @param productionTrials trial count of the production run
     * @param mode             projection mode
     * @param rng              random source for bootstrap resampling, unused in normal mode
     */
    public ErrorBarProjection(int productionTrials, Mode mode, IRandomProvider rng) {
        if (productionTrials < 1) {
            throw new IllegalArgumentException("productionTrials must be at least 1, was " + productionTrials);
        }
        this.productionTrials = productionTrials;
        this.mode = mode;
        this.rng = rng;
    }

    public int getProductionTrials() {
        return productionTrials;
    }

    public Mode getMode() {
        return mode;
    }

    /**
     * @param baseline  pilot DPS values without the perturbation
     * @param perturbed pilot DPS values with the perturbation
     * @return projected standard error of the DPS difference
     */
    public double project(double[] baseline, double[] perturbed) {
        if (mode == Mode.NORMAL) {
            return normal(baseline, perturbed, productionTrials);
        }
        return bootstrap(baseline, perturbed, productionTrials,
                Math.max(productionTrials, MIN_BOOTSTRAP_ITERATIONS), rng);
    }

    /**
     * @param baseline         pilot DPS values without the perturbation
     * @param perturbed        pilot DPS values with the perturbation
     * @param productionTrials trial count of the production run
     * @return projected standard error under a normal approximation
     */
    public static double normal(double[] baseline, double[] perturbed, int productionTrials) {
        StandardDeviation std = new StandardDeviation(false);
        double baseStd = std.evaluate(baseline);
        double perturbedStd = std.evaluate(perturbed);
        return Math.sqrt((baseStd * baseStd + perturbedStd * perturbedStd) / productionTrials);
    }

    /**
     * @param baseline         pilot DPS values without the perturbation
     * @param perturbed        pilot DPS values with the perturbation
     * @param productionTrials trial count of the production run
     * @param iterations       number of bootstrap resamples
     * @param rng              random source for resampling
     * @return standard deviation of the resampled mean differences
     */
    public static double bootstrap(double[] baseline, double[] perturbed, int productionTrials, int iterations,
                                   IRandomProvider rng) {
        double[] differences = new double[iterations];
        for (int i = 0; i < iterations; i++) {
            differences[i] = resampledMean(perturbed, productionTrials, rng)
                    - resampledMean(baseline, productionTrials, rng);
        }
        return new StandardDeviation(false).evaluate(differences, new Mean().evaluate(differences));
    }

    private static double resampledMean(double[] values, int size, IRandomProvider rng) {
        double sum = 0.0;
        for (int i = 0; i < size; i++) {
            sum += values[rng.nextInt(values.length)];
        }
        return sum / size;
    }
}
