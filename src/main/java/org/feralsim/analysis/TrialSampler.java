package org.feralsim.analysis;

import org.feralsim.runtime.TrialRecord;
import org.feralsim.runtime.spi.IRandomProvider;

/**
 * Runs one independent trial from its own random stream.
 * <p>
 * Implementations must be safe to call from several worker threads at once, which holds for
 * {@link org.feralsim.runtime.Simulation#run(IRandomProvider)}.
 * </p>
 */
@FunctionalInterface
public interface TrialSampler {

    /**
     * @param rng the random stream owned by this trial
     * @return the trial result
     */
    TrialRecord sample(IRandomProvider rng);
}
