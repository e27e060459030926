package org.feralsim.config;

import org.feralsim.runtime.SimulationSetup;

/**
 * A loaded configuration: the simulation input plus the batch parameters.
 *
 * @param setup      the simulation input
 * @param replicates trials per batch
 * @param workers    worker threads, 0 for one per available processor
 * @param seed       the batch seed
 */
public record SimulationSettings(SimulationSetup setup, int replicates, int workers, long seed) {

    public SimulationSettings {
        if (replicates < 1) {
            throw new ConfigurationException("simulation.replicates", "must be at least 1, was " + replicates);
        }
        if (workers < 0) {
            throw new ConfigurationException("simulation.workers", "must not be negative, was " + workers);
        }
    }

    /**
     * @return the configured worker count, or the number of available processors for 0
     */
    public int effectiveWorkers() {
        return workers == 0 ? Runtime.getRuntime().availableProcessors() : workers;
    }

    /**
     * @param replicates the new trial count
     * @return a copy with a different trial count
     */
    public SimulationSettings withReplicates(int replicates) {
        return new SimulationSettings(setup, replicates, workers, seed);
    }

    /**
     * @param workers the new worker count
     * @return a copy with a different worker count
     */
    public SimulationSettings withWorkers(int workers) {
        return new SimulationSettings(setup, replicates, workers, seed);
    }

    /**
     * @param seed the new batch seed
     * @return a copy with a different seed
     */
    public SimulationSettings withSeed(long seed) {
        return new SimulationSettings(setup, replicates, workers, seed);
    }
}
