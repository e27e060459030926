package org.feralsim.analysis;

import java.util.Map;

/**
 * Aggregated result of a batch of trials.
 *
 * @param trials                          trials that completed and were folded in
 * @param failedTrials                    trials that threw and were left out
 * @param meanDps                         mean damage per second
 * @param stdDps                          sample standard deviation of the per-trial DPS
 * @param medianDps                       median of the per-trial DPS
 * @param meanFightLength                 mean jittered fight length
 * @param abilities                       per-ability means keyed by display name, in ability order
 * @param effects                         per-effect means keyed by effect name, in configuration order
 * @param meanTimeToResourceExhaustion    mean time mana ran out, counting the fight length for
 *                                        trials that never ran out
 * @param stdTimeToResourceExhaustion     standard deviation of the same
 * @param resourceExhaustionRate          fraction of trials that ran out of mana
 */
public record ReplicateSummary(int trials, int failedTrials, double meanDps, double stdDps, double medianDps,
                               double meanFightLength, Map<String, AbilitySummary> abilities,
                               Map<String, EffectSummary> effects, double meanTimeToResourceExhaustion,
                               double stdTimeToResourceExhaustion, double resourceExhaustionRate) {

    /**
     * @param casts         mean casts per trial
     * @param damage        mean damage per trial
     * @param dps           mean damage per second contributed
     * @param castsPerMinute mean casts per minute of fight
     * @param damagePerCast mean damage per cast, 0 for abilities never cast
     */
    public record AbilitySummary(double casts, double damage, double dps, double castsPerMinute,
                                 double damagePerCast) {
    }

    /**
     * @param procs  mean activations per trial
     * @param uptime mean fraction of the fight the effect was active
     */
    public record EffectSummary(double procs, double uptime) {
    }
}
