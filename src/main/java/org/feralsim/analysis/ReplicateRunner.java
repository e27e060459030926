package org.feralsim.analysis;

import org.feralsim.runtime.TrialRecord;
import org.feralsim.runtime.internal.services.SeededRandomProvider;
import org.feralsim.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs batches of independent trials on a fixed pool of worker threads.
 * <p>
 * Trial {@code i} of a batch always draws from {@code deriveFor("trial", i)} of the batch seed,
 * whichever worker runs it, and results are folded into the aggregate in trial-index order on the
 * calling thread. The aggregate is therefore the same for any number of workers. A trial that
 * throws is logged and left out of the aggregate; the remaining trials are unaffected.
 * </p>
 */
public class ReplicateRunner {

    private static final Logger LOG = LoggerFactory.getLogger(ReplicateRunner.class);

    private final int workers;

    /**
     * @param workers number of worker threads, at least 1
     */
    public ReplicateRunner(int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1, was " + workers);
        }
        this.workers = workers;
    }

    /**
     * @return the number of available processors
     */
    public static int defaultWorkers() {
        return Runtime.getRuntime().availableProcessors();
    }

    public int getWorkers() {
        return workers;
    }

    /**
     * Runs a batch and summarizes it.
     *
     * @param sampler runs one trial
     * @param seed    the batch seed
     * @param trials  number of trials
     * @return the summary
     */
    public ReplicateSummary run(TrialSampler sampler, long seed, int trials) {
        return runAggregate(sampler, seed, trials).toSummary();
    }

    /**
     * Runs a batch and returns the raw aggregate, including per-trial DPS by trial index.
     *
     * @param sampler runs one trial
     * @param seed    the batch seed
     * @param trials  number of trials
     * @return the aggregate
     */
    public AggregateStatistics runAggregate(TrialSampler sampler, long seed, int trials) {
        if (trials < 1) {
            throw new IllegalArgumentException("trials must be at least 1, was " + trials);
        }
        IRandomProvider master = new SeededRandomProvider(seed);
        AggregateStatistics aggregate = new AggregateStatistics(trials);
        LOG.info("Running {} trials on {} worker(s) with seed {}", trials, workers, seed);
        long start = System.nanoTime();

        if (workers == 1) {
            for (int i = 0; i < trials; i++) {
                try {
                    aggregate.add(i, sampler.sample(master.deriveFor("trial", i)));
                } catch (RuntimeException e) {
                    recordFailure(aggregate, i, e);
                }
            }
        } else {
            runParallel(sampler, master, trials, aggregate);
        }

        if (LOG.isInfoEnabled()) {
            LOG.info("Finished {} trials ({} failed) in {} ms, mean DPS {}", aggregate.getCompletedTrials(),
                    aggregate.getFailedTrials(), (System.nanoTime() - start) / 1_000_000,
                    String.format("%.2f", aggregate.getMeanDps()));
        }
        return aggregate;
    }

    private void runParallel(TrialSampler sampler, IRandomProvider master, int trials,
                             AggregateStatistics aggregate) {
        ExecutorService executor = Executors.newFixedThreadPool(workers, new WorkerThreadFactory());
        try {
            List<Future<TrialRecord>> futures = new ArrayList<>(trials);
            for (int i = 0; i < trials; i++) {
                final IRandomProvider rng = master.deriveFor("trial", i);
                futures.add(executor.submit(() -> sampler.sample(rng)));
            }
            for (int i = 0; i < trials; i++) {
                try {
                    aggregate.add(i, futures.get(i).get());
                } catch (ExecutionException e) {
                    recordFailure(aggregate, i, e.getCause());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for trials", e);
        } finally {
            executor.shutdownNow();
        }
    }

    private static void recordFailure(AggregateStatistics aggregate, int index, Throwable cause) {
        LOG.warn("Trial {} failed and is excluded from the aggregate: {}", index, cause.toString(), cause);
        aggregate.markFailed(index);
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "feralsim-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
