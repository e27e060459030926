package org.feralsim.analysis;

import org.feralsim.junit.extensions.logging.ExpectLog;
import org.feralsim.junit.extensions.logging.LogLevel;
import org.feralsim.junit.extensions.logging.LogWatchExtension;
import org.feralsim.runtime.Simulation;
import org.feralsim.runtime.TrialRecord;
import org.feralsim.runtime.internal.services.SeededRandomProvider;
import org.feralsim.runtime.model.Ability;
import org.feralsim.runtime.rotation.RotationConfig;
import org.feralsim.runtime.spi.IRandomProvider;
import org.feralsim.testutils.TestSetups;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ReplicateRunnerTest {

    private static TrialRecord trial(double dps) {
        return new TrialRecord(100.0, dps * 100.0, List.of(), new EnumMap<>(Ability.class), Map.of(), null,
                List.of());
    }

    @Test
    void run_aggregateIsIndependentOfWorkerCount() {
        Simulation simulation = new Simulation(TestSetups.setup(60, RotationConfig.defaults(),
                TestSetups.hasteCooldowns()));

        AggregateStatistics single = new ReplicateRunner(1).runAggregate(simulation::run, 42L, 16);
        AggregateStatistics parallel = new ReplicateRunner(4).runAggregate(simulation::run, 42L, 16);

        assertThat(parallel.getDpsByTrial()).containsExactly(single.getDpsByTrial());
        assertThat(parallel.toSummary()).isEqualTo(single.toSummary());
        assertThat(single.getCompletedTrials()).isEqualTo(16);
    }

    @Test
    void run_differentSeedsGiveDifferentBatches() {
        Simulation simulation = new Simulation(TestSetups.setup(60));
        ReplicateRunner runner = new ReplicateRunner(2);

        double first = runner.run(simulation::run, 1L, 8).meanDps();
        double second = runner.run(simulation::run, 2L, 8).meanDps();

        assertThat(first).isNotEqualTo(second);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Trial 2 failed.*")
    void run_failedTrialIsExcludedFromAggregate() {
        TrialSampler sampler = mock(TrialSampler.class);
        when(sampler.sample(any(IRandomProvider.class)))
                .thenReturn(trial(1000.0))
                .thenReturn(trial(2000.0))
                .thenThrow(new IllegalStateException("clock stalled"))
                .thenReturn(trial(3000.0));

        AggregateStatistics aggregate = new ReplicateRunner(1).runAggregate(sampler, 7L, 4);

        verify(sampler, times(4)).sample(any(IRandomProvider.class));
        assertThat(aggregate.getCompletedTrials()).isEqualTo(3);
        assertThat(aggregate.getFailedTrials()).isEqualTo(1);
        assertThat(aggregate.getDpsByTrial()[2]).isNaN();
        assertThat(aggregate.getMeanDps()).isEqualTo(2000.0);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Trial 0 failed.*")
    void run_failedTrialOnWorkerThreadIsExcluded() {
        AggregateStatistics aggregate = new ReplicateRunner(3).runAggregate(new FailingFirstTrial(3L), 3L, 6);

        assertThat(aggregate.getFailedTrials()).isEqualTo(1);
        assertThat(aggregate.getCompletedTrials()).isEqualTo(5);
        assertThat(aggregate.getDpsByTrial()[0]).isNaN();
        assertThat(aggregate.getDpsValues()).containsOnly(100.0);
    }

    @Test
    void constructor_rejectsNonPositiveWorkers() {
        assertThatThrownBy(() -> new ReplicateRunner(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ReplicateRunner(1).run(rng -> trial(1.0), 1L, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    /**
     * Throws for the trial that draws from stream 0 of the batch.
     */
    private static final class FailingFirstTrial implements TrialSampler {
        private final double firstDraw;

        FailingFirstTrial(long seed) {
            this.firstDraw = new SeededRandomProvider(seed).deriveFor("trial", 0).nextDouble();
        }

        @Override
        public TrialRecord sample(IRandomProvider rng) {
            if (rng.nextDouble() == firstDraw) {
                throw new IllegalStateException("clock stalled");
            }
            return trial(100.0);
        }
    }
}
