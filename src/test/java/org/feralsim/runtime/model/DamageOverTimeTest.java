package org.feralsim.runtime.model;

import org.feralsim.runtime.combat.RollOutcome;
import org.feralsim.runtime.internal.services.SeededRandomProvider;
import org.feralsim.runtime.spi.IRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

@Tag("unit")
class DamageOverTimeTest {

    @Test
    void apply_schedulesTicksUpToTheEnd() {
        DamageOverTime rip = DamageOverTime.apply(Ability.RIP, 1.0, 12.0, 2.0, 100.0, true, 0.5, 2.0);

        assertThat(rip.getRemainingTicks()).isEqualTo(6);
        assertThat(rip.nextTickTime()).isEqualTo(3.0);
        assertThat(rip.isTickDue(2.9)).isFalse();
        assertThat(rip.isTickDue(3.0)).isTrue();
        assertThat(rip.getEnd()).isEqualTo(13.0);
    }

    @Test
    void rollTick_usesSnapshottedCritChance() {
        IRandomProvider rng = new SeededRandomProvider(9L);
        int crits = 0;
        int ticks = 0;

        for (int i = 0; i < 2_000; i++) {
            DamageOverTime rake = DamageOverTime.apply(Ability.RAKE, 0.0, 9.0, 3.0, 100.0, true, 0.25, 2.0);
            while (rake.getRemainingTicks() > 0) {
                RollOutcome tick = rake.rollTick(rng, 1.3);
                ticks++;
                if (tick.crit()) {
                    crits++;
                    assertThat(tick.damage()).isCloseTo(260.0, within(1e-9));
                } else {
                    assertThat(tick.damage()).isCloseTo(130.0, within(1e-9));
                }
            }
        }

        assertThat(crits / (double) ticks).isCloseTo(0.25, within(0.02));
    }

    @Test
    void rollTick_withoutCritsNeverDraws() {
        IRandomProvider rng = mock(IRandomProvider.class);
        DamageOverTime lacerate = DamageOverTime.apply(Ability.LACERATE, 0.0, 15.0, 3.0, 50.0, false, 0.5, 2.0);

        RollOutcome tick = lacerate.rollTick(rng, 1.0);

        assertThat(tick.damage()).isEqualTo(50.0);
        assertThat(lacerate.getLastTick()).isEqualTo(3.0);
        verifyNoInteractions(rng);
    }

    @Test
    void extend_addsOneTick() {
        DamageOverTime rip = DamageOverTime.apply(Ability.RIP, 0.0, 12.0, 2.0, 100.0, true, 0.5, 2.0);

        rip.extend(2.0);

        assertThat(rip.getEnd()).isEqualTo(14.0);
        assertThat(rip.getRemainingTicks()).isEqualTo(7);
        assertThat(rip.isExpired(13.9)).isFalse();
        assertThat(rip.isExpired(14.0)).isTrue();
    }

    @Test
    void refreshStacking_keepsTickRhythmAndCapsStacks() {
        DamageOverTime lacerate = DamageOverTime.apply(Ability.LACERATE, 0.0, 15.0, 3.0, 50.0, true, 0.1, 2.0);
        IRandomProvider rng = new SeededRandomProvider(2L);
        lacerate.rollTick(rng, 1.0);

        for (int i = 0; i < 7; i++) {
            lacerate.refreshStacking(4.0, 15.0, 5, 0.3, 2.0);
        }

        assertThat(lacerate.getStacks()).isEqualTo(5);
        assertThat(lacerate.getEnd()).isEqualTo(19.0);
        assertThat(lacerate.nextTickTime()).isEqualTo(6.0);
        assertThat(lacerate.getRemainingTicks()).isEqualTo(5);
        assertThat(lacerate.getCritChance()).isEqualTo(0.3);
    }
}
