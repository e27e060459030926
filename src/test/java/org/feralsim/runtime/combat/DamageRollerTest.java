package org.feralsim.runtime.combat;

import org.feralsim.runtime.internal.services.SeededRandomProvider;
import org.feralsim.runtime.spi.IRandomProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@Tag("unit")
class DamageRollerTest {

    private static final int DRAWS = 100_000;

    @Test
    @DisplayName("Yellow crits occur at the configured rate and hits deal the base damage")
    void rollYellow_critFrequencyMatchesCritChance() {
        IRandomProvider rng = new SeededRandomProvider(7L);
        int crits = 0;

        for (int i = 0; i < DRAWS; i++) {
            RollOutcome outcome = DamageRoller.rollYellow(rng, 100.0, 100.0, 0.0, 0.30, 2.0);
            assertThat(outcome.miss()).isFalse();
            if (outcome.crit()) {
                crits++;
                assertThat(outcome.damage()).isEqualTo(200.0);
            } else {
                assertThat(outcome.damage()).isEqualTo(100.0);
            }
        }

        assertThat(crits / (double) DRAWS).isCloseTo(0.30, within(0.01));
    }

    @Test
    void rollYellow_certainMissDealsNoDamage() {
        IRandomProvider rng = new SeededRandomProvider(1L);

        RollOutcome outcome = DamageRoller.rollYellow(rng, 100.0, 200.0, 1.0, 1.0, 2.0);

        assertThat(outcome.miss()).isTrue();
        assertThat(outcome.crit()).isFalse();
        assertThat(outcome.damage()).isZero();
    }

    @Test
    @DisplayName("White table order is miss, glance, crit, hit")
    void rollWhite_resolvesBandsInOrder() {
        IRandomProvider rng = mock(IRandomProvider.class);

        // outcome roll lands in the glance band, base roll mid-range, reduction mid-range
        when(rng.nextDouble()).thenReturn(0.10, 0.5, 0.5);
        RollOutcome glance = DamageRoller.rollWhite(rng, 100.0, 200.0, 0.05, 0.30, 2.0);
        assertThat(glance.miss()).isFalse();
        assertThat(glance.crit()).isFalse();
        assertThat(glance.damage()).isCloseTo(150.0 * 0.75, within(1e-9));

        // 0.05 + 0.24 <= 0.40 < 0.05 + 0.24 + 0.30 is a crit
        when(rng.nextDouble()).thenReturn(0.40, 0.0);
        RollOutcome crit = DamageRoller.rollWhite(rng, 100.0, 200.0, 0.05, 0.30, 2.0);
        assertThat(crit.crit()).isTrue();
        assertThat(crit.damage()).isEqualTo(200.0);

        when(rng.nextDouble()).thenReturn(0.95, 1.0 - 1e-12);
        RollOutcome hit = DamageRoller.rollWhite(rng, 100.0, 200.0, 0.05, 0.30, 2.0);
        assertThat(hit.crit()).isFalse();
        assertThat(hit.damage()).isCloseTo(200.0, within(1e-6));

        when(rng.nextDouble()).thenReturn(0.01);
        assertThat(DamageRoller.rollWhite(rng, 100.0, 200.0, 0.05, 0.30, 2.0).miss()).isTrue();
    }

    @Test
    void rollWhite_glanceFrequencyAndReductionRange() {
        IRandomProvider rng = new SeededRandomProvider(11L);
        int glances = 0;

        for (int i = 0; i < DRAWS; i++) {
            RollOutcome outcome = DamageRoller.rollWhite(rng, 100.0, 100.0, 0.0, 0.0, 2.0);
            if (outcome.damage() < 100.0) {
                glances++;
                assertThat(outcome.damage()).isBetween(65.0, 85.0);
            }
        }

        assertThat(glances / (double) DRAWS).isCloseTo(0.24, within(0.01));
    }

    @Test
    void rollWhite_overfullTableTruncatesOrdinaryHits() {
        IRandomProvider rng = new SeededRandomProvider(3L);

        for (int i = 0; i < 10_000; i++) {
            RollOutcome outcome = DamageRoller.rollWhite(rng, 100.0, 100.0, 0.10, 0.80, 2.0);
            if (!outcome.miss() && outcome.damage() >= 100.0) {
                assertThat(outcome.crit()).isTrue();
            }
        }
    }

    @Test
    void resistFactor_mapsRollOntoPartialResistTable() {
        assertThat(DamageRoller.resistFactor(0.0)).isEqualTo(1.0);
        assertThat(DamageRoller.resistFactor(0.5499)).isEqualTo(1.0);
        assertThat(DamageRoller.resistFactor(0.55)).isEqualTo(0.75);
        assertThat(DamageRoller.resistFactor(0.85)).isEqualTo(0.5);
        assertThat(DamageRoller.resistFactor(0.99)).isEqualTo(0.25);
    }

    @Test
    void rollSpell_missSkipsResistRoll() {
        IRandomProvider rng = mock(IRandomProvider.class);
        when(rng.nextDouble()).thenReturn(0.0);

        RollOutcome outcome = DamageRoller.rollSpell(rng, 100.0, 100.0, 0.5, 0.0, 1.5);

        assertThat(outcome).isSameAs(RollOutcome.missed());
    }
}
