package org.feralsim.runtime.effects;

import org.feralsim.runtime.CombatLog;
import org.feralsim.runtime.internal.services.SeededRandomProvider;
import org.feralsim.runtime.model.ProcTrigger;
import org.feralsim.runtime.spi.IRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@Tag("unit")
class InstantDamageEffectTest {

    @Test
    void update_dealsDamageOncePerProc() {
        IRandomProvider rng = new SeededRandomProvider(21L);
        EffectContext context = mock(EffectContext.class);
        when(context.rng()).thenReturn(rng);
        when(context.log()).thenReturn(CombatLog.disabled());
        Effect effect = EffectFactory.create("instant_damage", Map.of("name", "Lightning Capacitor",
                "chanceOnHit", 1.0, "minDamage", 100, "damageRange", 50, "missChance", 0.0)).newInstance();

        effect.checkForProc(ProcTrigger.ANY, false, false, rng);
        double damage = effect.update(1.0, context);
        double nothing = effect.update(2.0, context);

        assertThat(damage).isBetween(25.0, 150.0);
        assertThat(nothing).isZero();
        assertThat(effect.getProcCount()).isEqualTo(1);
    }

    @Test
    void resistFactor_followsBinaryTable() {
        assertThat(InstantDamageEffect.resistFactor(0.5)).isEqualTo(1.0);
        assertThat(InstantDamageEffect.resistFactor(0.9)).isEqualTo(0.75);
        assertThat(InstantDamageEffect.resistFactor(0.97)).isEqualTo(0.5);
        assertThat(InstantDamageEffect.resistFactor(0.995)).isEqualTo(0.25);
    }
}
