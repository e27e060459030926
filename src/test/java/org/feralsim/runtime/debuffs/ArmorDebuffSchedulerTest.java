package org.feralsim.runtime.debuffs;

import org.feralsim.runtime.CombatLog;
import org.feralsim.runtime.internal.services.SeededRandomProvider;
import org.feralsim.runtime.model.Actor;
import org.feralsim.runtime.model.ActorConfig;
import org.feralsim.runtime.model.EncounterParameters;
import org.feralsim.runtime.model.EncounterState;
import org.feralsim.runtime.model.StatTarget;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ArmorDebuffSchedulerTest {

    private static Actor actorFor(EncounterState encounter) {
        ActorConfig config = ActorConfig.builder().stat(StatTarget.ATTACK_POWER, 5000).build();
        return new Actor(config, encounter, new SeededRandomProvider(1L), CombatLog.disabled());
    }

    @Test
    void update_addsOneStackPerInterval() {
        EncounterState encounter = new EncounterState(new EncounterParameters(10643, true, true, true, false,
                false, false));
        Actor actor = actorFor(encounter);
        ArmorDebuffScheduler scheduler = new ArmorDebuffScheduler(encounter);
        double unsundered = actor.getDamage().whiteHigh();

        assertThat(scheduler.update(0.0, actor, CombatLog.disabled())).isTrue();
        assertThat(scheduler.update(0.0, actor, CombatLog.disabled())).isFalse();
        assertThat(scheduler.nextEventTime()).isEqualTo(1.5);
        assertThat(actor.getDamage().whiteHigh()).isGreaterThan(unsundered);

        for (int i = 1; i < 10; i++) {
            scheduler.update(i * ArmorDebuffScheduler.STACK_INTERVAL, actor, CombatLog.disabled());
        }

        assertThat(encounter.getSunderStacks()).isEqualTo(EncounterState.MAX_SUNDER_STACKS);
        assertThat(scheduler.nextEventTime()).isEqualTo(Double.POSITIVE_INFINITY);
    }

    @Test
    void update_isInactiveWithoutSunder() {
        EncounterState encounter = new EncounterState(new EncounterParameters(10643, false, true, true, false,
                false, false));
        ArmorDebuffScheduler scheduler = new ArmorDebuffScheduler(encounter);

        assertThat(scheduler.update(0.0, actorFor(encounter), CombatLog.disabled())).isFalse();
        assertThat(scheduler.nextEventTime()).isEqualTo(Double.POSITIVE_INFINITY);
    }

    @Test
    void reset_removesAllStacks() {
        EncounterState encounter = new EncounterState(new EncounterParameters(10643, true, false, false, false,
                false, false));
        ArmorDebuffScheduler scheduler = new ArmorDebuffScheduler(encounter);
        scheduler.update(0.0, actorFor(encounter), CombatLog.disabled());

        scheduler.reset();

        assertThat(encounter.getSunderStacks()).isZero();
        assertThat(scheduler.nextEventTime()).isZero();
    }
}
