package org.feralsim.runtime.rotation;

import org.feralsim.runtime.CombatLog;
import org.feralsim.runtime.Config;
import org.feralsim.runtime.SwingTimer;
import org.feralsim.runtime.internal.services.SeededRandomProvider;
import org.feralsim.runtime.model.Ability;
import org.feralsim.runtime.model.Actor;
import org.feralsim.runtime.model.ActorConfig;
import org.feralsim.runtime.model.EncounterParameters;
import org.feralsim.runtime.model.EncounterState;
import org.feralsim.runtime.model.Form;
import org.feralsim.runtime.model.StatTarget;
import org.feralsim.runtime.spi.IRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class RotationPolicyTest {

    private static final double LATENCY = 0.1;

    private final IRandomProvider rng = new SeededRandomProvider(17L);

    private SimulationState stateFor(ActorConfig config) {
        EncounterState encounter = new EncounterState(new EncounterParameters(10643, false, true, true, false,
                false, false));
        Actor actor = new Actor(config, encounter, rng, CombatLog.disabled());
        SwingTimer swingTimer = new SwingTimer(1.0, 1.0);
        swingTimer.start(0.0);
        return new SimulationState(actor, swingTimer, rng, CombatLog.disabled(), 180.0, LATENCY);
    }

    /**
     * Never misses and never clearcasts, so every decision is deterministic.
     */
    private static ActorConfig.Builder capped() {
        return ActorConfig.builder()
                .stat(StatTarget.ATTACK_POWER, 6000)
                .stat(StatTarget.HIT_CHANCE, 0.08)
                .stat(StatTarget.EXPERTISE_RATING, 214)
                .stat(StatTarget.CRIT_CHANCE, 0.0)
                .stat(StatTarget.MANA_POOL, 7000)
                .stat(StatTarget.INTELLECT, 300)
                .omen(false);
    }

    private static RotationPolicy policy(Map<String, Object> overrides) {
        RotationConfig rotation = RotationConfig.defaults().with(overrides);
        return new RotationPolicy(rotation, new BiteModel(rotation, 2.5));
    }

    @Test
    void execute_opensWithMangle() {
        SimulationState state = stateFor(capped().build());

        policy(Map.of()).execute(state, 0.0);

        assertThat(state.isMangleUp()).isTrue();
        assertThat(state.getMangleEnd()).isEqualTo(Config.MANGLE_DURATION);
        assertThat(state.actor().getStatistics().getCasts(Ability.MANGLE_CAT)).isEqualTo(1);
    }

    @Test
    void execute_bearMangleKeepsDebuffPermanently() {
        SimulationState state = stateFor(capped().build());

        policy(Map.of("bearMangle", true)).mangle(state, 0.0);

        assertThat(state.getMangleEnd()).isEqualTo(Double.POSITIVE_INFINITY);
    }

    @Test
    void execute_schedulesNextDecisionWhenRoarIsUnaffordable() {
        SimulationState state = stateFor(capped().build());
        RotationPolicy policy = policy(Map.of("useRake", false));
        state.applyMangle(Double.POSITIVE_INFINITY);

        policy.execute(state, 0.0);
        assertThat(state.actor().getStatistics().getCasts(Ability.SHRED)).isEqualTo(1);
        state.actor().shred(true);
        assertThat(state.actor().getEnergy()).isCloseTo(16.0, within(1e-9));

        double damage = policy.execute(state, 0.0);

        assertThat(damage).isZero();
        assertThat(state.actor().isSavageRoar()).isFalse();
        assertThat(state.getNextAction()).isCloseTo(0.9 + LATENCY, within(1e-9));

        state.actor().regen(1.0);
        int cp = state.actor().getComboPoints();
        policy.execute(state, 1.0);

        assertThat(state.actor().isSavageRoar()).isTrue();
        assertThat(state.getRoarEnd()).isEqualTo(1.0 + state.actor().savageRoarDuration(cp));
    }

    @Test
    void execute_appliesRipWithSnapshotAtFiveComboPoints() {
        SimulationState state = stateFor(capped().build());
        RotationPolicy policy = policy(Map.of("useRake", false));
        state.applyMangle(Double.POSITIVE_INFINITY);
        state.actor().shred(true);
        state.actor().savageRoar();
        state.setRoarEnd(1000.0);
        while (state.actor().getComboPoints() < 5) {
            state.actor().regen(10.0);
            state.actor().shred(true);
        }
        state.actor().regen(10.0);

        policy.execute(state, 10.0);

        assertThat(state.isRipUp()).isTrue();
        assertThat(state.getRipEnd()).isEqualTo(10.0 + state.actor().getRipDuration());
        assertThat(state.getRip().getCritChance()).isEqualTo(state.actor().getCritChance());
        assertThat(state.actor().getComboPoints()).isZero();
    }

    @Test
    void execute_marksResourceExhaustionWhenBearweaveIsUnaffordable() {
        SimulationState state = stateFor(capped().stat(StatTarget.MANA_POOL, 500).build());
        RotationPolicy policy = policy(Map.of("bearweave", true, "useRake", false));
        Actor actor = state.actor();
        state.applyMangle(Double.POSITIVE_INFINITY);
        actor.applyTigersFury();
        actor.shred(true);
        actor.shred(true);

        policy.execute(state, 5.0);

        assertThat(state.getTimeToResourceExhaustion()).isEqualTo(5.0);
        assertThat(actor.isReadyToShift()).isFalse();
        assertThat(actor.getForm()).isEqualTo(Form.CAT);
    }

    @Test
    void execute_shiftsOutOfBearWhenEnergyWouldCap() {
        SimulationState state = stateFor(capped().build());
        RotationPolicy policy = policy(Map.of("bearweave", true));
        policy.shift(state, 0.0, false);
        assertThat(state.actor().getForm()).isEqualTo(Form.BEAR);
        assertThat(state.getSwingTimer().getPeriod()).isCloseTo(2.5, within(1e-12));

        policy.execute(state, 1.5);
        assertThat(state.actor().isReadyToShift()).isTrue();

        policy.execute(state, 1.6);

        assertThat(state.actor().getForm()).isEqualTo(Form.CAT);
        assertThat(state.getSwingTimer().getPeriod()).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void clipRoar_neverClipsWithoutRip() {
        SimulationState state = stateFor(capped().build());
        state.setRoarEnd(5.0);

        assertThat(policy(Map.of()).clipRoar(state, 0.0, 5)).isFalse();
    }
}
