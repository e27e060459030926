package org.feralsim.runtime;

import org.feralsim.runtime.combat.RollOutcome;
import org.feralsim.runtime.debuffs.ArmorDebuffScheduler;
import org.feralsim.runtime.effects.Effect;
import org.feralsim.runtime.effects.EffectTemplate;
import org.feralsim.runtime.model.Ability;
import org.feralsim.runtime.model.Actor;
import org.feralsim.runtime.model.CastStatistics;
import org.feralsim.runtime.model.DamageOverTime;
import org.feralsim.runtime.model.EncounterState;
import org.feralsim.runtime.model.Form;
import org.feralsim.runtime.rotation.BiteModel;
import org.feralsim.runtime.rotation.RotationConfig;
import org.feralsim.runtime.rotation.RotationPolicy;
import org.feralsim.runtime.rotation.SimulationState;
import org.feralsim.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The discrete-event loop of a single trial.
 * <p>
 * The clock never advances by a fixed tick. Each step regenerates resources for the elapsed
 * time, resolves everything due at the current time in a fixed order (buff expiry, bleed ticks,
 * Revitalize, effects, the armor debuff, Enrage, the melee swing, the rotation, Tiger's Fury)
 * and then jumps to the earliest future event: the next swing, bleed tick, effect expiry or
 * cooldown, or the policy's next decision time.
 * </p>
 * <p>
 * A {@code Simulation} holds only immutable configuration and can run any number of trials,
 * also concurrently; every trial builds its own actor, effects and state.
 * </p>
 */
public class Simulation {

    private static final Logger LOG = LoggerFactory.getLogger(Simulation.class);

    private static final double REVITALIZE_CHANCE = 0.15;
    private static final double REVITALIZE_ENERGY = 8.0;
    private static final double REVITALIZE_RAGE = 4.0;

    private final SimulationSetup setup;
    private final RotationPolicy policy;

    /**
     * @param setup the immutable simulation input
     */
    public Simulation(SimulationSetup setup) {
        this.setup = setup;
        RotationConfig rotation = setup.rotation();
        this.policy = new RotationPolicy(rotation, new BiteModel(rotation, setup.revitalizeFrequency()));
    }

    public SimulationSetup getSetup() {
        return setup;
    }

    /**
     * Runs one replicate. The fight length is jittered by a standard normal draw so swing
     * timers do not alias with the fight end in the same way in every trial.
     *
     * @param rng the trial's own random source
     * @return the trial result
     */
    public TrialRecord run(IRandomProvider rng) {
        double fightLength = setup.fightLength() + rng.nextGaussian();
        return runTrial(rng, fightLength, CombatLog.disabled());
    }

    /**
     * Runs one trial over the nominal fight length and records a combat log.
     *
     * @param rng the trial's random source
     * @return the trial result including the log
     */
    public TrialRecord runSingleTraceWithLog(IRandomProvider rng) {
        return runTrial(rng, setup.fightLength(), CombatLog.enabled());
    }

    /**
     * Runs one trial.
     *
     * @param rng         the trial's random source
     * @param fightLength the length of this trial
     * @param log         the combat log, {@link CombatLog#disabled()} for untraced runs
     * @return the trial result
     * @throws IllegalStateException if the clock stops advancing
     */
    TrialRecord runTrial(IRandomProvider rng, double fightLength, CombatLog log) {
        EncounterState encounter = new EncounterState(setup.encounter());
        ArmorDebuffScheduler sunder = new ArmorDebuffScheduler(encounter);
        sunder.reset();

        Actor actor = new Actor(setup.actorConfig(), encounter, rng, log);
        SwingTimer swingTimer = new SwingTimer(actor.getSwingTimer(), setup.hasteMultiplier());
        actor.setSpellGcd(swingTimer.spellGcd(true));

        List<Effect> effects = new ArrayList<>();
        for (EffectTemplate template : setup.effects()) {
            Effect effect = template.newInstance();
            effects.add(effect);
            actor.addProcObserver(effect);
        }

        SimulationState state = new SimulationState(actor, swingTimer, rng, log, fightLength, setup.latency());
        RotationConfig rotation = setup.rotation();

        // the first swing lands shortly after the first special
        swingTimer.start(Config.FIRST_SWING_JITTER * rng.nextDouble());

        if (rotation.isBearMangle()) {
            state.applyMangle(Double.POSITIVE_INFINITY);
        }
        if (rotation.isUseBerserk() && rotation.isPrepopBerserk()) {
            policy.useBerserk(state, -1.0, true);
        }
        if (rotation.isPreprocOmen() && actor.getConfig().isOmen()) {
            actor.setOmenProc(true);
        }

        double revitalizeFrequency = setup.revitalizeFrequency();
        List<TrialRecord.DamageSample> samples = new ArrayList<>();
        double totalDamage = 0.0;
        double time = 0.0;
        double previousTime = 0.0;
        int hotTicks = 0;
        int stalledSteps = 0;

        while (time <= fightLength) {
            log.advanceTo(time);
            double deltaT = time - previousTime;
            actor.regen(deltaT);
            actor.tickCooldowns(deltaT);
            actor.updateFiveSecondRule(time);

            expireBuffs(state, time);
            double dealt = resolveBleeds(state, time);

            if (time >= revitalizeFrequency * (hotTicks + 1)) {
                hotTicks++;
                if (rng.nextDouble() < REVITALIZE_CHANCE) {
                    actor.grantResource(REVITALIZE_ENERGY, REVITALIZE_RAGE);
                    log.record("Revitalize", "applied", actor);
                }
            }

            for (Effect effect : effects) {
                dealt += effect.update(time, state);
            }
            sunder.update(time, actor, log);

            if (actor.getForm() == Form.BEAR && actor.getEnrageCooldown() < Config.EPSILON
                    && time < actor.getLastShift() + Config.BEAR_GCD + Config.EPSILON) {
                actor.useEnrage();
            }

            if (time >= swingTimer.getNextSwing() - Config.EPSILON) {
                dealt += resolveSwing(state, time);
                swingTimer.advance();
            }

            if (actor.getGcd() < Config.EPSILON && time >= state.getNextAction()) {
                dealt += policy.execute(state, time);
            }

            // leaving Cat form ends Tiger's Fury
            if (actor.isTigersFury() && actor.getForm() != Form.CAT) {
                actor.setTigersFury(false);
                log.record("Tiger's Fury", "falls off", actor);
            }

            for (Effect effect : effects) {
                dealt += effect.update(time, state);
            }

            double leeway = Math.max(actor.getGcd(), setup.latency());
            double tigersFuryThreshold = 40 - Config.ENERGY_PER_SECOND * (leeway + (actor.isOmenProc() ? 1 : 0));
            if (actor.getEnergy() < tigersFuryThreshold && actor.getTigersFuryCooldown() < Config.EPSILON
                    && !actor.isBerserk() && actor.isCatForm()) {
                policy.useTigersFury(state, time);
            }

            if (dealt > 0) {
                samples.add(new TrialRecord.DamageSample(time, dealt));
                totalDamage += dealt;
            }

            previousTime = time;
            time = nextEventTime(state, effects, sunder, time);
            if (time <= previousTime + Config.EPSILON) {
                if (++stalledSteps > Config.MAX_STALLED_STEPS) {
                    throw new IllegalStateException("Simulation clock stalled at t=" + previousTime);
                }
            } else {
                stalledSteps = 0;
            }
        }

        for (Effect effect : effects) {
            effect.finish(fightLength, state);
        }

        if (LOG.isDebugEnabled()) {
            LOG.debug("Trial finished: {} damage over {} s ({} DPS)", totalDamage, fightLength,
                    totalDamage / fightLength);
        }
        return buildRecord(fightLength, totalDamage, samples, actor.getStatistics(), effects, state, log);
    }

    private static void expireBuffs(SimulationState state, double time) {
        Actor actor = state.actor();
        CombatLog log = state.log();
        if (actor.isTigersFury() && time >= state.getTigersFuryEnd()) {
            actor.setTigersFury(false);
            log.record(state.getTigersFuryEnd(), "Tiger's Fury", "falls off", actor);
        }
        if (actor.isBerserk() && time >= state.getBerserkEnd()) {
            actor.dropBerserk();
            log.record(state.getBerserkEnd(), "Berserk", "falls off", actor);
        }
        if (state.isMangleUp() && time >= state.getMangleEnd()) {
            state.clearMangle();
            log.record(state.getMangleEnd(), "Mangle", "falls off", actor);
        }
        if (actor.isSavageRoar() && time > state.getRoarEnd() - Config.EPSILON) {
            actor.setSavageRoar(false);
            log.record(state.getRoarEnd(), "Savage Roar", "falls off", actor);
        }
    }

    private double resolveBleeds(SimulationState state, double time) {
        double mangleFactor = state.isMangleUp() ? Config.MANGLE_MULTIPLIER : 1.0;
        double dealt = 0.0;
        DamageOverTime rip = state.getRip();
        if (rip != null) {
            dealt += tickBleed(state, rip, "Rip", time, mangleFactor);
            if (rip.isExpired(time)) {
                state.clearRip();
            }
        }
        DamageOverTime rake = state.getRake();
        if (rake != null) {
            dealt += tickBleed(state, rake, "Rake", time, mangleFactor);
            if (rake.isExpired(time)) {
                state.clearRake();
            }
        }
        DamageOverTime lacerate = state.getLacerate();
        if (lacerate != null) {
            dealt += tickBleed(state, lacerate, "Lacerate", time, mangleFactor);
            if (lacerate.isExpired(time)) {
                state.clearLacerate();
            }
        }
        return dealt;
    }

    private static double tickBleed(SimulationState state, DamageOverTime bleed, String name, double time,
                                    double mangleFactor) {
        Actor actor = state.actor();
        CombatLog log = state.log();
        double dealt = 0.0;
        if (bleed.isTickDue(time)) {
            RollOutcome tick = bleed.rollTick(state.rng(), mangleFactor);
            actor.getStatistics().addDamage(bleed.getAbility(), tick.damage());
            if (log.isEnabled()) {
                log.record(name + " tick", CombatLog.describe(tick.damage(), false, tick.crit(), false), actor);
            }
            dealt = tick.damage();
        }
        if (bleed.isExpired(time) && log.isEnabled()) {
            log.record(bleed.getEnd(), name, "falls off", actor);
        }
        return dealt;
    }

    /**
     * Resolves the pending melee swing. In Bear form the swing becomes a Maul when enough rage
     * would be left for the special planned on the next global cooldown.
     */
    private double resolveSwing(SimulationState state, double time) {
        Actor actor = state.actor();
        if (actor.getForm() != Form.BEAR) {
            return actor.swing().damage();
        }

        RotationConfig rotation = setup.rotation();
        double latency = setup.latency();
        double gcd = actor.getGcd();
        double furorCap = Math.min(20.0 * actor.getConfig().getFuror(), 85.0);
        boolean ripRefreshPending = state.isRipUp()
                && state.getRipEnd() < state.getFightLength() - Config.END_OF_FIGHT_THRESHOLD;
        double energyLeeway = furorCap - 15 - Config.ENERGY_PER_SECOND * (gcd + latency);
        boolean shiftNext = actor.getEnergy() > energyLeeway
                || (ripRefreshPending && state.getRipEnd() < time + gcd + 3.0);

        boolean lacerateNext;
        boolean emergencyLacerateNext;
        boolean mangleNext;
        if (rotation.isLaceratePrio()) {
            lacerateNext = !state.isLacerateUp() || state.getLacerateStacks() < Config.LACERATE_MAX_STACKS
                    || state.getLacerateEnd() - time <= gcd + rotation.getLacerateTime();
            emergencyLacerateNext = state.isLacerateUp()
                    && state.getLacerateEnd() - time <= gcd + 3.0 + 2 * latency;
            mangleNext = !lacerateNext
                    && (!state.isMangleUp() || state.getMangleEnd() < time + gcd + 3.0);
        } else {
            mangleNext = actor.getMangleCooldown() < gcd;
            lacerateNext = state.isLacerateUp() && (state.getLacerateStacks() < Config.LACERATE_MAX_STACKS
                    || state.getLacerateEnd() < time + gcd + 4.5);
            emergencyLacerateNext = false;
        }

        double maulThreshold;
        if (emergencyLacerateNext) {
            maulThreshold = 23;
        } else if (shiftNext) {
            maulThreshold = 10;
        } else if (mangleNext) {
            maulThreshold = 25;
        } else if (lacerateNext) {
            maulThreshold = 23;
        } else {
            maulThreshold = 10;
        }

        if (actor.getRage() >= maulThreshold) {
            return actor.maul(state.isMangleUp()).damage();
        }
        return actor.swing().damage();
    }

    private double nextEventTime(SimulationState state, List<Effect> effects, ArmorDebuffScheduler sunder,
                                 double time) {
        Actor actor = state.actor();
        double next = Math.min(Math.max(time + actor.getGcd(), state.getNextAction()),
                state.getSwingTimer().getNextSwing());

        next = earliest(next, state.getRip() == null ? Double.POSITIVE_INFINITY : state.getRip().nextTickTime(), time);
        next = earliest(next, state.getRake() == null ? Double.POSITIVE_INFINITY : state.getRake().nextTickTime(),
                time);
        next = earliest(next, state.getLacerate() == null ? Double.POSITIVE_INFINITY
                : state.getLacerate().nextTickTime(), time);
        for (Effect effect : effects) {
            next = earliest(next, effect.nextEventTime(time), time);
        }
        next = earliest(next, sunder.nextEventTime(), time);
        if (actor.isTigersFury()) {
            next = earliest(next, state.getTigersFuryEnd(), time);
        }
        if (actor.isBerserk()) {
            next = earliest(next, state.getBerserkEnd(), time);
        }
        if (state.isMangleUp()) {
            next = earliest(next, state.getMangleEnd(), time);
        }
        if (actor.isSavageRoar()) {
            next = earliest(next, state.getRoarEnd(), time);
        }
        if (actor.getTigersFuryCooldown() > Config.EPSILON) {
            next = earliest(next, time + actor.getTigersFuryCooldown(), time);
        }
        return next;
    }

    private static double earliest(double current, double candidate, double time) {
        return candidate > time + Config.EPSILON ? Math.min(current, candidate) : current;
    }

    private static TrialRecord buildRecord(double fightLength, double totalDamage,
                                           List<TrialRecord.DamageSample> samples, CastStatistics statistics,
                                           List<Effect> effects, SimulationState state, CombatLog log) {
        Map<Ability, TrialRecord.AbilityTotals> abilities = new EnumMap<>(Ability.class);
        for (Ability ability : Ability.values()) {
            abilities.put(ability, new TrialRecord.AbilityTotals(statistics.getCasts(ability),
                    statistics.getDamage(ability)));
        }
        Map<String, TrialRecord.EffectTotals> effectTotals = new LinkedHashMap<>();
        for (Effect effect : effects) {
            effectTotals.put(effect.getName(), new TrialRecord.EffectTotals(effect.getProcCount(),
                    effect.getUptime()));
        }
        return new TrialRecord(fightLength, totalDamage, Collections.unmodifiableList(samples),
                Collections.unmodifiableMap(abilities), Collections.unmodifiableMap(effectTotals),
                state.getTimeToResourceExhaustion(), log.getEntries());
    }
}
