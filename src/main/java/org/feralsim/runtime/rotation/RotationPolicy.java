package org.feralsim.runtime.rotation;

import org.feralsim.runtime.Config;
import org.feralsim.runtime.model.Ability;
import org.feralsim.runtime.model.Actor;
import org.feralsim.runtime.model.CastResult;
import org.feralsim.runtime.model.DamageOverTime;
import org.feralsim.runtime.model.Form;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * The greedy priority rotation.
 * <p>
 * Each call to {@link #execute(SimulationState, double)} makes at most one decision. Either an
 * ability is cast right away, or the policy works out when the chosen ability becomes affordable
 * and stores that moment, plus latency, as the next decision time. It never polls.
 * </p>
 * <p>
 * In Cat form the priorities are: emergency bearweave, Berserk, Savage Roar, Rip, Ferocious
 * Bite, Mangle, Rake, Faerie Fire, bearweave, flowershift, Mangle spam and finally Shred.
 * Energy needed for upcoming Rip, Rake, Mangle and Savage Roar refreshes is held back from the
 * filler. In Bear form the policy decides between shifting back, powershifting and the bear
 * specials.
 * </p>
 */
public final class RotationPolicy {

    private static final Logger LOG = LoggerFactory.getLogger(RotationPolicy.class);

    private static final double LACERATE_RAGE = 13.0;
    private static final double MANGLE_BEAR_RAGE = 15.0;
    private static final double POWERBEAR_RAGE = 10.0;
    private static final double RAKE_COST = 35.0;
    private static final double ROAR_COST = 25.0;

    private final RotationConfig rotation;
    private final BiteModel biteModel;

    /**
     * @param rotation  the rotation tunables
     * @param biteModel the lookahead model shared with the event loop
     */
    public RotationPolicy(RotationConfig rotation, BiteModel biteModel) {
        this.rotation = rotation;
        this.biteModel = biteModel;
    }

    public RotationConfig getRotation() {
        return rotation;
    }

    public BiteModel getBiteModel() {
        return biteModel;
    }

    /**
     * Makes the next rotation decision.
     *
     * @param state the trial state
     * @param time  the current simulation time
     * @return damage dealt by the action taken
     */
    public double execute(SimulationState state, double time) {
        Actor actor = state.actor();

        // a shift decided on earlier is executed once the input delay is over
        if (actor.isReadyToShift() || actor.getForm() == Form.CASTER) {
            shift(state, time, false);
            return 0.0;
        }

        double energy = actor.getEnergy();
        int cp = actor.getComboPoints();
        boolean omen = actor.isOmenProc();
        double fightLength = state.getFightLength();
        double latency = state.getLatency();
        double endThreshold = Config.END_OF_FIGHT_THRESHOLD;

        boolean ripNow = cp >= rotation.getMinCombosForRip() && !state.isRipUp()
                && fightLength - time >= endThreshold && !omen;
        boolean biteAtEnd = cp >= rotation.getMinCombosForBite()
                && (fightLength - time < endThreshold
                || (state.isRipUp() && fightLength - state.getRipEnd() < endThreshold));
        boolean roarNow = cp >= 1 && !omen && (!actor.isSavageRoar() || clipRoar(state, time, cp));
        boolean mangleNow = !ripNow && !state.isMangleUp() && !omen;
        boolean biteBeforeRip = cp >= rotation.getMinCombosForBite() && state.isRipUp() && rotation.isUseBite()
                && actor.isSavageRoar() && biteModel.canBite(state, time);
        boolean biteNow = (biteBeforeRip || biteAtEnd) && !omen;
        if (biteNow && actor.isBerserk()) {
            biteNow = energy <= rotation.getBerserkBiteThresh();
        }
        boolean rakeNow = rotation.isUseRake() && !state.isRakeUp()
                && fightLength - time > actor.getRakeDuration() && !omen;
        double berserkThreshold = 90 - (omen ? 10 : 0);
        boolean berserkNow = rotation.isUseBerserk() && actor.getBerserkCooldown() < Config.EPSILON
                && actor.getTigersFuryCooldown() > 15 && energy < berserkThreshold + Config.EPSILON;
        boolean faerieFireNow = rotation.isUseFaerieFire() && actor.getFaerieFireCooldown() < Config.EPSILON
                && !omen && energy + Config.ENERGY_PER_SECOND * (Config.CAT_GCD + latency) < Config.ENERGY_CAP;

        // energy that must be floated so pending refreshes can be paid when they fall due
        List<PendingRefresh> pending = new ArrayList<>();
        boolean ripRefreshPending = false;
        boolean floatEnergyForRip = false;

        if (state.isRipUp() && state.getRipEnd() < fightLength - endThreshold) {
            double ripCost = biteModel.berserkExpectedAt(state, time, state.getRipEnd())
                    ? actor.getBaseRipCost() / 2 : actor.getBaseRipCost();
            pending.add(new PendingRefresh(state.getRipEnd(), ripCost));
            ripRefreshPending = true;
            if (state.getRipEnd() - time < ripCost / Config.ENERGY_PER_SECOND) {
                floatEnergyForRip = true;
            }
        }
        if (state.isRakeUp() && state.getRakeEnd() < fightLength - actor.getRakeDuration()) {
            pending.add(new PendingRefresh(state.getRakeEnd(),
                    biteModel.berserkExpectedAt(state, time, state.getRakeEnd()) ? RAKE_COST / 2 : RAKE_COST));
        }
        if (state.isMangleUp() && state.getMangleEnd() < fightLength - 1) {
            double baseCost = actor.getBaseMangleCost();
            pending.add(new PendingRefresh(state.getMangleEnd(),
                    biteModel.berserkExpectedAt(state, time, state.getMangleEnd()) ? baseCost / 2 : baseCost));
        }
        if (actor.isSavageRoar() && state.getRoarEnd() < fightLength - 1) {
            pending.add(new PendingRefresh(state.getRoarEnd(),
                    biteModel.berserkExpectedAt(state, time, state.getRoarEnd()) ? ROAR_COST / 2 : ROAR_COST));
        }
        pending.sort(Comparator.comparingDouble(PendingRefresh::time));

        double furorCap = Math.min(20.0 * actor.getConfig().getFuror(), 85.0);
        double weaveEnergy = furorCap - 30 - 20 * latency;
        if (actor.getConfig().getFuror() > 3) {
            weaveEnergy -= 15;
        }
        double weaveEnd = time + 4.5 + 2 * latency;
        boolean bearweaveNow = rotation.isBearweave() && energy <= weaveEnergy && !omen
                && (!ripRefreshPending || state.getRipEnd() >= weaveEnd)
                && !biteModel.tigersFuryExpectedBefore(state, time, weaveEnd)
                && !actor.isBerserk();
        boolean emergencyBearweave = rotation.isBearweave() && rotation.isLaceratePrio() && state.isLacerateUp()
                && state.getLacerateEnd() - time < 2.5 + latency;

        double flowerDelay = actor.getSpellGcd() + 2 * latency;
        double flowerEnergy = Math.min(20.0 * actor.getConfig().getFuror(), Config.ENERGY_CAP)
                - Config.ENERGY_PER_SECOND * flowerDelay;
        boolean flowershiftNow = rotation.isFlowershift() && energy <= flowerEnergy && !omen
                && (!ripRefreshPending || state.getRipEnd() >= time + flowerDelay + Config.SHIFT_GCD)
                && !biteModel.tigersFuryExpectedBefore(state, time, time + flowerDelay)
                && !actor.isBerserk();

        if ((bearweaveNow || emergencyBearweave) && actor.getMana() < 2 * actor.getShiftCost()) {
            state.markResourceExhaustion(time);
            bearweaveNow = false;
            emergencyBearweave = false;
        }
        if (flowershiftNow && actor.getMana() < Config.GIFT_OF_THE_WILD_COST + actor.getShiftCost()) {
            state.markResourceExhaustion(time);
            flowershiftNow = false;
        }

        double floatingEnergy = 0.0;
        double previousTime = time;
        for (PendingRefresh refresh : pending) {
            double deltaT = refresh.time() - previousTime;
            if (deltaT < refresh.cost() / Config.ENERGY_PER_SECOND) {
                floatingEnergy += refresh.cost() - Config.ENERGY_PER_SECOND * deltaT;
                previousTime = refresh.time();
            } else {
                previousTime += refresh.cost() / Config.ENERGY_PER_SECOND;
            }
        }
        double excessEnergy = energy - floatingEnergy;
        double waitTime = 0.0;

        if (LOG.isTraceEnabled()) {
            LOG.trace("t={} energy={} cp={} floating={} rip={} roar={} bite={} mangle={} rake={} weave={}",
                    time, energy, cp, floatingEnergy, ripNow, roarNow, biteNow, mangleNow, rakeNow, bearweaveNow);
        }

        if (actor.getForm() == Form.BEAR) {
            BearDecision decision = decideBear(state, time, energy, furorCap, ripRefreshPending);
            switch (decision) {
                case LACERATE:
                    return lacerate(state, time);
                case MANGLE:
                    return mangle(state, time);
                case FAERIE_FIRE:
                    return actor.faerieFire().damage();
                case SHIFT:
                    actor.setReadyToShift(true);
                    break;
                case POWERSHIFT:
                    shift(state, time, true);
                    break;
                default:
                    waitTime = state.getSwingTimer().getNextSwing() - time;
                    break;
            }
        } else if (emergencyBearweave) {
            actor.setReadyToShift(true);
        } else if (berserkNow) {
            useBerserk(state, time, false);
            return 0.0;
        } else if (roarNow) {
            if (energy >= actor.getRoarCost()) {
                return savageRoar(state, time);
            }
            waitTime = (actor.getRoarCost() - energy) / Config.ENERGY_PER_SECOND;
        } else if (ripNow) {
            if (energy >= actor.getRipCost() || omen) {
                return rip(state, time);
            }
            waitTime = (actor.getRipCost() - energy) / Config.ENERGY_PER_SECOND;
        } else if (biteNow && !floatEnergyForRip) {
            if (energy >= actor.getBiteCost()) {
                return actor.bite().damage();
            }
            waitTime = (actor.getBiteCost() - energy) / Config.ENERGY_PER_SECOND;
        } else if (mangleNow) {
            if (energy >= actor.getMangleCost() || omen) {
                return mangle(state, time);
            }
            waitTime = (actor.getMangleCost() - energy) / Config.ENERGY_PER_SECOND;
        } else if (rakeNow) {
            if (energy >= actor.getRakeCost() || omen) {
                return rake(state, time);
            }
            waitTime = (actor.getRakeCost() - energy) / Config.ENERGY_PER_SECOND;
        } else if (faerieFireNow) {
            return actor.faerieFire().damage();
        } else if (bearweaveNow) {
            actor.setReadyToShift(true);
        } else if (flowershiftNow) {
            actor.flowershift(time);
            actor.setReadyToShift(true);
        } else if (rotation.isMangleSpam() && !omen) {
            if (excessEnergy >= actor.getMangleCost()) {
                return mangle(state, time);
            }
            waitTime = (actor.getMangleCost() - excessEnergy) / Config.ENERGY_PER_SECOND;
        } else {
            if (excessEnergy >= actor.getShredCost() || omen) {
                return shred(state, time);
            }
            waitTime = (actor.getShredCost() - excessEnergy) / Config.ENERGY_PER_SECOND;
        }

        double nextAction = time + waitTime;
        if (!pending.isEmpty()) {
            nextAction = Math.min(nextAction, pending.get(0).time());
        }
        state.setNextAction(nextAction + latency);
        return 0.0;
    }

    private BearDecision decideBear(SimulationState state, double time, double energy, double furorCap,
                                    boolean ripRefreshPending) {
        Actor actor = state.actor();
        double latency = state.getLatency();
        double rage = actor.getRage();

        // shift back if the next cat global would otherwise waste energy or let Rip drop
        boolean shiftNow = energy + 15 + Config.ENERGY_PER_SECOND * latency > furorCap
                || (ripRefreshPending && state.getRipEnd() < time + 3.0);
        boolean powerbearNow;
        if (rotation.isPowerbear()) {
            powerbearNow = !shiftNow && rage < POWERBEAR_RAGE;
            if (powerbearNow && actor.getMana() < actor.getShiftCost()) {
                state.markResourceExhaustion(time);
                powerbearNow = false;
            }
        } else {
            powerbearNow = false;
            shiftNow = shiftNow || rage < POWERBEAR_RAGE;
        }
        if (!rotation.isLaceratePrio()) {
            shiftNow = shiftNow || actor.isOmenProc();
        }

        boolean lacerateNow = rotation.isLaceratePrio() && (!state.isLacerateUp()
                || state.getLacerateStacks() < Config.LACERATE_MAX_STACKS
                || state.getLacerateEnd() - time <= rotation.getLacerateTime());
        boolean emergencyLacerate = rotation.isLaceratePrio() && state.isLacerateUp()
                && state.getLacerateEnd() - time < 3.0 + 2 * latency;

        if (emergencyLacerate && rage >= LACERATE_RAGE) {
            return BearDecision.LACERATE;
        } else if (shiftNow) {
            return BearDecision.SHIFT;
        } else if (powerbearNow) {
            return BearDecision.POWERSHIFT;
        } else if (lacerateNow && rage >= LACERATE_RAGE) {
            return BearDecision.LACERATE;
        } else if (rotation.isUseFaerieFire() && actor.getFaerieFireCooldown() < Config.EPSILON
                && !actor.isOmenProc()) {
            return BearDecision.FAERIE_FIRE;
        } else if (rage >= MANGLE_BEAR_RAGE && actor.getMangleCooldown() < Config.EPSILON) {
            return BearDecision.MANGLE;
        } else if (rage >= LACERATE_RAGE) {
            return BearDecision.LACERATE;
        }
        return BearDecision.WAIT;
    }

    /**
     * Decides whether a running Savage Roar should be clipped now so that the new Roar outlasts
     * the longest possible Rip by the configured offset.
     *
     * @param state the trial state
     * @param time  the current time
     * @param cp    combo points available
     * @return true if Roar should be recast now
     */
    boolean clipRoar(SimulationState state, double time, int cp) {
        Actor actor = state.actor();
        if (!state.isRipUp() || state.getFightLength() - state.getRipEnd() < Config.END_OF_FIGHT_THRESHOLD) {
            return false;
        }
        double maxRipEnd = state.getRip().getStart() + actor.getRipDuration()
                + (actor.getConfig().isShredGlyph() ? Config.SHRED_GLYPH_MAX_EXTENSION : 0.0);
        if (state.getRoarEnd() >= maxRipEnd + rotation.getMinRoarOffset()) {
            return false;
        }
        if (state.getRoarEnd() - time > rotation.getMaxRoarClip()) {
            return false;
        }
        double newRoarEnd = time + actor.savageRoarDuration(cp);
        return newRoarEnd >= maxRipEnd + rotation.getMinRoarOffset();
    }

    // ---------------------------------------------------------------------
    // Actions with bookkeeping
    // ---------------------------------------------------------------------

    /**
     * Shifts form and keeps the swing schedule in step: the next swing keeps its time but
     * the swing period follows the new form.
     *
     * @param state      the trial state
     * @param time       the current time
     * @param powershift whether to re-enter the current form
     */
    public void shift(SimulationState state, double time, boolean powershift) {
        Actor actor = state.actor();
        if (actor.getMana() < actor.getShiftCost()) {
            state.markResourceExhaustion(time);
        }
        Form before = actor.getForm();
        actor.shift(time, powershift);
        Form after = actor.getForm();
        if (before == Form.BEAR && after == Form.CAT) {
            state.getSwingTimer().onShift(true);
        } else if (before == Form.CAT && after == Form.BEAR) {
            state.getSwingTimer().onShift(false);
        }
    }

    /**
     * Casts Mangle and maintains the debuff.
     * @param state the trial state
     * @param time  the current time
     * @return damage dealt
     */
    public double mangle(SimulationState state, double time) {
        CastResult result = state.actor().mangle();
        if (result.landed()) {
            state.applyMangle(rotation.isBearMangle() ? Double.POSITIVE_INFINITY : time + Config.MANGLE_DURATION);
        }
        return result.damage();
    }

    /**
     * Casts Rake and starts its bleed.
     * @param state the trial state
     * @param time  the current time
     * @return damage of the initial hit
     */
    public double rake(SimulationState state, double time) {
        Actor actor = state.actor();
        CastResult result = actor.rake(state.isMangleUp());
        if (result.landed()) {
            state.startRake(DamageOverTime.apply(Ability.RAKE, time, actor.getRakeDuration(),
                    Config.RAKE_TICK_INTERVAL, result.tickDamage(), false, 0.0, 1.0));
        }
        return result.damage();
    }

    /**
     * Casts Rip and starts its bleed with a snapshot of the current crit chance.
     * @param state the trial state
     * @param time  the current time
     * @return always zero, Rip damage is dealt by its ticks
     */
    public double rip(SimulationState state, double time) {
        Actor actor = state.actor();
        CastResult result = actor.rip();
        if (result.landed()) {
            state.startRip(DamageOverTime.apply(Ability.RIP, time, actor.getRipDuration(),
                    Config.RIP_TICK_INTERVAL, result.tickDamage(), actor.getConfig().isPrimalGore(),
                    actor.getCritChance(), actor.getCritMultiplier()));
        }
        return 0.0;
    }

    /**
     * Casts Shred; a landed Shred extends Rip with Glyph of Shred.
     * @param state the trial state
     * @param time  the current time
     * @return damage dealt
     */
    public double shred(SimulationState state, double time) {
        Actor actor = state.actor();
        CastResult result = actor.shred(state.isMangleUp());
        if (result.landed() && actor.getConfig().isShredGlyph() && state.extendRipFromShred()
                && LOG.isTraceEnabled()) {
            LOG.trace("t={} Rip extended to {}", time, state.getRipEnd());
        }
        return result.damage();
    }

    /**
     * Casts Lacerate, starting the bleed or adding a stack to it.
     * @param state the trial state
     * @param time  the current time
     * @return damage of the initial hit
     */
    public double lacerate(SimulationState state, double time) {
        Actor actor = state.actor();
        CastResult result = actor.lacerate(state.isMangleUp());
        if (result.landed()) {
            double critChance = actor.getCritChance() - Config.BEAR_CRIT_PENALTY;
            boolean canCrit = actor.getConfig().isPrimalGore();
            DamageOverTime bleed = state.getLacerate();
            if (bleed == null) {
                bleed = DamageOverTime.apply(Ability.LACERATE, time, Config.LACERATE_DURATION,
                        Config.LACERATE_TICK_INTERVAL, result.tickDamage(), canCrit, critChance,
                        actor.getCritMultiplier());
                state.startLacerate(bleed);
            } else {
                bleed.refreshStacking(time, Config.LACERATE_DURATION, Config.LACERATE_MAX_STACKS, critChance,
                        actor.getCritMultiplier());
            }
            bleed.setTickDamage(result.tickDamage() * bleed.getStacks()
                    * (actor.isEnrage() ? Config.ENRAGE_MULTIPLIER : 1.0));
        }
        return result.damage();
    }

    /**
     * Casts Savage Roar with every combo point.
     * @param state the trial state
     * @param time  the current time
     * @return always zero
     */
    public double savageRoar(SimulationState state, double time) {
        Actor actor = state.actor();
        int cp = actor.getComboPoints();
        CastResult result = actor.savageRoar();
        if (result.accepted()) {
            state.setRoarEnd(time + actor.savageRoarDuration(cp));
        }
        return 0.0;
    }

    /**
     * Uses Berserk.
     * @param state  the trial state
     * @param time   the current time, -1 when used before the pull
     * @param prepop whether Berserk is used before the pull
     */
    public void useBerserk(SimulationState state, double time, boolean prepop) {
        Actor actor = state.actor();
        actor.applyBerserk(prepop);
        state.setBerserkEnd(time + Config.BERSERK_DURATION + (actor.getConfig().isBerserkGlyph() ? 5.0 : 0.0));
        state.log().record(time, "Berserk", "applied", actor);
    }

    /**
     * Uses Tiger's Fury and lets the policy react to the new energy after the input delay.
     * @param state the trial state
     * @param time  the current time
     */
    public void useTigersFury(SimulationState state, double time) {
        Actor actor = state.actor();
        actor.applyTigersFury();
        state.setTigersFuryEnd(time + Config.TIGERS_FURY_DURATION);
        state.setNextAction(time + state.getLatency());
        state.log().record(time, "Tiger's Fury", "applied", actor);
    }

    private enum BearDecision {
        LACERATE, MANGLE, FAERIE_FIRE, SHIFT, POWERSHIFT, WAIT
    }

    private record PendingRefresh(double time, double cost) {
    }
}
