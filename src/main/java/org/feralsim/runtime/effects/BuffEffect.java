package org.feralsim.runtime.effects;

import org.feralsim.runtime.Config;
import org.feralsim.runtime.model.ProcTrigger;
import org.feralsim.runtime.spi.IRandomProvider;

/**
 * A stat buff whose activation follows one of the {@link EffectBehavior} strategies.
 * <p>
 * Proc-based behaviors are offered every landed attack matching their trigger through
 * {@link #checkForProc}; the roll only sets a flag which the next {@link #update} consumes.
 * A stacking effect first needs its aura, gained on cooldown or from a proc, and then gains
 * one stack per proc. When the aura ends every stack is removed in a single stat change.
 * </p>
 */
public class BuffEffect implements Effect {

    private final EffectSpec spec;
    private final EffectBehavior behavior;
    private final EffectState state = new EffectState();
    private ProcRates currentRates;

    public BuffEffect(EffectSpec spec, EffectBehavior behavior) {
        this.spec = spec;
        this.behavior = behavior;
        reset();
    }

    @Override
    public String getName() {
        return spec.name();
    }

    public EffectBehavior getBehavior() {
        return behavior;
    }

    public int getStacks() {
        return state.stacks;
    }

    @Override
    public void reset() {
        state.reset();
        currentRates = spec.rates();
        switch (behavior) {
            case FIXED_USE -> {
                if (spec.delay() > 0) {
                    // ready exactly when the delay has passed
                    state.activationTime = spec.delay() - spec.cooldown();
                    state.canProc = false;
                }
            }
            case STACKING_PROC -> resetAura();
            default -> {
            }
        }
    }

    private void resetAura() {
        state.active = false;
        state.canProc = false;
        state.procHappened = false;
        state.stacks = 0;
        currentRates = spec.isActivatedAura() ? spec.rates() : spec.auraRates();
    }

    @Override
    public void checkForProc(ProcTrigger trigger, boolean crit, boolean yellow, IRandomProvider rng) {
        if (behavior == EffectBehavior.FIXED_USE || trigger != spec.trigger() || currentRates == null) {
            return;
        }
        if (!state.canProc) {
            state.procHappened = false;
            return;
        }
        state.procHappened = rng.nextDouble() < currentRates.rate(crit, yellow);
    }

    @Override
    public double update(double time, EffectContext context) {
        state.bookUptime(time);

        if (state.isExpired(time)) {
            deactivate(state.deactivationTime, context);
        }
        if (!state.canProc && state.isCooldownReady(time, spec.cooldown())) {
            state.canProc = true;
        }
        if (shouldActivate()) {
            activate(time, context);
        }
        return 0.0;
    }

    private boolean shouldActivate() {
        return switch (behavior) {
            case FIXED_USE -> state.canProc && (spec.maxProcs() == 0 || state.procCount < spec.maxProcs());
            case CHANCE_PROC, REFRESHING_PROC -> consumeProc();
            case STACKING_PROC -> {
                if (spec.isActivatedAura() && !state.active && state.canProc) {
                    yield true;
                }
                if (state.stacks == spec.maxStacks()) {
                    state.canProc = false;
                    yield false;
                }
                yield consumeProc();
            }
        };
    }

    private boolean consumeProc() {
        if (state.canProc && state.procHappened) {
            state.procHappened = false;
            return true;
        }
        return false;
    }

    private void activate(double time, EffectContext context) {
        switch (behavior) {
            case REFRESHING_PROC -> {
                if (state.active) {
                    deactivate(time, context);
                }
                startBuff(time, context, true);
            }
            case STACKING_PROC -> {
                if (!state.active) {
                    startBuff(time, context, false);
                    state.canProc = true;
                    state.procHappened = false;
                    currentRates = spec.rates();
                } else {
                    applyStats(1.0, time, context);
                    state.stacks++;
                    context.log().record(time, spec.stackName(), "applied", context.actor());
                }
            }
            default -> startBuff(time, context, true);
        }
    }

    private void startBuff(double time, EffectContext context, boolean withStats) {
        state.activationTime = time;
        state.deactivationTime = time + spec.duration();
        if (withStats) {
            applyStats(1.0, time, context);
        }
        state.active = true;
        state.canProc = false;
        state.procCount++;
        context.log().record(time, spec.name(), "applied", context.actor());
    }

    private void deactivate(double time, EffectContext context) {
        if (behavior == EffectBehavior.STACKING_PROC) {
            applyStats(-state.stacks, time, context);
            resetAura();
        } else {
            applyStats(-1.0, time, context);
            state.active = false;
        }
        context.log().record(time, spec.name(), "falls off", context.actor());
    }

    private void applyStats(double scale, double time, EffectContext context) {
        if (scale == 0) {
            return;
        }
        for (StatDelta delta : spec.stats()) {
            context.applyStat(delta, scale, time);
        }
    }

    @Override
    public void finish(double time, EffectContext context) {
        update(time, context);
        if (state.active) {
            deactivate(time, context);
        }
    }

    @Override
    public int getProcCount() {
        return state.procCount;
    }

    @Override
    public double getUptime() {
        return state.uptime;
    }

    @Override
    public boolean isActive() {
        return state.active;
    }

    @Override
    public double nextEventTime(double time) {
        double next = Double.POSITIVE_INFINITY;
        if (state.active) {
            next = state.deactivationTime;
        }
        if (!state.canProc && Double.isFinite(state.activationTime)) {
            double ready = state.activationTime + spec.cooldown();
            if (ready > time + Config.EPSILON) {
                next = Math.min(next, ready);
            }
        }
        return next;
    }
}
