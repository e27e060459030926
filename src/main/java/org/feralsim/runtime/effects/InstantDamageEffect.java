package org.feralsim.runtime.effects;

import org.feralsim.runtime.CombatLog;
import org.feralsim.runtime.model.ProcTrigger;
import org.feralsim.runtime.spi.IRandomProvider;

/**
 * A proc that deals nature damage instead of granting a buff. The damage rolls its own miss
 * and a partial resist table for a raid boss with no nature resistance.
 */
public class InstantDamageEffect implements Effect {

    private static final double[] RESIST_THRESHOLDS = {0.84, 0.95, 0.99};
    private static final double[] RESIST_FACTORS = {1.0, 0.75, 0.5, 0.25};

    private final EffectSpec spec;
    private final double minDamage;
    private final double damageRange;
    private final double missChance;
    private final EffectState state = new EffectState();

    /**
     * @param spec        name, proc rates and trigger of the effect
     * @param minDamage   damage before resists at the low end
     * @param damageRange width of the uniform damage range
     * @param missChance  chance for the proc to miss
     */
    public InstantDamageEffect(EffectSpec spec, double minDamage, double damageRange, double missChance) {
        this.spec = spec;
        this.minDamage = minDamage;
        this.damageRange = damageRange;
        this.missChance = missChance;
    }

    @Override
    public String getName() {
        return spec.name();
    }

    @Override
    public void reset() {
        state.reset();
    }

    @Override
    public void checkForProc(ProcTrigger trigger, boolean crit, boolean yellow, IRandomProvider rng) {
        if (trigger != spec.trigger()) {
            return;
        }
        state.procHappened = rng.nextDouble() < spec.rates().rate(crit, yellow);
    }

    @Override
    public double update(double time, EffectContext context) {
        state.bookUptime(time);
        if (!state.procHappened) {
            return 0.0;
        }
        state.procHappened = false;
        state.procCount++;

        IRandomProvider rng = context.rng();
        if (rng.nextDouble() < missChance) {
            context.log().record(time, spec.name(), "miss", context.actor());
            return 0.0;
        }
        double damage = (minDamage + rng.nextDouble() * damageRange) * resistFactor(rng.nextDouble());
        context.log().record(time, spec.name(), CombatLog.describe(damage, false, false, false), context.actor());
        return damage;
    }

    static double resistFactor(double roll) {
        for (int i = 0; i < RESIST_THRESHOLDS.length; i++) {
            if (roll < RESIST_THRESHOLDS[i]) {
                return RESIST_FACTORS[i];
            }
        }
        return RESIST_FACTORS[RESIST_FACTORS.length - 1];
    }

    @Override
    public void finish(double time, EffectContext context) {
        state.bookUptime(time);
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
        return false;
    }

    @Override
    public double nextEventTime(double time) {
        return Double.POSITIVE_INFINITY;
    }
}
