package org.feralsim.runtime.effects;

import org.feralsim.runtime.Config;

/**
 * Cooldown, proc and uptime bookkeeping shared by all effect behaviors.
 */
final class EffectState {

    double activationTime = Double.NEGATIVE_INFINITY;
    double deactivationTime = Double.POSITIVE_INFINITY;
    boolean active;
    boolean canProc = true;
    boolean procHappened;
    int procCount;
    int stacks;
    double uptime;
    double lastUpdate;

    void reset() {
        activationTime = Double.NEGATIVE_INFINITY;
        deactivationTime = Double.POSITIVE_INFINITY;
        active = false;
        canProc = true;
        procHappened = false;
        procCount = 0;
        stacks = 0;
        uptime = 0.0;
        lastUpdate = 0.0;
    }

    /**
     * Folds the time since the last update into the running uptime average.
     */
    void bookUptime(double time) {
        if (time > lastUpdate) {
            double dt = time - lastUpdate;
            uptime = (uptime * lastUpdate + (active ? dt : 0.0)) / time;
            lastUpdate = time;
        }
    }

    boolean isExpired(double time) {
        return active && time > deactivationTime - Config.EPSILON;
    }

    boolean isCooldownReady(double time, double cooldown) {
        return time - activationTime > cooldown - Config.EPSILON;
    }
}
