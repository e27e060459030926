package org.feralsim.testutils;

import org.feralsim.runtime.SimulationSetup;
import org.feralsim.runtime.effects.EffectFactory;
import org.feralsim.runtime.effects.EffectTemplate;
import org.feralsim.runtime.model.ActorConfig;
import org.feralsim.runtime.model.EncounterParameters;
import org.feralsim.runtime.model.StatTarget;
import org.feralsim.runtime.rotation.RotationConfig;

import java.util.List;
import java.util.Map;

/**
 * Simulation inputs shared by engine and analysis tests.
 */
public final class TestSetups {

    private TestSetups() {}

    /**
     * @return a raid-buffed character with stats in the usual range
     */
    public static ActorConfig character() {
        return ActorConfig.builder()
                .stat(StatTarget.ATTACK_POWER, 6000)
                .stat(StatTarget.AGILITY, 1100)
                .stat(StatTarget.HIT_CHANCE, 0.07)
                .stat(StatTarget.SPELL_HIT_CHANCE, 0.10)
                .stat(StatTarget.EXPERTISE_RATING, 132)
                .stat(StatTarget.CRIT_CHANCE, 0.45)
                .stat(StatTarget.SPELL_CRIT_CHANCE, 0.20)
                .stat(StatTarget.ARMOR_PEN_RATING, 300)
                .stat(StatTarget.WEAPON_DAMAGE, 12)
                .stat(StatTarget.SWING_TIMER, 0.8)
                .stat(StatTarget.MANA_POOL, 7000)
                .stat(StatTarget.INTELLECT, 300)
                .stat(StatTarget.SPIRIT, 200)
                .stat(StatTarget.MP5, 0)
                .build();
    }

    public static EncounterParameters encounter() {
        return new EncounterParameters(10643, true, true, true, false, true, true);
    }

    /**
     * @param fightLength nominal fight length in seconds
     * @return a setup with the default rotation and no timed effects
     */
    public static SimulationSetup setup(double fightLength) {
        return setup(fightLength, RotationConfig.defaults(), List.of());
    }

    public static SimulationSetup setup(double fightLength, RotationConfig rotation, List<EffectTemplate> effects) {
        return new SimulationSetup(character(), encounter(), rotation, effects, fightLength, 0.1, 1.0, 0.75);
    }

    /**
     * @return Bloodlust at the pull and a haste potion
     */
    public static List<EffectTemplate> hasteCooldowns() {
        return List.of(EffectFactory.create("bloodlust", Map.of()), EffectFactory.create("haste_potion", Map.of()));
    }
}
