package org.feralsim.runtime.model;

import org.feralsim.config.ConfigurationException;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * A stat that effects and stat-weight perturbations can modify.
 * <p>
 * Most targets are actor attributes and are applied by {@link Actor#applyDelta(StatTarget, double)}.
 * {@link #HASTE_RATING} and {@link #HASTE_MULTIPLIER} change timers owned by the event loop and
 * are applied there instead. {@link #HASTE_MULTIPLIER} is multiplicative: applying an amount of
 * {@code a} with scale {@code s} multiplies the current multiplier by {@code a^s}.
 */
public enum StatTarget {
    ATTACK_POWER("attackPower", true),
    AGILITY("agility", true),
    HIT_CHANCE("hitChance", true),
    /** Offset added to the melee miss chance after the hit and expertise caps. */
    MISS_CHANCE("missChance", true),
    SPELL_HIT_CHANCE("spellHitChance", true),
    EXPERTISE_RATING("expertiseRating", true),
    CRIT_CHANCE("critChance", true),
    SPELL_CRIT_CHANCE("spellCritChance", true),
    ARMOR_PEN_RATING("armorPenRating", true),
    WEAPON_DAMAGE("weaponDamage", true),
    SWING_TIMER("swingTimer", true),
    MANA_POOL("mana", true),
    INTELLECT("intellect", true),
    SPIRIT("spirit", true),
    MP5("mp5", true),
    HASTE_RATING("hasteRating", false),
    HASTE_MULTIPLIER("hasteMultiplier", false);

    private static final Map<String, StatTarget> BY_KEY = Arrays.stream(values())
            .collect(Collectors.toMap(t -> t.configKey.toLowerCase(Locale.ROOT), Function.identity()));

    private final String configKey;
    private final boolean actorAttribute;

    StatTarget(String configKey, boolean actorAttribute) {
        this.configKey = configKey;
        this.actorAttribute = actorAttribute;
    }

    /**
     * @return the key used for this stat in configuration files
     */
    public String getConfigKey() {
        return configKey;
    }

    /**
     * @return true if the stat is stored on the actor, false if it is owned by the event loop
     */
    public boolean isActorAttribute() {
        return actorAttribute;
    }

    /**
     * Resolves a stat from its configuration key, case-insensitively.
     *
     * @param key the configuration key
     * @return the matching stat
     * @throws ConfigurationException if no stat uses that key
     */
    public static StatTarget fromConfigKey(String key) {
        StatTarget target = key == null ? null : BY_KEY.get(key.toLowerCase(Locale.ROOT));
        if (target == null) {
            throw new ConfigurationException(String.valueOf(key), "unknown stat, supported stats are "
                    + Arrays.stream(values()).map(StatTarget::getConfigKey).collect(Collectors.joining(", ")));
        }
        return target;
    }
}
