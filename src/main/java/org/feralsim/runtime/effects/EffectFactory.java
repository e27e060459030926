package org.feralsim.runtime.effects;

import org.feralsim.config.ConfigurationException;
import org.feralsim.runtime.model.ProcTrigger;
import org.feralsim.runtime.model.StatTarget;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A factory for effect templates.
 * It uses a registry mapping effect types to creators; each creator validates its parameters
 * and returns a template from which every trial builds its own effect instance.
 */
public final class EffectFactory {

    private static final Map<String, IEffectCreator> registry = new HashMap<>();

    private static final Set<String> PROC_KEYS = Set.of("type", "name", "stats", "duration", "cooldown",
            "chanceOnHit", "chanceOnCrit", "yellowChanceOnHit", "trigger");

    static {
        register("activated", (name, params) -> {
            requireKeys(name, params, Set.of("type", "name", "stats", "duration", "cooldown", "delay"));
            EffectSpec spec = new EffectSpec(name, stats(name, params), number(name, params, "duration", null),
                    number(name, params, "cooldown", null), number(name, params, "delay", 0.0),
                    null, ProcTrigger.ANY, 0, null, null, 0);
            return new EffectTemplate("activated", spec, s -> new BuffEffect(s, EffectBehavior.FIXED_USE));
        });

        register("proc", (name, params) -> {
            requireKeys(name, params, PROC_KEYS);
            EffectSpec spec = procSpec(name, params);
            return new EffectTemplate("proc", spec, s -> new BuffEffect(s, EffectBehavior.CHANCE_PROC));
        });

        register("refreshing_proc", (name, params) -> {
            requireKeys(name, params, PROC_KEYS);
            EffectSpec spec = procSpec(name, params);
            return new EffectTemplate("refreshing_proc", spec,
                    s -> new BuffEffect(s, EffectBehavior.REFRESHING_PROC));
        });

        register("stacking_proc", (name, params) -> {
            requireKeys(name, params, Set.of("type", "name", "stats", "duration", "cooldown", "maxStacks",
                    "stackName", "chanceOnHit", "yellowChanceOnHit", "auraType", "auraChanceOnHit",
                    "auraYellowChanceOnHit", "trigger"));
            String auraType = string(name, params, "auraType", "activated").toLowerCase(Locale.ROOT);
            ProcRates auraRates = switch (auraType) {
                case "activated" -> null;
                case "proc" -> ProcRates.whiteYellow(number(name, params, "auraChanceOnHit", null),
                        number(name, params, "auraYellowChanceOnHit", null));
                default -> throw new ConfigurationException("effects." + name + ".auraType",
                        "must be 'activated' or 'proc', was '" + auraType + "'");
            };
            int maxStacks = (int) Math.round(number(name, params, "maxStacks", null));
            if (maxStacks < 1) {
                throw new ConfigurationException("effects." + name + ".maxStacks", "must be at least 1");
            }
            double white = number(name, params, "chanceOnHit", null);
            EffectSpec spec = new EffectSpec(name, stats(name, params), number(name, params, "duration", null),
                    number(name, params, "cooldown", null), 0.0,
                    ProcRates.whiteYellow(white, number(name, params, "yellowChanceOnHit", white)),
                    trigger(name, params), maxStacks, string(name, params, "stackName", name), auraRates, 0);
            return new EffectTemplate("stacking_proc", spec, s -> new BuffEffect(s, EffectBehavior.STACKING_PROC));
        });

        register("instant_damage", (name, params) -> {
            requireKeys(name, params, Set.of("type", "name", "chanceOnHit", "chanceOnCrit", "yellowChanceOnHit",
                    "trigger", "minDamage", "damageRange", "missChance"));
            EffectSpec spec = new EffectSpec(name, List.of(), 0.0, 0.0, 0.0, rates(name, params),
                    trigger(name, params), 0, null, null, 0);
            double minDamage = number(name, params, "minDamage", 222.0);
            double damageRange = number(name, params, "damageRange", 110.0);
            double missChance = number(name, params, "missChance", 0.17);
            return new EffectTemplate("instant_damage", spec,
                    s -> new InstantDamageEffect(s, minDamage, damageRange, missChance));
        });

        register("haste_potion", (name, params) -> {
            requireKeys(name, params, Set.of("type", "name", "delay"));
            double delay = number(name, params, "delay", 0.0);
            // one potion in combat, plus the pre-pull potion when used at the pull
            int maxProcs = delay > 1e-9 ? 1 : 2;
            EffectSpec spec = new EffectSpec(name, List.of(new StatDelta(StatTarget.HASTE_RATING, 400.0)),
                    15.0, 60.0, delay, null, ProcTrigger.ANY, 0, null, null, maxProcs);
            return new EffectTemplate("haste_potion", spec, s -> new BuffEffect(s, EffectBehavior.FIXED_USE));
        });

        register("bloodlust", (name, params) -> {
            requireKeys(name, params, Set.of("type", "name", "delay"));
            EffectSpec spec = new EffectSpec(name, List.of(new StatDelta(StatTarget.HASTE_MULTIPLIER, 1.3)),
                    40.0, 600.0, number(name, params, "delay", 0.0), null, ProcTrigger.ANY, 0, null, null, 0);
            return new EffectTemplate("bloodlust", spec, s -> new BuffEffect(s, EffectBehavior.FIXED_USE));
        });
    }

    private EffectFactory() {}

    /**
     * Registers a new effect creator.
     * @param type The type of the effect.
     * @param creator The creator for the effect.
     */
    public static void register(String type, IEffectCreator creator) {
        registry.put(type.toLowerCase(Locale.ROOT), creator);
    }

    /**
     * Creates an effect template.
     * @param type The type of the effect to create.
     * @param params The parameters of the effect, including its name.
     * @return The created template.
     * @throws ConfigurationException if the type is unknown or a parameter is missing or invalid.
     */
    public static EffectTemplate create(String type, Map<String, Object> params) {
        Objects.requireNonNull(type, "Effect type cannot be null.");
        IEffectCreator creator = registry.get(type.toLowerCase(Locale.ROOT));
        if (creator == null) {
            throw new ConfigurationException("effects.type", "unknown effect type '" + type
                    + "', supported types are " + registry.keySet());
        }
        Map<String, Object> safeParams = params != null ? params : Map.of();
        Object name = safeParams.get("name");
        String effectName = name != null ? name.toString() : defaultName(type);
        return creator.create(effectName, safeParams);
    }

    private static String defaultName(String type) {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "haste_potion" -> "Haste Potion";
            case "bloodlust" -> "Bloodlust";
            default -> throw new ConfigurationException("effects.name", "is required for effects of type " + type);
        };
    }

    private static EffectSpec procSpec(String name, Map<String, Object> params) {
        return new EffectSpec(name, stats(name, params), number(name, params, "duration", null),
                number(name, params, "cooldown", 0.0), 0.0, rates(name, params), trigger(name, params),
                0, null, null, 0);
    }

    private static ProcRates rates(String name, Map<String, Object> params) {
        double onHit = number(name, params, "chanceOnHit", null);
        if (params.containsKey("yellowChanceOnHit")) {
            if (params.containsKey("chanceOnCrit")) {
                throw new ConfigurationException("effects." + name + ".chanceOnCrit",
                        "cannot be combined with yellowChanceOnHit");
            }
            return ProcRates.whiteYellow(onHit, number(name, params, "yellowChanceOnHit", null));
        }
        return ProcRates.hitCrit(onHit, number(name, params, "chanceOnCrit", onHit));
    }

    private static ProcTrigger trigger(String name, Map<String, Object> params) {
        Object value = params.get("trigger");
        if (value == null) {
            return ProcTrigger.ANY;
        }
        try {
            return ProcTrigger.parse(value.toString());
        } catch (ConfigurationException e) {
            throw new ConfigurationException("effects." + name + ".trigger", e.getMessage(), e);
        }
    }

    private static List<StatDelta> stats(String name, Map<String, Object> params) {
        Object value = params.get("stats");
        if (!(value instanceof Map<?, ?> map) || map.isEmpty()) {
            throw new ConfigurationException("effects." + name + ".stats", "must map at least one stat to an amount");
        }
        List<StatDelta> deltas = new ArrayList<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = String.valueOf(entry.getKey());
            if (!(entry.getValue() instanceof Number amount)) {
                throw new ConfigurationException("effects." + name + ".stats." + key, "must be a number");
            }
            StatTarget target;
            try {
                target = StatTarget.fromConfigKey(key);
            } catch (ConfigurationException e) {
                throw new ConfigurationException("effects." + name + ".stats." + key, e.getMessage(), e);
            }
            if (target == StatTarget.SWING_TIMER) {
                throw new ConfigurationException("effects." + name + ".stats." + key,
                        "the swing timer cannot be changed by an effect, use hasteRating or hasteMultiplier");
            }
            deltas.add(new StatDelta(target, amount.doubleValue()));
        }
        return deltas;
    }

    private static double number(String name, Map<String, Object> params, String key, Double defaultValue) {
        Object value = params.get(key);
        if (value == null) {
            if (defaultValue == null) {
                throw new ConfigurationException("effects." + name + "." + key, "is required");
            }
            return defaultValue;
        }
        if (!(value instanceof Number number)) {
            throw new ConfigurationException("effects." + name + "." + key, "must be a number, was '" + value + "'");
        }
        return number.doubleValue();
    }

    private static String string(String name, Map<String, Object> params, String key, String defaultValue) {
        Object value = params.get(key);
        return value == null ? defaultValue : value.toString();
    }

    private static void requireKeys(String name, Map<String, Object> params, Set<String> allowed) {
        for (String key : params.keySet()) {
            if (!allowed.contains(key)) {
                throw new ConfigurationException("effects." + name + "." + key, "is not a supported parameter, "
                        + "supported parameters are " + allowed);
            }
        }
    }
}
