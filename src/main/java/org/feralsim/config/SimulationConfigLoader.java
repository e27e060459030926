package org.feralsim.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigValue;
import org.feralsim.runtime.SimulationSetup;
import org.feralsim.runtime.effects.EffectFactory;
import org.feralsim.runtime.effects.EffectTemplate;
import org.feralsim.runtime.model.ActorConfig;
import org.feralsim.runtime.model.EncounterParameters;
import org.feralsim.runtime.model.StatTarget;
import org.feralsim.runtime.rotation.RotationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads the HOCON configuration and maps it onto the simulation input.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * simulation { fightLength, latency, hasteMultiplier, hotUptime, replicates, workers, seed }
 * actor      { attackPower, critChance, ..., furor, ..., omen, shredGlyph, ... }
 * encounter  { bossArmor, sunder, faerieFire, bloodFrenzy, curseOfElements, shatteringThrow, giftOfArthas }
 * rotation   { minCombosForRip, biteTime, bearweave, ... }
 * effects    = [ { type = "activated", name = "...", stats { attackPower = 1000 }, ... } ]
 * logging    { default-level, levels { ... } }
 * </pre>
 * Every section except {@code effects} is merged over {@code reference.conf}. Unknown keys in the
 * {@code actor}, {@code encounter}, {@code simulation} and {@code rotation} sections are rejected.
 */
public final class SimulationConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(SimulationConfigLoader.class);

    /** Configuration file picked up from the working directory. */
    public static final String CONFIG_FILE_NAME = "feralsim.conf";

    private static final Set<String> SIMULATION_KEYS = Set.of("fightLength", "latency", "hasteMultiplier",
            "hotUptime", "replicates", "workers", "seed");
    private static final Set<String> ENCOUNTER_KEYS = Set.of("bossArmor", "sunder", "faerieFire", "bloodFrenzy",
            "curseOfElements", "shatteringThrow", "giftOfArthas");

    private static final Map<String, ActorSetter> ACTOR_KEYS = new LinkedHashMap<>();

    static {
        for (StatTarget target : StatTarget.values()) {
            if (target.isActorAttribute()) {
                ACTOR_KEYS.put(target.getConfigKey(), (b, c, k) -> b.stat(target, c.getDouble(k)));
            }
        }
        ACTOR_KEYS.put("apMod", (b, c, k) -> b.apMod(c.getDouble(k)));
        ACTOR_KEYS.put("debuffAttackPower", (b, c, k) -> b.debuffAttackPower(c.getDouble(k)));
        ACTOR_KEYS.put("shredBonus", (b, c, k) -> b.shredBonus(c.getDouble(k)));
        ACTOR_KEYS.put("ripBonus", (b, c, k) -> b.ripBonus(c.getDouble(k)));
        ACTOR_KEYS.put("damageMultiplier", (b, c, k) -> b.damageMultiplier(c.getDouble(k)));
        ACTOR_KEYS.put("spellDamageMultiplier", (b, c, k) -> b.spellDamageMultiplier(c.getDouble(k)));
        ACTOR_KEYS.put("gotwTargets", (b, c, k) -> b.gotwTargets(c.getInt(k)));
        ACTOR_KEYS.put("feralAggression", (b, c, k) -> b.feralAggression(c.getInt(k)));
        ACTOR_KEYS.put("predatoryInstincts", (b, c, k) -> b.predatoryInstincts(c.getInt(k)));
        ACTOR_KEYS.put("savageFury", (b, c, k) -> b.savageFury(c.getInt(k)));
        ACTOR_KEYS.put("furor", (b, c, k) -> b.furor(c.getInt(k)));
        ACTOR_KEYS.put("naturalShapeshifter", (b, c, k) -> b.naturalShapeshifter(c.getInt(k)));
        ACTOR_KEYS.put("intensity", (b, c, k) -> b.intensity(c.getInt(k)));
        ACTOR_KEYS.put("protectorOfThePack", (b, c, k) -> b.protectorOfThePack(c.getInt(k)));
        ACTOR_KEYS.put("improvedMangle", (b, c, k) -> b.improvedMangle(c.getInt(k)));
        ACTOR_KEYS.put("improvedLeaderOfThePack", (b, c, k) -> b.improvedLeaderOfThePack(c.getInt(k)));
        ACTOR_KEYS.put("judgementOfWisdom", (b, c, k) -> b.judgementOfWisdom(c.getBoolean(k)));
        ACTOR_KEYS.put("rune", (b, c, k) -> b.rune(c.getBoolean(k)));
        ACTOR_KEYS.put("omen", (b, c, k) -> b.omen(c.getBoolean(k)));
        ACTOR_KEYS.put("primalGore", (b, c, k) -> b.primalGore(c.getBoolean(k)));
        ACTOR_KEYS.put("wolfshead", (b, c, k) -> b.wolfshead(c.getBoolean(k)));
        ACTOR_KEYS.put("metaGem", (b, c, k) -> b.metaGem(c.getBoolean(k)));
        ACTOR_KEYS.put("mangleGlyph", (b, c, k) -> b.mangleGlyph(c.getBoolean(k)));
        ACTOR_KEYS.put("ripGlyph", (b, c, k) -> b.ripGlyph(c.getBoolean(k)));
        ACTOR_KEYS.put("shredGlyph", (b, c, k) -> b.shredGlyph(c.getBoolean(k)));
        ACTOR_KEYS.put("roarGlyph", (b, c, k) -> b.roarGlyph(c.getBoolean(k)));
        ACTOR_KEYS.put("berserkGlyph", (b, c, k) -> b.berserkGlyph(c.getBoolean(k)));
        ACTOR_KEYS.put("t6TwoPiece", (b, c, k) -> b.t6TwoPiece(c.getBoolean(k)));
        ACTOR_KEYS.put("t6FourPiece", (b, c, k) -> b.t6FourPiece(c.getBoolean(k)));
        ACTOR_KEYS.put("t7TwoPiece", (b, c, k) -> b.t7TwoPiece(c.getBoolean(k)));
        ACTOR_KEYS.put("t8FourPiece", (b, c, k) -> b.t8FourPiece(c.getBoolean(k)));
        ACTOR_KEYS.put("t9TwoPiece", (b, c, k) -> b.t9TwoPiece(c.getBoolean(k)));
        ACTOR_KEYS.put("t9FourPiece", (b, c, k) -> b.t9FourPiece(c.getBoolean(k)));
        ACTOR_KEYS.put("t10TwoPiece", (b, c, k) -> b.t10TwoPiece(c.getBoolean(k)));
    }

    private SimulationConfigLoader() {}

    /**
     * Loads the configuration. Order of precedence, highest first: system properties, environment
     * variables, the explicit file, the file named by {@code -Dconfig.file}, {@value #CONFIG_FILE_NAME}
     * in the working directory, and the classpath defaults.
     *
     * @param explicitFile the file given on the command line, or null
     * @return the resolved configuration
     * @throws ConfigurationException if a named file does not exist or cannot be parsed
     */
    public static Config load(File explicitFile) {
        File file = explicitFile;
        if (file != null) {
            LOG.info("Using configuration file specified via --config: {}", file.getAbsolutePath());
        } else {
            String systemConfigPath = System.getProperty("config.file");
            if (systemConfigPath != null && !systemConfigPath.isBlank()) {
                file = new File(systemConfigPath).getAbsoluteFile();
                LOG.info("Using configuration file specified via -Dconfig.file: {}", file.getAbsolutePath());
            } else {
                File cwdConfigFile = new File(CONFIG_FILE_NAME);
                if (cwdConfigFile.exists()) {
                    file = cwdConfigFile;
                    LOG.info("Using configuration file found in current directory: {}", file.getAbsolutePath());
                } else {
                    LOG.info("No '{}' found in current directory. Using default configuration from classpath.",
                            CONFIG_FILE_NAME);
                }
            }
        }
        if (file != null && !file.exists()) {
            throw new ConfigurationException("config.file", "configuration file not found: " + file.getAbsolutePath());
        }
        try {
            Config config = ConfigFactory.systemProperties()
                    .withFallback(ConfigFactory.systemEnvironment());
            if (file != null) {
                config = config.withFallback(ConfigFactory.parseFile(file));
            }
            return config.withFallback(ConfigFactory.defaultReference()).resolve();
        } catch (ConfigException e) {
            throw new ConfigurationException("config", "failed to load or parse configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Maps a configuration onto the simulation input.
     *
     * @param config the configuration, merged over the classpath defaults if it is not already
     * @return the simulation input and batch parameters
     * @throws ConfigurationException for missing, unknown, wrongly typed or invalid values
     */
    public static SimulationSettings toSettings(Config config) {
        Config merged = config.withFallback(ConfigFactory.defaultReference()).resolve();
        Config simulation = section(merged, "simulation", SIMULATION_KEYS);

        SimulationSetup setup = new SimulationSetup(actorConfig(merged), encounter(merged), rotation(merged),
                effects(merged), read("simulation", () -> simulation.getDouble("fightLength")),
                read("simulation", () -> simulation.getDouble("latency")),
                read("simulation", () -> simulation.getDouble("hasteMultiplier")),
                read("simulation", () -> simulation.getDouble("hotUptime")));
        return new SimulationSettings(setup, read("simulation", () -> simulation.getInt("replicates")),
                read("simulation", () -> simulation.getInt("workers")),
                read("simulation", () -> simulation.getLong("seed")));
    }

    /**
     * @param config a configuration containing an {@code actor} section
     * @return the character
     */
    public static ActorConfig actorConfig(Config config) {
        Config actor = section(config, "actor", ACTOR_KEYS.keySet());
        ActorConfig.Builder builder = ActorConfig.builder();
        for (String key : actor.root().keySet()) {
            ActorSetter setter = ACTOR_KEYS.get(key);
            read("actor." + key, () -> {
                setter.apply(builder, actor, key);
                return null;
            });
        }
        return builder.build();
    }

    /**
     * @param config a configuration containing an {@code encounter} section
     * @return the encounter
     */
    public static EncounterParameters encounter(Config config) {
        Config encounter = section(config, "encounter", ENCOUNTER_KEYS);
        return read("encounter", () -> new EncounterParameters(encounter.getDouble("bossArmor"),
                encounter.getBoolean("sunder"), encounter.getBoolean("faerieFire"),
                encounter.getBoolean("bloodFrenzy"), encounter.getBoolean("curseOfElements"),
                encounter.getBoolean("shatteringThrow"), encounter.getBoolean("giftOfArthas")));
    }

    /**
     * @param config a configuration that may contain a {@code rotation} section
     * @return the rotation tunables
     */
    public static RotationConfig rotation(Config config) {
        if (!config.hasPath("rotation")) {
            return RotationConfig.defaults();
        }
        Map<String, Object> values = read("rotation", () -> config.getConfig("rotation").root().unwrapped());
        return RotationConfig.fromMap(values);
    }

    /**
     * @param config a configuration that may contain an {@code effects} list
     * @return one template per configured effect, in configuration order
     */
    public static List<EffectTemplate> effects(Config config) {
        if (!config.hasPath("effects")) {
            return List.of();
        }
        List<? extends Config> entries = read("effects", () -> config.getConfigList("effects"));
        List<EffectTemplate> templates = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            Config entry = entries.get(i);
            if (!entry.hasPath("type")) {
                throw new ConfigurationException("effects[" + i + "].type", "is required");
            }
            templates.add(EffectFactory.create(entry.getString("type"), entry.root().unwrapped()));
        }
        return templates;
    }

    private static Config section(Config config, String path, Set<String> allowedKeys) {
        Config section = read(path, () -> config.getConfig(path));
        for (Map.Entry<String, ConfigValue> entry : section.root().entrySet()) {
            if (!allowedKeys.contains(entry.getKey())) {
                throw new ConfigurationException(path + "." + entry.getKey(), "is not a supported key");
            }
        }
        return section;
    }

    private static <T> T read(String path, ConfigReader<T> reader) {
        try {
            return reader.read();
        } catch (ConfigException e) {
            throw new ConfigurationException(path, e.getMessage(), e);
        }
    }

    @FunctionalInterface
    private interface ConfigReader<T> {
        T read();
    }

    @FunctionalInterface
    private interface ActorSetter {
        void apply(ActorConfig.Builder builder, Config config, String key);
    }
}
