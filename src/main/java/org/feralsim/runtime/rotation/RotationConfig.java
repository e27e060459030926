package org.feralsim.runtime.rotation;

import org.feralsim.config.ConfigurationException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable tunables of the rotation policy.
 * <p>
 * Instances are created through {@link #fromMap(Map)}, which accepts a flat map of named keys
 * and rejects unknown keys and contradictory combinations. Every key is optional; missing keys
 * keep the value of {@link #defaults()}.
 * </p>
 *
 * <h3>Keys</h3>
 * <pre>
 * minCombosForRip    = 5       # 1..5
 * minCombosForBite   = 5       # 1..5
 * useRake            = true
 * useBite            = true
 * biteTime           = 8.0     # null selects the analytical Bite model
 * mangleSpam         = false
 * bearMangle         = false   # a tank keeps Mangle up permanently
 * useBerserk         = true
 * prepopBerserk      = false   # requires useBerserk
 * preprocOmen        = false
 * bearweave          = false
 * berserkBiteThresh  = 100.0   # 0..100
 * laceratePrio       = false   # requires bearweave
 * lacerateTime       = 10.0
 * powerbear          = false   # requires bearweave
 * maxRoarClip        = 8.0
 * minRoarOffset      = 10.0
 * useFaerieFire      = false
 * flowershift        = false   # excludes bearweave
 * </pre>
 */
public final class RotationConfig {

    private static final RotationConfig DEFAULTS = new RotationConfig(new LinkedHashMap<>());

    private final int minCombosForRip;
    private final int minCombosForBite;
    private final boolean useRake;
    private final boolean useBite;
    private final Double biteTime;
    private final boolean mangleSpam;
    private final boolean bearMangle;
    private final boolean useBerserk;
    private final boolean prepopBerserk;
    private final boolean preprocOmen;
    private final boolean bearweave;
    private final double berserkBiteThresh;
    private final boolean laceratePrio;
    private final double lacerateTime;
    private final boolean powerbear;
    private final double maxRoarClip;
    private final double minRoarOffset;
    private final boolean useFaerieFire;
    private final boolean flowershift;

    private static final Set<String> KEYS = Set.of("minCombosForRip", "minCombosForBite", "useRake", "useBite",
            "biteTime", "mangleSpam", "bearMangle", "useBerserk", "prepopBerserk", "preprocOmen", "bearweave",
            "berserkBiteThresh", "laceratePrio", "lacerateTime", "powerbear", "maxRoarClip", "minRoarOffset",
            "useFaerieFire", "flowershift");

    private RotationConfig(Map<String, Object> values) {
        this.minCombosForRip = intValue(values, "minCombosForRip", 5);
        this.minCombosForBite = intValue(values, "minCombosForBite", 5);
        this.useRake = boolValue(values, "useRake", true);
        this.useBite = boolValue(values, "useBite", true);
        this.biteTime = values.containsKey("biteTime") ? nullableDouble(values, "biteTime") : Double.valueOf(8.0);
        this.mangleSpam = boolValue(values, "mangleSpam", false);
        this.bearMangle = boolValue(values, "bearMangle", false);
        this.useBerserk = boolValue(values, "useBerserk", true);
        this.prepopBerserk = boolValue(values, "prepopBerserk", false);
        this.preprocOmen = boolValue(values, "preprocOmen", false);
        this.bearweave = boolValue(values, "bearweave", false);
        this.berserkBiteThresh = doubleValue(values, "berserkBiteThresh", 100.0);
        this.laceratePrio = boolValue(values, "laceratePrio", false);
        this.lacerateTime = doubleValue(values, "lacerateTime", 10.0);
        this.powerbear = boolValue(values, "powerbear", false);
        this.maxRoarClip = doubleValue(values, "maxRoarClip", 8.0);
        this.minRoarOffset = doubleValue(values, "minRoarOffset", 10.0);
        this.useFaerieFire = boolValue(values, "useFaerieFire", false);
        this.flowershift = boolValue(values, "flowershift", false);
        validate();
    }

    /**
     * @return the default tunables
     */
    public static RotationConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Creates rotation tunables from a flat key/value map.
     *
     * @param values the configured values, may be empty
     * @return the tunables
     * @throws ConfigurationException for unknown keys, wrongly typed values, values out of range
     *                                or contradictory combinations
     */
    public static RotationConfig fromMap(Map<String, Object> values) {
        for (String key : values.keySet()) {
            if (!KEYS.contains(key)) {
                throw new ConfigurationException("rotation." + key, "is not a supported rotation parameter, "
                        + "supported parameters are " + KEYS);
            }
        }
        return new RotationConfig(values);
    }

    /**
     * Returns a copy with some values replaced.
     * @param overrides the values to replace
     * @return the new tunables
     */
    public RotationConfig with(Map<String, Object> overrides) {
        Map<String, Object> merged = new LinkedHashMap<>(toMap());
        merged.putAll(overrides);
        return fromMap(merged);
    }

    /**
     * @return every tunable keyed by its configuration name
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("minCombosForRip", minCombosForRip);
        map.put("minCombosForBite", minCombosForBite);
        map.put("useRake", useRake);
        map.put("useBite", useBite);
        map.put("biteTime", biteTime);
        map.put("mangleSpam", mangleSpam);
        map.put("bearMangle", bearMangle);
        map.put("useBerserk", useBerserk);
        map.put("prepopBerserk", prepopBerserk);
        map.put("preprocOmen", preprocOmen);
        map.put("bearweave", bearweave);
        map.put("berserkBiteThresh", berserkBiteThresh);
        map.put("laceratePrio", laceratePrio);
        map.put("lacerateTime", lacerateTime);
        map.put("powerbear", powerbear);
        map.put("maxRoarClip", maxRoarClip);
        map.put("minRoarOffset", minRoarOffset);
        map.put("useFaerieFire", useFaerieFire);
        map.put("flowershift", flowershift);
        return map;
    }

    private void validate() {
        checkRange("minCombosForRip", minCombosForRip, 1, 5);
        checkRange("minCombosForBite", minCombosForBite, 1, 5);
        checkRange("berserkBiteThresh", berserkBiteThresh, 0, 100);
        checkRange("lacerateTime", lacerateTime, 0, 15);
        checkRange("maxRoarClip", maxRoarClip, 0, Double.MAX_VALUE);
        checkRange("minRoarOffset", minRoarOffset, 0, Double.MAX_VALUE);
        if (biteTime != null) {
            checkRange("biteTime", biteTime, 0, Double.MAX_VALUE);
        }
        if (prepopBerserk && !useBerserk) {
            throw new ConfigurationException("rotation.prepopBerserk", "requires useBerserk");
        }
        if (laceratePrio && !bearweave) {
            throw new ConfigurationException("rotation.laceratePrio", "requires bearweave");
        }
        if (powerbear && !bearweave) {
            throw new ConfigurationException("rotation.powerbear", "requires bearweave");
        }
        if (flowershift && bearweave) {
            throw new ConfigurationException("rotation.flowershift", "cannot be combined with bearweave");
        }
    }

    private static void checkRange(String key, double value, double min, double max) {
        if (value < min || value > max) {
            throw new ConfigurationException("rotation." + key, "must be between " + min + " and " + max
                    + ", was " + value);
        }
    }

    private static Object value(Map<String, Object> values, String key) {
        return values.get(key);
    }

    private static int intValue(Map<String, Object> values, String key, int defaultValue) {
        Object value = value(values, key);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof Number number) || number.doubleValue() != Math.rint(number.doubleValue())) {
            throw new ConfigurationException("rotation." + key, "must be an integer, was '" + value + "'");
        }
        return number.intValue();
    }

    private static double doubleValue(Map<String, Object> values, String key, double defaultValue) {
        Double value = nullableDouble(values, key);
        return value == null ? defaultValue : value;
    }

    private static Double nullableDouble(Map<String, Object> values, String key) {
        Object value = value(values, key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Number number)) {
            throw new ConfigurationException("rotation." + key, "must be a number, was '" + value + "'");
        }
        return number.doubleValue();
    }

    private static boolean boolValue(Map<String, Object> values, String key, boolean defaultValue) {
        Object value = value(values, key);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof Boolean bool)) {
            throw new ConfigurationException("rotation." + key, "must be true or false, was '" + value + "'");
        }
        return bool;
    }

    public int getMinCombosForRip() { return minCombosForRip; }
    public int getMinCombosForBite() { return minCombosForBite; }
    public boolean isUseRake() { return useRake; }
    public boolean isUseBite() { return useBite; }

    /**
     * @return the fixed minimum Rip time left for Biting, or null for the analytical model
     */
    public Double getBiteTime() { return biteTime; }
    public boolean isMangleSpam() { return mangleSpam; }
    public boolean isBearMangle() { return bearMangle; }
    public boolean isUseBerserk() { return useBerserk; }
    public boolean isPrepopBerserk() { return prepopBerserk; }
    public boolean isPreprocOmen() { return preprocOmen; }
    public boolean isBearweave() { return bearweave; }
    public double getBerserkBiteThresh() { return berserkBiteThresh; }
    public boolean isLaceratePrio() { return laceratePrio; }
    public double getLacerateTime() { return lacerateTime; }
    public boolean isPowerbear() { return powerbear; }
    public double getMaxRoarClip() { return maxRoarClip; }
    public double getMinRoarOffset() { return minRoarOffset; }
    public boolean isUseFaerieFire() { return useFaerieFire; }
    public boolean isFlowershift() { return flowershift; }
}
