package org.feralsim.runtime.model;

import org.feralsim.config.ConfigurationException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable, fully raid-buffed description of the simulated character: stats, talent points,
 * glyphs and set bonuses. A single instance is shared read-only by every trial; each trial
 * builds its own mutable {@link Actor} from it.
 */
public final class ActorConfig {

    private final Map<StatTarget, Double> stats;
    private final double apMod;
    private final double debuffAttackPower;
    private final double shredBonus;
    private final double ripBonus;
    private final double damageMultiplier;
    private final double spellDamageMultiplier;
    private final int gotwTargets;

    private final int feralAggression;
    private final int predatoryInstincts;
    private final int savageFury;
    private final int furor;
    private final int naturalShapeshifter;
    private final int intensity;
    private final int protectorOfThePack;
    private final int improvedMangle;
    private final int improvedLeaderOfThePack;

    private final boolean judgementOfWisdom;
    private final boolean rune;
    private final boolean omen;
    private final boolean primalGore;
    private final boolean wolfshead;
    private final boolean metaGem;
    private final boolean mangleGlyph;
    private final boolean ripGlyph;
    private final boolean shredGlyph;
    private final boolean roarGlyph;
    private final boolean berserkGlyph;
    private final boolean t6TwoPiece;
    private final boolean t6FourPiece;
    private final boolean t7TwoPiece;
    private final boolean t8FourPiece;
    private final boolean t9TwoPiece;
    private final boolean t9FourPiece;
    private final boolean t10TwoPiece;

    private ActorConfig(Builder b) {
        this.stats = Collections.unmodifiableMap(new EnumMap<>(b.stats));
        this.apMod = b.apMod;
        this.debuffAttackPower = b.debuffAttackPower;
        this.shredBonus = b.shredBonus;
        this.ripBonus = b.ripBonus;
        this.damageMultiplier = b.damageMultiplier;
        this.spellDamageMultiplier = b.spellDamageMultiplier;
        this.gotwTargets = b.gotwTargets;
        this.feralAggression = b.feralAggression;
        this.predatoryInstincts = b.predatoryInstincts;
        this.savageFury = b.savageFury;
        this.furor = b.furor;
        this.naturalShapeshifter = b.naturalShapeshifter;
        this.intensity = b.intensity;
        this.protectorOfThePack = b.protectorOfThePack;
        this.improvedMangle = b.improvedMangle;
        this.improvedLeaderOfThePack = b.improvedLeaderOfThePack;
        this.judgementOfWisdom = b.judgementOfWisdom;
        this.rune = b.rune;
        this.omen = b.omen;
        this.primalGore = b.primalGore;
        this.wolfshead = b.wolfshead;
        this.metaGem = b.metaGem;
        this.mangleGlyph = b.mangleGlyph;
        this.ripGlyph = b.ripGlyph;
        this.shredGlyph = b.shredGlyph;
        this.roarGlyph = b.roarGlyph;
        this.berserkGlyph = b.berserkGlyph;
        this.t6TwoPiece = b.t6TwoPiece;
        this.t6FourPiece = b.t6FourPiece;
        this.t7TwoPiece = b.t7TwoPiece;
        this.t8FourPiece = b.t8FourPiece;
        this.t9TwoPiece = b.t9TwoPiece;
        this.t9FourPiece = b.t9FourPiece;
        this.t10TwoPiece = b.t10TwoPiece;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with this configuration
     */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.stats.putAll(stats);
        b.apMod = apMod;
        b.debuffAttackPower = debuffAttackPower;
        b.shredBonus = shredBonus;
        b.ripBonus = ripBonus;
        b.damageMultiplier = damageMultiplier;
        b.spellDamageMultiplier = spellDamageMultiplier;
        b.gotwTargets = gotwTargets;
        b.feralAggression = feralAggression;
        b.predatoryInstincts = predatoryInstincts;
        b.savageFury = savageFury;
        b.furor = furor;
        b.naturalShapeshifter = naturalShapeshifter;
        b.intensity = intensity;
        b.protectorOfThePack = protectorOfThePack;
        b.improvedMangle = improvedMangle;
        b.improvedLeaderOfThePack = improvedLeaderOfThePack;
        b.judgementOfWisdom = judgementOfWisdom;
        b.rune = rune;
        b.omen = omen;
        b.primalGore = primalGore;
        b.wolfshead = wolfshead;
        b.metaGem = metaGem;
        b.mangleGlyph = mangleGlyph;
        b.ripGlyph = ripGlyph;
        b.shredGlyph = shredGlyph;
        b.roarGlyph = roarGlyph;
        b.berserkGlyph = berserkGlyph;
        b.t6TwoPiece = t6TwoPiece;
        b.t6FourPiece = t6FourPiece;
        b.t7TwoPiece = t7TwoPiece;
        b.t8FourPiece = t8FourPiece;
        b.t9TwoPiece = t9TwoPiece;
        b.t9FourPiece = t9FourPiece;
        b.t10TwoPiece = t10TwoPiece;
        return b;
    }

    /**
     * Returns a copy of this configuration with one stat increased.
     *
     * @param target the stat to change, must be an actor attribute
     * @param amount the amount to add
     * @return the perturbed configuration
     */
    public ActorConfig withAdded(StatTarget target, double amount) {
        if (!target.isActorAttribute()) {
            throw new IllegalArgumentException("Not an actor attribute: " + target);
        }
        return toBuilder().stat(target, getStat(target) + amount).build();
    }

    /**
     * @param target the stat to read
     * @return the configured value, 0 if never set
     */
    public double getStat(StatTarget target) {
        return stats.getOrDefault(target, 0.0);
    }

    public Map<StatTarget, Double> getStats() {
        return stats;
    }

    public double getApMod() { return apMod; }
    public double getDebuffAttackPower() { return debuffAttackPower; }
    public double getShredBonus() { return shredBonus; }
    public double getRipBonus() { return ripBonus; }
    public double getDamageMultiplier() { return damageMultiplier; }
    public double getSpellDamageMultiplier() { return spellDamageMultiplier; }
    public int getGotwTargets() { return gotwTargets; }

    public int getFeralAggression() { return feralAggression; }
    public int getPredatoryInstincts() { return predatoryInstincts; }
    public int getSavageFury() { return savageFury; }
    public int getFuror() { return furor; }
    public int getNaturalShapeshifter() { return naturalShapeshifter; }
    public int getIntensity() { return intensity; }
    public int getProtectorOfThePack() { return protectorOfThePack; }
    public int getImprovedMangle() { return improvedMangle; }
    public int getImprovedLeaderOfThePack() { return improvedLeaderOfThePack; }

    public boolean isJudgementOfWisdom() { return judgementOfWisdom; }
    public boolean isRune() { return rune; }
    public boolean isOmen() { return omen; }
    public boolean isPrimalGore() { return primalGore; }
    public boolean isWolfshead() { return wolfshead; }
    public boolean isMetaGem() { return metaGem; }
    public boolean isMangleGlyph() { return mangleGlyph; }
    public boolean isRipGlyph() { return ripGlyph; }
    public boolean isShredGlyph() { return shredGlyph; }
    public boolean isRoarGlyph() { return roarGlyph; }
    public boolean isBerserkGlyph() { return berserkGlyph; }
    public boolean isT6TwoPiece() { return t6TwoPiece; }
    public boolean isT6FourPiece() { return t6FourPiece; }
    public boolean isT7TwoPiece() { return t7TwoPiece; }
    public boolean isT8FourPiece() { return t8FourPiece; }
    public boolean isT9TwoPiece() { return t9TwoPiece; }
    public boolean isT9FourPiece() { return t9FourPiece; }
    public boolean isT10TwoPiece() { return t10TwoPiece; }

    /**
     * Builder for {@link ActorConfig}. Talent and flag defaults describe a standard feral
     * build; stats default to zero apart from a one second swing timer.
     */
    public static final class Builder {
        private final Map<StatTarget, Double> stats = new EnumMap<>(StatTarget.class);
        private double apMod = 1.1;
        private double debuffAttackPower = 0.0;
        private double shredBonus = 0.0;
        private double ripBonus = 0.0;
        private double damageMultiplier = 1.1;
        private double spellDamageMultiplier = 1.0;
        private int gotwTargets = 25;

        private int feralAggression = 0;
        private int predatoryInstincts = 3;
        private int savageFury = 2;
        private int furor = 3;
        private int naturalShapeshifter = 3;
        private int intensity = 0;
        private int protectorOfThePack = 2;
        private int improvedMangle = 0;
        private int improvedLeaderOfThePack = 2;

        private boolean judgementOfWisdom = false;
        private boolean rune = true;
        private boolean omen = true;
        private boolean primalGore = true;
        private boolean wolfshead = true;
        private boolean metaGem = false;
        private boolean mangleGlyph = false;
        private boolean ripGlyph = true;
        private boolean shredGlyph = true;
        private boolean roarGlyph = false;
        private boolean berserkGlyph = false;
        private boolean t6TwoPiece = false;
        private boolean t6FourPiece = false;
        private boolean t7TwoPiece = false;
        private boolean t8FourPiece = false;
        private boolean t9TwoPiece = false;
        private boolean t9FourPiece = false;
        private boolean t10TwoPiece = false;

        private Builder() {
            stats.put(StatTarget.SWING_TIMER, 1.0);
        }

        public Builder stat(StatTarget target, double value) {
            if (!target.isActorAttribute()) {
                throw new ConfigurationException(target.getConfigKey(), "is not a character stat");
            }
            stats.put(target, value);
            return this;
        }

        public Builder apMod(double value) { this.apMod = value; return this; }
        public Builder debuffAttackPower(double value) { this.debuffAttackPower = value; return this; }
        public Builder shredBonus(double value) { this.shredBonus = value; return this; }
        public Builder ripBonus(double value) { this.ripBonus = value; return this; }
        public Builder damageMultiplier(double value) { this.damageMultiplier = value; return this; }
        public Builder spellDamageMultiplier(double value) { this.spellDamageMultiplier = value; return this; }
        public Builder gotwTargets(int value) { this.gotwTargets = value; return this; }

        public Builder feralAggression(int value) { this.feralAggression = value; return this; }
        public Builder predatoryInstincts(int value) { this.predatoryInstincts = value; return this; }
        public Builder savageFury(int value) { this.savageFury = value; return this; }
        public Builder furor(int value) { this.furor = value; return this; }
        public Builder naturalShapeshifter(int value) { this.naturalShapeshifter = value; return this; }
        public Builder intensity(int value) { this.intensity = value; return this; }
        public Builder protectorOfThePack(int value) { this.protectorOfThePack = value; return this; }
        public Builder improvedMangle(int value) { this.improvedMangle = value; return this; }
        public Builder improvedLeaderOfThePack(int value) { this.improvedLeaderOfThePack = value; return this; }

        public Builder judgementOfWisdom(boolean value) { this.judgementOfWisdom = value; return this; }
        public Builder rune(boolean value) { this.rune = value; return this; }
        public Builder omen(boolean value) { this.omen = value; return this; }
        public Builder primalGore(boolean value) { this.primalGore = value; return this; }
        public Builder wolfshead(boolean value) { this.wolfshead = value; return this; }
        public Builder metaGem(boolean value) { this.metaGem = value; return this; }
        public Builder mangleGlyph(boolean value) { this.mangleGlyph = value; return this; }
        public Builder ripGlyph(boolean value) { this.ripGlyph = value; return this; }
        public Builder shredGlyph(boolean value) { this.shredGlyph = value; return this; }
        public Builder roarGlyph(boolean value) { this.roarGlyph = value; return this; }
        public Builder berserkGlyph(boolean value) { this.berserkGlyph = value; return this; }
        public Builder t6TwoPiece(boolean value) { this.t6TwoPiece = value; return this; }
        public Builder t6FourPiece(boolean value) { this.t6FourPiece = value; return this; }
        public Builder t7TwoPiece(boolean value) { this.t7TwoPiece = value; return this; }
        public Builder t8FourPiece(boolean value) { this.t8FourPiece = value; return this; }
        public Builder t9TwoPiece(boolean value) { this.t9TwoPiece = value; return this; }
        public Builder t9FourPiece(boolean value) { this.t9FourPiece = value; return this; }
        public Builder t10TwoPiece(boolean value) { this.t10TwoPiece = value; return this; }

        /**
         * Validates and builds the configuration.
         * @return the immutable configuration
         * @throws ConfigurationException if a value is out of range
         */
        public ActorConfig build() {
            if (apMod <= 0) {
                throw new ConfigurationException("actor.apMod", "must be positive, was " + apMod);
            }
            if (stats.getOrDefault(StatTarget.SWING_TIMER, 0.0) <= 0) {
                throw new ConfigurationException("actor.swingTimer", "must be positive");
            }
            if (stats.getOrDefault(StatTarget.MANA_POOL, 0.0) < 0) {
                throw new ConfigurationException("actor.mana", "must not be negative");
            }
            requireRange("actor.furor", furor, 5);
            requireRange("actor.feralAggression", feralAggression, 5);
            requireRange("actor.predatoryInstincts", predatoryInstincts, 3);
            requireRange("actor.savageFury", savageFury, 2);
            requireRange("actor.naturalShapeshifter", naturalShapeshifter, 3);
            requireRange("actor.intensity", intensity, 3);
            requireRange("actor.protectorOfThePack", protectorOfThePack, 3);
            requireRange("actor.improvedMangle", improvedMangle, 3);
            requireRange("actor.improvedLeaderOfThePack", improvedLeaderOfThePack, 2);
            if (gotwTargets < 1) {
                throw new ConfigurationException("actor.gotwTargets", "must be at least 1");
            }
            return new ActorConfig(this);
        }

        private static void requireRange(String key, int points, int max) {
            if (points < 0 || points > max) {
                throw new ConfigurationException(key, "talent points must be within 0.." + max + ", was " + points);
            }
        }
    }
}
