package org.feralsim.runtime.model;

/**
 * Low and high damage bounds of every ability for one combination of actor stats, boss armor
 * debuffs and Tiger's Fury state. Instances are immutable; the {@link Actor} replaces its
 * parameters whenever one of the inputs changes.
 * <p>
 * Finisher tables are indexed by combo points, index 0 is unused.
 * </p>
 */
public final class DamageParameters {

    private static final double ARMOR_CONSTANT = 467.5 * 80 - 22167.5;
    private static final double ARP_RATING_CAP = 1399.0;
    private static final double ARP_RATING_PER_PERCENT = 13.99;
    private static final double GIFT_OF_ARTHAS_DAMAGE = 8.0;

    private final double armorMultiplier;
    private final double multiplier;
    private final double whiteLow;
    private final double whiteHigh;
    private final double shredLow;
    private final double shredHigh;
    private final double biteMultiplier;
    private final double[] biteLow = new double[6];
    private final double[] biteHigh = new double[6];
    private final double mangleLow;
    private final double mangleHigh;
    private final double rakeHit;
    private final double rakeTick;
    private final double[] ripTick = new double[6];
    private final double whiteBearLow;
    private final double whiteBearHigh;
    private final double maulLow;
    private final double maulHigh;
    private final double mangleBearLow;
    private final double mangleBearHigh;
    private final double lacerateHit;
    private final double lacerateTick;
    private final double faerieFireHit;

    private DamageParameters(ActorConfig config, double attackPower, double agility, double armorPenRating,
                             double weaponDamage, EncounterState encounter, boolean tigersFury) {
        EncounterParameters debuffs = encounter.getParameters();
        double bonusDamage = (attackPower + config.getDebuffAttackPower()) / 14 + weaponDamage
                + (tigersFury ? 80 : 0);

        double debuffedArmor = debuffs.bossArmor()
                * (1 - 0.04 * encounter.getSunderStacks())
                * (1 - (debuffs.faerieFire() ? 0.05 : 0))
                * (1 - (debuffs.shatteringThrow() ? 0.2 : 0));
        double arpCap = (debuffedArmor + ARMOR_CONSTANT) / 3.0;
        double armorPen = Math.min(ARP_RATING_CAP, armorPenRating) / ARP_RATING_PER_PERCENT / 100
                * Math.min(arpCap, debuffedArmor);
        double residualArmor = debuffedArmor - armorPen;
        this.armorMultiplier = 1 - residualArmor / (residualArmor + ARMOR_CONSTANT);

        double damageMultiplier = config.getDamageMultiplier() * (debuffs.bloodFrenzy() ? 1.04 : 1.0);
        this.multiplier = armorMultiplier * damageMultiplier;

        double goa = debuffs.giftOfArthas() ? GIFT_OF_ARTHAS_DAMAGE * armorMultiplier : 0.0;

        double rawWhiteLow = (43.0 + bonusDamage) * multiplier;
        double rawWhiteHigh = (66.0 + bonusDamage) * multiplier;
        this.whiteLow = rawWhiteLow + goa;
        this.whiteHigh = rawWhiteHigh + goa;
        this.shredLow = 1.2 * (rawWhiteLow * 2.25 + (666 + config.getShredBonus()) * multiplier) + goa;
        this.shredHigh = 1.2 * (rawWhiteHigh * 2.25 + (666 + config.getShredBonus()) * multiplier) + goa;

        this.biteMultiplier = multiplier * (1 + 0.03 * config.getFeralAggression())
                * (config.isT6FourPiece() ? 1.15 : 1.0);
        for (int cp = 1; cp <= 5; cp++) {
            biteLow[cp] = (290 * cp + 120 + 0.07 * cp * attackPower) * biteMultiplier + goa;
            biteHigh[cp] = (290 * cp + 260 + 0.07 * cp * attackPower) * biteMultiplier + goa;
        }

        double savageFury = 1 + 0.1 * config.getSavageFury();
        double mangleFactor = savageFury * (config.isMangleGlyph() ? 1.1 : 1.0);
        this.mangleLow = mangleFactor * (rawWhiteLow * 2 + 566 * multiplier) + goa;
        this.mangleHigh = mangleFactor * (rawWhiteHigh * 2 + 566 * multiplier) + goa;

        double rakeMultiplier = savageFury * damageMultiplier;
        this.rakeHit = rakeMultiplier * (176 + 0.01 * attackPower);
        this.rakeTick = rakeMultiplier * (358 + 0.06 * attackPower);

        double ripMultiplier = damageMultiplier * (config.isT6FourPiece() ? 1.15 : 1.0);
        for (int cp = 1; cp <= 5; cp++) {
            ripTick[cp] = (36 + 93 * cp + 0.01 * cp * attackPower + config.getRipBonus() * cp) * ripMultiplier;
        }

        double bearApMod = config.getApMod() / 1.1 * (1 + 0.02 * config.getProtectorOfThePack());
        double bearAttackPower = bearApMod * (attackPower / config.getApMod() - agility + 80);
        double bearBonusDamage = (bearAttackPower + config.getDebuffAttackPower()) / 14 * 2.5 + weaponDamage;
        double bearMultiplier = multiplier * 1.04;
        double rawBearLow = (109.0 + bearBonusDamage) * bearMultiplier;
        double rawBearHigh = (165.0 + bearBonusDamage) * bearMultiplier;
        this.whiteBearLow = rawBearLow + goa;
        this.whiteBearHigh = rawBearHigh + goa;
        double maulMultiplier = savageFury * 1.2;
        this.maulLow = (rawBearLow + 578 * bearMultiplier) * maulMultiplier + goa;
        this.maulHigh = (rawBearHigh + 578 * bearMultiplier) * maulMultiplier + goa;
        this.mangleBearLow = mangleFactor * (rawBearLow * 1.15 + 299 * bearMultiplier) + goa;
        this.mangleBearHigh = mangleFactor * (rawBearHigh * 1.15 + 299 * bearMultiplier) + goa;

        double lacerateMultiplier = (config.isT7TwoPiece() ? 1.05 : 1.0) * (config.isT10TwoPiece() ? 1.2 : 1.0);
        this.lacerateHit = (88 + 0.01 * bearAttackPower) * bearMultiplier * lacerateMultiplier;
        // bleeds ignore armor
        this.lacerateTick = (64 + 0.01 * bearAttackPower) * bearMultiplier / armorMultiplier;

        this.faerieFireHit = (0.15 * bearAttackPower + 1.0) * (debuffs.curseOfElements() ? 1.13 : 1.0)
                * config.getSpellDamageMultiplier();
    }

    /**
     * Computes the damage bounds of every ability.
     *
     * @param config         the static actor configuration
     * @param attackPower    current Cat form attack power
     * @param agility        current agility
     * @param armorPenRating current armor penetration rating
     * @param weaponDamage   current flat bonus weapon damage
     * @param encounter      boss armor and debuff state
     * @param tigersFury     whether Tiger's Fury bonus damage applies
     * @return the computed parameters
     */
    public static DamageParameters compute(ActorConfig config, double attackPower, double agility,
                                           double armorPenRating, double weaponDamage,
                                           EncounterState encounter, boolean tigersFury) {
        return new DamageParameters(config, attackPower, agility, armorPenRating, weaponDamage,
                encounter, tigersFury);
    }

    public double armorMultiplier() { return armorMultiplier; }
    public double multiplier() { return multiplier; }
    public double whiteLow() { return whiteLow; }
    public double whiteHigh() { return whiteHigh; }
    public double shredLow() { return shredLow; }
    public double shredHigh() { return shredHigh; }
    public double biteMultiplier() { return biteMultiplier; }
    public double biteLow(int comboPoints) { return biteLow[comboPoints]; }
    public double biteHigh(int comboPoints) { return biteHigh[comboPoints]; }
    public double mangleLow() { return mangleLow; }
    public double mangleHigh() { return mangleHigh; }
    public double rakeHit() { return rakeHit; }
    public double rakeTick() { return rakeTick; }
    public double ripTick(int comboPoints) { return ripTick[comboPoints]; }
    public double whiteBearLow() { return whiteBearLow; }
    public double whiteBearHigh() { return whiteBearHigh; }
    public double maulLow() { return maulLow; }
    public double maulHigh() { return maulHigh; }
    public double mangleBearLow() { return mangleBearLow; }
    public double mangleBearHigh() { return mangleBearHigh; }
    public double lacerateHit() { return lacerateHit; }
    public double lacerateTick() { return lacerateTick; }
    public double faerieFireHit() { return faerieFireHit; }
}
