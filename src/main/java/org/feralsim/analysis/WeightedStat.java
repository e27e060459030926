package org.feralsim.analysis;

/**
 * The stats a weight is estimated for, each expressed per reporting unit.
 */
public enum WeightedStat {
    ATTACK_POWER("1 AP", false),
    HIT("1% hit", false),
    CRIT("1% crit", false),
    AGILITY("1 Agility", false),
    HASTE("1% haste", false),
    ARMOR_PEN("1 Armor Pen Rating", false),
    WEAPON_DAMAGE("1 Weapon Damage", false),
    MANA("1 mana", true),
    SPIRIT("1 Spirit", true),
    /** Derived from the mana and Spirit weights, never simulated directly. */
    INTELLECT("1 Int", true),
    MP5("1 mp5", true);

    private final String label;
    private final boolean manaStat;

    WeightedStat(String label, boolean manaStat) {
        this.label = label;
        this.manaStat = manaStat;
    }

    public String getLabel() {
        return label;
    }

    /**
     * @return true for stats that only matter once mana runs out
     */
    public boolean isManaStat() {
        return manaStat;
    }
}
