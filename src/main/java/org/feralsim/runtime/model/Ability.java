package org.feralsim.runtime.model;

/**
 * Every action whose casts and damage are tallied per trial, in reporting order.
 */
public enum Ability {
    MELEE("Melee"),
    MANGLE_CAT("Mangle (Cat)"),
    RAKE("Rake"),
    SHRED("Shred"),
    SAVAGE_ROAR("Savage Roar"),
    RIP("Rip"),
    FEROCIOUS_BITE("Ferocious Bite"),
    FAERIE_FIRE_CAT("Faerie Fire (Cat)"),
    SHIFT_BEAR("Shift (Bear)"),
    MAUL("Maul"),
    MANGLE_BEAR("Mangle (Bear)"),
    LACERATE("Lacerate"),
    SHIFT_CAT("Shift (Cat)"),
    GIFT_OF_THE_WILD("Gift of the Wild"),
    FAERIE_FIRE_BEAR("Faerie Fire (Bear)");

    private final String displayName;

    Ability(String displayName) {
        this.displayName = displayName;
    }

    /**
     * @return the name used in reports and the combat log
     */
    public String getDisplayName() {
        return displayName;
    }
}
