package org.feralsim.runtime.model;

import org.feralsim.config.ConfigurationException;

/**
 * Boss armor and the raid debuffs present for the whole encounter.
 *
 * @param bossArmor       unmodified boss armor
 * @param sunder          whether five Sunder Armor stacks are ramped up during the fight
 * @param faerieFire      whether Faerie Fire reduces boss armor
 * @param bloodFrenzy     whether Blood Frenzy increases physical damage
 * @param curseOfElements whether a spell damage debuff increases Faerie Fire (Bear) damage
 * @param shatteringThrow whether Shattering Throw reduces boss armor
 * @param giftOfArthas    whether Gift of Arthas adds flat damage to every hit
 */
public record EncounterParameters(double bossArmor, boolean sunder, boolean faerieFire, boolean bloodFrenzy,
                                  boolean curseOfElements, boolean shatteringThrow, boolean giftOfArthas) {

    public EncounterParameters {
        if (bossArmor < 0) {
            throw new ConfigurationException("encounter.bossArmor", "must not be negative, was " + bossArmor);
        }
    }
}
