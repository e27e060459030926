package org.feralsim.runtime.model;

import org.feralsim.config.ConfigurationException;

import java.util.Locale;

/**
 * Which landed attacks give a proc effect the chance to fire.
 */
public enum ProcTrigger {
    /** Any landed melee swing or special ability. */
    ANY,
    /** Landed Mangle in either form. */
    MANGLE,
    /** Landed Mangle in Cat form only. */
    CAT_MANGLE,
    /** Landed Shred. */
    SHRED;

    /**
     * Parses a trigger name such as {@code any}, {@code mangle}, {@code catMangle} or {@code shred}.
     *
     * @param value the configured name
     * @return the trigger
     */
    public static ProcTrigger parse(String value) {
        String normalized = value.replace("_", "").toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "any":
                return ANY;
            case "mangle":
                return MANGLE;
            case "catmangle":
                return CAT_MANGLE;
            case "shred":
                return SHRED;
            default:
                throw new ConfigurationException("trigger", "unknown proc trigger '" + value + "'");
        }
    }
}
