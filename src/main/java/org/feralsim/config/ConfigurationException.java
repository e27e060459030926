package org.feralsim.config;

/**
 * Thrown when a simulation cannot be constructed from the supplied configuration: an unknown
 * key, an unknown effect type, a value outside its allowed range or a contradictory combination
 * of flags.
 * <p>
 * Configuration errors are fatal. They are raised before any trial runs and always name the
 * offending key so the caller can fix the input.
 */
public class ConfigurationException extends RuntimeException {

    private final String key;

    /**
     * Constructs a new configuration exception for the given key.
     * @param key The configuration key that caused the error.
     * @param message The detail message.
     */
    public ConfigurationException(String key, String message) {
        super(String.format("%s: %s", key, message));
        this.key = key;
    }

    /**
     * Constructs a new configuration exception for the given key with a cause.
     * @param key The configuration key that caused the error.
     * @param message The detail message.
     * @param cause The cause.
     */
    public ConfigurationException(String key, String message, Throwable cause) {
        super(String.format("%s: %s", key, message), cause);
        this.key = key;
    }

    /**
     * @return the configuration key that caused the error
     */
    public String getKey() {
        return key;
    }
}
