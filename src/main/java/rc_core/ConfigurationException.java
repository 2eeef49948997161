package rc_core;

/**
 * Thrown when the configuration or the supplied data don't fit together (mismatched dimensions, an invalid washout, 
 * a missing selector or an option out of its range).
 */
public class ConfigurationException extends IllegalArgumentException {
    public ConfigurationException(String message) {
        super(message);
    }
}
