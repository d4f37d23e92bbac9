package io.warden.jackson;

/**
 * Thrown when a settings document cannot be read or holds invalid values.
 *
 * @since 1.0.0
 */
public class SettingsException extends RuntimeException {

    public SettingsException(String message, Throwable cause) {
        super(message, cause);
    }
}
