package com.paymsg.config;

/**
 * Raised when the bundled settings resource is missing or unreadable.
 */
public class SettingsLoadException extends RuntimeException {

    public SettingsLoadException(String message) {
        super(message);
    }

    public SettingsLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
