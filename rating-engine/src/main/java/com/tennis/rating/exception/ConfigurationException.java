package com.tennis.rating.exception;

/**
 * Fatal misconfiguration of a rating run: invalid year range, test size not smaller
 * than the range, a tier without a weight, or an invalid tunable.
 *
 * Always raised before any match is processed.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
