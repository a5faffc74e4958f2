package de.bsommerfeld.moltgraph.core.config;

/**
 * Raised at startup when the configuration cannot be read or lacks a value the
 * crawler cannot run without. Nothing has touched the network or the database
 * when this is thrown.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
