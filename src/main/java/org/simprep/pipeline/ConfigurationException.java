package org.simprep.pipeline;

/**
 * Thrown when configuration is malformed: missing or invalid parameters, leaflet fractions
 * that do not sum to one, or mutually exclusive directives set together.
 * <p>
 * Always raised before any external engine is launched.
 */
public class ConfigurationException extends PipelineException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
