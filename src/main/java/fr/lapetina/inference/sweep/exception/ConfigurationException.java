package fr.lapetina.inference.sweep.exception;

import fr.lapetina.inference.sweep.domain.model.ErrorType;

/**
 * Exception for configuration errors, including GPU counts that do not fit the machines.
 */
public final class ConfigurationException extends SweepException {

    public ConfigurationException(String message) {
        super(ErrorType.CONFIGURATION, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorType.CONFIGURATION, message, cause);
    }
}
