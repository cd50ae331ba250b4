package fr.lapetina.inference.sweep.domain.model;

/**
 * Error taxonomy for a sweep run.
 * Provides clear categorization for error handling and metrics.
 */
public enum ErrorType {
    /** Invalid GPU/machine arithmetic or malformed configuration */
    CONFIGURATION,

    /** Not enough machines for the requested endpoints */
    INSUFFICIENT_RESOURCES,

    /** The remote-start capability could not launch a process */
    PROCESS_START,

    /** A critical process terminated while the run depended on it */
    CRITICAL_PROCESS_FAILURE,

    /** A readiness probe never succeeded within its bound */
    HEALTH_CHECK_TIMEOUT,

    /** The operator stopped the run */
    CANCELLED
}
