package fr.lapetina.inference.sweep.lifecycle;

/**
 * Why a run was cancelled.
 *
 * OPERATOR_INTERRUPT: SIGINT/SIGTERM or an explicit stop request
 * CRITICAL_FAILURE: the monitor saw a critical process fail
 * RUN_COMPLETE: the orchestrator reached cleanup and is unwinding
 */
public enum CancellationReason {
    OPERATOR_INTERRUPT,
    CRITICAL_FAILURE,
    RUN_COMPLETE
}
