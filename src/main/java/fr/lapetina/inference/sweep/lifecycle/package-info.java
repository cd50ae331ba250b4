/**
 * Run lifecycle: cancellation, failure monitoring and operator interrupts.
 *
 * <p>One {@link fr.lapetina.inference.sweep.lifecycle.CancellationFlag} per run is shared by the
 * orchestrator thread, the {@link fr.lapetina.inference.sweep.lifecycle.ProcessMonitor} thread and the
 * shutdown hook installed by {@link fr.lapetina.inference.sweep.lifecycle.LifecycleSupervisor}.
 * Nothing is forcibly interrupted; every wait observes the flag.
 */
package fr.lapetina.inference.sweep.lifecycle;
