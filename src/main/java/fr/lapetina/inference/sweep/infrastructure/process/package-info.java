/**
 * Launching and owning worker processes.
 *
 * <p>{@link fr.lapetina.inference.sweep.infrastructure.process.RemoteProcessLauncher} is the only way a
 * process gets started; {@link fr.lapetina.inference.sweep.infrastructure.process.ProcessRegistry} is the
 * only component that polls or signals it afterwards.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.inference.sweep.infrastructure.process.SrunProcessLauncher} - Starts processes on SLURM machines</li>
 *   <li>{@link fr.lapetina.inference.sweep.infrastructure.process.LocalProcessLauncher} - Starts processes on this machine</li>
 *   <li>{@link fr.lapetina.inference.sweep.infrastructure.process.ManagedProcess} - A tracked process and its status</li>
 *   <li>{@link fr.lapetina.inference.sweep.infrastructure.process.ProcessRegistry} - Polling, graceful-then-forced shutdown, failure reports</li>
 * </ul>
 */
package fr.lapetina.inference.sweep.infrastructure.process;
