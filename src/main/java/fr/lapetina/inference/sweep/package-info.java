/**
 * Sweep orchestrator for disaggregated LLM serving on a cluster.
 *
 * <p>{@link fr.lapetina.inference.sweep.SweepApplication} is the command-line entry point and
 * {@link fr.lapetina.inference.sweep.SweepFactory} wires configuration, launcher, backend and
 * orchestrator together.
 *
 * <h2>Packages</h2>
 * <ul>
 *   <li>{@code domain.model} - endpoints, worker processes, statuses</li>
 *   <li>{@code domain.allocation} - machine allocation and process expansion</li>
 *   <li>{@code backend} - serving engine commands</li>
 *   <li>{@code infrastructure} - configuration, process launching, readiness, metrics</li>
 *   <li>{@code lifecycle} - cancellation, failure monitor, interrupt handling</li>
 *   <li>{@code orchestrator} - the stage sequence of a run</li>
 * </ul>
 */
package fr.lapetina.inference.sweep;
