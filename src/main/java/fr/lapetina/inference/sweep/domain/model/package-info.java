/**
 * Domain model of a serving topology.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.inference.sweep.domain.model.ResourceRequest} - Validated role counts and GPU needs</li>
 *   <li>{@link fr.lapetina.inference.sweep.domain.model.Endpoint} - Logical serving unit of a role</li>
 *   <li>{@link fr.lapetina.inference.sweep.domain.model.WorkerProcess} - Physical process of an endpoint on one machine</li>
 *   <li>{@link fr.lapetina.inference.sweep.domain.model.EndpointTopology} - An endpoint and the processes it owns</li>
 *   <li>{@link fr.lapetina.inference.sweep.domain.model.ProcessStatus} - Running, Exited(code) or Killed</li>
 * </ul>
 *
 * <p>Everything here is an immutable record or an enum and can be shared freely between threads.
 */
package fr.lapetina.inference.sweep.domain.model;
