/**
 * Placement of endpoints on machines and their expansion into processes.
 *
 * <p>Both classes are pure functions of their inputs: identical requests on an identical
 * machine list always produce identical results.
 *
 * @see fr.lapetina.inference.sweep.domain.allocation.EndpointAllocator
 * @see fr.lapetina.inference.sweep.domain.allocation.ProcessTopologyBuilder
 */
package fr.lapetina.inference.sweep.domain.allocation;
