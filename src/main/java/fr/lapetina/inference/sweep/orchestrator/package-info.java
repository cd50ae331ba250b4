/**
 * The run state machine: head infrastructure, workers, frontend, benchmark, cleanup.
 */
package fr.lapetina.inference.sweep.orchestrator;
