/**
 * Serving engines. A {@link fr.lapetina.inference.sweep.backend.Backend} decides where workers go
 * and renders the command lines that start them; launching is left to the orchestrator.
 */
package fr.lapetina.inference.sweep.backend;
