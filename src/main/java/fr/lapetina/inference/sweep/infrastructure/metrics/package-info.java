/**
 * Run metrics exported in Prometheus text format.
 */
package fr.lapetina.inference.sweep.infrastructure.metrics;
