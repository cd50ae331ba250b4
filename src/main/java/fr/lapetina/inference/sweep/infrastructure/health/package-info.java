/**
 * Readiness probing of launched services.
 */
package fr.lapetina.inference.sweep.infrastructure.health;
