/**
 * Upstream-agnostic retry with jittered exponential backoff.
 */
package fr.lapetina.factcheck.resilience;
