/**
 * Fact-check orchestrator: resilient, rate-limited model and search calls behind a single
 * {@code check(text)} operation.
 *
 * <p>{@link fr.lapetina.factcheck.FactCheckFactory} wires the components from YAML
 * configuration; {@link fr.lapetina.factcheck.FactCheckApplication} runs them behind an
 * HTTP API.
 */
package fr.lapetina.factcheck;
