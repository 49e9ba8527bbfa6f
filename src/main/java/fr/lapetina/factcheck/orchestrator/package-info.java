/**
 * The fact-check pipeline.
 *
 * <p>{@link fr.lapetina.factcheck.orchestrator.FactCheckOrchestrator} is the only public entry
 * point; the collaborators in this package (query extraction, evidence collection, prompt text,
 * rating parsing) are internal to it. {@link fr.lapetina.factcheck.orchestrator.RatingAggregator}
 * is public so ratings from other sources can be combined the same way.
 */
package fr.lapetina.factcheck.orchestrator;
