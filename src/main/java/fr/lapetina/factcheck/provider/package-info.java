/**
 * Collaborator boundary: the model and search providers the orchestrator calls.
 *
 * <p>{@link fr.lapetina.factcheck.provider.ModelClient} composes a
 * {@link fr.lapetina.factcheck.provider.ModelProvider} with the response cache and the model
 * request queue. HTTP implementations live in the {@code http} subpackage.
 */
package fr.lapetina.factcheck.provider;
