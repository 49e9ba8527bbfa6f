/**
 * Domain model for fact-check orchestration.
 *
 * <p>This package contains immutable value types and enumerations shared by every layer:
 * <ul>
 *   <li>{@link fr.lapetina.factcheck.domain.model.ModelRequest} - A prompt bound to a concrete provider model</li>
 *   <li>{@link fr.lapetina.factcheck.domain.model.CheckResult} - The structured verdict returned to callers</li>
 *   <li>{@link fr.lapetina.factcheck.domain.model.SearchResult} - One piece of web evidence</li>
 *   <li>{@link fr.lapetina.factcheck.domain.model.RecoveryStrategy} - Recovery action for an error category</li>
 *   <li>{@link fr.lapetina.factcheck.domain.model.ModelTier} - Ordered model quality levels</li>
 * </ul>
 *
 * <p>All records are thread-safe.
 */
package fr.lapetina.factcheck.domain.model;
