/**
 * Pure decision policies.
 *
 * - {@link fr.lapetina.factcheck.domain.policy.ErrorClassifier}: failure to category
 * - {@link fr.lapetina.factcheck.domain.policy.RecoveryPolicy}: category to recovery action
 * - {@link fr.lapetina.factcheck.domain.policy.ModelPolicy}: text and urgency to model tier
 *
 * None of these classes hold mutable state; they are safe to share between threads.
 */
package fr.lapetina.factcheck.domain.policy;
