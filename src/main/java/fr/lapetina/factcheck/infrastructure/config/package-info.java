/**
 * Configuration loading and hot-reload support.
 *
 * <p>The YAML file maps onto {@link fr.lapetina.factcheck.infrastructure.config.FactCheckConfig}.
 * API keys are usually written as {@code ${OPENAI_API_KEY}} and resolved from the environment.
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - HTTP server settings (port, backlog, worker threads)</li>
 *   <li>{@code provider} - AI provider type, key and per-tier model ids</li>
 *   <li>{@code search} - web search key and claim limits</li>
 *   <li>{@code queues} - rate limit and backoff per upstream queue</li>
 *   <li>{@code retry} - model call and whole-check retry</li>
 *   <li>{@code cache} - response cache size, TTL and persistence</li>
 *   <li>{@code check} - pipeline toggles, reloadable at runtime</li>
 *   <li>{@code timeouts} - upstream HTTP timeouts</li>
 *   <li>{@code metrics} - Prometheus metrics configuration</li>
 * </ul>
 */
package fr.lapetina.factcheck.infrastructure.config;
