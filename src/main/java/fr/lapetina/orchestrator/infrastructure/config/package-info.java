/**
 * YAML configuration and hot reload.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.orchestrator.infrastructure.config.OrchestratorConfig} - Bean tree bound by SnakeYAML</li>
 *   <li>{@link fr.lapetina.orchestrator.infrastructure.config.ConfigLoader} - Loading, validation and file polling</li>
 *   <li>{@link fr.lapetina.orchestrator.infrastructure.config.ConfigMapper} - Conversion into domain objects</li>
 * </ul>
 *
 * <h2>Configuration Sections</h2>
 * <ul>
 *   <li>{@code server} - HTTP API settings</li>
 *   <li>{@code nodes} - Placement targets for locally modelled instances</li>
 *   <li>{@code services} - Initial service definitions and instance counts</li>
 *   <li>{@code loadBalancers}, {@code policies} - Routing and traffic rules, hot-reloadable</li>
 *   <li>{@code autoScaling} - Per-service scaling bounds</li>
 *   <li>{@code healthMonitor}, {@code deployment}, {@code pipeline}, {@code timeouts}, {@code metrics}</li>
 * </ul>
 */
package fr.lapetina.orchestrator.infrastructure.config;
