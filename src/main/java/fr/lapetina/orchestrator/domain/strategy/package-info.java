/**
 * Instance selection algorithms.
 *
 * <table border="1">
 *   <tr><th>Algorithm</th><th>Selection</th></tr>
 *   <tr><td>{@code round_robin}</td><td>Per-key cursor over the candidates</td></tr>
 *   <tr><td>{@code least_connections}</td><td>Fewest active calls, then lowest network load</td></tr>
 *   <tr><td>{@code weighted_round_robin}</td><td>Random draw weighted by {@code max(1, 100 - cpu%)}</td></tr>
 * </table>
 *
 * <pre>{@code
 * LoadBalancingStrategy strategy = StrategyFactory.create(LoadBalancingAlgorithm.LEAST_CONNECTIONS);
 * Optional<ServiceInstance> instance = strategy.selectInstance(healthy, context);
 * }</pre>
 */
package fr.lapetina.orchestrator.domain.strategy;
