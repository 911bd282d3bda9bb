/**
 * Service Orchestrator - registry, routing, scaling and rollout of backend services.
 *
 * <p>An orchestrator registers logical services and their running instances, probes
 * instance health, routes calls between services through a policy-gated LMAX Disruptor
 * pipeline, keeps instance counts within auto-scaling bounds and drives new versions
 * through staged deployments.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.orchestrator.ServiceOrchestrator} - Explicitly constructed facade
 *       owning every component</li>
 *   <li>{@link fr.lapetina.orchestrator.OrchestratorApplication} - Standalone process with the
 *       JSON-over-HTTP API</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * OrchestratorConfig config = new ConfigLoader("config.yaml").load();
 * try (ServiceOrchestrator orchestrator = ServiceOrchestrator.builder()
 *         .fromConfig(config)
 *         .build()
 *         .start()) {
 *     CallResult result = orchestrator.callService("web", "auth", "/login", Map.of("user", "alice"));
 *     String deploymentId = orchestrator.deployService(orchestrator.getService("auth").withVersion("2.0.0"));
 * }
 * }</pre>
 *
 * @see fr.lapetina.orchestrator.ServiceOrchestrator
 * @see fr.lapetina.orchestrator.disruptor.CallPipeline
 */
package fr.lapetina.orchestrator;
