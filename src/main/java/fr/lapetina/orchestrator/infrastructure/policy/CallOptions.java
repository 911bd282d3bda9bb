package fr.lapetina.orchestrator.infrastructure.policy;

import java.time.Duration;

/**
 * Dispatch parameters of a call, resolved from retry and timeout policies.
 *
 * @param timeout    bound of a single attempt
 * @param maxRetries attempts allowed after the first one
 */
public record CallOptions(Duration timeout, int maxRetries) {
}
