package fr.lapetina.orchestrator.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.orchestrator.domain.event.CallEvent;
import fr.lapetina.orchestrator.domain.event.EventState;
import fr.lapetina.orchestrator.domain.model.CallRequest;
import fr.lapetina.orchestrator.domain.model.PolicyDecision;
import fr.lapetina.orchestrator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.orchestrator.infrastructure.policy.PolicyEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Second stage handler: asks the policy engine whether the call may proceed.
 *
 * Denials carry the policy reason (AuthorizationDenied, RateLimitExceeded,
 * CircuitOpen) through to the caller's result.
 */
public final class PolicyHandler implements EventHandler<CallEvent> {

    private static final Logger log = LoggerFactory.getLogger(PolicyHandler.class);

    private final PolicyEngine policyEngine;
    private final MetricsRegistry metricsRegistry;

    public PolicyHandler(PolicyEngine policyEngine, MetricsRegistry metricsRegistry) {
        this.policyEngine = policyEngine;
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(CallEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip() || event.getState() != EventState.VALIDATED) {
            return;
        }

        CallRequest request = event.getRequest();
        PolicyDecision decision = policyEngine.authorize(
                request.sourceService(), request.targetService(), request.endpoint());

        if (decision.allowed()) {
            event.setState(EventState.AUTHORIZED);
            return;
        }

        event.reject(EventState.DENIED, decision.reason(), decision.message());
        metricsRegistry.incrementPolicyDenial(request.targetService(), decision.reason());
        log.debug("Call denied: requestId={}, source={}, target={}, reason={}, policyId={}",
                request.requestId(), request.sourceService(), request.targetService(),
                decision.reason().reason(), decision.policyId());
    }
}
