package fr.lapetina.orchestrator.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.orchestrator.domain.event.CallEvent;
import fr.lapetina.orchestrator.domain.event.EventState;
import fr.lapetina.orchestrator.domain.exception.NoHealthyInstanceException;
import fr.lapetina.orchestrator.domain.exception.NotFoundException;
import fr.lapetina.orchestrator.domain.model.CallRequest;
import fr.lapetina.orchestrator.domain.model.ServiceInstance;
import fr.lapetina.orchestrator.infrastructure.balancer.LoadBalancer;
import fr.lapetina.orchestrator.infrastructure.policy.PolicyEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Third stage handler: picks the target instance through the load balancer.
 *
 * The calling service is passed as routing key so that session affinity,
 * when enabled on the target, keeps a caller on the same instance. A call
 * that finds no instance hands its circuit breaker permit back.
 */
public final class InstanceSelectionHandler implements EventHandler<CallEvent> {

    private static final Logger log = LoggerFactory.getLogger(InstanceSelectionHandler.class);

    private final LoadBalancer loadBalancer;
    private final PolicyEngine policyEngine;

    public InstanceSelectionHandler(LoadBalancer loadBalancer, PolicyEngine policyEngine) {
        this.loadBalancer = loadBalancer;
        this.policyEngine = policyEngine;
    }

    @Override
    public void onEvent(CallEvent event, long sequence, boolean endOfBatch) {
        if (event.shouldSkip() || event.getState() != EventState.AUTHORIZED) {
            return;
        }

        CallRequest request = event.getRequest();
        try {
            ServiceInstance instance = loadBalancer.selectInstance(request.targetService(), request.sourceService());
            event.setSelectedInstance(instance);
            log.debug("Instance selected: requestId={}, target={}, instanceId={}, version={}",
                    request.requestId(), request.targetService(), instance.getId(), instance.getVersion());

        } catch (NoHealthyInstanceException | NotFoundException e) {
            event.reject(EventState.NO_INSTANCE_AVAILABLE, e.getErrorType(), e.getMessage());
            policyEngine.releasePermission(request.targetService());
            log.warn("No instance available: requestId={}, target={}, reason={}",
                    request.requestId(), request.targetService(), e.getMessage());
        }
    }
}
