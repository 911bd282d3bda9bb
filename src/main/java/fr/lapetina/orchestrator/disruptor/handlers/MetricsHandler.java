package fr.lapetina.orchestrator.disruptor.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.orchestrator.domain.event.CallEvent;
import fr.lapetina.orchestrator.domain.model.CallRequest;
import fr.lapetina.orchestrator.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Fifth stage handler: records call metrics and sets logging context.
 *
 * Dispatched calls finish asynchronously, so the call counters and latency
 * timer are recorded from a callback on the caller's future, which fires for
 * rejected and dispatched calls alike.
 */
public final class MetricsHandler implements EventHandler<CallEvent> {

    private static final Logger log = LoggerFactory.getLogger(MetricsHandler.class);

    private final MetricsRegistry metricsRegistry;

    public MetricsHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(CallEvent event, long sequence, boolean endOfBatch) {
        CallRequest request = event.getRequest();
        if (request == null || event.getResultFuture() == null) {
            return;
        }

        setupMDC(event);
        try {
            String source = request.sourceService() != null ? request.sourceService() : "unknown";
            String target = request.targetService() != null ? request.targetService() : "unknown";
            event.getResultFuture().whenComplete((result, throwable) -> {
                if (result != null) {
                    metricsRegistry.recordCall(source, target, result);
                }
            });

            if (event.getErrorType() != null) {
                log.debug("Call rejected before dispatch: state={}, errorType={}, message={}",
                        event.getState(), event.getErrorType().reason(), event.getErrorMessage());
            }
        } finally {
            clearMDC();
        }
    }

    private void setupMDC(CallEvent event) {
        CallRequest request = event.getRequest();
        MDC.put("requestId", request.requestId());
        if (request.sourceService() != null) {
            MDC.put("sourceService", request.sourceService());
        }
        if (request.targetService() != null) {
            MDC.put("targetService", request.targetService());
        }
        if (event.getSelectedInstance() != null) {
            MDC.put("instanceId", event.getSelectedInstance().getId());
        }
    }

    private void clearMDC() {
        MDC.remove("requestId");
        MDC.remove("sourceService");
        MDC.remove("targetService");
        MDC.remove("instanceId");
    }
}
