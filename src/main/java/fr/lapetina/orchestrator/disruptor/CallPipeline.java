package fr.lapetina.orchestrator.disruptor;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.orchestrator.disruptor.exception.BackpressureException;
import fr.lapetina.orchestrator.disruptor.handlers.CompletionHandler;
import fr.lapetina.orchestrator.disruptor.handlers.DispatchHandler;
import fr.lapetina.orchestrator.disruptor.handlers.InstanceSelectionHandler;
import fr.lapetina.orchestrator.disruptor.handlers.MetricsHandler;
import fr.lapetina.orchestrator.disruptor.handlers.PolicyHandler;
import fr.lapetina.orchestrator.disruptor.handlers.ValidationHandler;
import fr.lapetina.orchestrator.domain.event.CallEvent;
import fr.lapetina.orchestrator.domain.event.CallEventFactory;
import fr.lapetina.orchestrator.domain.model.CallRequest;
import fr.lapetina.orchestrator.domain.model.CallResult;
import fr.lapetina.orchestrator.domain.model.ErrorType;
import fr.lapetina.orchestrator.infrastructure.balancer.LoadBalancer;
import fr.lapetina.orchestrator.infrastructure.config.OrchestratorConfig;
import fr.lapetina.orchestrator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.orchestrator.infrastructure.metrics.TrafficRecorder;
import fr.lapetina.orchestrator.infrastructure.policy.PolicyEngine;
import fr.lapetina.orchestrator.infrastructure.registry.ServiceRegistry;
import fr.lapetina.orchestrator.infrastructure.runtime.ServiceTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Disruptor pipeline carrying inter-service calls.
 *
 * Stages, in order:
 * validate -> policy -> select instance -> dispatch -> metrics -> complete
 *
 * Multiple producers publish (every thread calling {@code callService}), so
 * the ring buffer is MULTI producer. A full ring buffer rejects immediately
 * with a {@link BackpressureException} instead of blocking the caller.
 *
 * Wait strategy is configurable: {@code blocking} (default, CPU friendly),
 * {@code yielding}, {@code sleeping} or {@code busy-spin}.
 */
public final class CallPipeline implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CallPipeline.class);

    private final Disruptor<CallEvent> disruptor;
    private final RingBuffer<CallEvent> ringBuffer;
    private final MetricsRegistry metricsRegistry;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private CallPipeline(Builder builder) {
        this.metricsRegistry = builder.metricsRegistry;

        this.disruptor = new Disruptor<>(
                new CallEventFactory(),
                builder.ringBufferSize,
                new PipelineThreadFactory("call-pipeline"),
                ProducerType.MULTI,
                createWaitStrategy(builder.waitStrategy)
        );

        disruptor
                .handleEventsWith(new ValidationHandler(builder.registry))
                .then(new PolicyHandler(builder.policyEngine, builder.metricsRegistry))
                .then(new InstanceSelectionHandler(builder.loadBalancer, builder.policyEngine))
                .then(new DispatchHandler(builder.transport, builder.loadBalancer,
                        builder.policyEngine, builder.trafficRecorder))
                .then(new MetricsHandler(builder.metricsRegistry))
                .then(new CompletionHandler());

        disruptor.setDefaultExceptionHandler(new PipelineExceptionHandler());

        this.ringBuffer = disruptor.getRingBuffer();

        log.info("CallPipeline created: ringBufferSize={}, waitStrategy={}",
                builder.ringBufferSize, builder.waitStrategy);
    }

    /**
     * Starts the Disruptor processing.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            metricsRegistry.setRingBufferRemaining((int) ringBuffer.remainingCapacity());
            log.info("CallPipeline started");
        }
    }

    /**
     * Submits a call for processing.
     *
     * @return future completing with the call result; it never completes exceptionally
     *         for call-level failures, those are carried by the result
     * @throws BackpressureException if the pipeline is stopped or the ring buffer is full
     */
    public CompletableFuture<CallResult> submit(CallRequest request) {
        if (!running.get()) {
            throw new BackpressureException(BackpressureException.BackpressureReason.PIPELINE_STOPPED);
        }

        CompletableFuture<CallResult> resultFuture = new CompletableFuture<>();

        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            throw new BackpressureException(
                    BackpressureException.BackpressureReason.RING_BUFFER_FULL,
                    "Ring buffer full, remaining capacity: " + ringBuffer.remainingCapacity()
            );
        }

        try {
            ringBuffer.get(sequence).initialize(request, resultFuture);
        } finally {
            ringBuffer.publish(sequence);
        }
        metricsRegistry.setRingBufferRemaining((int) ringBuffer.remainingCapacity());

        log.debug("Call submitted: requestId={}, target={}, sequence={}",
                request.requestId(), request.targetService(), sequence);

        return resultFuture;
    }

    /**
     * Returns current ring buffer remaining capacity.
     */
    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Gracefully shuts down the pipeline.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down CallPipeline...");
            try {
                disruptor.shutdown(30, TimeUnit.SECONDS);
                log.info("CallPipeline shut down gracefully");
            } catch (TimeoutException e) {
                log.warn("CallPipeline shutdown timed out, halting...");
                disruptor.halt();
            }
        }
    }

    private static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Thread factory for Disruptor consumer threads.
     */
    private static class PipelineThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        PipelineThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Completes the caller's future when a handler throws, so no call is left hanging.
     */
    private static class PipelineExceptionHandler implements com.lmax.disruptor.ExceptionHandler<CallEvent> {

        private static final Logger log = LoggerFactory.getLogger(PipelineExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, CallEvent event) {
            log.error("Exception in event handler: sequence={}, event={}", sequence, event, ex);

            CompletableFuture<CallResult> future = event.getResultFuture();
            if (future != null && !future.isDone()) {
                String requestId = event.getRequest() != null ? event.getRequest().requestId() : null;
                future.complete(CallResult.failure(requestId, ErrorType.INTERNAL_ERROR,
                        String.valueOf(ex.getMessage()), null, event.elapsedMs()));
            }
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during Disruptor start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during Disruptor shutdown", ex);
        }
    }

    /**
     * Builder for CallPipeline.
     */
    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private ServiceRegistry registry;
        private PolicyEngine policyEngine;
        private LoadBalancer loadBalancer;
        private ServiceTransport transport;
        private TrafficRecorder trafficRecorder;
        private MetricsRegistry metricsRegistry;

        public Builder ringBufferSize(int size) {
            if (Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        public Builder registry(ServiceRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder policyEngine(PolicyEngine policyEngine) {
            this.policyEngine = policyEngine;
            return this;
        }

        public Builder loadBalancer(LoadBalancer loadBalancer) {
            this.loadBalancer = loadBalancer;
            return this;
        }

        public Builder transport(ServiceTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder trafficRecorder(TrafficRecorder trafficRecorder) {
            this.trafficRecorder = trafficRecorder;
            return this;
        }

        public Builder metricsRegistry(MetricsRegistry metricsRegistry) {
            this.metricsRegistry = metricsRegistry;
            return this;
        }

        public Builder fromConfig(OrchestratorConfig.PipelineConfig config) {
            ringBufferSize(config.getRingBufferSize());
            this.waitStrategy = config.getWaitStrategy();
            return this;
        }

        public CallPipeline build() {
            if (registry == null) {
                throw new IllegalStateException("ServiceRegistry is required");
            }
            if (policyEngine == null) {
                throw new IllegalStateException("PolicyEngine is required");
            }
            if (loadBalancer == null) {
                throw new IllegalStateException("LoadBalancer is required");
            }
            if (transport == null) {
                throw new IllegalStateException("ServiceTransport is required");
            }
            if (trafficRecorder == null) {
                throw new IllegalStateException("TrafficRecorder is required");
            }
            if (metricsRegistry == null) {
                throw new IllegalStateException("MetricsRegistry is required");
            }
            return new CallPipeline(this);
        }
    }
}
