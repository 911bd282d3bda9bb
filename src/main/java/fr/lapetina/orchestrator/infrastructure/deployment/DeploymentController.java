package fr.lapetina.orchestrator.infrastructure.deployment;

import fr.lapetina.orchestrator.domain.exception.ConflictException;
import fr.lapetina.orchestrator.domain.exception.NotFoundException;
import fr.lapetina.orchestrator.domain.exception.OrchestrationException;
import fr.lapetina.orchestrator.domain.model.CanaryConfig;
import fr.lapetina.orchestrator.domain.model.DeploymentRecord;
import fr.lapetina.orchestrator.domain.model.DeploymentRequest;
import fr.lapetina.orchestrator.domain.model.DeploymentStatus;
import fr.lapetina.orchestrator.domain.model.DeploymentStrategy;
import fr.lapetina.orchestrator.domain.model.ErrorType;
import fr.lapetina.orchestrator.domain.model.InstanceState;
import fr.lapetina.orchestrator.domain.model.Service;
import fr.lapetina.orchestrator.domain.model.ServiceInstance;
import fr.lapetina.orchestrator.domain.model.TrafficSnapshot;
import fr.lapetina.orchestrator.infrastructure.balancer.LoadBalancer;
import fr.lapetina.orchestrator.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.orchestrator.infrastructure.metrics.TrafficRecorder;
import fr.lapetina.orchestrator.infrastructure.registry.ServiceRegistry;
import fr.lapetina.orchestrator.infrastructure.registry.ServiceRegistry.RegistryEvent;
import fr.lapetina.orchestrator.infrastructure.runtime.DeploymentValidator;
import fr.lapetina.orchestrator.infrastructure.runtime.InstanceProvisioner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Drives new versions of services through a staged rollout.
 *
 * Workflow of one deployment, each step cancellable and time-bounded:
 * 1. Provision the new instances (they enter the registry as STARTING)
 * 2. Health gate: wait until the health monitor reports all of them healthy
 * 3. Cutover: route traffic to the new version; canary first routes a share
 *    for an observation window and promotes only if the success criteria hold
 * 4. Post-cutover validation
 * 5. Teardown of the old version's instances
 *
 * A failure before cutover terminates the new instances and restores the
 * previous routing. A failure of the validation leaves the new version live
 * and the old instances in place: recovery is an explicit {@link #rollback}.
 *
 * Only one deployment per service runs at a time; the registry's deployment
 * guard also keeps the auto-scaler away while it runs.
 */
public final class DeploymentController implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DeploymentController.class);

    private final ServiceRegistry registry;
    private final LoadBalancer loadBalancer;
    private final InstanceProvisioner provisioner;
    private final DeploymentValidator validator;
    private final TrafficRecorder trafficRecorder;
    private final MetricsRegistry metricsRegistry;
    private final DeploymentSettings settings;
    private final Clock clock;
    private final ExecutorService workflows;

    private final Map<String, DeploymentRecord> records = new ConcurrentHashMap<>();
    private final Map<String, Execution> executions = new ConcurrentHashMap<>();
    private final Map<String, Service> previousDescriptors = new ConcurrentHashMap<>();

    public DeploymentController(
            ServiceRegistry registry,
            LoadBalancer loadBalancer,
            InstanceProvisioner provisioner,
            DeploymentValidator validator,
            TrafficRecorder trafficRecorder,
            MetricsRegistry metricsRegistry,
            DeploymentSettings settings,
            Clock clock
    ) {
        this.registry = registry;
        this.loadBalancer = loadBalancer;
        this.provisioner = provisioner;
        this.validator = validator;
        this.trafficRecorder = trafficRecorder;
        this.metricsRegistry = metricsRegistry;
        this.settings = settings;
        this.clock = clock;
        AtomicInteger threadCount = new AtomicInteger();
        this.workflows = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "deployment-" + threadCount.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
    }

    // ==================== SUBMISSION ====================

    /**
     * Submits a deployment. The record is IN_PROGRESS when this method returns;
     * the workflow runs in the background.
     *
     * @return the deployment id
     * @throws ConflictException if a deployment of the same service is already running
     */
    public String deploy(DeploymentRequest request) {
        Service target = request.service();
        String serviceId = target.getId();

        if (!registry.beginDeployment(serviceId)) {
            throw new ConflictException("Deployment already in progress for service: " + serviceId);
        }

        try {
            Optional<Service> current = registry.findService(serviceId);
            String previousActive = current.flatMap(s -> loadBalancer.activeVersion(serviceId)).orElse(null);
            int replicas = request.replicas() != null
                    ? request.replicas()
                    : Math.max(1, countActiveInstances(serviceId, previousActive));

            String id = "deploy-" + UUID.randomUUID();
            records.put(id, DeploymentRecord.pending(id, target, request.strategy(), previousActive, clock.instant()));
            current.ifPresent(previous -> previousDescriptors.put(id, previous));

            if (current.isEmpty()) {
                registry.register(target);
            }
            // Traffic stays on the live version until cutover
            loadBalancer.pinVersion(serviceId, previousActive);

            Execution execution = new Execution(id, request, previousActive, replicas);
            executions.put(id, execution);
            updateRecord(id, record -> record.transitionTo(DeploymentStatus.IN_PROGRESS, clock.instant()));

            log.info("Deployment started: deploymentId={}, serviceId={}, version={}, strategy={}, replicas={}, previousVersion={}",
                    id, serviceId, target.getVersion(), request.strategy().wireName(), replicas, previousActive);

            workflows.execute(() -> runWorkflow(execution));
            return id;
        } catch (RuntimeException e) {
            registry.endDeployment(serviceId);
            throw e;
        }
    }

    /**
     * Returns a deployment record.
     *
     * @throws NotFoundException if the deployment is unknown
     */
    public DeploymentRecord getStatus(String deploymentId) {
        DeploymentRecord record = records.get(deploymentId);
        if (record == null) {
            throw NotFoundException.deployment(deploymentId);
        }
        return record;
    }

    /**
     * Returns the deployments of a service, oldest first.
     */
    public List<DeploymentRecord> history(String serviceId) {
        return records.values().stream()
                .filter(record -> record.serviceId().equals(serviceId))
                .sorted(Comparator.comparing(DeploymentRecord::startTime))
                .toList();
    }

    /**
     * Returns a future completing with the record once the workflow has finished.
     */
    public CompletableFuture<DeploymentRecord> awaitCompletion(String deploymentId) {
        Execution execution = executions.get(deploymentId);
        if (execution != null) {
            return execution.done;
        }
        return CompletableFuture.completedFuture(getStatus(deploymentId));
    }

    /**
     * Cancels a running deployment. Further steps are not executed and the
     * record ends FAILED with reason {@code Cancelled}.
     *
     * @return false if the deployment is not running
     */
    public boolean cancel(String deploymentId) {
        getStatus(deploymentId);
        Execution execution = executions.get(deploymentId);
        if (execution == null) {
            return false;
        }
        execution.cancelled = true;
        CompletableFuture<?> step = execution.currentStep;
        if (step != null) {
            step.cancel(true);
        }
        log.info("Deployment cancellation requested: deploymentId={}", deploymentId);
        return true;
    }

    // ==================== WORKFLOW ====================

    private void runWorkflow(Execution execution) {
        Service target = execution.request.service();
        String serviceId = target.getId();
        MDC.put("deploymentId", execution.id);
        MDC.put("serviceId", serviceId);
        boolean cutOver = false;

        try {
            provision(execution);
            updateRecord(execution.id, record -> record.withInstanceIds(execution.createdIds()));
            awaitHealthy(execution, execution.createdIds(), "Health gate");
            cutOver(execution);
            cutOver = true;
            validate(execution);
            tearDownPreviousVersion(execution);

            DeploymentRecord done = updateRecord(execution.id,
                    record -> record.transitionTo(DeploymentStatus.COMPLETED, clock.instant()));
            metricsRegistry.incrementDeployment(serviceId, DeploymentStatus.COMPLETED);
            log.info("Deployment completed: deploymentId={}, serviceId={}, version={}, durationMs={}",
                    execution.id, serviceId, target.getVersion(),
                    Duration.between(done.startTime(), done.endTime()).toMillis());

        } catch (StepFailure failure) {
            if (!cutOver) {
                revertBeforeCutover(execution);
            }
            fail(execution, failure.errorType, failure.getMessage());
        } catch (RuntimeException e) {
            log.error("Deployment workflow error: deploymentId={}", execution.id, e);
            if (!cutOver) {
                revertBeforeCutover(execution);
            }
            fail(execution, ErrorType.INTERNAL_ERROR, e.getMessage());
        } finally {
            executions.remove(execution.id);
            registry.endDeployment(serviceId);
            execution.done.complete(records.get(execution.id));
            MDC.remove("deploymentId");
            MDC.remove("serviceId");
        }
    }

    private void provision(Execution execution) throws StepFailure {
        Service target = execution.request.service();
        List<CompletableFuture<ServiceInstance>> requests = new ArrayList<>();
        for (int i = 0; i < execution.replicas; i++) {
            requests.add(safeProvision(target, target.getVersion()));
        }

        try {
            await(execution, CompletableFuture.allOf(requests.toArray(new CompletableFuture[0])),
                    settings.provisionTimeout(), ErrorType.PROVISIONING_FAILED, ErrorType.PROVISIONING_FAILED,
                    "Provisioning");
        } catch (StepFailure failure) {
            // Instances provisioned so far, and any that arrive later, are terminated on arrival
            for (CompletableFuture<ServiceInstance> request : requests) {
                request.thenAccept(instance -> discardUnregistered(execution, instance));
            }
            throw failure;
        }

        for (CompletableFuture<ServiceInstance> request : requests) {
            execution.created.add(asStarting(request.join(), target));
        }

        for (ServiceInstance instance : execution.created) {
            try {
                registry.addInstance(target.getId(), instance);
            } catch (OrchestrationException e) {
                throw new StepFailure(ErrorType.PROVISIONING_FAILED,
                        "Could not register instance " + instance.getId() + ": " + e.getMessage());
            }
        }
        log.info("Deployment instances provisioned: deploymentId={}, instances={}",
                execution.id, execution.createdIds());
    }

    private void cutOver(Execution execution) throws StepFailure {
        checkCancelled(execution);
        Service target = execution.request.service();
        String serviceId = target.getId();

        if (execution.request.strategy() == DeploymentStrategy.CANARY) {
            runCanary(execution);
        }

        loadBalancer.pinVersion(serviceId, target.getVersion());
        registry.register(target);
        log.info("Traffic cut over: deploymentId={}, serviceId={}, version={}, previousVersion={}",
                execution.id, serviceId, target.getVersion(), execution.previousActive);
    }

    private void runCanary(Execution execution) throws StepFailure {
        Service target = execution.request.service();
        String serviceId = target.getId();
        CanaryConfig canary = execution.request.canary();

        if (execution.previousActive == null) {
            // Nothing to compare against: a brand new service is promoted directly
            log.info("Canary skipped for new service: deploymentId={}, serviceId={}", execution.id, serviceId);
            return;
        }

        trafficRecorder.resetVersion(serviceId, target.getVersion());
        loadBalancer.startCanary(serviceId, target.getVersion(), canary.weightPercent());

        CompletableFuture<Void> window = CompletableFuture.runAsync(() -> { },
                CompletableFuture.delayedExecutor(canary.window().toMillis(), TimeUnit.MILLISECONDS, workflows));
        await(execution, window, canary.window().plus(settings.validationTimeout()),
                ErrorType.TIMEOUT, ErrorType.INTERNAL_ERROR, "Canary window");

        TrafficSnapshot observed = trafficRecorder.snapshot(serviceId, target.getVersion());
        CanaryConfig.SuccessCriteria criteria = canary.criteria();
        log.info("Canary analysis: deploymentId={}, requests={}, successRate={}, meanResponseTimeMs={}, errorRate={}",
                execution.id, observed.requestCount(), observed.successRate(),
                observed.meanResponseTime(), observed.observedErrorRate());

        List<String> violations = new ArrayList<>();
        if (observed.successRate() < criteria.minSuccessRate()) {
            violations.add("successRate " + observed.successRate() + " < " + criteria.minSuccessRate());
        }
        if (observed.meanResponseTime() > criteria.maxResponseTimeMs()) {
            violations.add("responseTime " + observed.meanResponseTime() + "ms > " + criteria.maxResponseTimeMs() + "ms");
        }
        if (observed.observedErrorRate() > criteria.maxErrorRate()) {
            violations.add("errorRate " + observed.observedErrorRate() + " > " + criteria.maxErrorRate());
        }
        if (!violations.isEmpty()) {
            throw new StepFailure(ErrorType.DEPLOYMENT_VALIDATION_FAILED,
                    "Canary analysis failed: " + String.join(", ", violations));
        }
    }

    private void validate(Execution execution) throws StepFailure {
        checkCancelled(execution);
        DeploymentRecord record = getStatus(execution.id);

        CompletableFuture<DeploymentValidator.Result> validation;
        try {
            validation = validator.validate(record, List.copyOf(execution.created));
        } catch (RuntimeException e) {
            validation = CompletableFuture.failedFuture(e);
        }

        DeploymentValidator.Result result = await(execution, validation, settings.validationTimeout(),
                ErrorType.DEPLOYMENT_TIMEOUT, ErrorType.DEPLOYMENT_VALIDATION_FAILED, "Validation");
        if (!result.valid()) {
            throw new StepFailure(ErrorType.DEPLOYMENT_VALIDATION_FAILED,
                    "Post-cutover validation failed: " + result.reason());
        }
        log.info("Deployment validated: deploymentId={}", execution.id);
    }

    private void tearDownPreviousVersion(Execution execution) throws StepFailure {
        Service target = execution.request.service();
        String serviceId = target.getId();
        Set<String> created = Set.copyOf(execution.createdIds());

        List<ServiceInstance> previous = registry.listInstances(serviceId).stream()
                .filter(instance -> !instance.getVersion().equals(target.getVersion()))
                .filter(instance -> !created.contains(instance.getId()))
                .toList();

        if (execution.request.strategy() == DeploymentStrategy.BLUE_GREEN) {
            checkCancelled(execution);
            List<CompletableFuture<Void>> terminations = previous.stream()
                    .map(instance -> retire(serviceId, instance))
                    .toList();
            awaitQuietly(CompletableFuture.allOf(terminations.toArray(new CompletableFuture[0])),
                    settings.teardownTimeout());
        } else {
            for (ServiceInstance instance : previous) {
                checkCancelled(execution);
                awaitQuietly(retire(serviceId, instance), settings.teardownTimeout());
            }
        }
        log.info("Previous version torn down: deploymentId={}, removed={}", execution.id, previous.size());
    }

    private void revertBeforeCutover(Execution execution) {
        String serviceId = execution.request.service().getId();
        loadBalancer.pinVersion(serviceId, execution.previousActive);

        List<CompletableFuture<Void>> terminations = new ArrayList<>();
        for (ServiceInstance instance : execution.created) {
            terminations.add(retire(serviceId, instance));
        }
        awaitQuietly(CompletableFuture.allOf(terminations.toArray(new CompletableFuture[0])),
                settings.teardownTimeout());
        if (!execution.created.isEmpty()) {
            log.info("New instances discarded: deploymentId={}, instances={}", execution.id, execution.createdIds());
        }
    }

    private void fail(Execution execution, ErrorType errorType, String message) {
        String serviceId = execution.request.service().getId();
        updateRecord(execution.id, record -> record.fail(errorType, message, clock.instant()));
        metricsRegistry.incrementDeployment(serviceId, DeploymentStatus.FAILED);
        log.warn("Deployment failed: deploymentId={}, serviceId={}, version={}, reason={}, error={}",
                execution.id, serviceId, execution.request.service().getVersion(), errorType.reason(), message);
    }

    // ==================== ROLLBACK ====================

    /**
     * Restores the version that was live before a deployment.
     *
     * Instances of the previous version still registered are reused; when none
     * is left, new ones are provisioned and health-gated. Instances of the
     * rolled back version are then terminated and the record becomes ROLLED_BACK.
     *
     * @return future completing with the updated record, or exceptionally if the rollback failed
     * @throws ConflictException if the deployment cannot be rolled back now
     */
    public CompletableFuture<DeploymentRecord> rollback(String deploymentId) {
        DeploymentRecord record = getStatus(deploymentId);
        String serviceId = record.serviceId();

        if (!record.status().canTransitionTo(DeploymentStatus.ROLLED_BACK)) {
            throw new ConflictException("Deployment " + deploymentId + " cannot be rolled back from status "
                    + record.status().wireName());
        }
        Service previous = previousDescriptors.get(deploymentId);
        if (record.rollbackVersion() == null || previous == null) {
            throw new ConflictException("Deployment " + deploymentId + " has no previous version to roll back to");
        }
        Optional<String> active = loadBalancer.activeVersion(serviceId);
        if (active.isPresent() && !active.get().equals(record.version())
                && !active.get().equals(record.rollbackVersion())) {
            throw new ConflictException("Deployment " + deploymentId + " was superseded by version " + active.get());
        }
        if (!registry.beginDeployment(serviceId)) {
            throw new ConflictException("Deployment already in progress for service: " + serviceId);
        }

        log.info("Rollback started: deploymentId={}, serviceId={}, from={}, to={}",
                deploymentId, serviceId, record.version(), record.rollbackVersion());

        DeploymentRequest restore = new DeploymentRequest(previous, DeploymentStrategy.BLUE_GREEN,
                Math.max(1, record.instanceIds().size()), null);
        Execution execution = new Execution(deploymentId, restore, record.version(), restore.replicas());

        return CompletableFuture.supplyAsync(() -> {
            try {
                return runRollback(execution, record);
            } catch (StepFailure failure) {
                log.warn("Rollback failed: deploymentId={}, reason={}, error={}",
                        deploymentId, failure.errorType.reason(), failure.getMessage());
                throw new CompletionException(new OrchestrationException(failure.errorType, failure.getMessage()));
            } finally {
                registry.endDeployment(serviceId);
            }
        }, workflows);
    }

    private DeploymentRecord runRollback(Execution execution, DeploymentRecord record) throws StepFailure {
        Service previous = execution.request.service();
        String serviceId = previous.getId();

        List<ServiceInstance> survivors = registry.listInstances(serviceId).stream()
                .filter(instance -> instance.getVersion().equals(previous.getVersion()))
                .filter(instance -> instance.getState() != InstanceState.STOPPING)
                .toList();

        try {
            List<String> gated;
            if (survivors.isEmpty()) {
                provision(execution);
                gated = execution.createdIds();
            } else {
                gated = survivors.stream().map(ServiceInstance::getId).toList();
            }
            awaitHealthy(execution, gated, "Rollback health gate");
        } catch (StepFailure failure) {
            for (ServiceInstance instance : execution.created) {
                awaitQuietly(retire(serviceId, instance), settings.teardownTimeout());
            }
            throw failure;
        }

        loadBalancer.pinVersion(serviceId, previous.getVersion());
        registry.register(previous);

        List<CompletableFuture<Void>> terminations = registry.listInstances(serviceId).stream()
                .filter(instance -> instance.getVersion().equals(record.version()))
                .map(instance -> retire(serviceId, instance))
                .toList();
        awaitQuietly(CompletableFuture.allOf(terminations.toArray(new CompletableFuture[0])),
                settings.teardownTimeout());

        DeploymentRecord rolledBack = updateRecord(record.id(),
                current -> current.transitionTo(DeploymentStatus.ROLLED_BACK, clock.instant()));
        metricsRegistry.incrementDeployment(serviceId, DeploymentStatus.ROLLED_BACK);
        log.info("Rollback completed: deploymentId={}, serviceId={}, activeVersion={}",
                record.id(), serviceId, previous.getVersion());
        return rolledBack;
    }

    // ==================== STEP HELPERS ====================

    /**
     * Waits until every listed instance is healthy, failing after the health gate timeout.
     */
    private void awaitHealthy(Execution execution, List<String> instanceIds, String stepName) throws StepFailure {
        if (instanceIds.isEmpty()) {
            return;
        }
        Set<String> pending = ConcurrentHashMap.newKeySet();
        pending.addAll(instanceIds);
        CompletableFuture<Void> gate = new CompletableFuture<>();

        Consumer<RegistryEvent> listener = event -> {
            ServiceInstance instance = event.instance();
            if (instance == null || !pending.contains(instance.getId())) {
                return;
            }
            if (event.type() == RegistryEvent.Type.INSTANCE_REMOVED) {
                gate.completeExceptionally(new IllegalStateException(
                        "Instance " + instance.getId() + " was removed before becoming healthy"));
            } else if (instance.isHealthy()) {
                pending.remove(instance.getId());
                if (pending.isEmpty()) {
                    gate.complete(null);
                }
            }
        };
        registry.addListener(listener);
        gate.whenComplete((ignored, ex) -> registry.removeListener(listener));

        for (String instanceId : instanceIds) {
            registry.findInstance(instanceId)
                    .filter(ServiceInstance::isHealthy)
                    .ifPresent(instance -> pending.remove(instanceId));
        }
        if (pending.isEmpty()) {
            gate.complete(null);
        }

        try {
            await(execution, gate, settings.healthGateTimeout(),
                    ErrorType.DEPLOYMENT_TIMEOUT, ErrorType.PROVISIONING_FAILED, stepName);
        } catch (StepFailure failure) {
            gate.cancel(false);
            if (failure.errorType == ErrorType.DEPLOYMENT_TIMEOUT) {
                throw new StepFailure(ErrorType.DEPLOYMENT_TIMEOUT, failure.getMessage()
                        + ", instances not healthy: " + pending);
            }
            throw failure;
        }
        log.info("{} passed: deploymentId={}, instances={}", stepName, execution.id, instanceIds);
    }

    /**
     * Waits for a step, honouring cancellation and the step timeout.
     */
    private <T> T await(Execution execution, CompletableFuture<T> step, Duration timeout,
                        ErrorType onTimeout, ErrorType onFailure, String stepName) throws StepFailure {
        execution.currentStep = step;
        try {
            if (execution.cancelled) {
                step.cancel(true);
            }
            return step.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            step.cancel(true);
            throw new StepFailure(onTimeout, stepName + " timed out after " + timeout);
        } catch (CancellationException e) {
            throw new StepFailure(ErrorType.CANCELLED, "Cancelled");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new StepFailure(onFailure, stepName + " failed: " + cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StepFailure(ErrorType.CANCELLED, "Interrupted");
        } finally {
            execution.currentStep = null;
        }
    }

    private void checkCancelled(Execution execution) throws StepFailure {
        if (execution.cancelled) {
            throw new StepFailure(ErrorType.CANCELLED, "Cancelled");
        }
    }

    private void awaitQuietly(CompletableFuture<?> future, Duration timeout) {
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Instance teardown incomplete: error={}", e.getMessage());
        }
    }

    /**
     * Takes an instance out of service: STOPPING, terminate, remove from the registry.
     */
    private CompletableFuture<Void> retire(String serviceId, ServiceInstance instance) {
        try {
            registry.updateInstanceHealth(instance.getId(), InstanceState.STOPPING);
        } catch (NotFoundException e) {
            log.debug("Instance not registered, terminating only: instanceId={}", instance.getId());
        }

        CompletableFuture<Void> termination;
        try {
            termination = provisioner.terminateInstance(instance);
        } catch (RuntimeException e) {
            termination = CompletableFuture.failedFuture(e);
        }

        return termination.handle((ignored, ex) -> {
            if (ex != null) {
                log.warn("Instance termination failed: serviceId={}, instanceId={}, error={}",
                        serviceId, instance.getId(), ex.getMessage());
            }
            try {
                registry.removeInstance(serviceId, instance.getId());
            } catch (NotFoundException e) {
                log.debug("Instance already removed: instanceId={}", instance.getId());
            }
            return null;
        });
    }

    /**
     * Terminates an instance provisioned for a step that already failed. It was
     * never registered, so only the runtime holds it.
     */
    private void discardUnregistered(Execution execution, ServiceInstance instance) {
        log.info("Discarding instance of failed provisioning: deploymentId={}, instanceId={}",
                execution.id, instance.getId());
        CompletableFuture<Void> termination;
        try {
            termination = provisioner.terminateInstance(instance);
        } catch (RuntimeException e) {
            termination = CompletableFuture.failedFuture(e);
        }
        termination.whenComplete((ignored, ex) -> {
            if (ex != null) {
                log.warn("Instance termination failed: deploymentId={}, instanceId={}, error={}",
                        execution.id, instance.getId(), ex.getMessage());
            }
        });
    }

    private CompletableFuture<ServiceInstance> safeProvision(Service service, String version) {
        try {
            return provisioner.provisionInstance(service, version);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private ServiceInstance asStarting(ServiceInstance provisioned, Service target) {
        return provisioned.toBuilder()
                .serviceId(target.getId())
                .version(target.getVersion())
                .state(InstanceState.STARTING)
                .startedAt(clock.instant())
                .build();
    }

    private int countActiveInstances(String serviceId, String version) {
        if (version == null || !registry.contains(serviceId)) {
            return 0;
        }
        return (int) registry.listInstances(serviceId).stream()
                .filter(instance -> instance.getState() != InstanceState.STOPPING)
                .filter(instance -> instance.getVersion().equals(version))
                .count();
    }

    private DeploymentRecord updateRecord(String deploymentId, UnaryOperator<DeploymentRecord> change) {
        return records.computeIfPresent(deploymentId, (id, record) -> change.apply(record));
    }

    @Override
    public void close() {
        executions.keySet().forEach(this::cancel);
        workflows.shutdown();
        try {
            if (!workflows.awaitTermination(10, TimeUnit.SECONDS)) {
                workflows.shutdownNow();
            }
        } catch (InterruptedException e) {
            workflows.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Deployment controller stopped");
    }

    /**
     * Mutable state of one running workflow.
     */
    private static final class Execution {
        private final String id;
        private final DeploymentRequest request;
        private final String previousActive;
        private final int replicas;
        private final List<ServiceInstance> created = Collections.synchronizedList(new ArrayList<>());
        private final CompletableFuture<DeploymentRecord> done = new CompletableFuture<>();
        private volatile boolean cancelled;
        private volatile CompletableFuture<?> currentStep;

        Execution(String id, DeploymentRequest request, String previousActive, int replicas) {
            this.id = id;
            this.request = request;
            this.previousActive = previousActive;
            this.replicas = replicas;
        }

        List<String> createdIds() {
            synchronized (created) {
                return created.stream().map(ServiceInstance::getId).toList();
            }
        }
    }

    private static final class StepFailure extends Exception {
        private final ErrorType errorType;

        StepFailure(ErrorType errorType, String message) {
            super(message);
            this.errorType = errorType;
        }
    }
}
