package fr.lapetina.orchestrator.infrastructure.policy;

import fr.lapetina.orchestrator.domain.model.CircuitBreakerSettings;
import fr.lapetina.orchestrator.domain.model.ErrorType;
import fr.lapetina.orchestrator.domain.model.LoadBalancerConfig;
import fr.lapetina.orchestrator.domain.model.Policy;
import fr.lapetina.orchestrator.domain.model.PolicyDecision;
import fr.lapetina.orchestrator.domain.model.PolicyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Gates each inter-service call.
 *
 * Evaluation order, short-circuiting on the first deny:
 * 1. Authorization policies bound to the target: a deny rule applies to every
 *    caller not listed in its {@code source}; absence of rules allows
 * 2. Rate-limit policies bound to the target: admitted calls over a trailing
 *    window of one {@code unit} must stay below {@code requestsPerUnit}
 * 3. Circuit breaker of the target, configured by a circuit_breaker policy or
 *    by the bound load-balancer configuration
 *
 * A call is counted against rate limits only once all checks passed.
 */
public final class PolicyEngine {

    private static final Logger log = LoggerFactory.getLogger(PolicyEngine.class);

    private final AtomicReference<List<Policy>> policies = new AtomicReference<>(List.of());
    private final Function<String, Optional<LoadBalancerConfig>> loadBalancerConfigs;
    private final Clock clock;
    private final Duration defaultTimeout;

    private final Map<String, SlidingWindowRateLimiter> rateLimiters = new ConcurrentHashMap<>();
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final Map<String, Object> admissionLocks = new ConcurrentHashMap<>();

    public PolicyEngine(
            Function<String, Optional<LoadBalancerConfig>> loadBalancerConfigs,
            Clock clock,
            Duration defaultTimeout
    ) {
        this.loadBalancerConfigs = loadBalancerConfigs;
        this.clock = clock;
        this.defaultTimeout = defaultTimeout;
    }

    /**
     * Decides whether a call from {@code sourceService} to {@code targetService} may proceed.
     */
    public PolicyDecision authorize(String sourceService, String targetService, String endpoint) {
        List<Policy> applicable = applicablePolicies(targetService);

        PolicyDecision authorization = checkAuthorization(applicable, sourceService, targetService);
        if (!authorization.allowed()) {
            return authorization;
        }

        synchronized (admissionLocks.computeIfAbsent(targetService, id -> new Object())) {
            Instant now = clock.instant();
            List<SlidingWindowRateLimiter> limiters = new ArrayList<>();

            for (Policy policy : applicable) {
                if (policy.type() != PolicyType.RATE_LIMIT) {
                    continue;
                }
                SlidingWindowRateLimiter limiter = limiterFor(policy, targetService);
                if (!limiter.hasCapacity(now)) {
                    log.warn("Call rate limited: source={}, target={}, endpoint={}, policy={}, limit={}/{}",
                            sourceService, targetService, endpoint, policy.id(), limiter.limit(), limiter.window());
                    return PolicyDecision.deny(ErrorType.RATE_LIMIT_EXCEEDED,
                            "Rate limit exceeded for " + targetService + " (" + limiter.limit() + " per "
                                    + limiter.window() + ")", policy.id());
                }
                limiters.add(limiter);
            }

            Optional<CircuitBreaker> breaker = breakerFor(targetService);
            if (breaker.isPresent() && !breaker.get().tryAcquirePermission()) {
                log.warn("Call rejected by open circuit: source={}, target={}, endpoint={}",
                        sourceService, targetService, endpoint);
                return PolicyDecision.deny(ErrorType.CIRCUIT_OPEN,
                        "Circuit breaker open for " + targetService, null);
            }

            limiters.forEach(limiter -> limiter.record(now));
        }

        return PolicyDecision.allow();
    }

    /**
     * Feeds a call outcome to the circuit breaker of the target.
     */
    public void recordOutcome(String targetService, boolean success) {
        breakerFor(targetService).ifPresent(breaker -> {
            if (success) {
                breaker.recordSuccess();
            } else {
                breaker.recordFailure();
            }
        });
    }

    /**
     * Gives back the breaker permit of an authorized call that was stopped
     * before dispatch, so a half-open breaker keeps its probe budget.
     */
    public void releasePermission(String targetService) {
        breakerFor(targetService).ifPresent(CircuitBreaker::releasePermission);
    }

    /**
     * Resolves timeout and retry count for calls to a target.
     * Policies win over the bound load-balancer configuration.
     */
    public CallOptions callOptions(String targetService) {
        Optional<LoadBalancerConfig> config = loadBalancerConfigs.apply(targetService);
        Duration timeout = config.map(LoadBalancerConfig::connectionTimeout).orElse(defaultTimeout);
        int retries = config.map(LoadBalancerConfig::retries).orElse(0);

        for (Policy policy : applicablePolicies(targetService)) {
            if (policy.type() == PolicyType.TIMEOUT) {
                timeout = policy.durationValue("timeoutMs", policy.durationValue("timeout", timeout));
            } else if (policy.type() == PolicyType.RETRY) {
                int attempts = policy.intValue("attempts", retries + 1);
                retries = Math.max(0, policy.intValue("retries", attempts - 1));
            }
        }
        return new CallOptions(timeout, retries);
    }

    // ==================== POLICY SET ====================

    /**
     * Adds a policy, replacing any policy with the same id.
     */
    public void addPolicy(Policy policy) {
        policies.updateAndGet(current -> {
            List<Policy> updated = new ArrayList<>(current);
            updated.removeIf(existing -> existing.id().equals(policy.id()));
            updated.add(policy);
            updated.sort(Comparator.comparing(Policy::id));
            return List.copyOf(updated);
        });
        log.info("Policy added: id={}, type={}, target={}, enabled={}",
                policy.id(), policy.type().wireName(), policy.target(), policy.enabled());
    }

    public boolean removePolicy(String policyId) {
        List<Policy> before = policies.getAndUpdate(current -> current.stream()
                .filter(policy -> !policy.id().equals(policyId))
                .toList());
        boolean removed = before.stream().anyMatch(policy -> policy.id().equals(policyId));
        if (removed) {
            log.info("Policy removed: id={}", policyId);
        }
        return removed;
    }

    /**
     * Replaces the whole policy set. Used for configuration reload.
     */
    public void replacePolicies(Collection<Policy> newPolicies) {
        List<Policy> sorted = newPolicies.stream()
                .sorted(Comparator.comparing(Policy::id))
                .toList();
        policies.set(sorted);
        log.info("Policies replaced: count={}", sorted.size());
    }

    public List<Policy> getPolicies() {
        return policies.get();
    }

    public Optional<CircuitBreaker.State> circuitState(String targetService) {
        return breakerFor(targetService).map(CircuitBreaker::getState);
    }

    private List<Policy> applicablePolicies(String targetService) {
        return policies.get().stream()
                .filter(policy -> policy.appliesTo(targetService))
                .toList();
    }

    private PolicyDecision checkAuthorization(List<Policy> applicable, String sourceService, String targetService) {
        for (Policy policy : applicable) {
            if (policy.type() != PolicyType.AUTHORIZATION) {
                continue;
            }
            String action = policy.stringValue("action", "allow");
            List<String> sources = policy.stringList("source");
            boolean exempt = sources.contains(Policy.WILDCARD) || sources.contains(sourceService);
            if ("deny".equalsIgnoreCase(action) && !exempt) {
                log.warn("Call denied by authorization policy: source={}, target={}, policy={}",
                        sourceService, targetService, policy.id());
                return PolicyDecision.deny(ErrorType.AUTHORIZATION_DENIED,
                        "Access denied by policy " + policy.id() + " for caller " + sourceService, policy.id());
            }
        }
        return PolicyDecision.allow();
    }

    private SlidingWindowRateLimiter limiterFor(Policy policy, String targetService) {
        int limit = policy.intValue("requestsPerUnit", Integer.MAX_VALUE);
        Duration window = unitToWindow(policy.stringValue("unit", "minute"));
        return rateLimiters.compute(policy.id() + "|" + targetService, (key, existing) -> {
            if (existing != null && existing.limit() == limit && existing.window().equals(window)) {
                return existing;
            }
            return new SlidingWindowRateLimiter(limit, window);
        });
    }

    private Optional<CircuitBreaker> breakerFor(String targetService) {
        Optional<CircuitBreakerSettings> settings = resolveBreakerSettings(targetService);
        if (settings.isEmpty()) {
            return Optional.empty();
        }
        CircuitBreaker breaker = breakers.compute(targetService, (id, existing) -> {
            if (existing != null && existing.getSettings().equals(settings.get())) {
                return existing;
            }
            return new CircuitBreaker(targetService, settings.get(), clock);
        });
        return Optional.of(breaker);
    }

    private Optional<CircuitBreakerSettings> resolveBreakerSettings(String targetService) {
        for (Policy policy : applicablePolicies(targetService)) {
            if (policy.type() == PolicyType.CIRCUIT_BREAKER) {
                CircuitBreakerSettings defaults = CircuitBreakerSettings.defaults();
                return Optional.of(new CircuitBreakerSettings(
                        true,
                        policy.intValue("consecutiveErrors", defaults.failureThreshold()),
                        policy.durationValue("intervalMs", policy.durationValue("interval", defaults.interval())),
                        policy.durationValue("recoveryTimeoutMs",
                                policy.durationValue("baseEjectionTime", defaults.recoveryTimeout())),
                        policy.intValue("halfOpenRequests", defaults.halfOpenRequests())
                ));
            }
        }
        return loadBalancerConfigs.apply(targetService)
                .map(LoadBalancerConfig::circuitBreaker)
                .filter(CircuitBreakerSettings::enabled);
    }

    private static Duration unitToWindow(String unit) {
        return switch (unit.toLowerCase()) {
            case "second" -> Duration.ofSeconds(1);
            case "hour" -> Duration.ofHours(1);
            case "minute" -> Duration.ofMinutes(1);
            default -> throw new IllegalArgumentException("Unknown rate limit unit: " + unit);
        };
    }
}
