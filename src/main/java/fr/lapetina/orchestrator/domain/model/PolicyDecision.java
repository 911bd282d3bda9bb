package fr.lapetina.orchestrator.domain.model;

/**
 * Outcome of policy evaluation for one call.
 *
 * @param allowed  whether the call may proceed
 * @param reason   deny reason, null when allowed
 * @param message  human readable detail, null when allowed
 * @param policyId policy that denied the call, null when allowed or denied by breaker state
 */
public record PolicyDecision(boolean allowed, ErrorType reason, String message, String policyId) {

    private static final PolicyDecision ALLOW = new PolicyDecision(true, null, null, null);

    public static PolicyDecision allow() {
        return ALLOW;
    }

    public static PolicyDecision deny(ErrorType reason, String message, String policyId) {
        return new PolicyDecision(false, reason, message, policyId);
    }
}
