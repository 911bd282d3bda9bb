package fr.lapetina.orchestrator.domain.strategy;

import java.util.function.ToIntFunction;

/**
 * Per-call inputs of a selection.
 *
 * @param routingKey  key scoping strategy state, normally the service id
 * @param activeCalls number of calls currently dispatched to an instance id
 */
public record SelectionContext(String routingKey, ToIntFunction<String> activeCalls) {

    public static SelectionContext of(String routingKey) {
        return new SelectionContext(routingKey, instanceId -> 0);
    }
}
