package fr.lapetina.orchestrator.disruptor.handlers;

import fr.lapetina.orchestrator.domain.event.CallEvent;
import fr.lapetina.orchestrator.domain.event.EventState;
import fr.lapetina.orchestrator.domain.model.CallRequest;
import fr.lapetina.orchestrator.domain.model.ErrorType;
import fr.lapetina.orchestrator.infrastructure.registry.ServiceRegistry;
import fr.lapetina.orchestrator.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class ValidationHandlerTest {

    private ValidationHandler handler;
    private CallEvent event;

    @BeforeEach
    void setUp() {
        ServiceRegistry registry = new ServiceRegistry();
        registry.register(Fixtures.service("auth", "1.0.0"));
        handler = new ValidationHandler(registry);
        event = new CallEvent();
    }

    @Test
    @DisplayName("should validate a call to a registered service")
    void shouldValidateKnownTarget() {
        event.initialize(CallRequest.of("web", "auth", "/login", Map.of("user", "alice")), new CompletableFuture<>());

        handler.onEvent(event, 0, true);

        assertThat(event.getState()).isEqualTo(EventState.VALIDATED);
        assertThat(event.getErrorType()).isNull();
        assertThat(event.getValidatedAt()).isNotNull();
    }

    @Test
    @DisplayName("should reject null request")
    void shouldRejectNullRequest() {
        event.initialize(null, new CompletableFuture<>());

        handler.onEvent(event, 0, true);

        assertThat(event.getState()).isEqualTo(EventState.VALIDATION_FAILED);
        assertThat(event.getErrorType()).isEqualTo(ErrorType.VALIDATION_ERROR);
    }

    @Test
    @DisplayName("should reject a call to an unknown service")
    void shouldRejectUnknownTarget() {
        event.initialize(CallRequest.of("web", "billing", "/invoices", null), new CompletableFuture<>());

        handler.onEvent(event, 0, true);

        assertThat(event.getState()).isEqualTo(EventState.VALIDATION_FAILED);
        assertThat(event.getErrorType()).isEqualTo(ErrorType.NOT_FOUND);
        assertThat(event.getErrorMessage()).isEqualTo("Service not found: billing");
    }

    @Test
    @DisplayName("should reject a call without source service")
    void shouldRejectMissingSource() {
        event.initialize(CallRequest.of(" ", "auth", "/login", null), new CompletableFuture<>());

        handler.onEvent(event, 0, true);

        assertThat(event.getErrorType()).isEqualTo(ErrorType.VALIDATION_ERROR);
        assertThat(event.isRejected()).isTrue();
    }

    @Test
    @DisplayName("should reject a call without endpoint")
    void shouldRejectMissingEndpoint() {
        event.initialize(CallRequest.of("web", "auth", null, null), new CompletableFuture<>());

        handler.onEvent(event, 0, true);

        assertThat(event.getErrorType()).isEqualTo(ErrorType.VALIDATION_ERROR);
        assertThat(event.getErrorMessage()).isEqualTo("Endpoint is required");
    }

    @Test
    @DisplayName("should skip already rejected events")
    void shouldSkipRejectedEvents() {
        event.initialize(CallRequest.of("web", "auth", "/login", null), new CompletableFuture<>());
        event.reject(EventState.DENIED, ErrorType.AUTHORIZATION_DENIED, "denied upstream");

        handler.onEvent(event, 0, true);

        assertThat(event.getState()).isEqualTo(EventState.DENIED);
        assertThat(event.getErrorType()).isEqualTo(ErrorType.AUTHORIZATION_DENIED);
    }

    @Test
    @DisplayName("should record the ring buffer sequence")
    void shouldRecordSequence() {
        event.initialize(CallRequest.of("web", "auth", "/login", null), new CompletableFuture<>());

        handler.onEvent(event, 42, true);

        assertThat(event.getSequence()).isEqualTo(42);
    }
}
