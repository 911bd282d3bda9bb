package fr.lapetina.orchestrator.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Factory for creating CallEvent instances in the Disruptor ring buffer.
 *
 * The Disruptor pre-allocates events at startup; they are then reused by
 * clearing and re-initializing them.
 */
public final class CallEventFactory implements EventFactory<CallEvent> {

    @Override
    public CallEvent newInstance() {
        return new CallEvent();
    }
}
