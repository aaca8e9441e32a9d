package fr.lapetina.kvrouter.domain.event;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates {@link RoutingEvent} slots for the ring buffer.
 */
public final class RoutingEventFactory implements EventFactory<RoutingEvent> {

    @Override
    public RoutingEvent newInstance() {
        return new RoutingEvent();
    }
}
