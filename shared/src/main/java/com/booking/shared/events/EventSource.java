package com.booking.shared.events;

import java.util.List;

/**
 * Capability of an aggregate that buffers the domain events its mutations raise.
 */
public interface EventSource {

    /**
     * Drains the buffered events in the order they were raised.
     * Call once per persistence transaction; a second call returns an empty list.
     */
    List<DomainEvent> pullEvents();
}
