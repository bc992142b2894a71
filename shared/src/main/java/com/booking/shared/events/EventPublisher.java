package com.booking.shared.events;

import java.util.List;

/**
 * Hands drained domain events over to the event infrastructure.
 *
 * Delivery is at-least-once. Implementations do not retry on their own: a failure surfaces as
 * {@link com.booking.shared.error.EventPublishException} and the caller decides.
 */
public interface EventPublisher {

    void publish(List<DomainEvent> events);
}
