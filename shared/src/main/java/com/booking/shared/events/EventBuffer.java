package com.booking.shared.events;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered queue of domain events an aggregate raised and nobody has published yet.
 *
 * Append-only while the aggregate mutates; {@link #pull()} hands the whole sequence over
 * exactly once and leaves the buffer empty.
 */
public final class EventBuffer {

    private final List<DomainEvent> pending = new ArrayList<>();

    public void register(DomainEvent event) {
        pending.add(Objects.requireNonNull(event, "event"));
    }

    public List<DomainEvent> pull() {
        if (pending.isEmpty()) {
            return List.of();
        }
        List<DomainEvent> drained = List.copyOf(pending);
        pending.clear();
        return drained;
    }

    public List<DomainEvent> peek() {
        return Collections.unmodifiableList(pending);
    }

    public int size() {
        return pending.size();
    }
}
