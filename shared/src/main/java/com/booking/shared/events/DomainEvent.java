package com.booking.shared.events;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.UUID;

/**
 * Base CloudEvent following the CloudEvents specification v1.0.
 * https://cloudevents.io/
 *
 * All domain events extend this class. Every event carries:
 *  - id:      Globally unique event identifier (UUID v4)
 *  - type:    Hierarchical dot-notation name, also the Kafka topic, e.g. "organizations.created"
 *  - source:  Originating aggregate family, e.g. "/organizations"
 *  - subject: Identifier of the aggregate the event is about
 *  - time:    When the triggering operation happened (taken from the aggregate's audit metadata)
 *
 * The partition key is not part of the payload; it only routes the record.
 * Events are immutable snapshots: subclasses copy aggregate state at construction time.
 */
@Getter
@ToString
public abstract class DomainEvent {

    private final String id;
    private final String type;
    private final String source;
    private final String subject;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private final Instant time;

    @JsonIgnore
    private final String key;

    private final String specversion = "1.0";
    private final String datacontenttype = "application/json";

    protected DomainEvent(String type, String source, String subject, String key, Instant time) {
        this.id = UUID.randomUUID().toString();
        this.type = type;
        this.source = source;
        this.subject = subject;
        this.key = key;
        this.time = time;
    }

    /** Kafka topic the event is routed to. */
    @JsonIgnore
    public String getTopic() {
        return type;
    }
}
