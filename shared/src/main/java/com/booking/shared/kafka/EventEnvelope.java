package com.booking.shared.kafka;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * An already serialized event together with its routing data and CloudEvents attributes.
 */
@Getter
@Builder
@ToString(exclude = "payload")
public class EventEnvelope {

    private final String topic;
    private final String key;
    private final String eventId;
    private final String type;
    private final String source;
    private final String subject;
    private final Instant time;
    private final String payload;
}
