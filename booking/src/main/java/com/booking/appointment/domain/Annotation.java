package com.booking.appointment.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.time.Instant;
import java.util.Objects;

/**
 * One entry of an appointment's append-only action log.
 */
@Getter
@EqualsAndHashCode
public final class Annotation {

    public enum Kind {
        CANCEL,
        RESCHEDULE,
        NOTE
    }

    private final Kind kind;
    private final String text;
    private final String actor;

    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private final Instant time;

    @JsonCreator
    public Annotation(@JsonProperty("kind") Kind kind,
                      @JsonProperty("text") String text,
                      @JsonProperty("actor") String actor,
                      @JsonProperty("time") Instant time) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.text = text == null ? "" : text;
        this.actor = actor;
        this.time = time;
    }

    /** Single-line rendering, e.g. {@code CANCEL: no longer needed}. */
    public String render() {
        return kind + ": " + text;
    }

    @Override
    public String toString() {
        return render();
    }
}
