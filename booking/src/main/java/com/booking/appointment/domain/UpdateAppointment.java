package com.booking.appointment.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Externally changeable fields of an appointment. {@code null} leaves a field unchanged; {@code note}
 * appends a NOTE entry to the action log.
 */
@Getter
@Builder
@ToString
public class UpdateAppointment {

    private final Title title;
    private final String targetedTo;
    private final Instant scheduleTime;
    private final String note;
    private final AppointmentStatus status;

    public boolean isEmpty() {
        return title == null && targetedTo == null && scheduleTime == null && note == null && status == null;
    }
}
