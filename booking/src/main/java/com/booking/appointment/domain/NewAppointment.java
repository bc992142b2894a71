package com.booking.appointment.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Arguments of {@link Appointment#create(NewAppointment, String)}. {@code targetedTo} (the employee)
 * is optional.
 */
@Getter
@Builder
@ToString
public class NewAppointment {

    private final String id;
    private final Title title;
    private final String placeId;
    private final String targetedTo;
    private final String scheduledBy;
    private final Instant scheduleTime;
}
