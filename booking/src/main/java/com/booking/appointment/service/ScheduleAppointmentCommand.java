package com.booking.appointment.service;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class ScheduleAppointmentCommand {
    private String title;
    private String placeId;
    /** Employee the appointment is with; optional. */
    private String targetedTo;
    private Instant scheduleTime;
    /** Booking user; becomes scheduledBy and createBy. */
    private String actor;
}
