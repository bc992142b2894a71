package com.booking.appointment.service;

import com.booking.appointment.domain.Appointment;
import com.booking.employee.domain.Employee;
import com.booking.place.domain.Place;
import com.booking.user.domain.User;
import lombok.Builder;
import lombok.Getter;

/**
 * Appointment joined with the place, employee and user it references. A reference is {@code null}
 * when the listing it came from leaves it out or when it is unknown to the reference store.
 */
@Getter
@Builder
public class AppointmentView {
    private final Appointment appointment;
    private final Place place;
    private final Employee targetedTo;
    private final User scheduledBy;
}
