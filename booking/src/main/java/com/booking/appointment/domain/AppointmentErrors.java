package com.booking.appointment.domain;

import com.booking.shared.error.FailedPreconditionException;
import com.booking.shared.error.InvalidArgumentException;
import com.booking.shared.error.ResourceNotFoundException;

public final class AppointmentErrors {

    public static final String RESOURCE = "appointment";

    public static final String SCHEDULED_BEFORE_CURRENT_TIME = "SCHEDULED_BEFORE_CURRENT_TIME";
    public static final String APPOINTMENT_ALREADY_COMPLETED = "APPOINTMENT_ALREADY_COMPLETED";
    public static final String INVALID_STATUS = "INVALID_APPOINTMENT_STATUS";
    public static final String INVALID_TITLE = "INVALID_APPOINTMENT_TITLE";

    private AppointmentErrors() {}

    static InvalidArgumentException scheduledBeforeNow() {
        return new InvalidArgumentException("appointment scheduled before current time", SCHEDULED_BEFORE_CURRENT_TIME);
    }

    static InvalidArgumentException invalidStatus(AppointmentStatus status) {
        return new InvalidArgumentException(
                "status must be one of SCHEDULED, CANCELLED, COMPLETED, got " + status, INVALID_STATUS);
    }

    static FailedPreconditionException alreadyCompleted() {
        return new FailedPreconditionException("appointment is already completed", APPOINTMENT_ALREADY_COMPLETED);
    }

    public static ResourceNotFoundException notFound(String id) {
        return new ResourceNotFoundException(RESOURCE, id);
    }
}
