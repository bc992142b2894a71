package com.booking.appointment.domain;

import com.booking.shared.error.InvalidArgumentException;

import java.util.Arrays;

/**
 * Lifecycle state of an appointment. {@link #UNKNOWN} only marks an uninitialized value and never
 * passes validation.
 */
public enum AppointmentStatus {

    UNKNOWN("UNKNOWN"),
    SCHEDULED("SCHEDULED"),
    CANCELLED("CANCELLED"),
    COMPLETED("COMPLETED");

    private final String label;

    AppointmentStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * @throws InvalidArgumentException for any label outside the four known ones
     */
    public static AppointmentStatus fromLabel(String label) {
        return Arrays.stream(values())
                .filter(s -> s.label.equals(label))
                .findFirst()
                .orElseThrow(() -> new InvalidArgumentException(
                        "unknown appointment status: " + label, AppointmentErrors.INVALID_STATUS));
    }
}
