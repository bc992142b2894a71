package com.booking.appointment.domain;

import com.booking.shared.error.InvalidArgumentException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class AppointmentStatusTest {

    @Test
    @DisplayName("labels round-trip for every status")
    void labels() {
        for (AppointmentStatus status : AppointmentStatus.values()) {
            assertThat(AppointmentStatus.fromLabel(status.label())).isSameAs(status);
        }
    }

    @Test
    @DisplayName("unknown label is an invalid argument")
    void unknownLabel() {
        assertThatThrownBy(() -> AppointmentStatus.fromLabel("PENDING"))
                .isInstanceOf(InvalidArgumentException.class)
                .extracting("internalCode").isEqualTo(AppointmentErrors.INVALID_STATUS);
    }
}
