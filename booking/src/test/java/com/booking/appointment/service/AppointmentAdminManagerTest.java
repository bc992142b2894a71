package com.booking.appointment.service;

import com.booking.appointment.domain.Appointment;
import com.booking.appointment.domain.AppointmentEvents.AppointmentDeleted;
import com.booking.appointment.domain.AppointmentEvents.AppointmentUpdated;
import com.booking.appointment.domain.AppointmentRepository;
import com.booking.appointment.domain.AppointmentStatus;
import com.booking.appointment.domain.UpdateAppointment;
import com.booking.shared.events.DomainEvent;
import com.booking.shared.events.EventPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AppointmentAdminManagerTest {

    @Mock AppointmentRepository appointmentRepository;
    @Mock EventPublisher eventPublisher;

    @Captor ArgumentCaptor<List<DomainEvent>> eventsCaptor;

    AppointmentAdminManager adminManager;

    @BeforeEach
    void setUp() {
        adminManager = new AppointmentAdminManager(appointmentRepository, eventPublisher);
    }

    @Test
    @DisplayName("updateById: applies the update, saves and publishes Updated")
    void update() {
        when(appointmentRepository.findByKey("appt-1"))
                .thenReturn(Optional.of(AppointmentSchedulerTest.stored(AppointmentStatus.SCHEDULED, false)));

        Appointment appointment = adminManager.updateById("appt-1", "admin",
                UpdateAppointment.builder().status(AppointmentStatus.COMPLETED).build());

        assertThat(appointment.getStatus()).isEqualTo(AppointmentStatus.COMPLETED);
        assertThat(appointment.getVersion()).isEqualTo(2);
        verify(appointmentRepository).save(appointment);
        verify(eventPublisher).publish(eventsCaptor.capture());
        assertThat(eventsCaptor.getValue()).singleElement().isInstanceOf(AppointmentUpdated.class);
    }

    @Test
    @DisplayName("updateById: empty update saves nothing")
    void emptyUpdate() {
        when(appointmentRepository.findByKey("appt-1"))
                .thenReturn(Optional.of(AppointmentSchedulerTest.stored(AppointmentStatus.SCHEDULED, false)));

        adminManager.updateById("appt-1", "admin", UpdateAppointment.builder().build());

        verify(appointmentRepository, never()).save(any());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("deleteById: deletes and publishes Deleted")
    void delete() {
        when(appointmentRepository.findByKey("appt-1"))
                .thenReturn(Optional.of(AppointmentSchedulerTest.stored(AppointmentStatus.CANCELLED, false)));

        adminManager.deleteById("appt-1", "admin");

        ArgumentCaptor<Appointment> captor = ArgumentCaptor.forClass(Appointment.class);
        verify(appointmentRepository).delete(captor.capture());
        assertThat(captor.getValue().isDeleted()).isTrue();
        verify(eventPublisher).publish(eventsCaptor.capture());
        assertThat(eventsCaptor.getValue()).singleElement().isInstanceOf(AppointmentDeleted.class);
    }

    @Test
    @DisplayName("deleteById: missing or already deleted appointment is a no-op")
    void deleteMissing() {
        when(appointmentRepository.findByKey("nope")).thenReturn(Optional.empty());
        when(appointmentRepository.findByKey("gone"))
                .thenReturn(Optional.of(AppointmentSchedulerTest.stored(AppointmentStatus.SCHEDULED, true)));

        adminManager.deleteById("nope", "admin");
        adminManager.deleteById("gone", "admin");

        verify(appointmentRepository, never()).delete(any());
        verifyNoInteractions(eventPublisher);
    }
}
