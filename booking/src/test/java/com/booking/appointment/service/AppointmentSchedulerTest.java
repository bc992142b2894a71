package com.booking.appointment.service;

import com.booking.appointment.domain.Appointment;
import com.booking.appointment.domain.AppointmentEvents.AppointmentCancelled;
import com.booking.appointment.domain.AppointmentEvents.AppointmentCompleted;
import com.booking.appointment.domain.AppointmentEvents.AppointmentRescheduled;
import com.booking.appointment.domain.AppointmentEvents.AppointmentScheduled;
import com.booking.appointment.domain.AppointmentRepository;
import com.booking.appointment.domain.AppointmentStatus;
import com.booking.appointment.domain.Title;
import com.booking.shared.audit.Auditable;
import com.booking.shared.error.FailedPreconditionException;
import com.booking.shared.error.InvalidArgumentException;
import com.booking.shared.error.ResourceNotFoundException;
import com.booking.shared.events.DomainEvent;
import com.booking.shared.events.EventPublisher;
import com.booking.shared.identifier.IdFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AppointmentSchedulerTest {

    static final Instant NEXT_WEEK = Instant.now().plus(Duration.ofDays(7)).truncatedTo(ChronoUnit.SECONDS);

    @Mock AppointmentRepository appointmentRepository;
    @Mock EventPublisher eventPublisher;
    @Mock IdFactory idFactory;

    @Captor ArgumentCaptor<List<DomainEvent>> eventsCaptor;

    AppointmentScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new AppointmentScheduler(appointmentRepository, eventPublisher, idFactory);
    }

    static Appointment stored(AppointmentStatus status, boolean deleted) {
        return Appointment.restore()
                .id("appt-1")
                .title(Title.restore("Haircut"))
                .placeId("place-1")
                .scheduledBy("user-1")
                .scheduleTime(NEXT_WEEK)
                .status(status)
                .audit(Auditable.restore()
                        .createTime(Instant.now().minus(Duration.ofDays(1)))
                        .createBy("user-1")
                        .version(1)
                        .deleted(deleted)
                        .build())
                .build();
    }

    // ─── Schedule ─────────────────────────────────────────────────────────────

    @Test
    @DisplayName("schedule: normalizes the title, saves, then publishes Scheduled")
    void schedule() {
        when(idFactory.newId()).thenReturn("appt-9");

        Appointment appointment = scheduler.schedule(ScheduleAppointmentCommand.builder()
                .title("  beard   trim ")
                .placeId("place-1")
                .scheduleTime(NEXT_WEEK)
                .actor("user-1")
                .build());

        assertThat(appointment.getId()).isEqualTo("appt-9");
        assertThat(appointment.getTitle().value()).isEqualTo("Beard Trim");
        assertThat(appointment.getScheduledBy()).isEqualTo("user-1");
        assertThat(appointment.getTargetedTo()).isNull();
        verify(appointmentRepository).save(appointment);
        verify(eventPublisher).publish(eventsCaptor.capture());
        assertThat(eventsCaptor.getValue()).singleElement().isInstanceOf(AppointmentScheduled.class);
    }

    @Test
    @DisplayName("schedule: past time saves nothing")
    void scheduleInPast() {
        when(idFactory.newId()).thenReturn("appt-9");

        assertThatThrownBy(() -> scheduler.schedule(ScheduleAppointmentCommand.builder()
                .title("late")
                .placeId("place-1")
                .scheduleTime(Instant.now().minus(Duration.ofHours(2)))
                .actor("user-1")
                .build()))
                .isInstanceOf(InvalidArgumentException.class);

        verifyNoInteractions(appointmentRepository, eventPublisher);
    }

    // ─── Cancel / Reschedule / Complete ───────────────────────────────────────

    @Test
    @DisplayName("cancel: saves the cancelled appointment and publishes Cancelled")
    void cancel() {
        when(appointmentRepository.findByKey("appt-1")).thenReturn(Optional.of(stored(AppointmentStatus.SCHEDULED, false)));

        Appointment appointment = scheduler.cancel("appt-1", "user-1", "conflict");

        assertThat(appointment.getStatus()).isEqualTo(AppointmentStatus.CANCELLED);
        verify(appointmentRepository).save(appointment);
        verify(eventPublisher).publish(eventsCaptor.capture());
        assertThat(eventsCaptor.getValue()).singleElement().isInstanceOf(AppointmentCancelled.class);
    }

    @Test
    @DisplayName("cancel: completed appointment fails without saving")
    void cancelCompleted() {
        when(appointmentRepository.findByKey("appt-1")).thenReturn(Optional.of(stored(AppointmentStatus.COMPLETED, false)));

        assertThatThrownBy(() -> scheduler.cancel("appt-1", "user-1", "x"))
                .isInstanceOf(FailedPreconditionException.class);

        verify(appointmentRepository, never()).save(any());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("cancel: deleted appointment is not found")
    void cancelDeleted() {
        when(appointmentRepository.findByKey("appt-1")).thenReturn(Optional.of(stored(AppointmentStatus.SCHEDULED, true)));

        assertThatThrownBy(() -> scheduler.cancel("appt-1", "user-1", "x"))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("reschedule: new time is saved and Rescheduled published")
    void reschedule() {
        when(appointmentRepository.findByKey("appt-1")).thenReturn(Optional.of(stored(AppointmentStatus.SCHEDULED, false)));
        Instant later = NEXT_WEEK.plus(Duration.ofDays(1));

        Appointment appointment = scheduler.reschedule("appt-1", "user-1", "traffic", later);

        assertThat(appointment.getScheduleTime()).isEqualTo(later);
        verify(appointmentRepository).save(appointment);
        verify(eventPublisher).publish(eventsCaptor.capture());
        assertThat(eventsCaptor.getValue()).singleElement().isInstanceOf(AppointmentRescheduled.class);
    }

    @Test
    @DisplayName("reschedule: same time saves and publishes nothing")
    void rescheduleSameTime() {
        when(appointmentRepository.findByKey("appt-1")).thenReturn(Optional.of(stored(AppointmentStatus.SCHEDULED, false)));

        Appointment appointment = scheduler.reschedule("appt-1", "user-1", "none", NEXT_WEEK);

        assertThat(appointment.getVersion()).isEqualTo(1);
        verify(appointmentRepository, never()).save(any());
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("complete: saves and publishes Completed")
    void complete() {
        when(appointmentRepository.findByKey("appt-1")).thenReturn(Optional.of(stored(AppointmentStatus.SCHEDULED, false)));

        Appointment appointment = scheduler.complete("appt-1", "staff-1");

        assertThat(appointment.getStatus()).isEqualTo(AppointmentStatus.COMPLETED);
        verify(eventPublisher).publish(eventsCaptor.capture());
        assertThat(eventsCaptor.getValue()).singleElement().isInstanceOf(AppointmentCompleted.class);
    }

    @Test
    @DisplayName("complete: unknown id is not found")
    void completeMissing() {
        when(appointmentRepository.findByKey("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> scheduler.complete("nope", "staff-1"))
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("nope");
    }
}
