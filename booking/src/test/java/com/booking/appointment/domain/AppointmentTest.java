package com.booking.appointment.domain;

import com.booking.appointment.domain.AppointmentEvents.AppointmentCancelled;
import com.booking.appointment.domain.AppointmentEvents.AppointmentCompleted;
import com.booking.appointment.domain.AppointmentEvents.AppointmentDeleted;
import com.booking.appointment.domain.AppointmentEvents.AppointmentRescheduled;
import com.booking.appointment.domain.AppointmentEvents.AppointmentScheduled;
import com.booking.appointment.domain.AppointmentEvents.AppointmentUpdated;
import com.booking.shared.audit.Auditable;
import com.booking.shared.error.FailedPreconditionException;
import com.booking.shared.error.InvalidArgumentException;
import com.booking.shared.events.DomainEvent;
import com.booking.shared.events.EventTypes;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class AppointmentTest {

    static final Instant TOMORROW = Instant.now().plus(Duration.ofHours(24)).truncatedTo(ChronoUnit.SECONDS);

    static NewAppointment.NewAppointmentBuilder args() {
        return NewAppointment.builder()
                .id("appt-1")
                .title(Title.of("dental check-up"))
                .placeId("place-1")
                .targetedTo("emp-1")
                .scheduledBy("user-1")
                .scheduleTime(TOMORROW);
    }

    static Appointment scheduled() {
        return Appointment.create(args().build(), "user-1");
    }

    static Appointment completed() {
        Appointment appointment = scheduled();
        appointment.markAsCompleted("user-1");
        appointment.pullEvents();
        return appointment;
    }

    // ─── Creation ─────────────────────────────────────────────────────────────

    @Test
    @DisplayName("create: future time gives SCHEDULED, version 0, one Scheduled event keyed by place")
    void createInFuture() {
        Appointment appointment = scheduled();

        assertThat(appointment.getStatus()).isEqualTo(AppointmentStatus.SCHEDULED);
        assertThat(appointment.getVersion()).isZero();
        assertThat(appointment.getNotes()).isEmpty();

        List<DomainEvent> events = appointment.pullEvents();
        assertThat(events).singleElement().isInstanceOf(AppointmentScheduled.class);
        AppointmentScheduled event = (AppointmentScheduled) events.get(0);
        assertThat(event.getType()).isEqualTo(EventTypes.APPOINTMENT_SCHEDULED);
        assertThat(event.getKey()).isEqualTo("place-1");
        assertThat(event.getSubject()).isEqualTo("appt-1");
        assertThat(event.getTitle()).isEqualTo("Dental Check-up");
        assertThat(event.getStatus()).isEqualTo("SCHEDULED");
        assertThat(event.getScheduleTime()).isEqualTo(TOMORROW);
    }

    @Test
    @DisplayName("create: past time is rejected as an invalid argument")
    void createInPast() {
        NewAppointment past = args().scheduleTime(Instant.now().minus(Duration.ofMinutes(5))).build();

        assertThatThrownBy(() -> Appointment.create(past, "user-1"))
                .isInstanceOf(InvalidArgumentException.class)
                .extracting("internalCode").isEqualTo(AppointmentErrors.SCHEDULED_BEFORE_CURRENT_TIME);
    }

    // ─── Cancel ───────────────────────────────────────────────────────────────

    @Test
    @DisplayName("cancel: CANCELLED, note logged, version 2, events [Scheduled, Cancelled]")
    void cancel() {
        Appointment appointment = scheduled();

        appointment.cancel("user-1", "no longer needed");

        assertThat(appointment.getStatus()).isEqualTo(AppointmentStatus.CANCELLED);
        assertThat(appointment.getNotes()).contains("CANCEL: no longer needed");
        assertThat(appointment.getVersion()).isEqualTo(2);
        assertThat(appointment.getAnnotations()).singleElement()
                .satisfies(a -> {
                    assertThat(a.getKind()).isEqualTo(Annotation.Kind.CANCEL);
                    assertThat(a.getActor()).isEqualTo("user-1");
                });

        List<DomainEvent> events = appointment.pullEvents();
        assertThat(events).hasSize(2);
        assertThat(events.get(0)).isInstanceOf(AppointmentScheduled.class);
        assertThat(events.get(1)).isInstanceOf(AppointmentCancelled.class);
        assertThat(((AppointmentCancelled) events.get(1)).getReason()).isEqualTo("no longer needed");
        assertThat(appointment.pullEvents()).isEmpty();
    }

    @Test
    @DisplayName("cancel: completed appointment fails and nothing changes")
    void cancelCompleted() {
        Appointment appointment = completed();
        long version = appointment.getVersion();

        assertThatThrownBy(() -> appointment.cancel("user-1", "too late"))
                .isInstanceOf(FailedPreconditionException.class)
                .extracting("internalCode").isEqualTo(AppointmentErrors.APPOINTMENT_ALREADY_COMPLETED);

        assertThat(appointment.getStatus()).isEqualTo(AppointmentStatus.COMPLETED);
        assertThat(appointment.getVersion()).isEqualTo(version);
        assertThat(appointment.getNotes()).isEmpty();
        assertThat(appointment.pullEvents()).isEmpty();
    }

    // ─── Reschedule ───────────────────────────────────────────────────────────

    @Test
    @DisplayName("reschedule: same time is a no-op")
    void rescheduleSameTime() {
        Appointment appointment = scheduled();
        appointment.pullEvents();

        boolean changed = appointment.reschedule("user-1", "same", TOMORROW);

        assertThat(changed).isFalse();
        assertThat(appointment.getVersion()).isZero();
        assertThat(appointment.getNotes()).isEmpty();
        assertThat(appointment.pullEvents()).isEmpty();
    }

    @Test
    @DisplayName("reschedule: cancelled appointment is scheduled again at the new time")
    void rescheduleCancelled() {
        Appointment appointment = scheduled();
        appointment.cancel("user-1", "sick");
        appointment.pullEvents();
        Instant later = TOMORROW.plus(Duration.ofDays(2));

        boolean changed = appointment.reschedule("user-1", "feeling better", later);

        assertThat(changed).isTrue();
        assertThat(appointment.getStatus()).isEqualTo(AppointmentStatus.SCHEDULED);
        assertThat(appointment.getScheduleTime()).isEqualTo(later);
        assertThat(appointment.getVersion()).isEqualTo(4);
        assertThat(appointment.getNotes()).isEqualTo("CANCEL: sick\nRESCHEDULE: feeling better\n");
        assertThat(appointment.pullEvents()).singleElement().isInstanceOf(AppointmentRescheduled.class);
    }

    @Test
    @DisplayName("reschedule: past time is rejected and nothing changes")
    void rescheduleToPast() {
        Appointment appointment = scheduled();
        appointment.pullEvents();

        assertThatThrownBy(() -> appointment.reschedule("user-1", "oops", Instant.now().minus(Duration.ofHours(1))))
                .isInstanceOf(InvalidArgumentException.class);

        assertThat(appointment.getScheduleTime()).isEqualTo(TOMORROW);
        assertThat(appointment.getVersion()).isZero();
        assertThat(appointment.getNotes()).isEmpty();
        assertThat(appointment.pullEvents()).isEmpty();
    }

    @Test
    @DisplayName("reschedule: completed appointment fails")
    void rescheduleCompleted() {
        Appointment appointment = completed();

        assertThatThrownBy(() -> appointment.reschedule("user-1", "again", TOMORROW.plus(Duration.ofDays(1))))
                .isInstanceOf(FailedPreconditionException.class);
        assertThat(appointment.pullEvents()).isEmpty();
    }

    // ─── Complete / Delete ────────────────────────────────────────────────────

    @Test
    @DisplayName("markAsCompleted: allowed twice, each call bumps version and raises Completed")
    void completeTwice() {
        Appointment appointment = scheduled();
        appointment.pullEvents();

        appointment.markAsCompleted("staff-1");
        appointment.markAsCompleted("staff-1");

        assertThat(appointment.getStatus()).isEqualTo(AppointmentStatus.COMPLETED);
        assertThat(appointment.getVersion()).isEqualTo(2);
        assertThat(appointment.pullEvents())
                .hasSize(2)
                .allMatch(e -> e instanceof AppointmentCompleted);
    }

    @Test
    @DisplayName("markAsCompleted: works on an appointment whose time has passed")
    void completePastAppointment() {
        Appointment appointment = restoredAt(Instant.now().minus(Duration.ofDays(1)), AppointmentStatus.SCHEDULED);

        appointment.markAsCompleted("staff-1");

        assertThat(appointment.getStatus()).isEqualTo(AppointmentStatus.COMPLETED);
        assertThat(appointment.getVersion()).isEqualTo(6);
    }

    @Test
    @DisplayName("cancel: works on an appointment whose time has passed")
    void cancelPastAppointment() {
        Appointment appointment = restoredAt(Instant.now().minus(Duration.ofDays(1)), AppointmentStatus.SCHEDULED);

        appointment.cancel("staff-1", "no show");

        assertThat(appointment.getStatus()).isEqualTo(AppointmentStatus.CANCELLED);
        assertThat(appointment.getVersion()).isEqualTo(7);
        assertThat(appointment.getNotes()).isEqualTo("CANCEL: no show\n");
    }

    @Test
    @DisplayName("delete: unconditional, flags deleted and raises Deleted")
    void delete() {
        Appointment appointment = completed();

        appointment.delete("admin");

        assertThat(appointment.isDeleted()).isTrue();
        assertThat(appointment.getLastUpdateBy()).isEqualTo("admin");
        assertThat(appointment.pullEvents()).singleElement().isInstanceOf(AppointmentDeleted.class);
    }

    // ─── Update ───────────────────────────────────────────────────────────────

    @Test
    @DisplayName("update: several fields in one revision with one Updated event")
    void updateSeveralFields() {
        Appointment appointment = scheduled();
        appointment.pullEvents();

        boolean changed = appointment.update("admin", UpdateAppointment.builder()
                .title(Title.of("follow-up"))
                .targetedTo("emp-2")
                .note("bring x-rays")
                .build());

        assertThat(changed).isTrue();
        assertThat(appointment.getTitle().value()).isEqualTo("Follow-up");
        assertThat(appointment.getTargetedTo()).isEqualTo("emp-2");
        assertThat(appointment.getNotes()).isEqualTo("NOTE: bring x-rays\n");
        assertThat(appointment.getVersion()).isEqualTo(1);
        assertThat(appointment.pullEvents()).singleElement().isInstanceOf(AppointmentUpdated.class);
    }

    @Test
    @DisplayName("update: empty update changes nothing")
    void emptyUpdate() {
        Appointment appointment = scheduled();
        appointment.pullEvents();

        assertThat(appointment.update("admin", UpdateAppointment.builder().build())).isFalse();
        assertThat(appointment.getVersion()).isZero();
        assertThat(appointment.pullEvents()).isEmpty();
    }

    @Test
    @DisplayName("update: UNKNOWN status is rejected before anything is applied")
    void updateUnknownStatus() {
        Appointment appointment = scheduled();
        appointment.pullEvents();

        assertThatThrownBy(() -> appointment.update("admin", UpdateAppointment.builder()
                .title(Title.of("changed"))
                .status(AppointmentStatus.UNKNOWN)
                .build()))
                .isInstanceOf(InvalidArgumentException.class)
                .extracting("internalCode").isEqualTo(AppointmentErrors.INVALID_STATUS);

        assertThat(appointment.getTitle().value()).isEqualTo("Dental Check-up");
        assertThat(appointment.getVersion()).isZero();
        assertThat(appointment.pullEvents()).isEmpty();
    }

    @Test
    @DisplayName("update: moving the time into the past is rejected")
    void updateIntoPast() {
        Appointment appointment = scheduled();

        assertThatThrownBy(() -> appointment.update("admin", UpdateAppointment.builder()
                .scheduleTime(Instant.now().minus(Duration.ofDays(1)))
                .build()))
                .isInstanceOf(InvalidArgumentException.class);
        assertThat(appointment.getScheduleTime()).isEqualTo(TOMORROW);
    }

    @Test
    @DisplayName("update: a past appointment can still get a note")
    void noteOnPastAppointment() {
        Appointment appointment = restoredAt(Instant.now().minus(Duration.ofDays(1)), AppointmentStatus.COMPLETED);

        assertThat(appointment.update("admin", UpdateAppointment.builder().note("no-show").build())).isTrue();
        assertThat(appointment.getNotes()).isEqualTo("NOTE: no-show\n");
    }

    @Test
    @DisplayName("every mutation keeps lastUpdateTime at or after createTime")
    void lastUpdateNeverBeforeCreate() {
        Appointment appointment = scheduled();
        appointment.cancel("user-1", "x");
        appointment.reschedule("user-1", "y", TOMORROW.plus(Duration.ofHours(1)));
        appointment.markAsCompleted("user-1");

        assertThat(appointment.getLastUpdateTime()).isAfterOrEqualTo(appointment.getCreateTime());
    }

    static Appointment restoredAt(Instant scheduleTime, AppointmentStatus status) {
        return Appointment.restore()
                .id("appt-9")
                .title(Title.restore("Old One"))
                .placeId("place-1")
                .scheduledBy("user-1")
                .scheduleTime(scheduleTime)
                .status(status)
                .audit(Auditable.restore()
                        .createTime(Instant.now().minus(Duration.ofDays(3)))
                        .createBy("user-1")
                        .version(5)
                        .build())
                .build();
    }
}
