package com.booking.appointment.domain;

import com.booking.shared.events.DomainEvent;
import com.booking.shared.events.EventTypes;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Getter;

import java.time.Instant;

/**
 * Appointment event payloads. Keyed by place id: every appointment of one place lands on the same
 * partition, so consumers see a place's calendar changes in order.
 */
public final class AppointmentEvents {

    private AppointmentEvents() {}

    /** Fields every appointment event carries. */
    @Getter
    public abstract static class AppointmentEvent extends DomainEvent {
        private final String appointmentId;
        private final String placeId;
        private final String scheduledBy;
        private final String targetedTo;
        @JsonFormat(shape = JsonFormat.Shape.STRING)
        private final Instant scheduleTime;
        private final String status;
        private final String actor;
        private final long version;

        AppointmentEvent(String type, Appointment src, Instant time, String actor) {
            super(type, EventTypes.SOURCE_APPOINTMENTS, src.getId(), src.getPlaceId(), time);
            this.appointmentId = src.getId();
            this.placeId = src.getPlaceId();
            this.scheduledBy = src.getScheduledBy();
            this.targetedTo = src.getTargetedTo();
            this.scheduleTime = src.getScheduleTime();
            this.status = src.getStatus().label();
            this.actor = actor;
            this.version = src.getVersion();
        }
    }

    @Getter
    public static class AppointmentScheduled extends AppointmentEvent {
        private final String title;

        AppointmentScheduled(Appointment src) {
            super(EventTypes.APPOINTMENT_SCHEDULED, src, src.getCreateTime(), src.getCreateBy());
            this.title = src.getTitle().value();
        }
    }

    @Getter
    public static class AppointmentUpdated extends AppointmentEvent {
        private final String title;

        AppointmentUpdated(Appointment src) {
            super(EventTypes.APPOINTMENT_UPDATED, src, src.getLastUpdateTime(), src.getLastUpdateBy());
            this.title = src.getTitle().value();
        }
    }

    @Getter
    public static class AppointmentCancelled extends AppointmentEvent {
        private final String reason;

        AppointmentCancelled(Appointment src, String reason) {
            super(EventTypes.APPOINTMENT_CANCELLED, src, src.getLastUpdateTime(), src.getLastUpdateBy());
            this.reason = reason;
        }
    }

    @Getter
    public static class AppointmentRescheduled extends AppointmentEvent {
        private final String reason;

        AppointmentRescheduled(Appointment src, String reason) {
            super(EventTypes.APPOINTMENT_RESCHEDULED, src, src.getLastUpdateTime(), src.getLastUpdateBy());
            this.reason = reason;
        }
    }

    public static class AppointmentCompleted extends AppointmentEvent {
        AppointmentCompleted(Appointment src) {
            super(EventTypes.APPOINTMENT_COMPLETED, src, src.getLastUpdateTime(), src.getLastUpdateBy());
        }
    }

    public static class AppointmentDeleted extends AppointmentEvent {
        AppointmentDeleted(Appointment src) {
            super(EventTypes.APPOINTMENT_DELETED, src, src.getLastUpdateTime(), src.getLastUpdateBy());
        }
    }
}
