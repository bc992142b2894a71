package com.booking.appointment.domain;

import com.booking.appointment.domain.AppointmentEvents.AppointmentCancelled;
import com.booking.appointment.domain.AppointmentEvents.AppointmentCompleted;
import com.booking.appointment.domain.AppointmentEvents.AppointmentDeleted;
import com.booking.appointment.domain.AppointmentEvents.AppointmentRescheduled;
import com.booking.appointment.domain.AppointmentEvents.AppointmentScheduled;
import com.booking.appointment.domain.AppointmentEvents.AppointmentUpdated;
import com.booking.shared.audit.Auditable;
import com.booking.shared.audit.Audited;
import com.booking.shared.events.DomainEvent;
import com.booking.shared.events.EventBuffer;
import com.booking.shared.events.EventSource;
import lombok.Builder;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An appointment a user books at a place, optionally with a given employee.
 *
 * <pre>
 *   SCHEDULED --cancel-------> CANCELLED --reschedule--> SCHEDULED
 *   SCHEDULED --reschedule---> SCHEDULED
 *   any       --complete-----> COMPLETED   (cancel and reschedule then fail)
 *   any       --delete-------> deleted flag set
 * </pre>
 *
 * Every mutation validates the candidate state first; a rejected mutation leaves fields, version and
 * event buffer untouched. Cancel and reschedule record two revisions (the log entry and the state
 * transition) but raise a single event.
 *
 * Fields have no setters; only the methods below change them.
 */
public final class Appointment implements Audited, EventSource {

    private final String id;
    private Title title;
    private final String placeId;
    private String targetedTo;
    private final String scheduledBy;
    private Instant scheduleTime;
    private final List<Annotation> annotations;
    private AppointmentStatus status;
    private final Auditable audit;
    private final EventBuffer events = new EventBuffer();

    private Appointment(String id, Title title, String placeId, String targetedTo, String scheduledBy,
                        Instant scheduleTime, List<Annotation> annotations, AppointmentStatus status,
                        Auditable audit) {
        this.id = Objects.requireNonNull(id, "id");
        this.title = Objects.requireNonNull(title, "title");
        this.placeId = Objects.requireNonNull(placeId, "placeId");
        this.targetedTo = targetedTo;
        this.scheduledBy = Objects.requireNonNull(scheduledBy, "scheduledBy");
        this.scheduleTime = Objects.requireNonNull(scheduleTime, "scheduleTime");
        this.annotations = new ArrayList<>(annotations);
        this.status = status;
        this.audit = audit;
    }

    /**
     * Schedules a new appointment. The status is always SCHEDULED.
     *
     * @throws com.booking.shared.error.InvalidArgumentException if the schedule time is in the past
     */
    public static Appointment create(NewAppointment args, String actor) {
        Instant scheduleTime = normalize(args.getScheduleTime());
        requireNotInPast(scheduleTime);

        Appointment appointment = new Appointment(args.getId(), args.getTitle(), args.getPlaceId(),
                args.getTargetedTo(), args.getScheduledBy(), scheduleTime, List.of(),
                AppointmentStatus.SCHEDULED, Auditable.create(actor));
        appointment.events.register(new AppointmentScheduled(appointment));
        return appointment;
    }

    /** Rebuilds a stored appointment without validating it or raising events. */
    @Builder(builderMethodName = "restore")
    private static Appointment restored(String id, Title title, String placeId, String targetedTo,
                                        String scheduledBy, Instant scheduleTime, List<Annotation> annotations,
                                        AppointmentStatus status, Auditable audit) {
        return new Appointment(id, title, placeId, targetedTo, scheduledBy, scheduleTime,
                annotations == null ? List.of() : annotations, status, audit);
    }

    // ─── Transitions ──────────────────────────────────────────────────────────

    /**
     * Cancelling an already cancelled appointment succeeds again and logs another entry.
     * The schedule time is not checked, so an appointment already in the past can still be cancelled.
     *
     * @throws com.booking.shared.error.FailedPreconditionException if the appointment is completed
     */
    public void cancel(String actor, String reason) {
        if (status == AppointmentStatus.COMPLETED) {
            throw AppointmentErrors.alreadyCompleted();
        }
        annotate(Annotation.Kind.CANCEL, reason, actor);
        status = AppointmentStatus.CANCELLED;
        audit.recordUpdate(actor);
        events.register(new AppointmentCancelled(this, reason));
    }

    /**
     * Moves the appointment to {@code newTime} and back to SCHEDULED, also when it was cancelled.
     *
     * @return false, with no change at all, when {@code newTime} equals the current schedule time
     * @throws com.booking.shared.error.FailedPreconditionException if the appointment is completed
     * @throws com.booking.shared.error.InvalidArgumentException    if {@code newTime} is in the past
     */
    public boolean reschedule(String actor, String reason, Instant newTime) {
        if (status == AppointmentStatus.COMPLETED) {
            throw AppointmentErrors.alreadyCompleted();
        }
        Instant normalized = normalize(newTime);
        if (normalized.equals(scheduleTime)) {
            return false;
        }
        requireNotInPast(normalized);

        annotate(Annotation.Kind.RESCHEDULE, reason, actor);
        scheduleTime = normalized;
        status = AppointmentStatus.SCHEDULED;
        audit.recordUpdate(actor);
        events.register(new AppointmentRescheduled(this, reason));
        return true;
    }

    /** Completing twice is allowed and raises the event again. */
    public void markAsCompleted(String actor) {
        status = AppointmentStatus.COMPLETED;
        audit.recordUpdate(actor);
        events.register(new AppointmentCompleted(this));
    }

    /**
     * Applies every non-null field of {@code update} as one revision with one event.
     *
     * @return false when the update carries no field
     * @throws com.booking.shared.error.InvalidArgumentException if the resulting state is invalid
     */
    public boolean update(String actor, UpdateAppointment update) {
        if (update == null || update.isEmpty()) {
            return false;
        }
        Instant candidateTime = update.getScheduleTime() != null ? normalize(update.getScheduleTime()) : scheduleTime;
        AppointmentStatus candidateStatus = update.getStatus() != null ? update.getStatus() : status;
        if (!candidateTime.equals(scheduleTime)) {
            requireNotInPast(candidateTime);
        }
        requireValidStatus(candidateStatus);

        if (update.getTitle() != null) {
            title = update.getTitle();
        }
        if (update.getTargetedTo() != null) {
            targetedTo = update.getTargetedTo().isBlank() ? null : update.getTargetedTo();
        }
        if (update.getNote() != null) {
            annotations.add(new Annotation(Annotation.Kind.NOTE, update.getNote(), actor, now()));
        }
        scheduleTime = candidateTime;
        status = candidateStatus;
        audit.recordUpdate(actor);
        events.register(new AppointmentUpdated(this));
        return true;
    }

    public void delete(String actor) {
        audit.recordDelete(actor);
        events.register(new AppointmentDeleted(this));
    }

    // ─── Rules ────────────────────────────────────────────────────────────────

    private void annotate(Annotation.Kind kind, String reason, String actor) {
        annotations.add(new Annotation(kind, reason, actor, now()));
        audit.recordUpdate(actor);
    }

    private static void requireNotInPast(Instant scheduleTime) {
        if (scheduleTime.isBefore(now())) {
            throw AppointmentErrors.scheduledBeforeNow();
        }
    }

    private static void requireValidStatus(AppointmentStatus status) {
        if (status == null || status == AppointmentStatus.UNKNOWN) {
            throw AppointmentErrors.invalidStatus(status);
        }
    }

    private static Instant normalize(Instant time) {
        return Objects.requireNonNull(time, "scheduleTime").truncatedTo(ChronoUnit.MICROS);
    }

    private static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MICROS);
    }

    // ─── Accessors ────────────────────────────────────────────────────────────

    @Override
    public List<DomainEvent> pullEvents() {
        return events.pull();
    }

    public String getId() {
        return id;
    }

    public Title getTitle() {
        return title;
    }

    public String getPlaceId() {
        return placeId;
    }

    public String getTargetedTo() {
        return targetedTo;
    }

    public String getScheduledBy() {
        return scheduledBy;
    }

    public Instant getScheduleTime() {
        return scheduleTime;
    }

    public AppointmentStatus getStatus() {
        return status;
    }

    public List<Annotation> getAnnotations() {
        return Collections.unmodifiableList(annotations);
    }

    /** The action log as text, one rendered entry per line. */
    public String getNotes() {
        return annotations.stream().map(a -> a.render() + "\n").collect(Collectors.joining());
    }

    @Override
    public Instant getCreateTime() {
        return audit.getCreateTime();
    }

    @Override
    public String getCreateBy() {
        return audit.getCreateBy();
    }

    @Override
    public Instant getLastUpdateTime() {
        return audit.getLastUpdateTime();
    }

    @Override
    public String getLastUpdateBy() {
        return audit.getLastUpdateBy();
    }

    @Override
    public long getVersion() {
        return audit.getVersion();
    }

    @Override
    public boolean isDeleted() {
        return audit.isDeleted();
    }

    @Override
    public boolean isNew() {
        return audit.isNew();
    }

    @Override
    public long getStoredVersion() {
        return audit.getStoredVersion();
    }

    /** Called by the write repository after the appointment was stored. */
    public void markPersisted() {
        audit.markPersisted();
    }

    @Override
    public String toString() {
        return "Appointment{id=" + id + ", placeId=" + placeId + ", status=" + status
                + ", scheduleTime=" + scheduleTime + ", " + audit + "}";
    }
}
