package com.booking.appointment.service;

import com.booking.appointment.domain.Appointment;
import com.booking.appointment.domain.AppointmentErrors;
import com.booking.appointment.domain.AppointmentRepository;
import com.booking.appointment.domain.NewAppointment;
import com.booking.appointment.domain.Title;
import com.booking.shared.events.EventPublisher;
import com.booking.shared.identifier.IdFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Operations available to the booking user: schedule, cancel, reschedule, complete.
 *
 * Works on the transactional {@link AppointmentRepository} only; every operation saves the aggregate
 * and publishes the events it drained within the same transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AppointmentScheduler {

    private final AppointmentRepository appointmentRepository;
    private final EventPublisher eventPublisher;
    private final IdFactory idFactory;

    @Transactional
    public Appointment schedule(ScheduleAppointmentCommand cmd) {
        Appointment appointment = Appointment.create(NewAppointment.builder()
                .id(idFactory.newId())
                .title(Title.of(cmd.getTitle()))
                .placeId(cmd.getPlaceId())
                .targetedTo(cmd.getTargetedTo())
                .scheduledBy(cmd.getActor())
                .scheduleTime(cmd.getScheduleTime())
                .build(), cmd.getActor());
        persist(appointment);

        log.info("Appointment scheduled: appointmentId={}, placeId={}, scheduleTime={}, actor={}",
                appointment.getId(), appointment.getPlaceId(), appointment.getScheduleTime(), cmd.getActor());
        return appointment;
    }

    @Transactional
    public Appointment cancel(String id, String actor, String reason) {
        Appointment appointment = load(appointmentRepository, id);
        appointment.cancel(actor, reason);
        persist(appointment);

        log.info("Appointment cancelled: appointmentId={}, version={}, actor={}", id, appointment.getVersion(), actor);
        return appointment;
    }

    /** Rescheduling to the current schedule time returns the appointment unchanged. */
    @Transactional
    public Appointment reschedule(String id, String actor, String reason, Instant newTime) {
        Appointment appointment = load(appointmentRepository, id);
        if (!appointment.reschedule(actor, reason, newTime)) {
            log.debug("Appointment reschedule skipped, same time: appointmentId={}", id);
            return appointment;
        }
        persist(appointment);

        log.info("Appointment rescheduled: appointmentId={}, scheduleTime={}, actor={}",
                id, appointment.getScheduleTime(), actor);
        return appointment;
    }

    @Transactional
    public Appointment complete(String id, String actor) {
        Appointment appointment = load(appointmentRepository, id);
        appointment.markAsCompleted(actor);
        persist(appointment);

        log.info("Appointment completed: appointmentId={}, actor={}", id, actor);
        return appointment;
    }

    private void persist(Appointment appointment) {
        appointmentRepository.save(appointment);
        eventPublisher.publish(appointment.pullEvents());
    }

    /** Loads a live appointment for a write path; deleted ones count as missing. */
    static Appointment load(AppointmentRepository repository, String id) {
        return repository.findByKey(id)
                .filter(a -> !a.isDeleted())
                .orElseThrow(() -> AppointmentErrors.notFound(id));
    }
}
