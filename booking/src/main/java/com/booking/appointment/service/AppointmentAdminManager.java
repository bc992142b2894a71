package com.booking.appointment.service;

import com.booking.appointment.domain.Appointment;
import com.booking.appointment.domain.AppointmentRepository;
import com.booking.appointment.domain.UpdateAppointment;
import com.booking.shared.events.EventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Administrative operations on appointments: free-form updates and deletion.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AppointmentAdminManager {

    private final AppointmentRepository appointmentRepository;
    private final EventPublisher eventPublisher;

    @Transactional
    public Appointment updateById(String id, String actor, UpdateAppointment update) {
        Appointment appointment = AppointmentScheduler.load(appointmentRepository, id);
        if (!appointment.update(actor, update)) {
            return appointment;
        }
        appointmentRepository.save(appointment);
        eventPublisher.publish(appointment.pullEvents());

        log.info("Appointment updated: appointmentId={}, version={}, actor={}", id, appointment.getVersion(), actor);
        return appointment;
    }

    /** A missing or already deleted appointment is not an error. */
    @Transactional
    public void deleteById(String id, String actor) {
        Optional<Appointment> found = appointmentRepository.findByKey(id);
        if (found.isEmpty() || found.get().isDeleted()) {
            log.debug("Appointment delete skipped, not found: appointmentId={}", id);
            return;
        }

        Appointment appointment = found.get();
        appointment.delete(actor);
        appointmentRepository.delete(appointment);
        eventPublisher.publish(appointment.pullEvents());

        log.info("Appointment deleted: appointmentId={}, actor={}", id, actor);
    }
}
