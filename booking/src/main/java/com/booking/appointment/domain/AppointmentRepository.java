package com.booking.appointment.domain;

import java.util.Optional;

/**
 * Strongly consistent store of appointments, used by every write path.
 */
public interface AppointmentRepository {

    /**
     * Inserts a new appointment or applies a conditional update guarded by its stored version.
     *
     * @throws com.booking.shared.error.ConflictException when the row changed since it was loaded
     */
    void save(Appointment appointment);

    Optional<Appointment> findByKey(String id);

    void delete(Appointment appointment);

    void deleteByKey(String id);
}
