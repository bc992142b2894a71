package com.booking.appointment.repository;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * Appointment JPA row. {@code notes} holds the action log as a JSON array; {@code status} holds the
 * status label.
 */
@Entity
@Table(name = "appointments", indexes = {
    @Index(name = "idx_appointments_scheduled_by", columnList = "scheduled_by, schedule_time, id"),
    @Index(name = "idx_appointments_place", columnList = "place_id, schedule_time, id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AppointmentRecord implements Persistable<String> {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "title", nullable = false, length = 128)
    private String title;

    @Column(name = "place_id", nullable = false, updatable = false, length = 64)
    private String placeId;

    @Column(name = "targeted_to", length = 64)
    private String targetedTo;

    @Column(name = "scheduled_by", nullable = false, updatable = false, length = 64)
    private String scheduledBy;

    @Column(name = "schedule_time", nullable = false)
    private Instant scheduleTime;

    @Column(name = "notes", nullable = false, length = 65535)
    private String notes;

    @Column(name = "status", nullable = false, length = 32)
    private String status;

    @Column(name = "create_time", nullable = false, updatable = false)
    private Instant createTime;

    @Column(name = "create_by", nullable = false, updatable = false, length = 128)
    private String createBy;

    @Column(name = "last_update_time", nullable = false)
    private Instant lastUpdateTime;

    @Column(name = "last_update_by", nullable = false, length = 128)
    private String lastUpdateBy;

    @Column(name = "row_version", nullable = false)
    private long rowVersion;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @PostLoad
    @PostPersist
    void markStored() {
        newRecord = false;
    }

    @Override
    public boolean isNew() {
        return newRecord;
    }
}
