package com.booking.appointment.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;

public interface AppointmentJpaRepository
        extends JpaRepository<AppointmentRecord, String>, JpaSpecificationExecutor<AppointmentRecord> {

    /**
     * Writes every mutable column while the row still carries {@code storedVersion}.
     *
     * @return rows updated, 0 on a version mismatch or a missing row
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE AppointmentRecord a
           SET a.title = :title,
               a.targetedTo = :targetedTo,
               a.scheduleTime = :scheduleTime,
               a.notes = :notes,
               a.status = :status,
               a.lastUpdateTime = :lastUpdateTime,
               a.lastUpdateBy = :lastUpdateBy,
               a.rowVersion = :version,
               a.deleted = :deleted
         WHERE a.id = :id
           AND a.rowVersion = :storedVersion
        """)
    int updateIfVersion(@Param("id") String id,
                        @Param("storedVersion") long storedVersion,
                        @Param("title") String title,
                        @Param("targetedTo") String targetedTo,
                        @Param("scheduleTime") Instant scheduleTime,
                        @Param("notes") String notes,
                        @Param("status") String status,
                        @Param("lastUpdateTime") Instant lastUpdateTime,
                        @Param("lastUpdateBy") String lastUpdateBy,
                        @Param("version") long version,
                        @Param("deleted") boolean deleted);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM AppointmentRecord a WHERE a.id = :id AND a.rowVersion = :storedVersion")
    int deleteIfVersion(@Param("id") String id, @Param("storedVersion") long storedVersion);
}
