package com.booking.appointment.repository;

import com.booking.appointment.domain.Annotation;
import com.booking.appointment.domain.Appointment;
import com.booking.appointment.domain.AppointmentErrors;
import com.booking.appointment.domain.AppointmentReadRepository;
import com.booking.appointment.domain.AppointmentRepository;
import com.booking.appointment.domain.AppointmentStatus;
import com.booking.appointment.domain.Title;
import com.booking.shared.audit.Auditable;
import com.booking.shared.error.ConflictException;
import com.booking.shared.paging.Cursor;
import com.booking.shared.paging.CursorPaginator;
import com.booking.shared.paging.Page;
import com.booking.shared.paging.PageQuery;
import com.booking.shared.paging.jpa.SpecificationCursorSource;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Relational store of appointments, serving both the write and the read contract.
 */
@Slf4j
@Repository
public class JpaAppointmentRepository implements AppointmentRepository, AppointmentReadRepository {

    private static final TypeReference<List<Annotation>> ANNOTATIONS = new TypeReference<>() {};

    private final AppointmentJpaRepository jpa;
    private final CursorPaginator paginator;
    private final ObjectMapper objectMapper;
    private final SpecificationCursorSource<AppointmentRecord> cursorSource;
    private final boolean hardDelete;

    public JpaAppointmentRepository(AppointmentJpaRepository jpa,
                                    CursorPaginator paginator,
                                    ObjectMapper objectMapper,
                                    @Value("${booking.persistence.hard-delete:false}") boolean hardDelete) {
        this.jpa = jpa;
        this.paginator = paginator;
        this.objectMapper = objectMapper;
        this.hardDelete = hardDelete;
        this.cursorSource = new SpecificationCursorSource<>(jpa,
                Map.of(FIELD_SCHEDULE_TIME, "scheduleTime",
                       FIELD_SCHEDULED_BY, "scheduledBy",
                       FIELD_PLACE_ID, "placeId",
                       FIELD_TARGETED_TO, "targetedTo",
                       FIELD_STATUS, "status"),
                r -> new Cursor(r.getScheduleTime().toString(), r.getId()));
    }

    @Override
    public void save(Appointment appointment) {
        if (appointment.isNew()) {
            insert(appointment);
            return;
        }
        int updated = jpa.updateIfVersion(appointment.getId(), appointment.getStoredVersion(),
                appointment.getTitle().value(), appointment.getTargetedTo(), appointment.getScheduleTime(),
                writeNotes(appointment.getAnnotations()), appointment.getStatus().label(),
                appointment.getLastUpdateTime(), appointment.getLastUpdateBy(),
                appointment.getVersion(), appointment.isDeleted());
        if (updated == 0) {
            throw new ConflictException(AppointmentErrors.RESOURCE, appointment.getId(), appointment.getStoredVersion());
        }
        appointment.markPersisted();
        log.debug("Appointment updated: appointmentId={}, version={}", appointment.getId(), appointment.getVersion());
    }

    private void insert(Appointment appointment) {
        if (jpa.existsById(appointment.getId())) {
            throw new ConflictException(AppointmentErrors.RESOURCE, appointment.getId(), 0L);
        }
        try {
            jpa.saveAndFlush(toRecord(appointment));
        } catch (DataIntegrityViolationException e) {
            throw new ConflictException(AppointmentErrors.RESOURCE, appointment.getId(), e);
        }
        appointment.markPersisted();
        log.debug("Appointment inserted: appointmentId={}", appointment.getId());
    }

    @Override
    public Optional<Appointment> findByKey(String id) {
        return jpa.findById(id).map(this::toEntity);
    }

    @Override
    public void delete(Appointment appointment) {
        if (!hardDelete) {
            save(appointment);
            return;
        }
        int deleted = jpa.deleteIfVersion(appointment.getId(), appointment.getStoredVersion());
        if (deleted == 0) {
            throw new ConflictException(AppointmentErrors.RESOURCE, appointment.getId(), appointment.getStoredVersion());
        }
    }

    @Override
    public void deleteByKey(String id) {
        jpa.deleteById(id);
    }

    @Override
    public Page<Appointment> findAll(PageQuery query) {
        return paginator.paginate(query, cursorSource).map(this::toEntity);
    }

    AppointmentRecord toRecord(Appointment appointment) {
        return AppointmentRecord.builder()
                .id(appointment.getId())
                .title(appointment.getTitle().value())
                .placeId(appointment.getPlaceId())
                .targetedTo(appointment.getTargetedTo())
                .scheduledBy(appointment.getScheduledBy())
                .scheduleTime(appointment.getScheduleTime())
                .notes(writeNotes(appointment.getAnnotations()))
                .status(appointment.getStatus().label())
                .createTime(appointment.getCreateTime())
                .createBy(appointment.getCreateBy())
                .lastUpdateTime(appointment.getLastUpdateTime())
                .lastUpdateBy(appointment.getLastUpdateBy())
                .rowVersion(appointment.getVersion())
                .deleted(appointment.isDeleted())
                .build();
    }

    Appointment toEntity(AppointmentRecord record) {
        return Appointment.restore()
                .id(record.getId())
                .title(Title.restore(record.getTitle()))
                .placeId(record.getPlaceId())
                .targetedTo(record.getTargetedTo())
                .scheduledBy(record.getScheduledBy())
                .scheduleTime(record.getScheduleTime())
                .annotations(readNotes(record))
                .status(AppointmentStatus.fromLabel(record.getStatus()))
                .audit(Auditable.restore()
                        .createTime(record.getCreateTime())
                        .createBy(record.getCreateBy())
                        .lastUpdateTime(record.getLastUpdateTime())
                        .lastUpdateBy(record.getLastUpdateBy())
                        .version(record.getRowVersion())
                        .deleted(record.isDeleted())
                        .build())
                .build();
    }

    private String writeNotes(List<Annotation> annotations) {
        try {
            return objectMapper.writeValueAsString(annotations);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize appointment notes", e);
        }
    }

    private List<Annotation> readNotes(AppointmentRecord record) {
        if (record.getNotes() == null || record.getNotes().isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(record.getNotes(), ANNOTATIONS);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable notes on appointment " + record.getId(), e);
        }
    }
}
