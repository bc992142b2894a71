package com.booking.appointment.api;

import com.booking.appointment.domain.Annotation;
import com.booking.appointment.domain.Appointment;
import com.booking.appointment.domain.AppointmentStatus;
import com.booking.appointment.domain.Title;
import com.booking.appointment.domain.UpdateAppointment;
import com.booking.appointment.service.AppointmentAdminManager;
import com.booking.appointment.service.AppointmentFetcher;
import com.booking.appointment.service.AppointmentScheduler;
import com.booking.appointment.service.AppointmentView;
import com.booking.appointment.service.ScheduleAppointmentCommand;
import com.booking.shared.web.DataContainer;
import com.booking.shared.web.PageResponse;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.time.Instant;
import java.util.List;

/**
 * Appointment REST Controller
 *
 * POST   /api/v1/appointments                     schedule
 * GET    /api/v1/appointments/{id}                fetch with place, employee and user
 * POST   /api/v1/appointments/{id}/cancel         cancel
 * POST   /api/v1/appointments/{id}/reschedule     reschedule
 * POST   /api/v1/appointments/{id}/complete       mark as completed
 * PATCH  /api/v1/appointments/{id}                admin update
 * DELETE /api/v1/appointments/{id}                admin delete (idempotent)
 * GET    /api/v1/users/{userId}/appointments      a user's appointments, latest first
 * GET    /api/v1/places/{placeId}/appointments    a place's appointments, latest first
 *
 * The acting user is taken from the X-User-Id header.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class AppointmentController {

    static final String USER_HEADER = "X-User-Id";

    private final AppointmentScheduler scheduler;
    private final AppointmentAdminManager adminManager;
    private final AppointmentFetcher fetcher;

    // ─── Scheduling ───────────────────────────────────────────────────────────

    @PostMapping("/appointments")
    public ResponseEntity<DataContainer<AppointmentResponse>> schedule(
            @Valid @RequestBody ScheduleAppointmentRequest request,
            @RequestHeader(USER_HEADER) String actor) {

        Appointment appointment = scheduler.schedule(ScheduleAppointmentCommand.builder()
                .title(request.getTitle())
                .placeId(request.getPlaceId())
                .targetedTo(request.getTargetedTo())
                .scheduleTime(request.getScheduleTime())
                .actor(actor)
                .build());

        return ResponseEntity
                .created(URI.create("/api/v1/appointments/" + appointment.getId()))
                .body(DataContainer.of(AppointmentResponse.from(appointment)));
    }

    @PostMapping("/appointments/{appointmentId}/cancel")
    public DataContainer<AppointmentResponse> cancel(@PathVariable String appointmentId,
                                                     @Valid @RequestBody CancelAppointmentRequest request,
                                                     @RequestHeader(USER_HEADER) String actor) {
        return DataContainer.of(AppointmentResponse.from(scheduler.cancel(appointmentId, actor, request.getReason())));
    }

    @PostMapping("/appointments/{appointmentId}/reschedule")
    public DataContainer<AppointmentResponse> reschedule(@PathVariable String appointmentId,
                                                         @Valid @RequestBody RescheduleAppointmentRequest request,
                                                         @RequestHeader(USER_HEADER) String actor) {
        Appointment appointment = scheduler.reschedule(appointmentId, actor, request.getReason(),
                request.getScheduleTime());
        return DataContainer.of(AppointmentResponse.from(appointment));
    }

    @PostMapping("/appointments/{appointmentId}/complete")
    public DataContainer<AppointmentResponse> complete(@PathVariable String appointmentId,
                                                       @RequestHeader(USER_HEADER) String actor) {
        return DataContainer.of(AppointmentResponse.from(scheduler.complete(appointmentId, actor)));
    }

    // ─── Administration ───────────────────────────────────────────────────────

    @PatchMapping("/appointments/{appointmentId}")
    public DataContainer<AppointmentResponse> update(@PathVariable String appointmentId,
                                                     @Valid @RequestBody UpdateAppointmentRequest request,
                                                     @RequestHeader(USER_HEADER) String actor) {
        Appointment appointment = adminManager.updateById(appointmentId, actor, request.toUpdate());
        return DataContainer.of(AppointmentResponse.from(appointment));
    }

    @DeleteMapping("/appointments/{appointmentId}")
    public ResponseEntity<Void> delete(@PathVariable String appointmentId,
                                       @RequestHeader(USER_HEADER) String actor) {
        adminManager.deleteById(appointmentId, actor);
        return ResponseEntity.noContent().build();
    }

    // ─── Read Endpoints ───────────────────────────────────────────────────────

    @GetMapping("/appointments/{appointmentId}")
    public DataContainer<AppointmentResponse> get(@PathVariable String appointmentId) {
        return DataContainer.of(AppointmentResponse.fromView(fetcher.getByKey(appointmentId)));
    }

    @GetMapping("/users/{userId}/appointments")
    public DataContainer<PageResponse<AppointmentResponse>> listByUser(
            @PathVariable String userId,
            @RequestParam(name = "page_size", required = false) Integer pageSize,
            @RequestParam(name = "page_token", required = false) String pageToken) {
        return DataContainer.of(PageResponse.of(fetcher.listByUser(userId, pageSize, pageToken),
                AppointmentResponse::fromView));
    }

    @GetMapping("/places/{placeId}/appointments")
    public DataContainer<PageResponse<AppointmentResponse>> listByPlace(
            @PathVariable String placeId,
            @RequestParam(name = "page_size", required = false) Integer pageSize,
            @RequestParam(name = "page_token", required = false) String pageToken) {
        return DataContainer.of(PageResponse.of(fetcher.listByPlace(placeId, pageSize, pageToken),
                AppointmentResponse::fromView));
    }
}

// ─── Request / Response DTOs ───────────────────────────────────────────────────

@Data
class ScheduleAppointmentRequest {
    @NotBlank @Size(max = Title.MAX_LENGTH) private String title;
    @NotBlank @JsonProperty("place_id") private String placeId;
    @JsonProperty("targeted_to") private String targetedTo;
    @NotNull @JsonProperty("schedule_time") private Instant scheduleTime;
}

@Data
class CancelAppointmentRequest {
    @NotBlank @Size(max = 1000) private String reason;
}

@Data
class RescheduleAppointmentRequest {
    @NotBlank @Size(max = 1000) private String reason;
    @NotNull @JsonProperty("schedule_time") private Instant scheduleTime;
}

@Data
class UpdateAppointmentRequest {
    @Size(min = 1, max = Title.MAX_LENGTH) private String title;
    @JsonProperty("targeted_to") private String targetedTo;
    @JsonProperty("schedule_time") private Instant scheduleTime;
    @Size(max = 1000) private String note;
    private String status;

    UpdateAppointment toUpdate() {
        return UpdateAppointment.builder()
                .title(title != null ? Title.of(title) : null)
                .targetedTo(targetedTo)
                .scheduleTime(scheduleTime)
                .note(note)
                .status(status != null ? AppointmentStatus.fromLabel(status) : null)
                .build();
    }
}

@Data
@lombok.Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
class AppointmentResponse {
    @JsonProperty("appointment_id") private String appointmentId;
    private String title;
    @JsonProperty("place_id") private String placeId;
    @JsonProperty("place_name") private String placeName;
    @JsonProperty("targeted_to") private String targetedTo;
    @JsonProperty("targeted_to_name") private String targetedToName;
    @JsonProperty("scheduled_by") private String scheduledBy;
    @JsonProperty("scheduled_by_name") private String scheduledByName;
    @JsonProperty("schedule_time") private Instant scheduleTime;
    private String status;
    private List<Annotation> notes;
    @JsonProperty("create_time") private Instant createTime;
    @JsonProperty("last_update_time") private Instant lastUpdateTime;
    @JsonProperty("last_update_by") private String lastUpdateBy;
    private long version;

    static AppointmentResponse from(Appointment appointment) {
        return base(appointment).build();
    }

    static AppointmentResponse fromView(AppointmentView view) {
        AppointmentResponseBuilder builder = base(view.getAppointment());
        if (view.getPlace() != null) {
            builder.placeName(view.getPlace().getName());
        }
        if (view.getTargetedTo() != null) {
            builder.targetedToName(view.getTargetedTo().getFullName());
        }
        if (view.getScheduledBy() != null) {
            builder.scheduledByName(view.getScheduledBy().getFullName());
        }
        return builder.build();
    }

    private static AppointmentResponseBuilder base(Appointment appointment) {
        return AppointmentResponse.builder()
                .appointmentId(appointment.getId())
                .title(appointment.getTitle().value())
                .placeId(appointment.getPlaceId())
                .targetedTo(appointment.getTargetedTo())
                .scheduledBy(appointment.getScheduledBy())
                .scheduleTime(appointment.getScheduleTime())
                .status(appointment.getStatus().label())
                .notes(appointment.getAnnotations())
                .createTime(appointment.getCreateTime())
                .lastUpdateTime(appointment.getLastUpdateTime())
                .lastUpdateBy(appointment.getLastUpdateBy())
                .version(appointment.getVersion());
    }
}
