package com.booking.shared.events;

/**
 * Canonical event type constants.
 * All services MUST use these constants, never hardcode strings.
 * Changing a type here is a breaking change requiring consumer updates.
 */
public final class EventTypes {

    private EventTypes() {}

    // ── Organization Domain ───────────────────────────────────────────────────
    public static final String ORGANIZATION_CREATED = "organizations.created";
    public static final String ORGANIZATION_UPDATED = "organizations.updated";
    public static final String ORGANIZATION_DELETED = "organizations.deleted";

    // ── Appointment Domain ────────────────────────────────────────────────────
    public static final String APPOINTMENT_SCHEDULED   = "appointments.scheduled";
    public static final String APPOINTMENT_UPDATED     = "appointments.updated";
    public static final String APPOINTMENT_CANCELLED   = "appointments.cancelled";
    public static final String APPOINTMENT_RESCHEDULED = "appointments.rescheduled";
    public static final String APPOINTMENT_COMPLETED   = "appointments.completed";
    public static final String APPOINTMENT_DELETED     = "appointments.deleted";

    // ── Sources ───────────────────────────────────────────────────────────────
    public static final String SOURCE_ORGANIZATIONS = "/organizations";
    public static final String SOURCE_APPOINTMENTS  = "/appointments";

    // ── Kafka Topics (same as event types for simplicity) ─────────────────────
    public static final String TOPIC_ORGANIZATIONS_CREATED    = ORGANIZATION_CREATED;
    public static final String TOPIC_APPOINTMENTS_SCHEDULED   = APPOINTMENT_SCHEDULED;
    public static final String TOPIC_APPOINTMENTS_CANCELLED   = APPOINTMENT_CANCELLED;
    public static final String TOPIC_APPOINTMENTS_RESCHEDULED = APPOINTMENT_RESCHEDULED;

    /** Suffix of the dead-letter topic a consumer routes poison records to. */
    public static final String DLQ_SUFFIX = ".dlq";
}
