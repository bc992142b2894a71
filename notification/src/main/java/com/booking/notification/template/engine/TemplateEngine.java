package com.booking.notification.template.engine;

import java.util.Map;

import com.booking.notification.template.NotificationContent;

public class TemplateEngine {

    public static final String ORGANIZATION_CREATED = "organization-created";
    public static final String APPOINTMENT_SCHEDULED = "appointment-scheduled";
    public static final String APPOINTMENT_CANCELLED = "appointment-cancelled";
    public static final String APPOINTMENT_RESCHEDULED = "appointment-rescheduled";

    private TemplateEngine() {}

    public static NotificationContent render(String templateId, Map<String, Object> vars) {
        return switch (templateId) {
            case ORGANIZATION_CREATED -> new NotificationContent(
                    "Welcome, " + vars.get("name") + " is ready",
                    String.format("Your organization %s was registered. You can now add places and staff.", vars.get("name")),
                    String.format("Organization %s registered.", vars.get("name"))
            );
            case APPOINTMENT_SCHEDULED -> new NotificationContent(
                    "Appointment confirmed: " + vars.get("title"),
                    String.format("Your appointment \"%s\" is booked for %s.", vars.get("title"), vars.get("scheduleTime")),
                    String.format("Booked: %s at %s.", vars.get("title"), vars.get("scheduleTime"))
            );
            case APPOINTMENT_CANCELLED -> new NotificationContent(
                    "Appointment cancelled",
                    String.format("Your appointment for %s was cancelled. Reason: %s.", vars.get("scheduleTime"), vars.get("reason")),
                    String.format("Appointment %s cancelled: %s.", vars.get("scheduleTime"), vars.get("reason"))
            );
            case APPOINTMENT_RESCHEDULED -> new NotificationContent(
                    "Appointment moved",
                    String.format("Your appointment now takes place at %s. Reason: %s.", vars.get("scheduleTime"), vars.get("reason")),
                    String.format("Appointment moved to %s.", vars.get("scheduleTime"))
            );
            default -> new NotificationContent("Booking Notification", vars.toString(), vars.toString());
        };
    }
}
