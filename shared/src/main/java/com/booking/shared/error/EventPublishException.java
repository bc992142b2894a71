package com.booking.shared.error;

public class EventPublishException extends BookingException {

    private static final long serialVersionUID = 1L;

    public EventPublishException(String message, Throwable cause) {
        super(message, "EVENT_PUBLISH_FAILED", cause);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.UNAVAILABLE;
    }
}
