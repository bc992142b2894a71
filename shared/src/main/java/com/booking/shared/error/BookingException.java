package com.booking.shared.error;

/**
 * Base class of every error the booking domain raises on purpose.
 *
 * Each subclass maps to one category of the error taxonomy so the transport layer can turn it into
 * a status code without inspecting messages. {@code internalCode} is a stable machine-readable code
 * (e.g. {@code SCHEDULED_BEFORE_CURRENT_TIME}) clients may switch on.
 */
public abstract class BookingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String internalCode;

    protected BookingException(String message, String internalCode) {
        super(message);
        this.internalCode = internalCode;
    }

    protected BookingException(String message, String internalCode, Throwable cause) {
        super(message, cause);
        this.internalCode = internalCode;
    }

    public abstract ErrorCategory getCategory();

    public String getInternalCode() {
        return internalCode;
    }
}
