package com.booking.shared.error;

/**
 * A value the caller supplied breaks a domain rule (e.g. an appointment scheduled in the past).
 */
public class InvalidArgumentException extends BookingException {

    private static final long serialVersionUID = 1L;

    public InvalidArgumentException(String message, String internalCode) {
        super(message, internalCode);
    }

    public InvalidArgumentException(String message, String internalCode, Throwable cause) {
        super(message, internalCode, cause);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.INVALID_ARGUMENT;
    }
}
