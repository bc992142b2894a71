package com.booking.shared.error;

/**
 * The operation is valid in general but not in the aggregate's current state.
 */
public class FailedPreconditionException extends BookingException {

    private static final long serialVersionUID = 1L;

    public FailedPreconditionException(String message, String internalCode) {
        super(message, internalCode);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.FAILED_PRECONDITION;
    }
}
