package com.booking.shared.error;

public enum ErrorCategory {
    INVALID_ARGUMENT,
    FAILED_PRECONDITION,
    NOT_FOUND,
    ALREADY_EXISTS,
    CONFLICT,
    UNAVAILABLE
}
