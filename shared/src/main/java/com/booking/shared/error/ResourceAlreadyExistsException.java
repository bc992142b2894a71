package com.booking.shared.error;

/**
 * A uniqueness rule enforced by an application service was violated (e.g. organization name).
 */
public class ResourceAlreadyExistsException extends BookingException {

    private static final long serialVersionUID = 1L;

    public ResourceAlreadyExistsException(String resource, String attribute, String value) {
        super(String.format("%s with %s '%s' already exists", resource, attribute, value),
                resource.toUpperCase() + "_ALREADY_EXISTS");
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.ALREADY_EXISTS;
    }
}
