package com.booking.shared.error;

/**
 * A page token failed to unseal, decode, or does not belong to the listing it was sent to.
 * Always a client error; never answered with the first page instead.
 */
public class MalformedPageTokenException extends InvalidArgumentException {

    private static final long serialVersionUID = 1L;

    public MalformedPageTokenException(String message) {
        super(message, "MALFORMED_PAGE_TOKEN");
    }

    public MalformedPageTokenException(String message, Throwable cause) {
        super(message, "MALFORMED_PAGE_TOKEN", cause);
    }
}
