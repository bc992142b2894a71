package com.booking.shared.error;

/**
 * Optimistic-concurrency failure: the stored row no longer carries the version the aggregate was
 * loaded with. Not fatal; reload the aggregate and retry the operation.
 */
public class ConflictException extends BookingException {

    private static final long serialVersionUID = 1L;

    private final String resource;
    private final String key;
    private final long expectedVersion;

    public ConflictException(String resource, String key, long expectedVersion) {
        super(String.format("%s %s was modified concurrently (expected version %d)", resource, key, expectedVersion),
                "CONCURRENT_MODIFICATION");
        this.resource = resource;
        this.key = key;
        this.expectedVersion = expectedVersion;
    }

    public ConflictException(String resource, String key, Throwable cause) {
        super(String.format("%s %s could not be written: %s", resource, key, cause.getMessage()),
                "CONCURRENT_MODIFICATION", cause);
        this.resource = resource;
        this.key = key;
        this.expectedVersion = -1;
    }

    public String getResource() {
        return resource;
    }

    public String getKey() {
        return key;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.CONFLICT;
    }
}
