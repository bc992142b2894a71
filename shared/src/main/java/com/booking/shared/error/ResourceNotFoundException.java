package com.booking.shared.error;

public class ResourceNotFoundException extends BookingException {

    private static final long serialVersionUID = 1L;

    private final String resource;
    private final String key;

    public ResourceNotFoundException(String resource, String key) {
        super(resource + " not found: " + key, resource.toUpperCase() + "_NOT_FOUND");
        this.resource = resource;
        this.key = key;
    }

    public String getResource() {
        return resource;
    }

    public String getKey() {
        return key;
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.NOT_FOUND;
    }
}
