package com.booking.organization.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Fields of an organization that may change after registration. {@code null} leaves a field as is.
 */
@Getter
@Builder
@ToString
public class UpdateOrganization {

    private final String name;

    public boolean isEmpty() {
        return name == null;
    }
}
