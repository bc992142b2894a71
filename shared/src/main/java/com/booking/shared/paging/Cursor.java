package com.booking.shared.paging;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

/**
 * Position of a row in a listing: the sort field value rendered as a string plus the row id,
 * which breaks ties between rows sharing the same sort value.
 */
@Getter
@EqualsAndHashCode
public final class Cursor {

    private final String value;
    private final String id;

    public Cursor(String value, String id) {
        this.value = Objects.requireNonNull(value, "value");
        this.id = Objects.requireNonNull(id, "id");
    }

    @Override
    public String toString() {
        return value + "/" + id;
    }
}
