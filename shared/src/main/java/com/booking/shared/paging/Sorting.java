package com.booking.shared.paging;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.Objects;

/**
 * Sort field of a listing plus its declared direction. The field is a logical name resolved by the
 * {@link CursorSource}; it is never a raw column.
 */
@Getter
@EqualsAndHashCode
public final class Sorting {

    private final String field;
    private final SortDirection direction;

    private Sorting(String field, SortDirection direction) {
        this.field = Objects.requireNonNull(field, "field");
        this.direction = Objects.requireNonNull(direction, "direction");
    }

    public static Sorting asc(String field) {
        return new Sorting(field, SortDirection.ASC);
    }

    public static Sorting desc(String field) {
        return new Sorting(field, SortDirection.DESC);
    }

    @Override
    public String toString() {
        return field + " " + direction;
    }
}
