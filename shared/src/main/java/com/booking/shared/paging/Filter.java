package com.booking.shared.paging;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.List;
import java.util.Objects;

/**
 * Equality or set-membership predicate over a logical field.
 */
@Getter
@EqualsAndHashCode
public final class Filter {

    private final String field;
    private final FilterOperator operator;
    private final List<String> values;

    private Filter(String field, FilterOperator operator, List<String> values) {
        this.field = Objects.requireNonNull(field, "field");
        this.operator = operator;
        this.values = List.copyOf(values);
    }

    public static Filter equal(String field, String value) {
        return new Filter(field, FilterOperator.EQUAL, List.of(Objects.requireNonNull(value, field)));
    }

    public static Filter in(String field, List<String> values) {
        if (values.isEmpty()) {
            throw new IllegalArgumentException("IN filter on " + field + " needs at least one value");
        }
        return new Filter(field, FilterOperator.IN, values);
    }

    /** Single value of an EQUAL filter. */
    public String value() {
        return values.get(0);
    }

    @Override
    public String toString() {
        return operator == FilterOperator.EQUAL
                ? field + "=" + values.get(0)
                : field + " in " + String.join(",", values);
    }
}
