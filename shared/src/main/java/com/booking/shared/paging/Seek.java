package com.booking.shared.paging;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * One keyset read against a {@link CursorSource}: rows matching the filters, strictly beyond
 * {@code boundary} (or from the start when it is {@code null}) in the given direction, at most
 * {@code limit} of them, returned in traversal order.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class Seek {

    private final List<Filter> filters;
    private final Sorting sorting;
    private final boolean includeDeleted;
    private final Cursor boundary;
    private final CursorDirection direction;
    private final int limit;

    /**
     * Whether rows come back in ascending sort order. Walking backward through an ascending listing
     * reads descending, and vice versa.
     */
    public boolean ascending() {
        boolean declaredAscending = sorting.getDirection() == SortDirection.ASC;
        return direction == CursorDirection.FORWARD ? declaredAscending : !declaredAscending;
    }
}
