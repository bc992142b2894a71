package com.booking.shared.paging;

import java.util.List;

/**
 * Store-specific half of keyset pagination. Implementations translate a {@link Seek} into a query
 * on their backend; {@link CursorPaginator} owns everything else.
 *
 * @param <T> row type of the listing
 */
public interface CursorSource<T> {

    /** Rows beyond the boundary in traversal order, at most {@code seek.getLimit()}. */
    List<T> fetch(Seek seek);

    /** Whether at least one row lies beyond the boundary under the same filters. */
    boolean exists(Seek seek);

    Cursor cursorOf(T row);
}
