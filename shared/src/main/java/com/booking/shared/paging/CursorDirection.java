package com.booking.shared.paging;

/**
 * Traversal direction recorded in a page token. FORWARD continues after the boundary row in the
 * listing's declared order, BACKWARD walks towards the start of the listing.
 */
public enum CursorDirection {
    FORWARD,
    BACKWARD
}
