package com.booking.shared.paging;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Plain content of a page token before sealing. Never leaves the process unencrypted.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageToken {

    /** Digest of filters, sorting and the deleted-rows flag of the listing that issued the token. */
    private String fingerprint;

    private String cursorValue;
    private String cursorId;
    private CursorDirection direction;
    private int pageSize;
    private boolean includeDeleted;

    public Cursor cursor() {
        return new Cursor(cursorValue, cursorId);
    }
}
