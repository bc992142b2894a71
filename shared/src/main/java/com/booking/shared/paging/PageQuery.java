package com.booking.shared.paging;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;

/**
 * What a caller asks a read repository for: the criteria of the listing, a requested page size and,
 * when continuing a listing, the token handed out with the previous page.
 *
 * The criteria must stay the same for the whole traversal; a token presented with different
 * criteria is rejected.
 */
@Getter
@Builder
@ToString(exclude = "pageToken")
public class PageQuery {

    @Singular
    private final List<Filter> filters;

    private final Sorting sorting;

    /** Requested page size; {@code null} or non-positive selects the configured default. */
    private final Integer pageSize;

    private final String pageToken;

    private final boolean includeDeleted;

    public boolean hasPageToken() {
        return pageToken != null && !pageToken.isBlank();
    }
}
