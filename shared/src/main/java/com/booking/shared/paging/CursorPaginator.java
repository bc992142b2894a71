package com.booking.shared.paging;

import com.booking.shared.error.MalformedPageTokenException;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Keyset pagination over any {@link CursorSource}.
 *
 * <ol>
 *   <li>Without a token the first {@code pageSize} rows of the listing are read.</li>
 *   <li>With a token the sealed cursor is recovered and rows strictly beyond it are read in the
 *       recorded direction. Backward reads are reversed so items keep the declared order.</li>
 *   <li>Two existence probes decide whether rows lie before the first item and after the last one;
 *       only then is a previous or next token sealed.</li>
 * </ol>
 *
 * A token is bound to the criteria that produced it through a fingerprint. Presenting it with
 * other filters, sorting or deleted-row visibility is rejected as malformed.
 */
@Slf4j
public class CursorPaginator {

    private final PageTokenCipher cipher;
    private final int defaultPageSize;
    private final int maxPageSize;

    public CursorPaginator(PageTokenCipher cipher, int defaultPageSize, int maxPageSize) {
        if (defaultPageSize <= 0 || maxPageSize < defaultPageSize) {
            throw new IllegalArgumentException(
                    "page sizes must satisfy 0 < default <= max, got " + defaultPageSize + "/" + maxPageSize);
        }
        this.cipher = cipher;
        this.defaultPageSize = defaultPageSize;
        this.maxPageSize = maxPageSize;
    }

    public <T> Page<T> paginate(PageQuery query, CursorSource<T> source) {
        String fingerprint = fingerprint(query);
        Cursor boundary = null;
        CursorDirection direction = CursorDirection.FORWARD;
        int pageSize = resolvePageSize(query.getPageSize());

        if (query.hasPageToken()) {
            PageToken token = cipher.unseal(query.getPageToken());
            if (!fingerprint.equals(token.getFingerprint())) {
                throw new MalformedPageTokenException("page token was issued for a different listing");
            }
            if (token.getCursorValue() == null || token.getCursorId() == null || token.getDirection() == null) {
                throw new MalformedPageTokenException("page token carries no cursor");
            }
            boundary = token.cursor();
            direction = token.getDirection();
            pageSize = resolvePageSize(token.getPageSize());
        }

        Seek seek = Seek.builder()
                .filters(query.getFilters())
                .sorting(query.getSorting())
                .includeDeleted(query.isIncludeDeleted())
                .boundary(boundary)
                .direction(direction)
                .limit(pageSize)
                .build();

        List<T> rows = new ArrayList<>(source.fetch(seek));
        if (rows.isEmpty()) {
            log.debug("Empty page: sorting={}, boundary={}, direction={}", query.getSorting(), boundary, direction);
            return Page.empty();
        }
        if (direction == CursorDirection.BACKWARD) {
            Collections.reverse(rows);
        }

        Cursor first = source.cursorOf(rows.get(0));
        Cursor last = source.cursorOf(rows.get(rows.size() - 1));
        boolean hasPrevious = source.exists(seek.toBuilder()
                .boundary(first).direction(CursorDirection.BACKWARD).limit(1).build());
        boolean hasNext = source.exists(seek.toBuilder()
                .boundary(last).direction(CursorDirection.FORWARD).limit(1).build());

        String previousToken = hasPrevious
                ? seal(fingerprint, first, CursorDirection.BACKWARD, pageSize, query.isIncludeDeleted())
                : null;
        String nextToken = hasNext
                ? seal(fingerprint, last, CursorDirection.FORWARD, pageSize, query.isIncludeDeleted())
                : null;

        return new Page<>(rows, previousToken, nextToken);
    }

    int resolvePageSize(Integer requested) {
        if (requested == null || requested <= 0) {
            return defaultPageSize;
        }
        return Math.min(requested, maxPageSize);
    }

    private String seal(String fingerprint, Cursor cursor, CursorDirection direction,
                        int pageSize, boolean includeDeleted) {
        return cipher.seal(PageToken.builder()
                .fingerprint(fingerprint)
                .cursorValue(cursor.getValue())
                .cursorId(cursor.getId())
                .direction(direction)
                .pageSize(pageSize)
                .includeDeleted(includeDeleted)
                .build());
    }

    static String fingerprint(PageQuery query) {
        String canonical = query.getFilters().stream().map(Filter::toString).collect(Collectors.joining(";"))
                + "|" + query.getSorting()
                + "|" + query.isIncludeDeleted();
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(canonical.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
