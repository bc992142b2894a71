package com.booking.shared.paging;

import com.booking.shared.error.MalformedPageTokenException;
import com.booking.shared.paging.InMemoryCursorSource.Row;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CursorPaginatorTest {

    static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    PageTokenCipher cipher;
    CursorPaginator paginator;
    InMemoryCursorSource source;

    @BeforeEach
    void setUp() {
        cipher = new PageTokenCipher(new ObjectMapper(), PageTokenCipherTest.SECRET);
        paginator = new CursorPaginator(cipher, 2, 3);
        source = new InMemoryCursorSource()
                .add("a", T0.plusSeconds(1), "u1")
                .add("b", T0.plusSeconds(2), "u1")
                .add("c", T0.plusSeconds(3), "u1")
                .add("d", T0.plusSeconds(4), "u1");
    }

    // ─── Helpers ──────────────────────────────────────────────────────────────

    PageQuery ascending(Integer pageSize, String token) {
        return PageQuery.builder()
                .filter(Filter.equal("owner", "u1"))
                .sorting(Sorting.asc("time"))
                .pageSize(pageSize)
                .pageToken(token)
                .build();
    }

    static List<String> ids(Page<Row> page) {
        return page.getItems().stream().map(r -> r.id).toList();
    }

    // ─── Navigation ───────────────────────────────────────────────────────────

    @Test
    @DisplayName("pageSize=1 over 4 rows: next, next, then previous returns the first row again")
    void singleRowPagesWalkBothWays() {
        Page<Row> first = paginator.paginate(ascending(1, null), source);
        assertThat(ids(first)).containsExactly("a");
        assertThat(first.getPreviousPageToken()).isNull();
        assertThat(first.getNextPageToken()).isNotNull();

        Page<Row> second = paginator.paginate(ascending(1, first.getNextPageToken()), source);
        assertThat(ids(second)).containsExactly("b");
        assertThat(second.getPreviousPageToken()).isNotNull();
        assertThat(second.getNextPageToken()).isNotNull();

        Page<Row> back = paginator.paginate(ascending(1, second.getPreviousPageToken()), source);
        assertThat(ids(back)).containsExactly("a");
        assertThat(back.getPreviousPageToken()).isNull();
        assertThat(cipher.unseal(back.getNextPageToken()).cursor())
                .isEqualTo(cipher.unseal(first.getNextPageToken()).cursor());
    }

    @Test
    @DisplayName("last page carries no next token")
    void lastPageHasNoNext() {
        Page<Row> first = paginator.paginate(ascending(3, null), source);
        Page<Row> last = paginator.paginate(ascending(3, first.getNextPageToken()), source);

        assertThat(ids(first)).containsExactly("a", "b", "c");
        assertThat(ids(last)).containsExactly("d");
        assertThat(last.getNextPageToken()).isNull();
        assertThat(last.getPreviousPageToken()).isNotNull();
    }

    @Test
    @DisplayName("next then previous reconstructs the original page")
    void nextThenPreviousIsSymmetric() {
        Page<Row> first = paginator.paginate(ascending(2, null), source);
        Page<Row> second = paginator.paginate(ascending(2, first.getNextPageToken()), source);
        Page<Row> again = paginator.paginate(ascending(2, second.getPreviousPageToken()), source);

        assertThat(ids(second)).containsExactly("c", "d");
        assertThat(ids(again)).isEqualTo(ids(first));
    }

    @Test
    @DisplayName("descending listing keeps most-recent-first order when walking backward")
    void descendingBackwardKeepsDeclaredOrder() {
        PageQuery.PageQueryBuilder query = PageQuery.builder()
                .filter(Filter.equal("owner", "u1"))
                .sorting(Sorting.desc("time"))
                .pageSize(2);

        Page<Row> first = paginator.paginate(query.build(), source);
        Page<Row> second = paginator.paginate(query.pageToken(first.getNextPageToken()).build(), source);
        Page<Row> back = paginator.paginate(query.pageToken(second.getPreviousPageToken()).build(), source);

        assertThat(ids(first)).containsExactly("d", "c");
        assertThat(ids(second)).containsExactly("b", "a");
        assertThat(ids(back)).containsExactly("d", "c");
    }

    @Test
    @DisplayName("rows sharing a timestamp are ordered and paged by id")
    void tiesBrokenById() {
        InMemoryCursorSource tied = new InMemoryCursorSource()
                .add("x1", T0, "u1")
                .add("x2", T0, "u1")
                .add("x3", T0, "u1");

        Page<Row> first = paginator.paginate(ascending(2, null), tied);
        Page<Row> second = paginator.paginate(ascending(2, first.getNextPageToken()), tied);

        assertThat(ids(first)).containsExactly("x1", "x2");
        assertThat(ids(second)).containsExactly("x3");
    }

    // ─── Criteria ─────────────────────────────────────────────────────────────

    @Test
    @DisplayName("filters and the deleted flag restrict the listing")
    void filtersApply() {
        source.add("z", T0.plusSeconds(5), "u2").addDeleted("y", T0.plusSeconds(6), "u1");

        Page<Row> active = paginator.paginate(ascending(3, null), source);
        Page<Row> withDeleted = paginator.paginate(PageQuery.builder()
                .filter(Filter.in("owner", List.of("u1", "u2")))
                .sorting(Sorting.asc("time"))
                .includeDeleted(true)
                .pageSize(10)
                .build(), source);

        assertThat(ids(active)).containsExactly("a", "b", "c");
        assertThat(ids(withDeleted)).containsExactly("a", "b", "c");
        assertThat(withDeleted.getNextPageToken()).isNotNull();
    }

    @Test
    @DisplayName("page size defaults and is clamped to the maximum")
    void pageSizeResolution() {
        assertThat(ids(paginator.paginate(ascending(null, null), source))).hasSize(2);
        assertThat(ids(paginator.paginate(ascending(0, null), source))).hasSize(2);
        assertThat(ids(paginator.paginate(ascending(1000, null), source))).hasSize(3);
    }

    @Test
    @DisplayName("page size recorded in the token wins over the request")
    void tokenPageSizeWins() {
        Page<Row> first = paginator.paginate(ascending(1, null), source);

        Page<Row> second = paginator.paginate(ascending(3, first.getNextPageToken()), source);

        assertThat(ids(second)).containsExactly("b");
    }

    @Test
    @DisplayName("empty listing without a token yields the empty page and no probes")
    void emptyWithoutToken() {
        Page<Row> page = paginator.paginate(PageQuery.builder()
                .filter(Filter.equal("owner", "nobody"))
                .sorting(Sorting.asc("time"))
                .build(), source);

        assertThat(page.isEmpty()).isTrue();
        assertThat(page.getTotalItems()).isZero();
        assertThat(page.getNextPageToken()).isNull();
        assertThat(source.probes).isZero();
    }

    // ─── Token misuse ─────────────────────────────────────────────────────────

    @Test
    @DisplayName("a token replayed against other filters is rejected")
    void tokenBoundToFilters() {
        Page<Row> first = paginator.paginate(ascending(1, null), source);

        PageQuery otherOwner = PageQuery.builder()
                .filter(Filter.equal("owner", "u2"))
                .sorting(Sorting.asc("time"))
                .pageToken(first.getNextPageToken())
                .build();

        assertThatThrownBy(() -> paginator.paginate(otherOwner, source))
                .isInstanceOf(MalformedPageTokenException.class);
        assertThat(source.fetches).isEqualTo(1);
    }

    @Test
    @DisplayName("a token replayed with deleted rows switched on is rejected")
    void tokenBoundToDeletedFlag() {
        Page<Row> first = paginator.paginate(ascending(1, null), source);

        PageQuery widened = PageQuery.builder()
                .filter(Filter.equal("owner", "u1"))
                .sorting(Sorting.asc("time"))
                .includeDeleted(true)
                .pageToken(first.getNextPageToken())
                .build();

        assertThatThrownBy(() -> paginator.paginate(widened, source))
                .isInstanceOf(MalformedPageTokenException.class);
    }

    @Test
    @DisplayName("a forged token is rejected")
    void forgedTokenRejected() {
        assertThatThrownBy(() -> paginator.paginate(ascending(1, "Zm9yZ2VkLXRva2VuLXZhbHVlLXRoYXQtaXMtbG9uZw"), source))
                .isInstanceOf(MalformedPageTokenException.class);
    }

    @Test
    @DisplayName("invalid page size bounds fail fast")
    void invalidBounds() {
        assertThatThrownBy(() -> new CursorPaginator(cipher, 10, 5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CursorPaginator(cipher, 0, 5)).isInstanceOf(IllegalArgumentException.class);
    }
}
