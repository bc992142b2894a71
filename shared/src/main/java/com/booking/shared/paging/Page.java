package com.booking.shared.paging;

import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * A bounded, ordered slice of a listing with the sealed tokens that continue it.
 * Items are always in the listing's declared order, whichever direction was walked to reach them.
 */
@Getter
@ToString
public final class Page<T> {

    private static final Page<?> EMPTY = new Page<>(List.of(), null, null);

    private final List<T> items;
    private final String previousPageToken;
    private final String nextPageToken;

    public Page(List<T> items, String previousPageToken, String nextPageToken) {
        this.items = List.copyOf(items);
        this.previousPageToken = previousPageToken;
        this.nextPageToken = nextPageToken;
    }

    @SuppressWarnings("unchecked")
    public static <T> Page<T> empty() {
        return (Page<T>) EMPTY;
    }

    public int getTotalItems() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public Optional<String> previousPageToken() {
        return Optional.ofNullable(previousPageToken);
    }

    public Optional<String> nextPageToken() {
        return Optional.ofNullable(nextPageToken);
    }

    public <R> Page<R> map(Function<? super T, ? extends R> mapper) {
        return new Page<>(items.stream().<R>map(mapper).toList(), previousPageToken, nextPageToken);
    }
}
