package com.booking.shared.web;

import com.booking.shared.paging.Page;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import java.util.List;
import java.util.function.Function;

@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PageResponse<T> {

    @JsonProperty("total_items")
    private final int totalItems;

    @JsonProperty("previous_page_token")
    private final String previousPageToken;

    @JsonProperty("next_page_token")
    private final String nextPageToken;

    private final List<T> items;

    private PageResponse(int totalItems, String previousPageToken, String nextPageToken, List<T> items) {
        this.totalItems = totalItems;
        this.previousPageToken = previousPageToken;
        this.nextPageToken = nextPageToken;
        this.items = items;
    }

    public static <S, T> PageResponse<T> of(Page<S> page, Function<? super S, ? extends T> mapper) {
        List<T> items = page.getItems().stream().<T>map(mapper).toList();
        return new PageResponse<>(page.getTotalItems(), page.getPreviousPageToken(), page.getNextPageToken(), items);
    }
}
