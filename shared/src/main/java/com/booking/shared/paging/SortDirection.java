package com.booking.shared.paging;

public enum SortDirection {
    ASC,
    DESC
}
