package com.booking.shared.paging;

public enum FilterOperator {
    EQUAL,
    IN
}
