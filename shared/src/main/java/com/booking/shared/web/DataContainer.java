package com.booking.shared.web;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Envelope of every successful JSON body: {@code {"data": ...}}.
 */
@Getter
@AllArgsConstructor(staticName = "of")
public class DataContainer<T> {

    private final T data;
}
