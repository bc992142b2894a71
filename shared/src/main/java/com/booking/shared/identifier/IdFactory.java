package com.booking.shared.identifier;

/**
 * Source of identifiers for new aggregates.
 */
public interface IdFactory {

    String newId();
}
