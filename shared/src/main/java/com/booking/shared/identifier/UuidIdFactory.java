package com.booking.shared.identifier;

import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
public class UuidIdFactory implements IdFactory {

    @Override
    public String newId() {
        return UUID.randomUUID().toString();
    }
}
