package com.booking.appointment.domain;

import com.booking.shared.error.InvalidArgumentException;

import java.util.Locale;
import java.util.Objects;

/**
 * Appointment title: trimmed, non-blank, at most {@value #MAX_LENGTH} characters, each word capitalized
 * ("dental check-up" becomes "Dental Check-up").
 */
public final class Title {

    public static final int MAX_LENGTH = 128;

    private final String value;

    private Title(String value) {
        this.value = value;
    }

    public static Title of(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidArgumentException("title must not be blank", AppointmentErrors.INVALID_TITLE);
        }
        String trimmed = raw.trim().replaceAll("\\s+", " ");
        if (trimmed.length() > MAX_LENGTH) {
            throw new InvalidArgumentException("title must be at most " + MAX_LENGTH + " characters",
                    AppointmentErrors.INVALID_TITLE);
        }
        return new Title(titleCase(trimmed));
    }

    /** Wraps a title read back from storage, which was normalized when first written. */
    public static Title restore(String stored) {
        return new Title(Objects.requireNonNull(stored, "title"));
    }

    private static String titleCase(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean startOfWord = true;
        for (char c : text.toCharArray()) {
            sb.append(startOfWord ? Character.toTitleCase(c) : Character.toLowerCase(c));
            startOfWord = c == ' ';
        }
        return sb.toString();
    }

    public String value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Title)) return false;
        return value.equals(((Title) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
