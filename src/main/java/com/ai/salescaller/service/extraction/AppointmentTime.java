package com.ai.salescaller.service.extraction;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;

/**
 * Resolved appointment slot: the local date-time plus how to read it back to the customer.
 */
public final class AppointmentTime {

    private static final DateTimeFormatter SPOKEN = DateTimeFormatter.ofPattern("EEEE, MMMM d 'at' h:mm a", Locale.US);

    private final LocalDateTime when;

    public AppointmentTime(LocalDateTime when) {
        this.when = Objects.requireNonNull(when, "when");
    }

    public LocalDateTime getWhen() {
        return when;
    }

    /** ISO-8601 local date-time, the form written to the record store. */
    public String iso() {
        return when.toString();
    }

    public String spoken() {
        return SPOKEN.format(when);
    }

    @Override
    public String toString() {
        return iso();
    }
}
