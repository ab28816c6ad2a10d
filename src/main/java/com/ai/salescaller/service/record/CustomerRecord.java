package com.ai.salescaller.service.record;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

import java.time.LocalDate;
import java.util.Locale;
import java.util.Set;

/**
 * A customer row as read from the record store.
 */
@Getter
@Builder
@AllArgsConstructor
public class CustomerRecord {

    /** Statuses after which the customer is not called again. */
    static final Set<String> CLOSED_STATUSES = Set.of("completed", "not_interested", "do_not_call", "appointment_booked");

    private final String recordKey;
    private final String name;
    private final String phone;
    private final String email;
    private final String carModel;
    private final String status;
    /** Date (UTC) of the latest call, null if never called. */
    private final LocalDate lastCallDate;

    /**
     * Has a phone number, was not called on {@code today} and is not in a closed status.
     */
    public boolean isReadyToCall(LocalDate today) {
        if (StringUtils.isBlank(phone) || today.equals(lastCallDate)) {
            return false;
        }
        return !CLOSED_STATUSES.contains(StringUtils.defaultString(status).trim().toLowerCase(Locale.ROOT));
    }
}
