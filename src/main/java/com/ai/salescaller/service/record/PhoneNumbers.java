package com.ai.salescaller.service.record;

import org.apache.commons.lang3.StringUtils;

/**
 * Normalizes phone numbers so the number Twilio reports matches the one stored for the customer.
 */
public final class PhoneNumbers {

    private PhoneNumbers() {
    }

    /**
     * "+1 (555) 010-2030", "555.010.2030" and "15550102030" all become "+15550102030".
     * Ten-digit numbers without a country code are taken as North American.
     */
    public static String normalize(String raw) {
        if (StringUtils.isBlank(raw)) {
            return "";
        }
        String digits = raw.replaceAll("[^0-9]", "");
        if (digits.isEmpty()) {
            return "";
        }
        if (!raw.trim().startsWith("+") && digits.length() == 10) {
            return "+1" + digits;
        }
        return "+" + digits;
    }

    /** Record key used for callers that are not in the record store. */
    public static String unknownCustomerKey(String phone) {
        return "phone:" + normalize(phone);
    }

    /** Last four digits, for logs. */
    public static String mask(String phone) {
        String n = normalize(phone);
        return n.length() <= 4 ? n : "***" + n.substring(n.length() - 4);
    }
}
