package com.ai.salescaller.conversation;

import java.util.Objects;

/**
 * Phone number plus the key of the customer's row in the record store.
 */
public final class CustomerRef {

    private final String phone;
    private final String recordKey;

    public CustomerRef(String phone, String recordKey) {
        this.phone = phone != null ? phone : "";
        this.recordKey = Objects.requireNonNull(recordKey, "recordKey");
    }

    public String getPhone() {
        return phone;
    }

    public String getRecordKey() {
        return recordKey;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CustomerRef)) return false;
        CustomerRef that = (CustomerRef) o;
        return phone.equals(that.phone) && recordKey.equals(that.recordKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(phone, recordKey);
    }

    @Override
    public String toString() {
        return recordKey + "/" + phone;
    }
}
