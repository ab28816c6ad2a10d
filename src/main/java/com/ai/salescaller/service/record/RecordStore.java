package com.ai.salescaller.service.record;

import com.ai.salescaller.conversation.CustomerRef;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Backing store for customer records. Writes are idempotent by {@code (recordKey, callId)}:
 * delivering the same outcome twice leaves the store as if it had been written once.
 *
 * <p>Implementations throw {@link com.ai.salescaller.exception.ProviderException} subtypes so the
 * dispatcher can tell retryable failures from permanent ones.
 */
public interface RecordStore {

    Optional<CustomerRecord> findByPhone(String phone);

    Optional<CustomerRecord> getCustomer(CustomerRef ref);

    /**
     * Customers that may be called on {@code today}, in store order.
     *
     * @see CustomerRecord#isReadyToCall(LocalDate)
     */
    List<CustomerRecord> findReadyToCall(LocalDate today);

    void updateOutcome(CustomerRef ref, String callId, OutcomeUpdate update);
}
