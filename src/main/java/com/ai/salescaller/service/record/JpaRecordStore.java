package com.ai.salescaller.service.record;

import com.ai.salescaller.conversation.CustomerRef;
import com.ai.salescaller.entity.CallOutcomeEntity;
import com.ai.salescaller.entity.CustomerEntity;
import com.ai.salescaller.exception.PermanentProviderException;
import com.ai.salescaller.exception.TransientProviderException;
import com.ai.salescaller.repository.CallOutcomeRepository;
import com.ai.salescaller.repository.CustomerRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Default record store: customers and call outcomes in the application database.
 */
@Service
@ConditionalOnProperty(prefix = "record-store", name = "type", havingValue = "jpa", matchIfMissing = true)
public class JpaRecordStore implements RecordStore {

    private static final Logger log = LoggerFactory.getLogger(JpaRecordStore.class);

    static final String PROVIDER = "database";

    private final CustomerRepository customerRepository;
    private final CallOutcomeRepository callOutcomeRepository;
    private final ObjectMapper mapper;

    public JpaRecordStore(CustomerRepository customerRepository,
                          CallOutcomeRepository callOutcomeRepository,
                          ObjectMapper mapper) {
        this.customerRepository = customerRepository;
        this.callOutcomeRepository = callOutcomeRepository;
        this.mapper = mapper;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CustomerRecord> findByPhone(String phone) {
        String normalized = PhoneNumbers.normalize(phone);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        try {
            return customerRepository.findFirstByPhoneOrderByIdAsc(normalized).map(JpaRecordStore::toRecord);
        } catch (DataAccessException e) {
            throw translate(e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CustomerRecord> getCustomer(CustomerRef ref) {
        try {
            return customerRepository.findByRecordKey(ref.getRecordKey()).map(JpaRecordStore::toRecord);
        } catch (DataAccessException e) {
            throw translate(e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<CustomerRecord> findReadyToCall(LocalDate today) {
        try {
            List<CustomerRecord> ready = customerRepository.findAll(Sort.by("id")).stream()
                    .map(JpaRecordStore::toRecord)
                    .filter(c -> c.isReadyToCall(today))
                    .collect(Collectors.toList());
            log.debug("{} customer(s) ready to call on {}", ready.size(), today);
            return ready;
        } catch (DataAccessException e) {
            throw translate(e);
        }
    }

    /**
     * Upserts the call's outcome row and refreshes the customer's latest-call columns. Replaying the same
     * {@code callId} rewrites the same row.
     */
    @Override
    @Transactional
    public void updateOutcome(CustomerRef ref, String callId, OutcomeUpdate update) {
        try {
            CallOutcomeEntity row = callOutcomeRepository.findByCustomerKeyAndCallId(ref.getRecordKey(), callId)
                    .orElseGet(() -> CallOutcomeEntity.builder()
                            .customerKey(ref.getRecordKey())
                            .callId(callId)
                            .build());
            row.setPhone(PhoneNumbers.normalize(ref.getPhone()));
            row.setOutcome(update.getOutcome());
            row.setNextAction(update.getNextAction());
            row.setDurationSeconds(update.getDurationSeconds());
            row.setExtractedData(toJson(update));
            row.setTranscript(update.getTranscript());
            row.setNotes(StringUtils.abbreviate(update.getNotes(), 1000));
            callOutcomeRepository.save(row);

            Optional<CustomerEntity> customer = customerRepository.findByRecordKey(ref.getRecordKey());
            if (customer.isEmpty()) {
                log.info("[{}] No customer row for {}; outcome stored on its own", callId, ref.getRecordKey());
                return;
            }
            CustomerEntity c = customer.get();
            c.setStatus(update.customerStatus());
            c.setCallResult(update.getOutcome());
            c.setNextAction(update.getNextAction());
            c.setLastCallAt(update.getCalledAt());
            c.setLastCallId(callId);
            c.setNotes(StringUtils.abbreviate(update.getNotes(), 1000));
            if (StringUtils.isNotBlank(update.getEmail())) {
                c.setEmail(update.getEmail());
            }
            if (StringUtils.isNotBlank(update.getAppointmentTime())) {
                c.setAppointmentTime(update.getAppointmentTime());
            }
            customerRepository.save(c);
            log.info("[{}] Customer {} updated: {}", callId, ref.getRecordKey(), update.getOutcome());
        } catch (DataAccessException e) {
            throw translate(e);
        }
    }

    private String toJson(OutcomeUpdate update) {
        try {
            return mapper.writeValueAsString(update.getExtractedData());
        } catch (JsonProcessingException e) {
            throw new PermanentProviderException(PROVIDER, "Cannot serialize extracted data", 0, e);
        }
    }

    private static CustomerRecord toRecord(CustomerEntity e) {
        return CustomerRecord.builder()
                .recordKey(e.getRecordKey())
                .name(e.getName())
                .phone(e.getPhone())
                .email(e.getEmail())
                .carModel(e.getCarModel())
                .status(e.getStatus())
                .lastCallDate(e.getLastCallAt() == null ? null : e.getLastCallAt().atOffset(ZoneOffset.UTC).toLocalDate())
                .build();
    }

    private static RuntimeException translate(DataAccessException e) {
        if (e instanceof TransientDataAccessException || e instanceof RecoverableDataAccessException) {
            return new TransientProviderException(PROVIDER, e.getMessage(), e);
        }
        return new PermanentProviderException(PROVIDER, e.getMessage(), 0, e);
    }
}
