package com.ai.salescaller.repository;

import com.ai.salescaller.entity.CallOutcomeEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface CallOutcomeRepository extends JpaRepository<CallOutcomeEntity, Long> {

    Optional<CallOutcomeEntity> findByCustomerKeyAndCallId(String customerKey, String callId);

    List<CallOutcomeEntity> findByCustomerKeyOrderByUpdatedAtDesc(String customerKey);
}
