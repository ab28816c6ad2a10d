package com.ai.salescaller.repository;

import com.ai.salescaller.entity.CustomerEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface CustomerRepository extends JpaRepository<CustomerEntity, Long> {

    Optional<CustomerEntity> findByRecordKey(String recordKey);

    Optional<CustomerEntity> findFirstByPhoneOrderByIdAsc(String phone);
}
