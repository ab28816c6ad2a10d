package com.ai.salescaller.config;

import com.ai.salescaller.entity.CustomerEntity;
import com.ai.salescaller.repository.CustomerRepository;
import com.ai.salescaller.service.record.PhoneNumbers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Idempotent seeder: inserts a few demo leads into the JPA record store if their keys are not
 * present yet. Safe to re-run.
 */
@Component
@ConditionalOnProperty(prefix = "caller", name = "seed-demo-customers", havingValue = "true")
public class DemoCustomerSeeder {

    private static final Logger log = LoggerFactory.getLogger(DemoCustomerSeeder.class);

    private final CustomerRepository customerRepository;

    public DemoCustomerSeeder(CustomerRepository customerRepository) {
        this.customerRepository = customerRepository;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void seed() {
        List<CustomerEntity> demo = List.of(
                customer("CUST001", "John Smith", "+15551230001", "john.smith@example.com", "2023 Honda Accord"),
                customer("CUST002", "Maria Garcia", "+15551230002", null, "2022 Toyota Camry"),
                customer("CUST003", "David Lee", "+15551230003", "david.lee@example.com", "2023 Nissan Altima"));

        int added = 0;
        for (CustomerEntity c : demo) {
            if (customerRepository.findByRecordKey(c.getRecordKey()).isEmpty()) {
                customerRepository.save(c);
                added++;
            }
        }
        log.info("DemoCustomerSeeder: added {} of {} demo customers", added, demo.size());
    }

    private static CustomerEntity customer(String key, String name, String phone, String email, String carModel) {
        return CustomerEntity.builder()
                .recordKey(key)
                .name(name)
                .phone(PhoneNumbers.normalize(phone))
                .email(email)
                .carModel(carModel)
                .build();
    }
}
