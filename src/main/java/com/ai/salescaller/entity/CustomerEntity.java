package com.ai.salescaller.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Dealership lead: who to call, which car they asked about, and the latest call result.
 */
@Entity
@Table(name = "customer")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CustomerEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "record_key", nullable = false, unique = true, length = 64)
    private String recordKey;

    @Column(length = 100)
    private String name;

    /** E.164, as produced by PhoneNumbers.normalize */
    @Column(length = 20, nullable = false)
    private String phone;

    @Column(length = 254)
    private String email;

    @Column(name = "car_model", length = 100)
    private String carModel;

    @Column(length = 30)
    private String status;

    @Column(name = "last_call_at")
    private java.time.Instant lastCallAt;

    @Column(name = "last_call_id", length = 64)
    private String lastCallId;

    @Column(name = "call_result", length = 30)
    private String callResult;

    @Column(name = "next_action", length = 50)
    private String nextAction;

    /** ISO local date-time */
    @Column(name = "appointment_time", length = 32)
    private String appointmentTime;

    @Column(length = 1000)
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private java.time.Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = java.time.Instant.now();
        if (status == null) {
            status = "new";
        }
    }
}
