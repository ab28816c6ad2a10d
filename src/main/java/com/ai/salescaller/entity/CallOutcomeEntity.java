package com.ai.salescaller.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * One reported call result. Unique per (customer, call), so a re-delivered report overwrites
 * instead of duplicating.
 */
@Entity
@Table(name = "call_outcome",
        uniqueConstraints = @UniqueConstraint(name = "uk_call_outcome_customer_call", columnNames = {"customer_key", "call_id"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CallOutcomeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "customer_key", nullable = false, length = 64)
    private String customerKey;

    @Column(name = "call_id", nullable = false, length = 64)
    private String callId;

    @Column(length = 20)
    private String phone;

    @Column(nullable = false, length = 30)
    private String outcome;

    @Column(name = "next_action", length = 50)
    private String nextAction;

    @Column(name = "duration_seconds")
    private Long durationSeconds;

    @Lob
    @Column(name = "extracted_data")
    private String extractedData;

    @Lob
    private String transcript;

    @Column(length = 1000)
    private String notes;

    @Column(name = "updated_at", nullable = false)
    private java.time.Instant updatedAt;

    @PrePersist
    @PreUpdate
    protected void onWrite() {
        updatedAt = java.time.Instant.now();
    }
}
