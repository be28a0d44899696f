package com.payment.facilitator.persistence.entity;

import com.payment.facilitator.domain.FailureReason;
import com.payment.facilitator.domain.PaymentAuthorization;
import com.payment.facilitator.domain.PaymentRequirement;
import com.payment.facilitator.domain.PaymentStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Persistent payment record. Requirement and authorization are stored by value as JSON,
 * with the fields the ledger queries on copied into their own columns.
 */
@Entity
@Table(name = "payment_records", indexes = {
    @Index(name = "idx_record_status", columnList = "status"),
    @Index(name = "idx_record_deadline", columnList = "deadline"),
    @Index(name = "idx_record_payer_network", columnList = "payer, network"),
    @Index(name = "idx_record_transaction_ref", columnList = "transaction_ref")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentRecordEntity {

    @Id
    @Column(name = "payment_id", nullable = false, length = 64)
    private String paymentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private PaymentStatus status;

    @Column(name = "network", nullable = false)
    private String network;

    @Column(name = "payer", nullable = false)
    private String payer;

    @Column(name = "nonce", nullable = false, length = 66)
    private String nonce;

    @Column(name = "resource", nullable = false, length = 1000)
    private String resource;

    /** Decimal string; uint256 does not fit a numeric(38) column. */
    @Column(name = "amount", nullable = false, length = 78)
    private String amount;

    @Convert(converter = PaymentRequirementConverter.class)
    @Column(name = "requirement_json", nullable = false, length = 20000)
    private PaymentRequirement requirement;

    @Convert(converter = PaymentAuthorizationConverter.class)
    @Column(name = "authorization_json", nullable = false, length = 4000)
    private PaymentAuthorization authorization;

    @Column(name = "transaction_ref", length = 128)
    private String transactionRef;

    @Column(name = "submission_payload", length = 8000)
    private String submissionPayload;

    @Column(name = "confirmations", nullable = false)
    private int confirmations;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_reason", length = 64)
    private FailureReason failureReason;

    @Column(name = "failure_message", length = 1000)
    private String failureMessage;

    @Column(name = "deadline", nullable = false)
    private Instant deadline;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }
}
