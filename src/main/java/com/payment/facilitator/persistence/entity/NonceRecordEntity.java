package com.payment.facilitator.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * Write-once nonce reservation. Always reported as new, so saving a second row for the
 * same key is an insert that fails on the primary key instead of a silent merge.
 */
@Entity
@Table(name = "nonce_records")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NonceRecordEntity implements Persistable<String> {

    /** network:payer:nonce, normalized. */
    @Id
    @Column(name = "reservation_key", nullable = false, length = 400)
    private String reservationKey;

    @Column(name = "network", nullable = false)
    private String network;

    @Column(name = "payer", nullable = false)
    private String payer;

    @Column(name = "nonce", nullable = false, length = 66)
    private String nonce;

    @Column(name = "reserved_at", nullable = false)
    private Instant reservedAt;

    @Override
    @Transient
    public String getId() {
        return reservationKey;
    }

    @Override
    @Transient
    public boolean isNew() {
        return true;
    }
}
