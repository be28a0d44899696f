package com.payment.facilitator.persistence;

import com.payment.facilitator.domain.PaymentRecord;
import com.payment.facilitator.domain.PaymentStatus;
import com.payment.facilitator.domain.PaymentTransition;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Durable store of payment records. Only the settlement coordinator writes; everything
 * else reads. Every status change is recorded in the transition history.
 */
public interface PaymentLedger {

    Optional<PaymentRecord> find(String paymentId);

    /**
     * Insert a new record.
     *
     * @throws org.springframework.dao.DuplicateKeyException if a record with the same id exists
     */
    PaymentRecord create(PaymentRecord record);

    /**
     * Replace {@code current} with {@code next}.
     *
     * @throws IllegalStateException if the status change is not a legal transition
     * @throws org.springframework.dao.OptimisticLockingFailureException if the record changed since {@code current} was read
     */
    PaymentRecord update(PaymentRecord current, PaymentRecord next);

    /**
     * Start a new attempt on a record whose nonce was released: {@code released} must be
     * a failed record with {@link PaymentRecord#isNonceReleased()}, {@code reserved} the
     * RESERVED record of the new attempt under the same id. The history is kept.
     *
     * @throws IllegalStateException if {@code released} did not give its nonce back
     * @throws org.springframework.dao.OptimisticLockingFailureException if the record changed since {@code released} was read
     */
    PaymentRecord reopen(PaymentRecord released, PaymentRecord reserved);

    /**
     * Remove a record that never got past RESERVED, together with its history. Used only
     * to undo a settlement that was aborted before anything was prepared or broadcast.
     */
    void discard(String paymentId);

    List<PaymentRecord> findByStatus(Collection<PaymentStatus> statuses);

    List<PaymentRecord> findPastDeadline(Collection<PaymentStatus> statuses, Instant now);

    /** Records in the given statuses whose deadline is later than {@code cutoff}. */
    List<PaymentRecord> findDeadlineAfter(Collection<PaymentStatus> statuses, Instant cutoff);

    List<PaymentTransition> history(String paymentId);
}
