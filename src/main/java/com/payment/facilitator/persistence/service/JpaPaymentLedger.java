package com.payment.facilitator.persistence.service;

import com.payment.facilitator.domain.PaymentRecord;
import com.payment.facilitator.domain.PaymentStatus;
import com.payment.facilitator.domain.PaymentTransition;
import com.payment.facilitator.persistence.PaymentLedger;
import com.payment.facilitator.persistence.entity.PaymentRecordEntity;
import com.payment.facilitator.persistence.entity.PaymentTransitionEntity;
import com.payment.facilitator.persistence.repository.PaymentRecordRepository;
import com.payment.facilitator.persistence.repository.PaymentTransitionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Payment ledger on PostgreSQL via Spring Data JPA. Record and transition rows are
 * written in the same transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaPaymentLedger implements PaymentLedger {

    private final PaymentRecordRepository recordRepository;
    private final PaymentTransitionRepository transitionRepository;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Optional<PaymentRecord> find(String paymentId) {
        return recordRepository.findById(paymentId).map(JpaPaymentLedger::toRecord);
    }

    @Override
    @Transactional
    public PaymentRecord create(PaymentRecord record) {
        if (recordRepository.existsById(record.getId())) {
            throw new DuplicateKeyException("Payment record already exists: " + record.getId());
        }
        Instant now = Instant.now(clock);
        PaymentRecordEntity entity = PaymentRecordEntity.builder()
                .paymentId(record.getId())
                .network(record.getNetwork())
                .payer(record.getPayer())
                .nonce(record.getAuthorization().getNonce())
                .resource(record.getRequirement().getResource())
                .amount(record.getAuthorization().getAmount().toString())
                .requirement(record.getRequirement())
                .authorization(record.getAuthorization())
                .createdAt(now)
                .updatedAt(now)
                .build();
        apply(entity, record);
        PaymentRecordEntity saved = recordRepository.saveAndFlush(entity);
        recordTransition(null, record, now);
        log.debug("Created payment record paymentId={} status={}", record.getId(), record.getStatus());
        return toRecord(saved);
    }

    @Override
    @Transactional
    public PaymentRecord update(PaymentRecord current, PaymentRecord next) {
        if (current.getStatus() != next.getStatus() && !current.getStatus().canTransitionTo(next.getStatus())) {
            throw new IllegalStateException("Illegal transition " + current.getStatus() + " -> " + next.getStatus()
                    + " for payment " + current.getId());
        }
        PaymentRecordEntity entity = recordRepository.findById(current.getId())
                .orElseThrow(() -> new IllegalStateException("Payment record not found: " + current.getId()));
        if (!Objects.equals(entity.getVersion(), current.getVersion())) {
            throw new OptimisticLockingFailureException("Payment record " + current.getId() + " changed (version "
                    + current.getVersion() + " -> " + entity.getVersion() + ")");
        }
        Instant now = Instant.now(clock);
        apply(entity, next);
        entity.setUpdatedAt(now);
        PaymentRecordEntity saved = recordRepository.saveAndFlush(entity);
        if (current.getStatus() != next.getStatus()) {
            recordTransition(current.getStatus(), next, now);
        }
        return toRecord(saved);
    }

    @Override
    @Transactional
    public PaymentRecord reopen(PaymentRecord released, PaymentRecord reserved) {
        if (!released.isNonceReleased() || reserved.getStatus() != PaymentStatus.RESERVED) {
            throw new IllegalStateException("Cannot reopen payment " + released.getId() + " in status "
                    + released.getStatus() + " as " + reserved.getStatus());
        }
        PaymentRecordEntity entity = recordRepository.findById(released.getId())
                .orElseThrow(() -> new IllegalStateException("Payment record not found: " + released.getId()));
        if (!Objects.equals(entity.getVersion(), released.getVersion())) {
            throw new OptimisticLockingFailureException("Payment record " + released.getId() + " changed (version "
                    + released.getVersion() + " -> " + entity.getVersion() + ")");
        }
        Instant now = Instant.now(clock);
        entity.setNonce(reserved.getAuthorization().getNonce());
        entity.setResource(reserved.getRequirement().getResource());
        entity.setAmount(reserved.getAuthorization().getAmount().toString());
        entity.setRequirement(reserved.getRequirement());
        entity.setAuthorization(reserved.getAuthorization());
        apply(entity, reserved);
        entity.setUpdatedAt(now);
        PaymentRecordEntity saved = recordRepository.saveAndFlush(entity);
        recordTransition(released.getStatus(), reserved, now);
        log.info("Reopened payment record paymentId={} after {}", released.getId(), released.getStatus());
        return toRecord(saved);
    }

    @Override
    @Transactional
    public void discard(String paymentId) {
        recordRepository.findById(paymentId).ifPresent(entity -> {
            if (entity.getStatus().isPossiblyBroadcast()) {
                throw new IllegalStateException("Refusing to discard payment " + paymentId + " in status " + entity.getStatus());
            }
            transitionRepository.deleteByPaymentId(paymentId);
            recordRepository.delete(entity);
            log.info("Discarded payment record paymentId={} status={}", paymentId, entity.getStatus());
        });
    }

    @Override
    @Transactional(readOnly = true)
    public List<PaymentRecord> findByStatus(Collection<PaymentStatus> statuses) {
        return recordRepository.findByStatusInOrderByUpdatedAtAsc(statuses).stream()
                .map(JpaPaymentLedger::toRecord)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public List<PaymentRecord> findPastDeadline(Collection<PaymentStatus> statuses, Instant now) {
        return recordRepository.findPastDeadline(statuses, now).stream()
                .map(JpaPaymentLedger::toRecord)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public List<PaymentRecord> findDeadlineAfter(Collection<PaymentStatus> statuses, Instant cutoff) {
        return recordRepository.findByStatusInAndDeadlineAfterOrderByUpdatedAtAsc(statuses, cutoff).stream()
                .map(JpaPaymentLedger::toRecord)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public List<PaymentTransition> history(String paymentId) {
        return transitionRepository.findByPaymentIdOrderByOccurredAtAsc(paymentId).stream()
                .map(e -> PaymentTransition.builder()
                        .paymentId(e.getPaymentId())
                        .fromStatus(e.getFromStatus())
                        .toStatus(e.getToStatus())
                        .transactionRef(e.getTransactionRef())
                        .failureReason(e.getFailureReason())
                        .message(e.getMessage())
                        .occurredAt(e.getOccurredAt())
                        .build())
                .collect(Collectors.toList());
    }

    private void recordTransition(PaymentStatus from, PaymentRecord next, Instant at) {
        transitionRepository.save(PaymentTransitionEntity.builder()
                .transitionId(UUID.randomUUID().toString())
                .paymentId(next.getId())
                .fromStatus(from)
                .toStatus(next.getStatus())
                .transactionRef(next.getTransactionRef())
                .failureReason(next.getFailureReason())
                .message(next.getFailureMessage())
                .occurredAt(at)
                .build());
    }

    private static void apply(PaymentRecordEntity entity, PaymentRecord record) {
        entity.setStatus(record.getStatus());
        entity.setTransactionRef(record.getTransactionRef());
        entity.setSubmissionPayload(record.getSubmissionPayload());
        entity.setConfirmations(record.getConfirmations());
        entity.setAttempts(record.getAttempts());
        entity.setFailureReason(record.getFailureReason());
        entity.setFailureMessage(record.getFailureMessage());
        entity.setDeadline(record.getDeadline());
    }

    static PaymentRecord toRecord(PaymentRecordEntity entity) {
        return PaymentRecord.builder()
                .id(entity.getPaymentId())
                .status(entity.getStatus())
                .requirement(entity.getRequirement())
                .authorization(entity.getAuthorization())
                .transactionRef(entity.getTransactionRef())
                .submissionPayload(entity.getSubmissionPayload())
                .confirmations(entity.getConfirmations())
                .attempts(entity.getAttempts())
                .failureReason(entity.getFailureReason())
                .failureMessage(entity.getFailureMessage())
                .deadline(entity.getDeadline())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .version(entity.getVersion())
                .build();
    }
}
