package com.payment.facilitator.core;

import com.payment.facilitator.chain.ChainGateway;
import com.payment.facilitator.chain.ChainRejectedException;
import com.payment.facilitator.chain.ChainUnavailableException;
import com.payment.facilitator.chain.NetworkRegistry;
import com.payment.facilitator.config.FacilitatorProperties;
import com.payment.facilitator.domain.ChainFamily;
import com.payment.facilitator.domain.ChainTransactionStatus;
import com.payment.facilitator.domain.FailureReason;
import com.payment.facilitator.domain.NonceReservation;
import com.payment.facilitator.domain.PaymentAuthorization;
import com.payment.facilitator.domain.PaymentId;
import com.payment.facilitator.domain.PaymentRecord;
import com.payment.facilitator.domain.PaymentRequirement;
import com.payment.facilitator.domain.PaymentStatus;
import com.payment.facilitator.domain.PreparedSubmission;
import com.payment.facilitator.domain.SettlementResult;
import com.payment.facilitator.domain.VerificationResult;
import com.payment.facilitator.messaging.SettlementNotificationProducer;
import com.payment.facilitator.nonce.NonceStore;
import com.payment.facilitator.persistence.PaymentLedger;
import com.payment.facilitator.verification.SignatureVerifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drives each payment through its lifecycle: verify, reserve the nonce, prepare and
 * broadcast the settlement transaction, then follow it to confirmation.
 * <p>
 * The nonce reservation is the only point where concurrent settlements of the same
 * authorization are serialized; after that, optimistic locking on the record keeps
 * request threads, the poller and the sweep from overwriting each other.
 */
@Slf4j
@Service
public class SettlementCoordinator {

    private final SignatureVerifier signatureVerifier;
    private final NonceStore nonceStore;
    private final PaymentLedger ledger;
    private final ChainGateway chainGateway;
    private final NetworkRegistry networkRegistry;
    private final SettlementResultCache resultCache;
    private final SettlementNotificationProducer notificationProducer;
    private final Clock clock;
    private final int maxSubmitAttempts;
    private final Duration reconcileWindow;

    public SettlementCoordinator(SignatureVerifier signatureVerifier,
                                 NonceStore nonceStore,
                                 PaymentLedger ledger,
                                 ChainGateway chainGateway,
                                 NetworkRegistry networkRegistry,
                                 SettlementResultCache resultCache,
                                 SettlementNotificationProducer notificationProducer,
                                 Clock clock,
                                 @Value("${facilitator.settlement.max-submit-attempts:10}") int maxSubmitAttempts,
                                 @Value("${facilitator.settlement.reconcile-window:PT24H}") Duration reconcileWindow) {
        this.signatureVerifier = signatureVerifier;
        this.nonceStore = nonceStore;
        this.ledger = ledger;
        this.chainGateway = chainGateway;
        this.networkRegistry = networkRegistry;
        this.resultCache = resultCache;
        this.notificationProducer = notificationProducer;
        this.clock = clock;
        this.maxSubmitAttempts = maxSubmitAttempts;
        this.reconcileWindow = reconcileWindow;
    }

    /**
     * Verify without reserving. Reads the nonce store so an authorization that is already
     * being settled is reported as a duplicate, but never writes to it.
     */
    public VerificationResult verify(PaymentAuthorization authorization, PaymentRequirement requirement) {
        VerificationResult result = signatureVerifier.verify(authorization, requirement, clock.instant());
        if (!result.isValid()) {
            log.info("Verification failed payer={} network={} reason={}",
                    authorization != null ? authorization.getPayer() : null,
                    requirement != null ? requirement.getNetwork() : null, result.getReason());
            return result;
        }
        ChainFamily family = networkRegistry.require(requirement.getNetwork()).getFamily();
        String reservationKey = reservationKey(family, authorization);
        if (nonceStore.isReserved(reservationKey)) {
            return VerificationResult.invalid(FailureReason.DUPLICATE_AUTHORIZATION,
                    "Authorization already submitted as payment " + PaymentId.of(family, authorization),
                    authorization.getPayer());
        }
        return result;
    }

    /**
     * Settle an authorization at most once. Safe to call repeatedly: once a record exists
     * past RESERVED, its current state is returned and nothing is resubmitted. The exception
     * is a record that failed before reaching the chain and released its nonce; that one
     * is reserved and submitted again.
     *
     * @throws SettlementAbortedException on internal failure; nothing was persisted
     */
    public SettlementResult settle(PaymentAuthorization authorization, PaymentRequirement requirement) {
        Instant now = clock.instant();
        Optional<FacilitatorProperties.Network> network = authorization == null ? Optional.empty()
                : networkRegistry.find(authorization.getNetwork());
        if (network.isEmpty()) {
            return rejected(null, authorization, signatureVerifier.verify(authorization, requirement, now), now);
        }
        ChainFamily family = network.get().getFamily();
        String paymentId = PaymentId.of(family, authorization);
        String signatureKey = family.normalizeSignature(authorization.getSignature());

        Optional<SettlementResult> cached = resultCache.get(paymentId, signatureKey);
        if (cached.isPresent()) {
            return cached.get();
        }
        Optional<PaymentRecord> existing = ledger.find(paymentId);
        if (existing.isPresent() && !existing.get().isNonceReleased()) {
            return resumeOrReport(existing.get(), authorization, family);
        }

        VerificationResult verification = signatureVerifier.verify(authorization, requirement, now);
        if (!verification.isValid()) {
            log.info("Settlement rejected paymentId={} reason={}", paymentId, verification.getReason());
            return rejected(paymentId, authorization, verification, now);
        }
        requireAdapter(network.get());

        String reservationKey = reservationKey(family, authorization);
        NonceReservation reservation;
        try {
            reservation = nonceStore.reserve(reservationKey, family.normalizeAddress(authorization.getPayer()),
                    authorization.getNetwork(), authorization.getNonce());
        } catch (RuntimeException e) {
            log.error("Nonce store unavailable while settling paymentId={}", paymentId, e);
            throw new SettlementAbortedException("Nonce store unavailable: " + e.getMessage(), e);
        }
        if (reservation == NonceReservation.ALREADY_RESERVED) {
            return duplicate(paymentId, authorization, now);
        }

        PaymentRecord fresh = PaymentRecord.builder()
                .id(paymentId)
                .status(PaymentStatus.RESERVED)
                .requirement(requirement)
                .authorization(authorization)
                .deadline(now.plusSeconds(requirement.getMaxTimeoutSeconds()))
                .build();
        PaymentRecord reserved;
        try {
            reserved = existing.isPresent() ? ledger.reopen(existing.get(), fresh) : ledger.create(fresh);
        } catch (RuntimeException e) {
            log.error("Ledger write failed for paymentId={}; releasing reservation", paymentId, e);
            releaseQuietly(reservationKey);
            throw new SettlementAbortedException("Could not record payment " + paymentId + ": " + e.getMessage(), e);
        }
        if (existing.isPresent()) {
            log.info("Retrying paymentId={} after {} ({})", paymentId, existing.get().getStatus(), existing.get().getFailureReason());
        }
        log.info("Reserved paymentId={} payer={} network={} amount={} deadline={}",
                paymentId, authorization.getPayer(), authorization.getNetwork(), authorization.getAmount(), reserved.getDeadline());
        return toResult(submit(reserved));
    }

    public Optional<SettlementResult> find(String paymentId) {
        return ledger.find(paymentId).map(this::toResult);
    }

    /**
     * Advance every record waiting on the chain. SUBMITTED moves to CONFIRMING on the first
     * confirmation and to SETTLED at the network's threshold. SETTLEMENT_TIMEOUT records
     * are still watched until {@code reconcileWindow} after their deadline, so a late
     * confirmation can settle them.
     */
    public int pollConfirmations() {
        List<PaymentRecord> watched = new ArrayList<>(ledger.findByStatus(PaymentStatus.awaitingConfirmation()));
        watched.addAll(ledger.findDeadlineAfter(EnumSet.of(PaymentStatus.SETTLEMENT_TIMEOUT),
                clock.instant().minus(reconcileWindow)));
        int advanced = 0;
        for (PaymentRecord record : watched) {
            try {
                PaymentRecord updated = pollOne(record);
                if (updated.getStatus() != record.getStatus()) {
                    advanced++;
                }
            } catch (ChainUnavailableException e) {
                log.warn("Confirmation poll skipped paymentId={} network={}: {}", record.getId(), record.getNetwork(), e.getMessage());
            } catch (OptimisticLockingFailureException e) {
                log.debug("Payment {} changed during poll; will retry next cycle", record.getId());
            } catch (RuntimeException e) {
                log.error("Confirmation poll failed for paymentId={}", record.getId(), e);
            }
        }
        return advanced;
    }

    /**
     * Deadline sweep. Never-broadcast reservations expire and release their nonce;
     * anything that may have reached the chain becomes SETTLEMENT_TIMEOUT and keeps it.
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        int swept = 0;
        for (PaymentRecord record : ledger.findPastDeadline(PaymentStatus.inFlight(), now)) {
            try {
                if (record.getStatus() == PaymentStatus.RESERVED) {
                    transition(record, record.toBuilder()
                            .status(PaymentStatus.EXPIRED)
                            .failureReason(FailureReason.RESERVATION_EXPIRED)
                            .failureMessage("Deadline " + record.getDeadline() + " passed before submission")
                            .build());
                    releaseQuietly(reservationKey(record));
                } else {
                    transition(record, record.toBuilder()
                            .status(PaymentStatus.SETTLEMENT_TIMEOUT)
                            .failureReason(FailureReason.CONFIRMATION_TIMEOUT)
                            .failureMessage("Not confirmed by deadline " + record.getDeadline())
                            .build());
                }
                swept++;
            } catch (OptimisticLockingFailureException e) {
                log.debug("Payment {} changed during sweep; skipping", record.getId());
            } catch (RuntimeException e) {
                log.error("Deadline sweep failed for paymentId={}", record.getId(), e);
            }
        }
        if (swept > 0) {
            log.info("Deadline sweep moved {} payment(s)", swept);
        }
        return swept;
    }

    /**
     * Resume work interrupted by a restart. RESERVED records are submitted; SUBMITTING
     * records are looked up on chain by their reference first and re-broadcast with the
     * stored payload only if the chain has never seen them.
     */
    public int recoverInFlight() {
        Instant now = clock.instant();
        int recovered = 0;
        List<PaymentRecord> pending = ledger.findByStatus(EnumSet.of(PaymentStatus.RESERVED, PaymentStatus.SUBMITTING));
        log.info("Recovering {} in-flight payment(s)", pending.size());
        for (PaymentRecord record : pending) {
            if (record.isPastDeadline(now)) {
                continue;
            }
            try {
                if (record.getStatus() == PaymentStatus.RESERVED) {
                    submit(record);
                } else {
                    resumeSubmitting(record);
                }
                recovered++;
            } catch (ChainUnavailableException e) {
                log.warn("Recovery of paymentId={} deferred: {}", record.getId(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("Recovery failed for paymentId={}", record.getId(), e);
            }
        }
        return recovered;
    }

    private SettlementResult resumeOrReport(PaymentRecord record, PaymentAuthorization authorization, ChainFamily family) {
        if (!sameAuthorization(family, record.getAuthorization(), authorization)) {
            log.warn("Different authorization reuses nonce of paymentId={} (status={})", record.getId(), record.getStatus());
            return duplicate(record.getId(), authorization, clock.instant());
        }
        if (record.getStatus() == PaymentStatus.RESERVED) {
            log.info("Resuming reserved paymentId={}", record.getId());
            return toResult(submit(record));
        }
        SettlementResult result = toResult(record);
        resultCache.put(family.normalizeSignature(authorization.getSignature()), result);
        return result;
    }

    /**
     * RESERVED -> SUBMITTING -> SUBMITTED. The signed transaction and its reference are
     * written before anything is broadcast.
     */
    private PaymentRecord submit(PaymentRecord reserved) {
        PreparedSubmission prepared;
        try {
            prepared = chainGateway.prepare(reserved.getAuthorization(), reserved.getRequirement());
        } catch (ChainUnavailableException e) {
            log.warn("Could not prepare paymentId={}; stays RESERVED until retried or expired: {}", reserved.getId(), e.getMessage());
            return reserved.toBuilder().failureMessage("Chain unavailable: " + e.getMessage()).build();
        } catch (ChainRejectedException e) {
            return failSubmission(reserved, e);
        } catch (RuntimeException e) {
            abort(reserved, e);
            throw new SettlementAbortedException("Could not prepare payment " + reserved.getId() + ": " + e.getMessage(), e);
        }

        PaymentRecord submitting;
        try {
            submitting = transition(reserved, reserved.toBuilder()
                    .status(PaymentStatus.SUBMITTING)
                    .transactionRef(prepared.getReference())
                    .submissionPayload(prepared.getPayload())
                    .failureMessage(null)
                    .build());
        } catch (OptimisticLockingFailureException e) {
            log.info("Payment {} was claimed concurrently; discarding prepared transaction {}", reserved.getId(), prepared.getReference());
            chainGateway.discard(prepared);
            return ledger.find(reserved.getId()).orElse(reserved);
        } catch (RuntimeException e) {
            chainGateway.discard(prepared);
            abort(reserved, e);
            throw new SettlementAbortedException("Could not record submission of payment " + reserved.getId() + ": " + e.getMessage(), e);
        }
        return broadcast(submitting, prepared);
    }

    private PaymentRecord broadcast(PaymentRecord submitting, PreparedSubmission prepared) {
        int before = submitting.getAttempts();
        AtomicInteger attempts = new AtomicInteger(before);
        PaymentRecord next;
        try {
            chainGateway.submit(prepared, attempt -> attempts.incrementAndGet());
            next = submitting.toBuilder()
                    .status(PaymentStatus.SUBMITTED)
                    .attempts(attempts.get())
                    .failureMessage(null)
                    .build();
            log.info("Submitted paymentId={} ref={} attempts={}", submitting.getId(), prepared.getReference(), attempts.get());
        } catch (ChainRejectedException e) {
            PaymentRecord withAttempts = submitting.toBuilder().attempts(attempts.get()).build();
            if (attempts.get() - before > 1 && seenOnChain(withAttempts)) {
                // an earlier ambiguous attempt landed; the rejection is about the duplicate
                next = withAttempts.toBuilder().status(PaymentStatus.SUBMITTED).build();
            } else {
                return failSubmission(withAttempts, e);
            }
        } catch (ChainUnavailableException e) {
            log.warn("Retries exhausted for paymentId={} ref={} after {} attempt(s): {}",
                    submitting.getId(), prepared.getReference(), attempts.get(), e.getMessage());
            next = submitting.toBuilder()
                    .status(PaymentStatus.SETTLEMENT_TIMEOUT)
                    .attempts(attempts.get())
                    .failureReason(FailureReason.RETRIES_EXHAUSTED)
                    .failureMessage(e.getMessage())
                    .build();
        }
        return transitionOrReload(submitting, next);
    }

    private void resumeSubmitting(PaymentRecord record) {
        ChainTransactionStatus status = chainGateway.getStatus(record.getNetwork(), record.getTransactionRef());
        if (status.getState() != ChainTransactionStatus.State.NOT_FOUND) {
            log.info("Recovered paymentId={} ref={} already on chain ({})", record.getId(), record.getTransactionRef(), status.getState());
            transitionOrReload(record, record.toBuilder().status(PaymentStatus.SUBMITTED).build());
            return;
        }
        if (record.getAttempts() >= maxSubmitAttempts) {
            transitionOrReload(record, record.toBuilder()
                    .status(PaymentStatus.SETTLEMENT_TIMEOUT)
                    .failureReason(FailureReason.RETRIES_EXHAUSTED)
                    .failureMessage("Submit attempt limit " + maxSubmitAttempts + " reached")
                    .build());
            return;
        }
        log.info("Re-broadcasting stored transaction for paymentId={} ref={}", record.getId(), record.getTransactionRef());
        broadcast(record, new PreparedSubmission(record.getNetwork(), record.getTransactionRef(), record.getSubmissionPayload()));
    }

    private PaymentRecord pollOne(PaymentRecord record) {
        ChainTransactionStatus status = chainGateway.getStatus(record.getNetwork(), record.getTransactionRef());
        int required = chainGateway.requiredConfirmations(record.getNetwork());
        switch (status.getState()) {
            case CONFIRMED:
                return onConfirmed(record, status.getConfirmations(), required);
            case FAILED:
                if (record.getStatus() == PaymentStatus.SETTLEMENT_TIMEOUT) {
                    String message = "Failed on chain: " + status.getReason();
                    if (message.equals(record.getFailureMessage())) {
                        return record;
                    }
                    log.warn("Timed-out paymentId={} ref={} failed on chain: {}", record.getId(), record.getTransactionRef(), status.getReason());
                    return transition(record, record.toBuilder().failureMessage(message).build());
                }
                return transition(record, record.toBuilder()
                        .status(PaymentStatus.SUBMISSION_FAILED)
                        .failureReason(FailureReason.TRANSACTION_FAILED)
                        .failureMessage(status.getReason())
                        .build());
            default:
                return record;
        }
    }

    private PaymentRecord onConfirmed(PaymentRecord record, int confirmations, int required) {
        PaymentRecord current = record;
        if (current.getStatus() == PaymentStatus.SUBMITTED) {
            current = transition(current, current.toBuilder()
                    .status(PaymentStatus.CONFIRMING)
                    .confirmations(confirmations)
                    .build());
        }
        if (confirmations >= required) {
            log.info("Settled paymentId={} ref={} confirmations={}/{}", current.getId(), current.getTransactionRef(), confirmations, required);
            return transition(current, current.toBuilder()
                    .status(PaymentStatus.SETTLED)
                    .confirmations(confirmations)
                    .failureReason(null)
                    .failureMessage(null)
                    .build());
        }
        if (current.getConfirmations() != confirmations) {
            return transition(current, current.toBuilder().confirmations(confirmations).build());
        }
        return current;
    }

    private PaymentRecord failSubmission(PaymentRecord record, ChainRejectedException e) {
        log.warn("Chain rejected paymentId={}: {}", record.getId(), e.getMessage());
        PaymentRecord failed = transitionOrReload(record, record.toBuilder()
                .status(PaymentStatus.SUBMISSION_FAILED)
                .failureReason(FailureReason.CHAIN_REJECTED)
                .failureMessage(e.getMessage())
                .build());
        if (failed.getStatus() == PaymentStatus.SUBMISSION_FAILED) {
            releaseQuietly(reservationKey(failed));
        }
        return failed;
    }

    private boolean seenOnChain(PaymentRecord record) {
        try {
            return chainGateway.getStatus(record.getNetwork(), record.getTransactionRef()).getState()
                    != ChainTransactionStatus.State.NOT_FOUND;
        } catch (ChainUnavailableException e) {
            // unknown fate: treat as possibly landed so the nonce is not released
            log.warn("Could not check ref={} after rejection: {}", record.getTransactionRef(), e.getMessage());
            return true;
        }
    }

    /**
     * Apply a transition; if another writer got there first, return what the ledger now holds.
     */
    private PaymentRecord transitionOrReload(PaymentRecord current, PaymentRecord next) {
        try {
            return transition(current, next);
        } catch (OptimisticLockingFailureException e) {
            PaymentRecord latest = ledger.find(current.getId()).orElse(current);
            log.info("Payment {} moved to {} concurrently; dropping {} -> {}",
                    current.getId(), latest.getStatus(), current.getStatus(), next.getStatus());
            return latest;
        }
    }

    private PaymentRecord transition(PaymentRecord current, PaymentRecord next) {
        PaymentRecord saved = ledger.update(current, next);
        if (saved.getStatus() != current.getStatus()) {
            log.info("Payment {} {} -> {}", saved.getId(), current.getStatus(), saved.getStatus());
            if (saved.getStatus().isTerminal()) {
                onTerminal(saved);
            }
        }
        return saved;
    }

    private void onTerminal(PaymentRecord record) {
        ChainFamily family = networkRegistry.require(record.getNetwork()).getFamily();
        resultCache.put(family.normalizeSignature(record.getAuthorization().getSignature()), toResult(record));
        try {
            notificationProducer.publishTerminal(record);
        } catch (RuntimeException e) {
            log.error("Could not publish settlement notification for paymentId={}", record.getId(), e);
        }
    }

    private void abort(PaymentRecord reserved, RuntimeException cause) {
        log.error("Aborting settlement of paymentId={}", reserved.getId(), cause);
        try {
            ledger.discard(reserved.getId());
        } catch (RuntimeException e) {
            log.error("Could not discard aborted paymentId={}; the deadline sweep will expire it", reserved.getId(), e);
            return;
        }
        releaseQuietly(reservationKey(reserved));
    }

    private void releaseQuietly(String reservationKey) {
        try {
            nonceStore.expire(reservationKey);
        } catch (RuntimeException e) {
            log.error("Could not release nonce reservation key={}", reservationKey, e);
        }
    }

    private void requireAdapter(FacilitatorProperties.Network network) {
        try {
            chainGateway.requiredConfirmations(network.getName());
        } catch (IllegalStateException e) {
            throw new SettlementAbortedException(e.getMessage(), e);
        }
    }

    private SettlementResult duplicate(String paymentId, PaymentAuthorization authorization, Instant now) {
        PaymentStatus original = ledger.find(paymentId).map(PaymentRecord::getStatus).orElse(PaymentStatus.RESERVED);
        log.warn("Duplicate authorization for paymentId={} (original status {})", paymentId, original);
        return SettlementResult.builder()
                .paymentId(paymentId)
                .status(PaymentStatus.REJECTED)
                .network(authorization.getNetwork())
                .payer(authorization.getPayer())
                .failureReason(FailureReason.DUPLICATE_AUTHORIZATION)
                .message("Authorization already used by payment " + paymentId)
                .originalStatus(original)
                .updatedAt(now)
                .build();
    }

    private static SettlementResult rejected(String paymentId, PaymentAuthorization authorization,
                                             VerificationResult verification, Instant now) {
        return SettlementResult.builder()
                .paymentId(paymentId)
                .status(PaymentStatus.REJECTED)
                .network(authorization != null ? authorization.getNetwork() : null)
                .payer(authorization != null ? authorization.getPayer() : null)
                .failureReason(verification.getReason())
                .message(verification.getMessage())
                .updatedAt(now)
                .build();
    }

    private SettlementResult toResult(PaymentRecord record) {
        return SettlementResult.builder()
                .paymentId(record.getId())
                .status(record.getStatus())
                .network(record.getNetwork())
                .payer(record.getPayer())
                .transactionRef(record.getStatus().isPossiblyBroadcast() || record.getStatus() == PaymentStatus.SUBMISSION_FAILED
                        ? record.getTransactionRef() : null)
                .confirmations(record.getConfirmations())
                .requiredConfirmations(chainGateway.requiredConfirmations(record.getNetwork()))
                .attempts(record.getAttempts())
                .failureReason(record.getFailureReason())
                .message(record.getFailureMessage())
                .updatedAt(record.getUpdatedAt())
                .build();
    }

    private String reservationKey(PaymentRecord record) {
        return reservationKey(networkRegistry.require(record.getNetwork()).getFamily(), record.getAuthorization());
    }

    private static String reservationKey(ChainFamily family, PaymentAuthorization authorization) {
        return PaymentId.key(family, authorization.getPayer(), authorization.getNetwork(), authorization.getNonce());
    }

    private static boolean sameAuthorization(ChainFamily family, PaymentAuthorization a, PaymentAuthorization b) {
        return a.getAmount().equals(b.getAmount())
                && a.getValidAfter() == b.getValidAfter()
                && a.getValidBefore() == b.getValidBefore()
                && family.sameAddress(a.getPayee(), b.getPayee())
                && family.normalizeSignature(a.getSignature()).equals(family.normalizeSignature(b.getSignature()));
    }
}
