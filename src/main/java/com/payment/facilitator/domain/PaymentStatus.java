package com.payment.facilitator.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Lifecycle of a payment record. Only the transitions listed in {@link #canTransitionTo}
 * are legal; the settlement coordinator is the only component that applies them.
 */
public enum PaymentStatus {
    REQUESTED,
    VERIFIED,
    RESERVED,
    SUBMITTING,
    SUBMITTED,
    CONFIRMING,
    /** Terminal success. */
    SETTLED,
    /** Failed verification or lost the reservation race; no nonce consumed by this attempt. */
    REJECTED,
    /**
     * Chain rejected the transaction at broadcast (nonce released), or it failed on-chain
     * after broadcast (nonce kept).
     */
    SUBMISSION_FAILED,
    /** Deadline passed before anything was broadcast; nonce released. */
    EXPIRED,
    /** Broadcast (or possibly broadcast) but not confirmed in time; nonce kept, needs reconciliation. */
    SETTLEMENT_TIMEOUT;

    private static final Map<PaymentStatus, Set<PaymentStatus>> TRANSITIONS = new EnumMap<>(PaymentStatus.class);

    static {
        TRANSITIONS.put(REQUESTED, EnumSet.of(VERIFIED, REJECTED));
        TRANSITIONS.put(VERIFIED, EnumSet.of(RESERVED, REJECTED));
        TRANSITIONS.put(RESERVED, EnumSet.of(SUBMITTING, SUBMISSION_FAILED, EXPIRED));
        TRANSITIONS.put(SUBMITTING, EnumSet.of(SUBMITTED, SUBMISSION_FAILED, SETTLEMENT_TIMEOUT));
        TRANSITIONS.put(SUBMITTED, EnumSet.of(CONFIRMING, SUBMISSION_FAILED, SETTLEMENT_TIMEOUT));
        TRANSITIONS.put(CONFIRMING, EnumSet.of(SETTLED, SUBMISSION_FAILED, SETTLEMENT_TIMEOUT));
        // a late confirmation wins over the tentative timeout tag
        TRANSITIONS.put(SETTLEMENT_TIMEOUT, EnumSet.of(SETTLED));
        TRANSITIONS.put(SETTLED, EnumSet.noneOf(PaymentStatus.class));
        TRANSITIONS.put(REJECTED, EnumSet.noneOf(PaymentStatus.class));
        TRANSITIONS.put(SUBMISSION_FAILED, EnumSet.noneOf(PaymentStatus.class));
        TRANSITIONS.put(EXPIRED, EnumSet.noneOf(PaymentStatus.class));
    }

    public boolean canTransitionTo(PaymentStatus next) {
        return TRANSITIONS.get(this).contains(next);
    }

    public Set<PaymentStatus> successors() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    /**
     * Terminal for notification purposes. SETTLEMENT_TIMEOUT is reported as terminal even
     * though a later SETTLED observation may still replace it.
     */
    public boolean isTerminal() {
        return this == SETTLED || this == REJECTED || this == SUBMISSION_FAILED
                || this == EXPIRED || this == SETTLEMENT_TIMEOUT;
    }

    /** True once a transaction may have reached the chain; such records never release their nonce. */
    public boolean isPossiblyBroadcast() {
        return this == SUBMITTING || this == SUBMITTED || this == CONFIRMING
                || this == SETTLED || this == SETTLEMENT_TIMEOUT;
    }

    /**
     * States the confirmation poller always looks at. SETTLEMENT_TIMEOUT records are
     * watched too, but only for a bounded reconciliation window.
     */
    public static Set<PaymentStatus> awaitingConfirmation() {
        return EnumSet.of(SUBMITTED, CONFIRMING);
    }

    /** States with no settled outcome yet, subject to the deadline sweep. */
    public static Set<PaymentStatus> inFlight() {
        return EnumSet.of(RESERVED, SUBMITTING, SUBMITTED, CONFIRMING);
    }
}
