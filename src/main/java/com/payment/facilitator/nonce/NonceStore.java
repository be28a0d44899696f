package com.payment.facilitator.nonce;

import com.payment.facilitator.domain.NonceReservation;

/**
 * Write-once reservations of {@code (payer, network, nonce)}. {@link #reserve} is the single
 * point where two settlements of the same authorization are told apart, so it must be
 * atomic across every facilitator instance sharing the store.
 * <p>
 * Callers pass already-normalized keys (see {@code PaymentId.key}).
 */
public interface NonceStore {

    NonceReservation reserve(String reservationKey, String payer, String network, String nonce);

    boolean isReserved(String reservationKey);

    /**
     * Release a reservation. Only for settlements that definitely never broadcast.
     */
    void expire(String reservationKey);
}
