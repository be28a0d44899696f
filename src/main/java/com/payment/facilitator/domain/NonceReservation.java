package com.payment.facilitator.domain;

/**
 * Result of a check-and-reserve on the nonce store.
 */
public enum NonceReservation {
    RESERVED,
    ALREADY_RESERVED
}
