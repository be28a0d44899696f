package com.payment.facilitator.domain;

/**
 * Why a verification or settlement did not succeed. Validation reasons are
 * deterministic and never retried; chain reasons describe terminal record states.
 */
public enum FailureReason {
    // validation
    INVALID_REQUIREMENT(true, false),
    UNSUPPORTED_NETWORK(true, false),
    SCHEME_MISMATCH(true, false),
    RECIPIENT_MISMATCH(true, false),
    INSUFFICIENT_AMOUNT(true, false),
    AUTHORIZATION_EXPIRED(true, false),
    AUTHORIZATION_NOT_YET_VALID(true, false),
    SIGNATURE_INVALID(true, false),
    // replay
    DUPLICATE_AUTHORIZATION(false, false),
    // chain outcomes
    CHAIN_REJECTED(false, true),
    TRANSACTION_FAILED(false, false),
    RETRIES_EXHAUSTED(false, false),
    CONFIRMATION_TIMEOUT(false, false),
    RESERVATION_EXPIRED(false, true);

    private final boolean validation;
    private final boolean releasesNonce;

    FailureReason(boolean validation, boolean releasesNonce) {
        this.validation = validation;
        this.releasesNonce = releasesNonce;
    }

    public boolean isValidation() {
        return validation;
    }

    /**
     * True for outcomes where nothing reached the chain and the nonce reservation was
     * given back, so the same authorization may be settled again.
     */
    public boolean releasesNonce() {
        return releasesNonce;
    }
}
