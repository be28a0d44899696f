package com.payment.facilitator.domain;

import lombok.Value;

/**
 * Outcome of verifying an authorization against a requirement. Either a verified payer
 * ({@code valid == true}) or a deterministic validation failure.
 */
@Value
public class VerificationResult {

    boolean valid;
    String payer;
    String network;
    FailureReason reason;
    String message;

    public static VerificationResult verified(String payer, String network) {
        return new VerificationResult(true, payer, network, null, null);
    }

    public static VerificationResult invalid(FailureReason reason, String message) {
        return new VerificationResult(false, null, null, reason, message);
    }

    public static VerificationResult invalid(FailureReason reason, String message, String payer) {
        return new VerificationResult(false, payer, null, reason, message);
    }
}
