package com.payment.facilitator.domain;

import lombok.Value;

/**
 * What a chain reports about a transaction reference.
 */
@Value
public class ChainTransactionStatus {

    public enum State {
        PENDING,
        CONFIRMED,
        FAILED,
        NOT_FOUND
    }

    State state;
    int confirmations;
    String reason;

    public static ChainTransactionStatus pending() {
        return new ChainTransactionStatus(State.PENDING, 0, null);
    }

    public static ChainTransactionStatus confirmed(int confirmations) {
        return new ChainTransactionStatus(State.CONFIRMED, confirmations, null);
    }

    public static ChainTransactionStatus failed(String reason) {
        return new ChainTransactionStatus(State.FAILED, 0, reason);
    }

    public static ChainTransactionStatus notFound() {
        return new ChainTransactionStatus(State.NOT_FOUND, 0, null);
    }
}
