package com.payment.facilitator.chain;

/**
 * Permanent chain failure: the network refused the transaction (insufficient payer
 * balance, authorization already used, malformed transaction). Never retried.
 */
public class ChainRejectedException extends RuntimeException {

    private final String network;

    public ChainRejectedException(String network, String message) {
        super(message);
        this.network = network;
    }

    public ChainRejectedException(String network, String message, Throwable cause) {
        super(message, cause);
        this.network = network;
    }

    public String getNetwork() {
        return network;
    }
}
