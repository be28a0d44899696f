package com.payment.facilitator.chain;

/**
 * Transient chain failure (RPC down, timeout, open circuit). Safe to retry with backoff.
 */
public class ChainUnavailableException extends RuntimeException {

    private final String network;

    public ChainUnavailableException(String network, String message) {
        super(message);
        this.network = network;
    }

    public ChainUnavailableException(String network, String message, Throwable cause) {
        super(message, cause);
        this.network = network;
    }

    public String getNetwork() {
        return network;
    }
}
