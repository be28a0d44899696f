package com.payment.facilitator.api;

/**
 * The payment header or payload could not be decoded, or uses an unsupported protocol version.
 */
public class InvalidPaymentHeaderException extends RuntimeException {

    public InvalidPaymentHeaderException(String message) {
        super(message);
    }

    public InvalidPaymentHeaderException(String message, Throwable cause) {
        super(message, cause);
    }
}
