package com.payment.facilitator.registry;

/**
 * Thrown when a declared requirement is malformed. Handler returns HTTP 400.
 */
public class InvalidRequirementException extends RuntimeException {

    public InvalidRequirementException(String message) {
        super(message);
    }
}
