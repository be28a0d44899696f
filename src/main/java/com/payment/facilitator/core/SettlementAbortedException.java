package com.payment.facilitator.core;

/**
 * Settlement could not proceed because of an internal failure (ledger or nonce store
 * unavailable, missing chain adapter). Nothing was persisted by the aborted call;
 * callers may retry {@code settle} with the same authorization.
 */
public class SettlementAbortedException extends RuntimeException {

    public SettlementAbortedException(String message) {
        super(message);
    }

    public SettlementAbortedException(String message, Throwable cause) {
        super(message, cause);
    }
}
