package com.payment.facilitator.domain;

import lombok.Value;

/**
 * A fully signed settlement transaction that has not necessarily been broadcast yet.
 * {@code reference} is derived from {@code payload}, so broadcasting the same payload
 * again can only ever produce the same transaction.
 */
@Value
public class PreparedSubmission {

    String network;
    String reference;
    String payload;
}
