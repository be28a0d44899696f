package com.payment.facilitator.domain;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigInteger;

/**
 * A payer-signed, time-bounded instruction to transfer {@code amount} to {@code payee}.
 * Immutable once signed. {@code validAfter}/{@code validBefore} are epoch seconds.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PaymentAuthorization {

    @NotNull
    PaymentScheme scheme;

    @NotBlank
    String network;

    @NotBlank
    String payer;

    @NotBlank
    String payee;

    @NotNull
    BigInteger amount;

    long validAfter;

    long validBefore;

    /** 32-byte payer-chosen value, 0x-prefixed hex. Scoped to (payer, network). */
    @NotBlank
    String nonce;

    /** 65-byte r||s||v hex for EVM, base58 for Ed25519. */
    @NotBlank
    String signature;
}
