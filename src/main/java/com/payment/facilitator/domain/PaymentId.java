package com.payment.facilitator.domain;

import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Deterministic payment identifiers. The id is a function of {@code (payer, network, nonce)}
 * only, so two submissions of the same authorization always collide on the same record.
 */
public final class PaymentId {

    private static final Pattern NONCE_HEX = Pattern.compile("(0[xX])?[0-9a-fA-F]{64}");

    private PaymentId() {
    }

    public static String of(ChainFamily family, String payer, String network, String nonce) {
        return Numeric.toHexStringNoPrefix(Hash.sha256(key(family, payer, network, nonce).getBytes(StandardCharsets.UTF_8)));
    }

    public static String of(ChainFamily family, PaymentAuthorization authorization) {
        return of(family, authorization.getPayer(), authorization.getNetwork(), authorization.getNonce());
    }

    /** Canonical reservation key shared by the nonce store and the id. */
    public static String key(ChainFamily family, String payer, String network, String nonce) {
        return network + ":" + family.normalizeAddress(payer) + ":" + canonicalNonce(nonce);
    }

    /**
     * {@code 0x} followed by 64 lowercase hex digits for a well-formed nonce, so every
     * spelling of the same 32 bytes maps to one key. Anything else is only lowercased;
     * such nonces never pass verification.
     */
    public static String canonicalNonce(String nonce) {
        if (nonce == null) {
            return null;
        }
        if (NONCE_HEX.matcher(nonce).matches()) {
            return Numeric.toHexString(Numeric.hexStringToByteArray(nonce));
        }
        return nonce.toLowerCase(Locale.ROOT);
    }

    /**
     * The 32 nonce bytes that get signed.
     *
     * @throws IllegalArgumentException unless the nonce is 64 hex digits, optionally 0x-prefixed
     */
    public static byte[] nonceBytes(String nonce) {
        if (nonce == null || !NONCE_HEX.matcher(nonce).matches()) {
            throw new IllegalArgumentException("Nonce must be 32 bytes of hex, got " + nonce);
        }
        return Numeric.hexStringToByteArray(nonce);
    }
}
