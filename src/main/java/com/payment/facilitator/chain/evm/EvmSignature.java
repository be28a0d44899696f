package com.payment.facilitator.chain.evm;

import org.web3j.utils.Numeric;

import java.util.Arrays;

/**
 * A 65-byte secp256k1 signature in r || s || v order. {@code v} is normalized to 27/28.
 */
public final class EvmSignature {

    private final byte[] r;
    private final byte[] s;
    private final byte v;

    private EvmSignature(byte[] r, byte[] s, byte v) {
        this.r = r;
        this.s = s;
        this.v = v;
    }

    /**
     * @throws IllegalArgumentException if the value is not 65 bytes of hex or v is out of range
     */
    public static EvmSignature parse(String hex) {
        if (hex == null || hex.isBlank()) {
            throw new IllegalArgumentException("Signature is empty");
        }
        byte[] raw;
        try {
            raw = Numeric.hexStringToByteArray(hex);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Signature is not hex", e);
        }
        if (raw.length != 65) {
            throw new IllegalArgumentException("Signature must be 65 bytes, got " + raw.length);
        }
        int v = raw[64] & 0xff;
        if (v < 27) {
            v += 27;
        }
        if (v != 27 && v != 28) {
            throw new IllegalArgumentException("Signature recovery id out of range: " + raw[64]);
        }
        return new EvmSignature(Arrays.copyOfRange(raw, 0, 32), Arrays.copyOfRange(raw, 32, 64), (byte) v);
    }

    public byte[] r() {
        return r.clone();
    }

    public byte[] s() {
        return s.clone();
    }

    public byte v() {
        return v;
    }

    /** Recovery id in 0..1 form expected by {@code Sign.recoverFromSignature}. */
    public int recoveryId() {
        return v - 27;
    }
}
