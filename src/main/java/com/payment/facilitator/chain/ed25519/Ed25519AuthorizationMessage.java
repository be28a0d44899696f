package com.payment.facilitator.chain.ed25519;

import com.payment.facilitator.domain.PaymentAuthorization;
import com.payment.facilitator.domain.PaymentId;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Canonical bytes a payer signs on an Ed25519 network. The same bytes are carried in the
 * settlement transaction, where the signature-verify precompile checks them again.
 * <p>
 * Layout (big-endian): u16-length-prefixed domain tag, u16-length-prefixed network name,
 * then asset (32), from (32), to (32), value (32, unsigned), validAfter (8),
 * validBefore (8), nonce (32).
 */
public final class Ed25519AuthorizationMessage {

    public static final String DOMAIN_TAG = "x402:ed25519:transfer-authorization:v1";

    private static final int KEY_LENGTH = 32;
    private static final BigInteger MAX_VALUE = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    private Ed25519AuthorizationMessage() {
    }

    /**
     * @throws IllegalArgumentException if an address, amount or nonce is malformed
     */
    public static byte[] encode(PaymentAuthorization authorization, String asset) {
        byte[] tag = DOMAIN_TAG.getBytes(StandardCharsets.UTF_8);
        byte[] network = authorization.getNetwork().getBytes(StandardCharsets.UTF_8);
        if (network.length > 0xFFFF) {
            throw new IllegalArgumentException("Network name too long");
        }
        ByteBuffer buf = ByteBuffer.allocate(2 + tag.length + 2 + network.length + 4 * KEY_LENGTH + 32 + 16);
        buf.putShort((short) tag.length).put(tag);
        buf.putShort((short) network.length).put(network);
        buf.put(key("asset", asset));
        buf.put(key("from", authorization.getPayer()));
        buf.put(key("to", authorization.getPayee()));
        buf.put(uint256(authorization.getAmount()));
        buf.putLong(authorization.getValidAfter());
        buf.putLong(authorization.getValidBefore());
        buf.put(PaymentId.nonceBytes(authorization.getNonce()));
        return buf.array();
    }

    static byte[] key(String field, String base58) {
        byte[] raw = Base58.decode(base58);
        if (raw.length != KEY_LENGTH) {
            throw new IllegalArgumentException(field + " must decode to 32 bytes, got " + raw.length);
        }
        return raw;
    }

    private static byte[] uint256(BigInteger value) {
        if (value == null || value.signum() < 0 || value.compareTo(MAX_VALUE) > 0) {
            throw new IllegalArgumentException("Amount out of range: " + value);
        }
        return Numeric.toBytesPadded(value, 32);
    }
}
