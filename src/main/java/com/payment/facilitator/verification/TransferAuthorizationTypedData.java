package com.payment.facilitator.verification;

import com.payment.facilitator.domain.PaymentAuthorization;
import com.payment.facilitator.domain.PaymentId;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

/**
 * EIP-712 digest of an EIP-3009 {@code TransferWithAuthorization} message. The domain's
 * verifying contract is the token itself.
 */
public final class TransferAuthorizationTypedData {

    static final byte[] DOMAIN_TYPEHASH = Hash.sha3(
            "EIP712Domain(string name,string version,uint256 chainId,address verifyingContract)"
                    .getBytes(StandardCharsets.UTF_8));

    static final byte[] TRANSFER_TYPEHASH = Hash.sha3(
            ("TransferWithAuthorization(address from,address to,uint256 value,"
                    + "uint256 validAfter,uint256 validBefore,bytes32 nonce)").getBytes(StandardCharsets.UTF_8));

    private TransferAuthorizationTypedData() {
    }

    /**
     * keccak256(0x19 0x01 || domainSeparator || structHash)
     */
    public static byte[] digest(PaymentAuthorization authorization, String tokenName, String tokenVersion,
                                long chainId, String verifyingContract) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(0x19);
        out.write(0x01);
        out.writeBytes(domainSeparator(tokenName, tokenVersion, chainId, verifyingContract));
        out.writeBytes(structHash(authorization));
        return Hash.sha3(out.toByteArray());
    }

    static byte[] domainSeparator(String name, String version, long chainId, String verifyingContract) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(DOMAIN_TYPEHASH);
        out.writeBytes(Hash.sha3(name.getBytes(StandardCharsets.UTF_8)));
        out.writeBytes(Hash.sha3(version.getBytes(StandardCharsets.UTF_8)));
        out.writeBytes(uint256(BigInteger.valueOf(chainId)));
        out.writeBytes(address(verifyingContract));
        return Hash.sha3(out.toByteArray());
    }

    static byte[] structHash(PaymentAuthorization authorization) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.writeBytes(TRANSFER_TYPEHASH);
        out.writeBytes(address(authorization.getPayer()));
        out.writeBytes(address(authorization.getPayee()));
        out.writeBytes(uint256(authorization.getAmount()));
        out.writeBytes(uint256(BigInteger.valueOf(authorization.getValidAfter())));
        out.writeBytes(uint256(BigInteger.valueOf(authorization.getValidBefore())));
        out.writeBytes(PaymentId.nonceBytes(authorization.getNonce()));
        return Hash.sha3(out.toByteArray());
    }

    private static byte[] uint256(BigInteger value) {
        if (value == null || value.signum() < 0 || value.bitLength() > 256) {
            throw new IllegalArgumentException("uint256 out of range: " + value);
        }
        return Numeric.toBytesPadded(value, 32);
    }

    private static byte[] address(String address) {
        byte[] raw = Numeric.hexStringToByteArray(address);
        if (raw.length != 20) {
            throw new IllegalArgumentException("Address must be 20 bytes: " + address);
        }
        byte[] padded = new byte[32];
        System.arraycopy(raw, 0, padded, 12, 20);
        return padded;
    }
}
