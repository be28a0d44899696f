package com.payment.facilitator.chain.ed25519;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;

/**
 * Builds the legacy-format transaction that settles one authorization:
 * instruction 0 runs the Ed25519 signature-verify precompile over the payer's
 * authorization, instruction 1 calls the settlement program, which checks the
 * previous instruction and moves the tokens.
 * <p>
 * Accounts: [facilitator (signer, writable), payer, payee, asset, precompile, program].
 */
public final class Ed25519SettlementTransaction {

    public static final String SIG_VERIFY_PROGRAM = "Ed25519SigVerify111111111111111111111111111";

    static final byte SETTLE_INSTRUCTION = 0x01;

    private static final int PRECOMPILE_HEADER = 16;
    private static final int PUBKEY_OFFSET = PRECOMPILE_HEADER;
    private static final int SIGNATURE_OFFSET = PUBKEY_OFFSET + 32;
    private static final int MESSAGE_OFFSET = SIGNATURE_OFFSET + 64;
    private static final int CURRENT_INSTRUCTION = 0xFFFF;

    private final byte[] message;
    private final byte[] signature;

    private Ed25519SettlementTransaction(byte[] message, byte[] signature) {
        this.message = message;
        this.signature = signature;
    }

    /**
     * @param payerSignature     64-byte signature over {@code authorizationMessage}
     * @param recentBlockhash    32-byte blockhash
     * @param facilitatorSeed    32-byte seed of the fee-paying facilitator key
     */
    public static Ed25519SettlementTransaction build(byte[] facilitator, byte[] payer, byte[] payee, byte[] asset,
                                                     byte[] settlementProgram, byte[] recentBlockhash,
                                                     byte[] authorizationMessage, byte[] payerSignature,
                                                     byte[] facilitatorSeed) throws GeneralSecurityException {
        if (payerSignature.length != 64) {
            throw new IllegalArgumentException("Payer signature must be 64 bytes, got " + payerSignature.length);
        }
        byte[] message = compileMessage(facilitator, payer, payee, asset, settlementProgram, recentBlockhash,
                precompileData(payer, payerSignature, authorizationMessage), settleData(authorizationMessage));
        PrivateKey key = Ed25519Keys.privateKey(facilitatorSeed);
        return new Ed25519SettlementTransaction(message, Ed25519Keys.sign(key, message));
    }

    /** Transaction id: base58 of the fee payer's signature. */
    public String reference() {
        return Base58.encode(signature);
    }

    /** Wire form: shortvec signature count, signatures, message. */
    public byte[] serialize() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        writeLength(out, 1);
        out.writeBytes(signature);
        out.writeBytes(message);
        return out.toByteArray();
    }

    byte[] message() {
        return message.clone();
    }

    static byte[] precompileData(byte[] publicKey, byte[] signature, byte[] message) {
        if (message.length > 0xFFFF) {
            throw new IllegalArgumentException("Authorization message too long");
        }
        ByteBuffer buf = ByteBuffer.allocate(MESSAGE_OFFSET + message.length).order(ByteOrder.LITTLE_ENDIAN);
        buf.put((byte) 1).put((byte) 0);
        buf.putShort((short) SIGNATURE_OFFSET).putShort((short) CURRENT_INSTRUCTION);
        buf.putShort((short) PUBKEY_OFFSET).putShort((short) CURRENT_INSTRUCTION);
        buf.putShort((short) MESSAGE_OFFSET).putShort((short) message.length).putShort((short) CURRENT_INSTRUCTION);
        buf.put(publicKey).put(signature).put(message);
        return buf.array();
    }

    private static byte[] settleData(byte[] authorizationMessage) {
        byte[] data = new byte[authorizationMessage.length + 1];
        data[0] = SETTLE_INSTRUCTION;
        System.arraycopy(authorizationMessage, 0, data, 1, authorizationMessage.length);
        return data;
    }

    private static byte[] compileMessage(byte[] facilitator, byte[] payer, byte[] payee, byte[] asset,
                                         byte[] program, byte[] blockhash, byte[] verifyData, byte[] settleData) {
        byte[] sigVerify = Base58.decode(SIG_VERIFY_PROGRAM);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        // one signer, no read-only signers, three read-only non-signers
        out.write(1);
        out.write(0);
        out.write(3);
        writeLength(out, 6);
        for (byte[] account : new byte[][]{facilitator, payer, payee, asset, sigVerify, program}) {
            requireKey(account);
            out.writeBytes(account);
        }
        requireKey(blockhash);
        out.writeBytes(blockhash);

        writeLength(out, 2);
        writeInstruction(out, 4, new byte[0], verifyData);
        writeInstruction(out, 5, new byte[]{1, 2, 3, 0}, settleData);
        return out.toByteArray();
    }

    private static void writeInstruction(ByteArrayOutputStream out, int programIndex, byte[] accounts, byte[] data) {
        out.write(programIndex);
        writeLength(out, accounts.length);
        out.writeBytes(accounts);
        writeLength(out, data.length);
        out.writeBytes(data);
    }

    /** compact-u16: 7 bits per byte, high bit set on all but the last. */
    static void writeLength(ByteArrayOutputStream out, int length) {
        int remaining = length;
        while (true) {
            int b = remaining & 0x7f;
            remaining >>>= 7;
            if (remaining == 0) {
                out.write(b);
                return;
            }
            out.write(b | 0x80);
        }
    }

    private static void requireKey(byte[] key) {
        if (key == null || key.length != 32) {
            throw new IllegalArgumentException("Account keys and blockhash must be 32 bytes");
        }
    }
}
