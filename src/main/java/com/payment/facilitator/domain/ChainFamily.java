package com.payment.facilitator.domain;

import com.payment.facilitator.chain.ed25519.Base58;
import org.web3j.crypto.WalletUtils;

import java.util.Locale;

/**
 * Classes of blockchains that share a signature and transaction-submission model.
 * Each family has exactly one chain adapter and one signature scheme verifier; new
 * families are added here, never detected at runtime from address shapes.
 */
public enum ChainFamily {

    /** secp256k1 accounts, EIP-712 typed-data authorizations, EIP-3009 token transfers. */
    EVM {
        @Override
        public boolean isValidAddress(String address) {
            return address != null && WalletUtils.isValidAddress(address) && address.startsWith("0x");
        }

        @Override
        public String normalizeAddress(String address) {
            return address == null ? null : address.toLowerCase(Locale.ROOT);
        }

        @Override
        public String normalizeSignature(String signature) {
            return signature == null ? null : signature.toLowerCase(Locale.ROOT);
        }
    },

    /** Ed25519 accounts addressed by base58 public keys (Solana-style). */
    ED25519 {
        @Override
        public boolean isValidAddress(String address) {
            if (address == null || address.isBlank()) {
                return false;
            }
            try {
                return Base58.decode(address).length == 32;
            } catch (IllegalArgumentException e) {
                return false;
            }
        }

        @Override
        public String normalizeAddress(String address) {
            return address;
        }

        @Override
        public String normalizeSignature(String signature) {
            return signature;
        }
    };

    public abstract boolean isValidAddress(String address);

    /**
     * Canonical form used for comparisons and storage keys. EVM addresses are
     * case-insensitive (checksum casing is presentation only); base58 is not.
     */
    public abstract String normalizeAddress(String address);

    /** Hex signatures compare case-insensitively; base58 ones exactly. */
    public abstract String normalizeSignature(String signature);

    public boolean sameAddress(String a, String b) {
        return a != null && b != null && normalizeAddress(a).equals(normalizeAddress(b));
    }
}
