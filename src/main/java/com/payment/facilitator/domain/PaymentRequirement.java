package com.payment.facilitator.domain;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigInteger;
import java.util.Map;

/**
 * What payment a resource demands on one network. Immutable; identified by
 * {@code (resource, scheme, network)}. Amounts are in the asset's smallest unit.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PaymentRequirement {

    @NotNull
    PaymentScheme scheme;

    /** Configured network name, e.g. "base-sepolia" or "solana-devnet". */
    @NotBlank
    String network;

    /** Token contract address (EVM) or mint address (Ed25519). */
    @NotBlank
    String asset;

    @NotNull
    BigInteger maxAmountRequired;

    @NotBlank
    String payToAddress;

    long maxTimeoutSeconds;

    /** Opaque identifier of the protected resource. */
    @NotBlank
    String resource;

    String description;

    String mimeType;

    /** Scheme-specific metadata, e.g. the EIP-712 domain {@code name} and {@code version} of the asset. */
    Map<String, String> extra;

    public String extraOrDefault(String key, String fallback) {
        if (extra == null) {
            return fallback;
        }
        String value = extra.get(key);
        return value != null && !value.isBlank() ? value : fallback;
    }
}
