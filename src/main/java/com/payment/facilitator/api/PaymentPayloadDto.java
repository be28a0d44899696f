package com.payment.facilitator.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Decoded payment header: the payer's signed authorization plus the scheme and network
 * it was signed for.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentPayloadDto {

    private Integer x402Version;
    private String scheme;
    private String network;
    private SignedAuthorization payload;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SignedAuthorization {
        private String signature;
        private Authorization authorization;
    }

    /** EIP-3009 field names; Ed25519 payloads use the same shape with base58 values. */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Authorization {
        private String from;
        private String to;
        private String value;
        private String validAfter;
        private String validBefore;
        private String nonce;
    }
}
