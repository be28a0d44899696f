package com.payment.facilitator.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payment.facilitator.domain.PaymentAuthorization;
import com.payment.facilitator.domain.PaymentId;
import com.payment.facilitator.domain.PaymentScheme;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Decodes the base64 JSON payment header and maps the payload onto a
 * {@link PaymentAuthorization}. Encoding is provided for clients and tests.
 */
@Component
public class PaymentHeaderCodec {

    private final ObjectMapper objectMapper;
    private final int protocolVersion;

    public PaymentHeaderCodec(ObjectMapper objectMapper,
                              @Value("${facilitator.protocol-version:1}") int protocolVersion) {
        this.objectMapper = objectMapper;
        this.protocolVersion = protocolVersion;
    }

    public PaymentPayloadDto decode(String header) {
        if (header == null || header.isBlank()) {
            throw new InvalidPaymentHeaderException("Payment header is empty");
        }
        byte[] json;
        try {
            json = Base64.getDecoder().decode(header.trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidPaymentHeaderException("Payment header is not valid base64", e);
        }
        try {
            return objectMapper.readValue(json, PaymentPayloadDto.class);
        } catch (IOException e) {
            throw new InvalidPaymentHeaderException("Payment header is not a valid payment payload: " + e.getMessage(), e);
        }
    }

    public String encode(PaymentPayloadDto payload) {
        try {
            return Base64.getEncoder().encodeToString(objectMapper.writeValueAsString(payload).getBytes(StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not encode payment payload", e);
        }
    }

    /**
     * Resolve the authorization carried by a verify/settle request, from either the header
     * or the decoded payload.
     */
    public PaymentAuthorization resolve(FacilitatorRequestDto request) {
        PaymentPayloadDto payload = request.getPaymentPayload();
        if (payload == null) {
            payload = decode(request.getPaymentHeader());
        }
        Integer version = payload.getX402Version() != null ? payload.getX402Version() : request.getX402Version();
        if (version == null || version != protocolVersion) {
            throw new InvalidPaymentHeaderException("Unsupported x402Version " + version + "; expected " + protocolVersion);
        }
        return toAuthorization(payload);
    }

    PaymentAuthorization toAuthorization(PaymentPayloadDto payload) {
        PaymentPayloadDto.SignedAuthorization signed = payload.getPayload();
        if (signed == null || signed.getAuthorization() == null) {
            throw new InvalidPaymentHeaderException("Payment payload has no authorization");
        }
        PaymentPayloadDto.Authorization auth = signed.getAuthorization();
        require(signed.getSignature(), "signature");
        require(payload.getNetwork(), "network");
        require(auth.getFrom(), "authorization.from");
        require(auth.getTo(), "authorization.to");
        require(auth.getNonce(), "authorization.nonce");
        try {
            return PaymentAuthorization.builder()
                    .scheme(payload.getScheme() == null ? null : PaymentScheme.fromWireName(payload.getScheme()))
                    .network(payload.getNetwork())
                    .payer(auth.getFrom())
                    .payee(auth.getTo())
                    .amount(new BigInteger(require(auth.getValue(), "authorization.value")))
                    .validAfter(Long.parseLong(require(auth.getValidAfter(), "authorization.validAfter")))
                    .validBefore(Long.parseLong(require(auth.getValidBefore(), "authorization.validBefore")))
                    .nonce(PaymentId.canonicalNonce(auth.getNonce()))
                    .signature(signed.getSignature())
                    .build();
        } catch (NumberFormatException e) {
            throw new InvalidPaymentHeaderException("Payment payload has a malformed number: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new InvalidPaymentHeaderException("Unknown scheme " + payload.getScheme(), e);
        }
    }

    private static String require(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidPaymentHeaderException("Payment payload is missing " + field);
        }
        return value;
    }
}
