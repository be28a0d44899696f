package com.payment.facilitator.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * Body of {@code /verify} and {@code /settle}. The authorization arrives either as the raw
 * base64 {@code X-PAYMENT} header value or already decoded as {@code paymentPayload}.
 */
@Data
public class FacilitatorRequestDto {

    private Integer x402Version;

    private String paymentHeader;

    private PaymentPayloadDto paymentPayload;

    @NotNull(message = "paymentRequirements is required")
    @Valid
    private PaymentRequirementsDto paymentRequirements;
}
