package com.payment.facilitator.api;

import com.payment.facilitator.domain.PaymentRequirement;
import com.payment.facilitator.domain.PaymentScheme;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.util.Map;

/**
 * Payment requirements in x402 wire form. Amounts are decimal strings in the asset's
 * smallest unit.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentRequirementsDto {

    @NotBlank
    private String scheme;

    @NotBlank
    private String network;

    @NotBlank
    @Pattern(regexp = "\\d+", message = "must be a non-negative integer in the asset's smallest unit")
    private String maxAmountRequired;

    @NotBlank
    private String resource;

    private String description;
    private String mimeType;

    @NotBlank
    private String payTo;

    @Positive
    private long maxTimeoutSeconds;

    @NotBlank
    private String asset;

    private Map<String, String> extra;

    public PaymentRequirement toDomain() {
        return PaymentRequirement.builder()
                .scheme(PaymentScheme.fromWireName(scheme))
                .network(network)
                .asset(asset)
                .maxAmountRequired(new BigInteger(maxAmountRequired))
                .payToAddress(payTo)
                .maxTimeoutSeconds(maxTimeoutSeconds)
                .resource(resource)
                .description(description)
                .mimeType(mimeType)
                .extra(extra)
                .build();
    }

    public static PaymentRequirementsDto from(PaymentRequirement requirement) {
        return PaymentRequirementsDto.builder()
                .scheme(requirement.getScheme().wireName())
                .network(requirement.getNetwork())
                .maxAmountRequired(requirement.getMaxAmountRequired().toString())
                .resource(requirement.getResource())
                .description(requirement.getDescription())
                .mimeType(requirement.getMimeType())
                .payTo(requirement.getPayToAddress())
                .maxTimeoutSeconds(requirement.getMaxTimeoutSeconds())
                .asset(requirement.getAsset())
                .extra(requirement.getExtra())
                .build();
    }
}
