package com.payment.facilitator.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.payment.facilitator.domain.FailureReason;
import com.payment.facilitator.domain.VerificationResult;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VerifyResponseDto {

    @JsonProperty("isValid")
    boolean valid;

    FailureReason invalidReason;
    String payer;
    String message;

    public static VerifyResponseDto from(VerificationResult result) {
        return VerifyResponseDto.builder()
                .valid(result.isValid())
                .invalidReason(result.getReason())
                .payer(result.getPayer())
                .message(result.getMessage())
                .build();
    }
}
