package com.payment.facilitator.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.payment.facilitator.domain.FailureReason;
import com.payment.facilitator.domain.PaymentStatus;
import com.payment.facilitator.domain.SettlementResult;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Settlement outcome. {@code success} is true only for SETTLED; callers that accept
 * in-flight payments can look at {@code status} and poll {@code /payments/{id}}.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SettleResponseDto {

    boolean success;
    FailureReason errorReason;
    String transaction;
    String network;
    String payer;
    String paymentId;
    PaymentStatus status;
    Integer confirmations;
    Integer requiredConfirmations;
    PaymentStatus originalStatus;
    String message;
    Instant updatedAt;

    public static SettleResponseDto from(SettlementResult result) {
        return SettleResponseDto.builder()
                .success(result.isSuccess())
                .errorReason(result.getFailureReason())
                .transaction(result.getTransactionRef())
                .network(result.getNetwork())
                .payer(result.getPayer())
                .paymentId(result.getPaymentId())
                .status(result.getStatus())
                .confirmations(result.getConfirmations())
                .requiredConfirmations(result.getRequiredConfirmations())
                .originalStatus(result.getOriginalStatus())
                .message(result.getMessage())
                .updatedAt(result.getUpdatedAt())
                .build();
    }
}
