package com.payment.facilitator.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Estimated facilitator cost of settling one authorization, in the network's native unit
 * (wei for EVM, lamports for Ed25519 networks).
 */
@Value
@Builder
@Jacksonized
public class FeeEstimate {

    String network;
    BigInteger gasLimit;
    BigInteger unitPrice;
    BigInteger totalFee;
    String feeUnit;
    Instant estimatedAt;
}
