package com.payment.facilitator.api;

import com.payment.facilitator.domain.ChainFamily;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class NetworkStatusDto {

    String name;
    ChainFamily family;
    long chainId;
    int requiredConfirmations;
    /** Resilience4j circuit breaker state, e.g. CLOSED or OPEN. */
    String circuitState;
}
