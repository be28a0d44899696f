package com.payment.facilitator.api;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Body a resource server returns with HTTP 402: every way the resource can be paid for.
 */
@Value
@Builder
public class PaymentRequiredResponse {

    int x402Version;
    String error;
    List<PaymentRequirementsDto> accepts;
}
