package com.payment.facilitator.api;

import lombok.Value;

@Value
public class SupportedKindDto {

    int x402Version;
    String scheme;
    String network;
}
