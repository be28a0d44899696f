package com.payment.facilitator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the payment facilitator. Provides:
 * <ul>
 *   <li>Verification of signed EIP-712 (EVM) and Ed25519 payment authorizations</li>
 *   <li>At-most-once settlement backed by a write-once nonce store and a JPA ledger</li>
 *   <li>Retry and per-network circuit breakers around chain RPC (Resilience4j)</li>
 *   <li>Kafka settlement notifications and REST API docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
public class PaymentFacilitatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaymentFacilitatorApplication.class, args);
    }
}
