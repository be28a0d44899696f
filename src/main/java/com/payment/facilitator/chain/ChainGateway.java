package com.payment.facilitator.chain;

import com.payment.facilitator.config.FacilitatorProperties;
import com.payment.facilitator.domain.ChainTransactionStatus;
import com.payment.facilitator.domain.FeeEstimate;
import com.payment.facilitator.domain.PaymentAuthorization;
import com.payment.facilitator.domain.PaymentRequirement;
import com.payment.facilitator.domain.PreparedSubmission;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.IntConsumer;
import java.util.function.Supplier;

/**
 * Calls chain adapters with retries and circuit breaker protection.
 * Each network gets its own circuit breaker so one failing RPC doesn't block the others;
 * an open breaker fails fast with {@link ChainUnavailableException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChainGateway {

    static final String SUBMIT_RETRY = "chain-submit";
    static final String CIRCUIT_PREFIX = "chain-";

    private final ChainAdapterRegistry adapterRegistry;
    private final NetworkRegistry networkRegistry;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final RetryRegistry retryRegistry;

    public FeeEstimate estimateFee(PaymentRequirement requirement) {
        FacilitatorProperties.Network network = networkRegistry.require(requirement.getNetwork());
        ChainAdapter adapter = adapterRegistry.forNetwork(network);
        return guarded(network, () -> adapter.estimateFee(network, requirement));
    }

    public PreparedSubmission prepare(PaymentAuthorization authorization, PaymentRequirement requirement) {
        FacilitatorProperties.Network network = networkRegistry.require(authorization.getNetwork());
        ChainAdapter adapter = adapterRegistry.forNetwork(network);
        Retry retry = retryRegistry.retry(SUBMIT_RETRY);
        Supplier<PreparedSubmission> withRetry = Retry.decorateSupplier(retry,
                () -> guarded(network, () -> adapter.prepare(network, authorization, requirement)));
        return withRetry.get();
    }

    /**
     * Broadcast with bounded exponential-backoff retries on {@link ChainUnavailableException}.
     * {@code onAttempt} is called before every broadcast attempt with the 1-based attempt number.
     * Retries go through the circuit breaker one by one, so an open breaker burns attempts
     * without touching the node.
     */
    public String submit(PreparedSubmission prepared, IntConsumer onAttempt) {
        FacilitatorProperties.Network network = networkRegistry.require(prepared.getNetwork());
        ChainAdapter adapter = adapterRegistry.forNetwork(network);
        Retry retry = retryRegistry.retry(SUBMIT_RETRY);
        int[] attempt = {0};
        Supplier<String> call = () -> {
            attempt[0]++;
            onAttempt.accept(attempt[0]);
            log.debug("Broadcasting transaction ref={} network={} attempt={}", prepared.getReference(), network.getName(), attempt[0]);
            return guarded(network, () -> adapter.submit(network, prepared));
        };
        return Retry.decorateSupplier(retry, call).get();
    }

    public ChainTransactionStatus getStatus(String networkName, String transactionRef) {
        FacilitatorProperties.Network network = networkRegistry.require(networkName);
        ChainAdapter adapter = adapterRegistry.forNetwork(network);
        return guarded(network, () -> adapter.getStatus(network, transactionRef));
    }

    public void discard(PreparedSubmission prepared) {
        FacilitatorProperties.Network network = networkRegistry.require(prepared.getNetwork());
        adapterRegistry.forNetwork(network).discard(network, prepared);
    }

    public int requiredConfirmations(String networkName) {
        FacilitatorProperties.Network network = networkRegistry.require(networkName);
        return adapterRegistry.forNetwork(network).requiredConfirmations(network);
    }

    public CircuitBreaker.State circuitState(String networkName) {
        return circuitBreakerRegistry.circuitBreaker(CIRCUIT_PREFIX + networkName).getState();
    }

    private <T> T guarded(FacilitatorProperties.Network network, Supplier<T> call) {
        CircuitBreaker cb = circuitBreakerRegistry.circuitBreaker(CIRCUIT_PREFIX + network.getName());
        try {
            return cb.executeSupplier(call);
        } catch (CallNotPermittedException e) {
            log.warn("Circuit open for network={}; failing fast", network.getName());
            throw new ChainUnavailableException(network.getName(), "Circuit open for network " + network.getName(), e);
        }
    }
}
