package com.payment.facilitator.chain;

import com.payment.facilitator.config.FacilitatorProperties;
import com.payment.facilitator.domain.ChainFamily;
import com.payment.facilitator.domain.ChainTransactionStatus;
import com.payment.facilitator.domain.FeeEstimate;
import com.payment.facilitator.domain.PaymentAuthorization;
import com.payment.facilitator.domain.PaymentRequirement;
import com.payment.facilitator.domain.PreparedSubmission;

/**
 * What every chain-family adapter needs to implement. Takes a verified authorization,
 * talks to the family's RPC nodes, and reports transaction state back in a common shape.
 * <p>
 * All methods throw {@link ChainUnavailableException} for transient failures and
 * {@link ChainRejectedException} for permanent ones.
 */
public interface ChainAdapter {

    ChainFamily family();

    default boolean supports(FacilitatorProperties.Network network) {
        return network.getFamily() == family();
    }

    /**
     * Estimated facilitator cost of settling against this requirement.
     */
    FeeEstimate estimateFee(FacilitatorProperties.Network network, PaymentRequirement requirement);

    /**
     * Build and sign the settlement transaction without broadcasting it. The returned
     * reference is deterministic for the returned payload.
     */
    PreparedSubmission prepare(FacilitatorProperties.Network network,
                               PaymentAuthorization authorization,
                               PaymentRequirement requirement);

    /**
     * Broadcast a prepared transaction. Broadcasting the same payload twice is harmless
     * and returns the same reference.
     *
     * @return the chain transaction reference
     */
    String submit(FacilitatorProperties.Network network, PreparedSubmission prepared);

    ChainTransactionStatus getStatus(FacilitatorProperties.Network network, String transactionRef);

    /**
     * Called when a prepared transaction will never be broadcast, so the adapter can
     * give back anything it allocated for it (e.g. an account nonce).
     */
    default void discard(FacilitatorProperties.Network network, PreparedSubmission prepared) {
    }

    /**
     * Confirmations after which {@code CONFIRMED} counts as settled.
     */
    default int requiredConfirmations(FacilitatorProperties.Network network) {
        return Math.max(1, network.getRequiredConfirmations());
    }
}
