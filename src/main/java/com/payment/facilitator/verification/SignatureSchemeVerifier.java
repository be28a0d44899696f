package com.payment.facilitator.verification;

import com.payment.facilitator.config.FacilitatorProperties;
import com.payment.facilitator.domain.ChainFamily;
import com.payment.facilitator.domain.PaymentAuthorization;
import com.payment.facilitator.domain.PaymentRequirement;

/**
 * Rebuilds the exact bytes a payer signed on one chain family and checks the signature.
 * Implementations must not do any I/O.
 */
public interface SignatureSchemeVerifier {

    ChainFamily family();

    /**
     * @return true if the signature was produced by {@code authorization.getPayer()}
     * @throws IllegalArgumentException if a field is malformed (bad hex, wrong length)
     */
    boolean isSignedByPayer(PaymentAuthorization authorization,
                            PaymentRequirement requirement,
                            FacilitatorProperties.Network network);
}
