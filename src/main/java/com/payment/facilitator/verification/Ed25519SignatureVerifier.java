package com.payment.facilitator.verification;

import com.payment.facilitator.chain.ed25519.Base58;
import com.payment.facilitator.chain.ed25519.Ed25519AuthorizationMessage;
import com.payment.facilitator.chain.ed25519.Ed25519Keys;
import com.payment.facilitator.config.FacilitatorProperties;
import com.payment.facilitator.domain.ChainFamily;
import com.payment.facilitator.domain.PaymentAuthorization;
import com.payment.facilitator.domain.PaymentRequirement;
import org.springframework.stereotype.Component;

import java.security.GeneralSecurityException;

@Component
public class Ed25519SignatureVerifier implements SignatureSchemeVerifier {

    @Override
    public ChainFamily family() {
        return ChainFamily.ED25519;
    }

    @Override
    public boolean isSignedByPayer(PaymentAuthorization authorization,
                                   PaymentRequirement requirement,
                                   FacilitatorProperties.Network network) {
        byte[] message = Ed25519AuthorizationMessage.encode(authorization, requirement.getAsset());
        byte[] signature = Base58.decode(authorization.getSignature());
        if (signature.length != 64) {
            throw new IllegalArgumentException("Ed25519 signature must be 64 bytes, got " + signature.length);
        }
        try {
            return Ed25519Keys.verify(Base58.decode(authorization.getPayer()), message, signature);
        } catch (GeneralSecurityException e) {
            throw new IllegalArgumentException("Ed25519 verification failed: " + e.getMessage(), e);
        }
    }
}
