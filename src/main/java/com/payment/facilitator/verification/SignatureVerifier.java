package com.payment.facilitator.verification;

import com.payment.facilitator.chain.NetworkRegistry;
import com.payment.facilitator.config.FacilitatorProperties;
import com.payment.facilitator.domain.ChainFamily;
import com.payment.facilitator.domain.FailureReason;
import com.payment.facilitator.domain.PaymentAuthorization;
import com.payment.facilitator.domain.PaymentRequirement;
import com.payment.facilitator.domain.VerificationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks an authorization against a requirement: recipient, amount, validity window and
 * signature, in that order, stopping at the first failure.
 * <p>
 * Pure by contract. No nonce store, no ledger and no chain I/O, so callers can verify
 * the same authorization as often as they like without consuming it.
 */
@Slf4j
@Service
public class SignatureVerifier {

    private final NetworkRegistry networkRegistry;
    private final DynamicPricingService pricingService;
    private final Map<ChainFamily, SignatureSchemeVerifier> verifiers = new EnumMap<>(ChainFamily.class);

    public SignatureVerifier(NetworkRegistry networkRegistry,
                             DynamicPricingService pricingService,
                             List<SignatureSchemeVerifier> schemeVerifiers) {
        this.networkRegistry = networkRegistry;
        this.pricingService = pricingService;
        for (SignatureSchemeVerifier verifier : schemeVerifiers) {
            if (verifiers.putIfAbsent(verifier.family(), verifier) != null) {
                throw new IllegalStateException("Two signature verifiers registered for family " + verifier.family());
            }
        }
    }

    /**
     * @param now the single instant the validity window is checked against
     */
    public VerificationResult verify(PaymentAuthorization authorization, PaymentRequirement requirement, Instant now) {
        if (authorization == null || requirement == null) {
            return VerificationResult.invalid(FailureReason.INVALID_REQUIREMENT, "Authorization and requirement are both required");
        }
        String payer = authorization.getPayer();

        Optional<FacilitatorProperties.Network> network = networkRegistry.find(requirement.getNetwork());
        if (!requirement.getNetwork().equals(authorization.getNetwork())) {
            return VerificationResult.invalid(FailureReason.RECIPIENT_MISMATCH,
                    "Authorization is for network " + authorization.getNetwork() + ", requirement for " + requirement.getNetwork(), payer);
        }
        if (network.isEmpty()) {
            return VerificationResult.invalid(FailureReason.UNSUPPORTED_NETWORK, "Unsupported network: " + requirement.getNetwork(), payer);
        }
        ChainFamily family = network.get().getFamily();
        if (!family.sameAddress(authorization.getPayee(), requirement.getPayToAddress())) {
            return VerificationResult.invalid(FailureReason.RECIPIENT_MISMATCH,
                    "Payee " + authorization.getPayee() + " does not match payTo " + requirement.getPayToAddress(), payer);
        }
        if (authorization.getScheme() != null && authorization.getScheme() != requirement.getScheme()) {
            return VerificationResult.invalid(FailureReason.SCHEME_MISMATCH,
                    "Authorization scheme " + authorization.getScheme() + " does not match requirement scheme " + requirement.getScheme(), payer);
        }

        Optional<String> amountProblem = checkAmount(authorization, requirement, now);
        if (amountProblem.isPresent()) {
            return VerificationResult.invalid(FailureReason.INSUFFICIENT_AMOUNT, amountProblem.get(), payer);
        }

        long epochSeconds = now.getEpochSecond();
        if (epochSeconds > authorization.getValidBefore()) {
            return VerificationResult.invalid(FailureReason.AUTHORIZATION_EXPIRED,
                    "Authorization expired at " + authorization.getValidBefore(), payer);
        }
        if (epochSeconds < authorization.getValidAfter()) {
            return VerificationResult.invalid(FailureReason.AUTHORIZATION_NOT_YET_VALID,
                    "Authorization not valid before " + authorization.getValidAfter(), payer);
        }

        SignatureSchemeVerifier verifier = verifiers.get(family);
        if (verifier == null) {
            return VerificationResult.invalid(FailureReason.UNSUPPORTED_NETWORK, "No signature scheme for family " + family, payer);
        }
        try {
            if (!verifier.isSignedByPayer(authorization, requirement, network.get())) {
                return VerificationResult.invalid(FailureReason.SIGNATURE_INVALID, "Signature was not produced by payer " + payer, payer);
            }
        } catch (IllegalArgumentException e) {
            log.debug("Malformed authorization from payer={} on network={}: {}", payer, requirement.getNetwork(), e.getMessage());
            return VerificationResult.invalid(FailureReason.SIGNATURE_INVALID, e.getMessage(), payer);
        }
        return VerificationResult.verified(payer, requirement.getNetwork());
    }

    private Optional<String> checkAmount(PaymentAuthorization authorization, PaymentRequirement requirement, Instant now) {
        BigInteger amount = authorization.getAmount();
        BigInteger max = requirement.getMaxAmountRequired();
        if (amount == null || amount.signum() <= 0) {
            return Optional.of("Amount must be positive");
        }
        switch (requirement.getScheme()) {
            case EXACT:
                if (amount.compareTo(max) != 0) {
                    return Optional.of("Amount " + amount + " must equal " + max);
                }
                break;
            case UPTO:
                if (amount.compareTo(max) > 0) {
                    return Optional.of("Amount " + amount + " exceeds maximum " + max);
                }
                break;
            case DYNAMIC:
                BigInteger quoted = pricingService.quote(requirement, now);
                if (quoted == null || amount.compareTo(quoted) != 0 || amount.compareTo(max) > 0) {
                    return Optional.of("Amount " + amount + " does not match quoted price " + quoted);
                }
                break;
            default:
                return Optional.of("Unsupported scheme " + requirement.getScheme());
        }
        return Optional.empty();
    }
}
