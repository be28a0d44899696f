package com.payment.facilitator.chain.ed25519;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.facilitator.chain.ChainAdapter;
import com.payment.facilitator.chain.ChainRejectedException;
import com.payment.facilitator.chain.ChainUnavailableException;
import com.payment.facilitator.config.FacilitatorProperties;
import com.payment.facilitator.domain.ChainFamily;
import com.payment.facilitator.domain.ChainTransactionStatus;
import com.payment.facilitator.domain.FeeEstimate;
import com.payment.facilitator.domain.PaymentAuthorization;
import com.payment.facilitator.domain.PaymentRequirement;
import com.payment.facilitator.domain.PreparedSubmission;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Settles Ed25519 authorizations through a settlement program. The facilitator signs and
 * pays for the transaction; the payer's authorization is checked on-chain by the
 * signature-verify precompile.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class Ed25519ChainAdapter implements ChainAdapter {

    /** Facilitator signature plus the payer's signature checked by the precompile. */
    static final int SIGNATURES_PER_SETTLEMENT = 2;

    /** JSON-RPC error code for a failed preflight simulation. */
    static final int SIMULATION_FAILED = -32002;

    private static final List<String> ALREADY_PROCESSED = List.of("already been processed", "already processed", "alreadyprocessed");
    private static final List<String> PERMANENT = List.of("blockhash not found", "insufficient funds",
            "invalid", "custom program error");

    private final Ed25519RpcClient rpcClient;
    private final Clock clock;

    @Override
    public ChainFamily family() {
        return ChainFamily.ED25519;
    }

    @Override
    public FeeEstimate estimateFee(FacilitatorProperties.Network network, PaymentRequirement requirement) {
        BigInteger signatures = BigInteger.valueOf(SIGNATURES_PER_SETTLEMENT);
        return FeeEstimate.builder()
                .network(network.getName())
                .gasLimit(signatures)
                .unitPrice(network.getLamportsPerSignature())
                .totalFee(network.getLamportsPerSignature().multiply(signatures))
                .feeUnit("lamports")
                .estimatedAt(Instant.now(clock))
                .build();
    }

    @Override
    public PreparedSubmission prepare(FacilitatorProperties.Network network,
                                      PaymentAuthorization authorization,
                                      PaymentRequirement requirement) {
        byte[] keypair = facilitatorKeypair(network);
        if (network.getSettlementProgram() == null) {
            throw new IllegalStateException("No settlement program configured for network " + network.getName());
        }
        byte[] blockhash = Base58.decode(latestBlockhash(network));
        byte[] message = Ed25519AuthorizationMessage.encode(authorization, requirement.getAsset());
        try {
            Ed25519SettlementTransaction tx = Ed25519SettlementTransaction.build(
                    Arrays.copyOfRange(keypair, 32, 64),
                    Base58.decode(authorization.getPayer()),
                    Base58.decode(authorization.getPayee()),
                    Base58.decode(requirement.getAsset()),
                    Base58.decode(network.getSettlementProgram()),
                    blockhash,
                    message,
                    Base58.decode(authorization.getSignature()),
                    Arrays.copyOfRange(keypair, 0, 32));
            String payload = Base64.getEncoder().encodeToString(tx.serialize());
            log.debug("Prepared Ed25519 settlement network={} ref={}", network.getName(), tx.reference());
            return new PreparedSubmission(network.getName(), tx.reference(), payload);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Could not sign settlement transaction for network " + network.getName(), e);
        }
    }

    @Override
    public String submit(FacilitatorProperties.Network network, PreparedSubmission prepared) {
        JsonNode response = rpcClient.call(network, "sendTransaction", List.of(prepared.getPayload(),
                Map.of("encoding", "base64", "preflightCommitment", "confirmed")));
        JsonNode error = response.get("error");
        if (error == null || error.isNull()) {
            String signature = response.path("result").asText(null);
            if (signature != null && !signature.equals(prepared.getReference())) {
                log.warn("Node returned unexpected signature {} for ref={} on network={}", signature, prepared.getReference(), network.getName());
            }
            return prepared.getReference();
        }
        String message = error.path("message").asText("").toLowerCase(Locale.ROOT);
        if (ALREADY_PROCESSED.stream().anyMatch(message::contains)) {
            log.info("Transaction ref={} already processed on network={}", prepared.getReference(), network.getName());
            return prepared.getReference();
        }
        if (error.path("code").asInt() == SIMULATION_FAILED || PERMANENT.stream().anyMatch(message::contains)) {
            throw new ChainRejectedException(network.getName(), "Transaction rejected: " + message);
        }
        throw new ChainUnavailableException(network.getName(), "sendTransaction error: " + message);
    }

    @Override
    public ChainTransactionStatus getStatus(FacilitatorProperties.Network network, String transactionRef) {
        JsonNode response = rpcClient.call(network, "getSignatureStatuses",
                List.of(List.of(transactionRef), Map.of("searchTransactionHistory", true)));
        if (response.hasNonNull("error")) {
            throw new ChainUnavailableException(network.getName(),
                    "getSignatureStatuses error: " + response.path("error").path("message").asText());
        }
        JsonNode status = response.path("result").path("value").path(0);
        if (status.isMissingNode() || status.isNull()) {
            return ChainTransactionStatus.notFound();
        }
        if (status.hasNonNull("err")) {
            return ChainTransactionStatus.failed("transaction error: " + status.get("err"));
        }
        String commitment = status.path("confirmationStatus").asText("");
        if ("finalized".equals(commitment)) {
            return ChainTransactionStatus.confirmed(requiredConfirmations(network));
        }
        int confirmations = status.path("confirmations").asInt(0);
        return confirmations > 0 ? ChainTransactionStatus.confirmed(confirmations) : ChainTransactionStatus.pending();
    }

    private String latestBlockhash(FacilitatorProperties.Network network) {
        JsonNode response = rpcClient.call(network, "getLatestBlockhash", List.of(Map.of("commitment", "confirmed")));
        String blockhash = response.path("result").path("value").path("blockhash").asText(null);
        if (blockhash == null) {
            throw new ChainUnavailableException(network.getName(), "getLatestBlockhash returned no blockhash");
        }
        return blockhash;
    }

    private static byte[] facilitatorKeypair(FacilitatorProperties.Network network) {
        if (network.getFacilitatorKey() == null || network.getFacilitatorKey().isBlank()) {
            throw new IllegalStateException("No facilitator key configured for network " + network.getName());
        }
        byte[] keypair = Base58.decode(network.getFacilitatorKey());
        if (keypair.length != 64) {
            throw new IllegalStateException("Facilitator key for network " + network.getName() + " must be a 64-byte keypair");
        }
        return keypair;
    }
}
