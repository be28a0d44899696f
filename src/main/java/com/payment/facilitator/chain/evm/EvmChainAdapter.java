package com.payment.facilitator.chain.evm;

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
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Hash;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionDecoder;
import org.web3j.crypto.TransactionEncoder;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.Transaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.http.HttpService;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Settles EIP-3009 authorizations by calling {@code transferWithAuthorization} on the asset
 * contract from the facilitator account. The facilitator pays gas; the payer's signature
 * moves the tokens.
 * <p>
 * Account nonces are tracked locally per network and seeded from the node's pending count,
 * so concurrent settlements don't hand out the same nonce.
 */
@Slf4j
@Component
public class EvmChainAdapter implements ChainAdapter {

    static final String TRANSFER_WITH_AUTHORIZATION = "transferWithAuthorization";

    private static final List<String> ALREADY_KNOWN = List.of("already known", "known transaction", "already imported");
    private static final List<String> PERMANENT = List.of("insufficient funds", "execution reverted", "invalid",
            "nonce too low", "intrinsic gas too low", "exceeds block gas limit", "authorization is used");

    private final java.util.function.Function<FacilitatorProperties.Network, Web3j> clientFactory;
    private final Clock clock;
    private final Map<String, Web3j> clients = new ConcurrentHashMap<>();
    private final Map<String, BigInteger> nextNonce = new HashMap<>();

    @Autowired
    public EvmChainAdapter(Clock clock) {
        this(network -> Web3j.build(new HttpService(network.getRpcUrl())), clock);
    }

    EvmChainAdapter(java.util.function.Function<FacilitatorProperties.Network, Web3j> clientFactory, Clock clock) {
        this.clientFactory = clientFactory;
        this.clock = clock;
    }

    @Override
    public ChainFamily family() {
        return ChainFamily.EVM;
    }

    @Override
    public FeeEstimate estimateFee(FacilitatorProperties.Network network, PaymentRequirement requirement) {
        BigInteger gasPrice = gasPrice(network);
        return FeeEstimate.builder()
                .network(network.getName())
                .gasLimit(network.getGasLimit())
                .unitPrice(gasPrice)
                .totalFee(gasPrice.multiply(network.getGasLimit()))
                .feeUnit("wei")
                .estimatedAt(Instant.now(clock))
                .build();
    }

    @Override
    public PreparedSubmission prepare(FacilitatorProperties.Network network,
                                      PaymentAuthorization authorization,
                                      PaymentRequirement requirement) {
        Credentials credentials = credentials(network);
        String data = encodeTransferWithAuthorization(authorization);
        BigInteger gasPrice = gasPrice(network);
        BigInteger nonce = allocateNonce(network, credentials.getAddress());

        RawTransaction tx = RawTransaction.createTransaction(nonce, gasPrice, network.getGasLimit(),
                requirement.getAsset(), data);
        byte[] signed = TransactionEncoder.signMessage(tx, network.getChainId(), credentials);
        String payload = Numeric.toHexString(signed);
        String reference = Hash.sha3(payload);
        log.debug("Prepared EVM settlement network={} ref={} accountNonce={} gasPrice={}",
                network.getName(), reference, nonce, gasPrice);
        return new PreparedSubmission(network.getName(), reference, payload);
    }

    @Override
    public String submit(FacilitatorProperties.Network network, PreparedSubmission prepared) {
        EthSendTransaction response;
        try {
            response = client(network).ethSendRawTransaction(prepared.getPayload()).send();
        } catch (IOException e) {
            throw new ChainUnavailableException(network.getName(), "eth_sendRawTransaction failed: " + e.getMessage(), e);
        }
        if (!response.hasError()) {
            String hash = response.getTransactionHash();
            if (hash != null && !hash.equalsIgnoreCase(prepared.getReference())) {
                log.warn("Node returned unexpected hash {} for ref={} on network={}", hash, prepared.getReference(), network.getName());
            }
            return prepared.getReference();
        }
        String message = errorMessage(response);
        if (matches(message, ALREADY_KNOWN)) {
            log.info("Transaction ref={} already known to network={}", prepared.getReference(), network.getName());
            return prepared.getReference();
        }
        if (matches(message, PERMANENT)) {
            if (message.contains("nonce too low")) {
                resetNonce(network);
            }
            throw new ChainRejectedException(network.getName(), "Transaction rejected: " + message);
        }
        throw new ChainUnavailableException(network.getName(), "eth_sendRawTransaction error: " + message);
    }

    @Override
    public ChainTransactionStatus getStatus(FacilitatorProperties.Network network, String transactionRef) {
        Web3j web3j = client(network);
        try {
            Optional<TransactionReceipt> receipt = web3j.ethGetTransactionReceipt(transactionRef).send().getTransactionReceipt();
            if (receipt.isPresent()) {
                TransactionReceipt r = receipt.get();
                if (!r.isStatusOK()) {
                    return ChainTransactionStatus.failed("execution reverted in block " + r.getBlockNumber());
                }
                BigInteger latest = web3j.ethBlockNumber().send().getBlockNumber();
                long confirmations = latest.subtract(r.getBlockNumber()).add(BigInteger.ONE).longValue();
                return ChainTransactionStatus.confirmed((int) Math.max(1, Math.min(Integer.MAX_VALUE, confirmations)));
            }
            Optional<Transaction> pending = web3j.ethGetTransactionByHash(transactionRef).send().getTransaction();
            return pending.isPresent() ? ChainTransactionStatus.pending() : ChainTransactionStatus.notFound();
        } catch (IOException e) {
            throw new ChainUnavailableException(network.getName(), "Status lookup failed for " + transactionRef + ": " + e.getMessage(), e);
        }
    }

    /**
     * Gives the account nonce back if nothing was allocated after it; otherwise the gap is
     * left for the node's pending count to resolve.
     */
    @Override
    public void discard(FacilitatorProperties.Network network, PreparedSubmission prepared) {
        BigInteger nonce = TransactionDecoder.decode(prepared.getPayload()).getNonce();
        synchronized (nextNonce) {
            BigInteger next = nextNonce.get(network.getName());
            if (next != null && next.equals(nonce.add(BigInteger.ONE))) {
                nextNonce.put(network.getName(), nonce);
            }
        }
        log.info("Discarded prepared transaction ref={} accountNonce={} on network={}", prepared.getReference(), nonce, network.getName());
    }

    static String encodeTransferWithAuthorization(PaymentAuthorization authorization) {
        EvmSignature signature = EvmSignature.parse(authorization.getSignature());
        Function function = new Function(TRANSFER_WITH_AUTHORIZATION,
                List.of(new Address(authorization.getPayer()),
                        new Address(authorization.getPayee()),
                        new Uint256(authorization.getAmount()),
                        new Uint256(BigInteger.valueOf(authorization.getValidAfter())),
                        new Uint256(BigInteger.valueOf(authorization.getValidBefore())),
                        new Bytes32(Numeric.hexStringToByteArray(authorization.getNonce())),
                        new Uint8(BigInteger.valueOf(signature.v())),
                        new Bytes32(signature.r()),
                        new Bytes32(signature.s())),
                Collections.emptyList());
        return FunctionEncoder.encode(function);
    }

    private BigInteger gasPrice(FacilitatorProperties.Network network) {
        try {
            BigInteger quoted = client(network).ethGasPrice().send().getGasPrice();
            return quoted.multiply(BigInteger.valueOf(network.getGasPricePercent())).divide(BigInteger.valueOf(100));
        } catch (IOException e) {
            throw new ChainUnavailableException(network.getName(), "eth_gasPrice failed: " + e.getMessage(), e);
        }
    }

    private BigInteger allocateNonce(FacilitatorProperties.Network network, String address) {
        synchronized (nextNonce) {
            BigInteger pending;
            try {
                pending = client(network).ethGetTransactionCount(address, DefaultBlockParameterName.PENDING)
                        .send().getTransactionCount();
            } catch (IOException e) {
                throw new ChainUnavailableException(network.getName(), "eth_getTransactionCount failed: " + e.getMessage(), e);
            }
            BigInteger local = nextNonce.getOrDefault(network.getName(), BigInteger.ZERO);
            BigInteger allocated = pending.max(local);
            nextNonce.put(network.getName(), allocated.add(BigInteger.ONE));
            return allocated;
        }
    }

    private void resetNonce(FacilitatorProperties.Network network) {
        synchronized (nextNonce) {
            nextNonce.remove(network.getName());
        }
    }

    private Credentials credentials(FacilitatorProperties.Network network) {
        if (network.getFacilitatorKey() == null || network.getFacilitatorKey().isBlank()) {
            throw new IllegalStateException("No facilitator key configured for network " + network.getName());
        }
        return Credentials.create(network.getFacilitatorKey());
    }

    private Web3j client(FacilitatorProperties.Network network) {
        return clients.computeIfAbsent(network.getName(), name -> clientFactory.apply(network));
    }

    private static String errorMessage(Response<?> response) {
        Response.Error error = response.getError();
        return error == null || error.getMessage() == null ? "" : error.getMessage().toLowerCase(Locale.ROOT);
    }

    private static boolean matches(String message, List<String> fragments) {
        return fragments.stream().anyMatch(message::contains);
    }
}
