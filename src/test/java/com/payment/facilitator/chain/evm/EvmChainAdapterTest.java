package com.payment.facilitator.chain.evm;

import com.payment.facilitator.chain.ChainRejectedException;
import com.payment.facilitator.chain.ChainUnavailableException;
import com.payment.facilitator.config.FacilitatorProperties;
import com.payment.facilitator.domain.ChainTransactionStatus;
import com.payment.facilitator.domain.FeeEstimate;
import com.payment.facilitator.domain.PaymentAuthorization;
import com.payment.facilitator.domain.PaymentRequirement;
import com.payment.facilitator.domain.PaymentScheme;
import com.payment.facilitator.domain.PreparedSubmission;
import com.payment.facilitator.support.EvmTestSigner;
import com.payment.facilitator.support.TestNetworks;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Hash;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.SignedRawTransaction;
import org.web3j.crypto.TransactionDecoder;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.Web3jService;
import org.web3j.protocol.core.Request;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.response.EthBlockNumber;
import org.web3j.protocol.core.methods.response.EthGasPrice;
import org.web3j.protocol.core.methods.response.EthGetTransactionCount;
import org.web3j.protocol.core.methods.response.EthGetTransactionReceipt;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.EthTransaction;
import org.web3j.protocol.core.methods.response.Transaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EvmChainAdapterTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final String REF = "0x5c504ed432cb51138bcf09aa5e8a410dd4a1e204ef84bfed1be16dfba1b22060";

    private final Web3j web3j = mock(Web3j.class);
    private final EvmTestSigner payer = new EvmTestSigner(EvmTestSigner.PAYER_KEY);
    private EvmChainAdapter adapter;
    private FacilitatorProperties.Network network;
    private PaymentRequirement requirement;

    @BeforeEach
    void setUp() throws IOException {
        adapter = new EvmChainAdapter(n -> web3j, Clock.fixed(NOW, ZoneOffset.UTC));
        network = TestNetworks.registry().require(TestNetworks.EVM);
        requirement = TestNetworks.evmRequirement(PaymentScheme.EXACT, 1000);

        EthGasPrice gasPrice = new EthGasPrice();
        gasPrice.setResult("0x3b9aca00");
        doReturn(request(gasPrice, EthGasPrice.class)).when(web3j).ethGasPrice();
        pendingCount(5);
    }

    @Test
    void feeIsMarkedUpGasPriceTimesGasLimit() {
        FeeEstimate fee = adapter.estimateFee(network, requirement);

        assertThat(fee.getUnitPrice()).isEqualTo(BigInteger.valueOf(1_200_000_000L));
        assertThat(fee.getTotalFee()).isEqualTo(BigInteger.valueOf(1_200_000_000L).multiply(BigInteger.valueOf(100_000)));
        assertThat(fee.getFeeUnit()).isEqualTo("wei");
        assertThat(fee.getEstimatedAt()).isEqualTo(NOW);
    }

    @Test
    void preparedTransactionCallsTokenFromFacilitatorAccount() throws Exception {
        PaymentAuthorization auth = payer.signedFor(requirement, 1000, NOW);

        PreparedSubmission prepared = adapter.prepare(network, auth, requirement);

        assertThat(prepared.getReference()).isEqualTo(Hash.sha3(prepared.getPayload()));
        RawTransaction tx = TransactionDecoder.decode(prepared.getPayload());
        assertThat(tx.getTo()).isEqualToIgnoringCase(TestNetworks.USDC);
        assertThat(tx.getNonce()).isEqualTo(BigInteger.valueOf(5));
        assertThat(Numeric.cleanHexPrefix(tx.getData()))
                .isEqualTo(Numeric.cleanHexPrefix(EvmChainAdapter.encodeTransferWithAuthorization(auth)));
        assertThat(((SignedRawTransaction) tx).getFrom())
                .isEqualToIgnoringCase(Credentials.create(network.getFacilitatorKey()).getAddress());
    }

    @Test
    void accountNoncesAreHandedOutOnceAndReturnedOnDiscard() {
        PreparedSubmission first = adapter.prepare(network, payer.signedFor(requirement, 1000, NOW), requirement);
        PreparedSubmission second = adapter.prepare(network, payer.signedFor(requirement, 1000, NOW), requirement);

        assertThat(nonceOf(first)).isEqualTo(5);
        assertThat(nonceOf(second)).isEqualTo(6);

        adapter.discard(network, second);
        PreparedSubmission third = adapter.prepare(network, payer.signedFor(requirement, 1000, NOW), requirement);
        assertThat(nonceOf(third)).isEqualTo(6);
    }

    @Test
    void nodeCountAheadOfLocalWins() throws IOException {
        adapter.prepare(network, payer.signedFor(requirement, 1000, NOW), requirement);
        pendingCount(9);

        PreparedSubmission next = adapter.prepare(network, payer.signedFor(requirement, 1000, NOW), requirement);

        assertThat(nonceOf(next)).isEqualTo(9);
    }

    @Test
    void prepareWithoutKeyFails() {
        network.setFacilitatorKey(null);

        assertThatThrownBy(() -> adapter.prepare(network, payer.signedFor(requirement, 1000, NOW), requirement))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("No facilitator key");
    }

    @Test
    void submitReturnsReference() throws IOException {
        EthSendTransaction sent = new EthSendTransaction();
        sent.setResult(REF);
        doReturn(request(sent, EthSendTransaction.class)).when(web3j).ethSendRawTransaction(anyString());

        assertThat(adapter.submit(network, new PreparedSubmission(TestNetworks.EVM, REF, "0xf86c"))).isEqualTo(REF);
    }

    @Test
    void alreadyKnownCountsAsBroadcast() throws IOException {
        sendError(-32000, "already known");

        assertThat(adapter.submit(network, new PreparedSubmission(TestNetworks.EVM, REF, "0xf86c"))).isEqualTo(REF);
    }

    @Test
    void revertIsRejected() throws IOException {
        sendError(-32000, "execution reverted: FiatTokenV2: authorization is used or canceled");

        assertThatThrownBy(() -> adapter.submit(network, new PreparedSubmission(TestNetworks.EVM, REF, "0xf86c")))
                .isInstanceOf(ChainRejectedException.class);
    }

    @Test
    void otherNodeErrorsAreUnavailable() throws IOException {
        sendError(-32005, "request rate exceeded");

        assertThatThrownBy(() -> adapter.submit(network, new PreparedSubmission(TestNetworks.EVM, REF, "0xf86c")))
                .isInstanceOf(ChainUnavailableException.class);
    }

    @Test
    void transportFailureIsUnavailable() throws IOException {
        Web3jService transport = mock(Web3jService.class);
        when(transport.send(any(), eq(EthSendTransaction.class))).thenThrow(new IOException("connection refused"));
        doReturn(new Request<>("eth_sendRawTransaction", List.of(), transport, EthSendTransaction.class))
                .when(web3j).ethSendRawTransaction(anyString());

        assertThatThrownBy(() -> adapter.submit(network, new PreparedSubmission(TestNetworks.EVM, REF, "0xf86c")))
                .isInstanceOf(ChainUnavailableException.class)
                .hasMessageContaining("connection refused");
    }

    @Test
    void confirmationsCountFromReceiptBlock() throws IOException {
        receipt("0x1", "0x64");
        EthBlockNumber latest = new EthBlockNumber();
        latest.setResult("0x65");
        doReturn(request(latest, EthBlockNumber.class)).when(web3j).ethBlockNumber();

        assertThat(adapter.getStatus(network, REF)).isEqualTo(ChainTransactionStatus.confirmed(2));
    }

    @Test
    void revertedReceiptIsFailed() throws IOException {
        receipt("0x0", "0x64");

        ChainTransactionStatus status = adapter.getStatus(network, REF);

        assertThat(status.getState()).isEqualTo(ChainTransactionStatus.State.FAILED);
        assertThat(status.getReason()).contains("reverted");
    }

    @Test
    void mempoolTransactionIsPendingAndUnknownIsNotFound() throws IOException {
        doReturn(request(new EthGetTransactionReceipt(), EthGetTransactionReceipt.class)).when(web3j).ethGetTransactionReceipt(REF);
        EthTransaction inMempool = new EthTransaction();
        inMempool.setResult(new Transaction());
        doReturn(request(inMempool, EthTransaction.class)).when(web3j).ethGetTransactionByHash(REF);

        assertThat(adapter.getStatus(network, REF).getState()).isEqualTo(ChainTransactionStatus.State.PENDING);

        doReturn(request(new EthTransaction(), EthTransaction.class)).when(web3j).ethGetTransactionByHash(REF);

        assertThat(adapter.getStatus(network, REF).getState()).isEqualTo(ChainTransactionStatus.State.NOT_FOUND);
    }

    private void receipt(String status, String blockNumber) throws IOException {
        TransactionReceipt receipt = new TransactionReceipt();
        receipt.setStatus(status);
        receipt.setBlockNumber(blockNumber);
        EthGetTransactionReceipt response = new EthGetTransactionReceipt();
        response.setResult(receipt);
        doReturn(request(response, EthGetTransactionReceipt.class)).when(web3j).ethGetTransactionReceipt(REF);
    }

    private void sendError(int code, String message) throws IOException {
        EthSendTransaction sent = new EthSendTransaction();
        sent.setError(new Response.Error(code, message));
        doReturn(request(sent, EthSendTransaction.class)).when(web3j).ethSendRawTransaction(anyString());
    }

    private void pendingCount(long count) throws IOException {
        EthGetTransactionCount txCount = new EthGetTransactionCount();
        txCount.setResult(Numeric.toHexStringWithPrefix(BigInteger.valueOf(count)));
        doReturn(request(txCount, EthGetTransactionCount.class)).when(web3j).ethGetTransactionCount(anyString(), any());
    }

    private static long nonceOf(PreparedSubmission prepared) {
        return TransactionDecoder.decode(prepared.getPayload()).getNonce().longValue();
    }

    /** A real web3j request whose transport answers with the given response. */
    private static <T extends Response<?>> Request<?, T> request(T response, Class<T> type) throws IOException {
        Web3jService transport = mock(Web3jService.class);
        when(transport.send(any(), eq(type))).thenReturn(response);
        return new Request<>("test", List.of(), transport, type);
    }
}
