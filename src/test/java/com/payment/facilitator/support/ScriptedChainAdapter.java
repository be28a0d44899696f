package com.payment.facilitator.support;

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

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process chain for coordinator tests. Broadcast outcomes are queued per call;
 * once the queue is empty every broadcast succeeds. Accepted transactions start
 * PENDING and are confirmed by the test.
 */
public class ScriptedChainAdapter implements ChainAdapter {

    public enum Outcome { ACCEPT, UNAVAILABLE, REJECT }

    private final ChainFamily family;
    private final Deque<Outcome> broadcastScript = new ArrayDeque<>();
    private final Map<String, ChainTransactionStatus> onChain = new ConcurrentHashMap<>();
    private final AtomicInteger prepareCalls = new AtomicInteger();
    private final AtomicInteger broadcastCalls = new AtomicInteger();
    private final AtomicInteger discards = new AtomicInteger();
    private final AtomicInteger statusCalls = new AtomicInteger();
    private volatile boolean prepareUnavailable;
    private volatile boolean statusUnavailable;

    public ScriptedChainAdapter(ChainFamily family) {
        this.family = family;
    }

    public synchronized ScriptedChainAdapter script(Outcome... outcomes) {
        for (Outcome outcome : outcomes) {
            broadcastScript.addLast(outcome);
        }
        return this;
    }

    public void setPrepareUnavailable(boolean prepareUnavailable) {
        this.prepareUnavailable = prepareUnavailable;
    }

    public void setStatusUnavailable(boolean statusUnavailable) {
        this.statusUnavailable = statusUnavailable;
    }

    /** Put a transaction on chain directly, as if an earlier broadcast had landed. */
    public void land(String ref) {
        onChain.put(ref, ChainTransactionStatus.pending());
    }

    public void confirm(String ref, int confirmations) {
        onChain.put(ref, ChainTransactionStatus.confirmed(confirmations));
    }

    public void fail(String ref, String reason) {
        onChain.put(ref, ChainTransactionStatus.failed(reason));
    }

    public int prepareCalls() {
        return prepareCalls.get();
    }

    public int broadcastCalls() {
        return broadcastCalls.get();
    }

    public int statusCalls() {
        return statusCalls.get();
    }

    public int discards() {
        return discards.get();
    }

    public int transactionsOnChain() {
        return onChain.size();
    }

    @Override
    public ChainFamily family() {
        return family;
    }

    @Override
    public FeeEstimate estimateFee(FacilitatorProperties.Network network, PaymentRequirement requirement) {
        return FeeEstimate.builder()
                .network(network.getName())
                .totalFee(BigInteger.valueOf(21_000))
                .feeUnit("wei")
                .build();
    }

    @Override
    public PreparedSubmission prepare(FacilitatorProperties.Network network, PaymentAuthorization authorization,
                                      PaymentRequirement requirement) {
        prepareCalls.incrementAndGet();
        if (prepareUnavailable) {
            throw new ChainUnavailableException(network.getName(), "node unreachable");
        }
        String ref = "0xtx-" + authorization.getNonce().substring(2, 14);
        return new PreparedSubmission(network.getName(), ref, "signed:" + ref);
    }

    @Override
    public String submit(FacilitatorProperties.Network network, PreparedSubmission prepared) {
        broadcastCalls.incrementAndGet();
        Outcome outcome;
        synchronized (this) {
            outcome = broadcastScript.isEmpty() ? Outcome.ACCEPT : broadcastScript.pollFirst();
        }
        switch (outcome) {
            case UNAVAILABLE:
                throw new ChainUnavailableException(network.getName(), "timeout talking to node");
            case REJECT:
                throw new ChainRejectedException(network.getName(), "execution reverted: authorization is used");
            default:
                onChain.putIfAbsent(prepared.getReference(), ChainTransactionStatus.pending());
                return prepared.getReference();
        }
    }

    @Override
    public ChainTransactionStatus getStatus(FacilitatorProperties.Network network, String transactionRef) {
        statusCalls.incrementAndGet();
        if (statusUnavailable) {
            throw new ChainUnavailableException(network.getName(), "status unavailable");
        }
        return onChain.getOrDefault(transactionRef, ChainTransactionStatus.notFound());
    }

    @Override
    public void discard(FacilitatorProperties.Network network, PreparedSubmission prepared) {
        discards.incrementAndGet();
    }
}
