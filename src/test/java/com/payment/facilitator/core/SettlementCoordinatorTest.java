package com.payment.facilitator.core;

import com.payment.facilitator.chain.ChainGateway;
import com.payment.facilitator.chain.NetworkRegistry;
import com.payment.facilitator.domain.ChainFamily;
import com.payment.facilitator.domain.FailureReason;
import com.payment.facilitator.domain.PaymentAuthorization;
import com.payment.facilitator.domain.PaymentId;
import com.payment.facilitator.domain.PaymentRecord;
import com.payment.facilitator.domain.PaymentRequirement;
import com.payment.facilitator.domain.PaymentScheme;
import com.payment.facilitator.domain.PaymentStatus;
import com.payment.facilitator.domain.PaymentTransition;
import com.payment.facilitator.domain.SettlementResult;
import com.payment.facilitator.domain.VerificationResult;
import com.payment.facilitator.messaging.SettlementNotificationProducer;
import com.payment.facilitator.support.EvmTestSigner;
import com.payment.facilitator.support.InMemoryNonceStore;
import com.payment.facilitator.support.InMemoryPaymentLedger;
import com.payment.facilitator.support.MutableClock;
import com.payment.facilitator.support.ScriptedChainAdapter;
import com.payment.facilitator.support.ScriptedChainAdapter.Outcome;
import com.payment.facilitator.support.TestChainGateways;
import com.payment.facilitator.support.TestNetworks;
import com.payment.facilitator.verification.EvmSignatureVerifier;
import com.payment.facilitator.verification.SignatureVerifier;
import com.payment.facilitator.verification.StaticPricingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Settlement lifecycle against an in-memory ledger, nonce store and scripted chain.
 * Signatures are real EIP-712 signatures so verification runs end to end.
 */
@ExtendWith(MockitoExtension.class)
class SettlementCoordinatorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private SettlementResultCache resultCache;
    @Mock
    private SettlementNotificationProducer notificationProducer;

    private final EvmTestSigner payer = new EvmTestSigner(EvmTestSigner.PAYER_KEY);
    private MutableClock clock;
    private NetworkRegistry networks;
    private InMemoryNonceStore nonceStore;
    private InMemoryPaymentLedger ledger;
    private ScriptedChainAdapter chain;
    private SettlementCoordinator coordinator;
    private PaymentRequirement requirement;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        networks = TestNetworks.registry();
        nonceStore = new InMemoryNonceStore();
        ledger = new InMemoryPaymentLedger(clock);
        chain = new ScriptedChainAdapter(ChainFamily.EVM);
        coordinator = coordinator(ledger);
        requirement = TestNetworks.evmRequirement(PaymentScheme.EXACT, 1000).toBuilder()
                .maxTimeoutSeconds(900)
                .build();
    }

    private SettlementCoordinator coordinator(InMemoryPaymentLedger paymentLedger) {
        ChainGateway gateway = TestChainGateways.create(networks, chain);
        SignatureVerifier verifier = new SignatureVerifier(networks, new StaticPricingService(),
                List.of(new EvmSignatureVerifier()));
        return new SettlementCoordinator(verifier, nonceStore, paymentLedger, gateway, networks,
                resultCache, notificationProducer, clock, 10, Duration.ofHours(1));
    }

    private PaymentAuthorization authorization(long amount, long validBeforeOffset) {
        PaymentAuthorization unsigned = payer.authorizationFor(requirement, amount, NOW)
                .validBefore(NOW.getEpochSecond() + validBeforeOffset)
                .build();
        return payer.sign(unsigned, requirement.getAsset());
    }

    @Test
    void scenarioA_validAuthorizationSettlesOnceThresholdReached() {
        PaymentAuthorization auth = authorization(1000, 500);

        VerificationResult verification = coordinator.verify(auth, requirement);
        assertThat(verification.isValid()).isTrue();
        assertThat(verification.getPayer()).isEqualTo(payer.address());

        SettlementResult submitted = coordinator.settle(auth, requirement);
        assertThat(submitted.getStatus()).isEqualTo(PaymentStatus.SUBMITTED);
        assertThat(submitted.getTransactionRef()).isNotBlank();
        assertThat(submitted.getRequiredConfirmations()).isEqualTo(2);

        chain.confirm(submitted.getTransactionRef(), 1);
        coordinator.pollConfirmations();
        assertThat(ledger.find(submitted.getPaymentId()).orElseThrow().getStatus()).isEqualTo(PaymentStatus.CONFIRMING);

        chain.confirm(submitted.getTransactionRef(), 2);
        coordinator.pollConfirmations();
        PaymentRecord settled = ledger.find(submitted.getPaymentId()).orElseThrow();
        assertThat(settled.getStatus()).isEqualTo(PaymentStatus.SETTLED);
        assertThat(settled.getConfirmations()).isEqualTo(2);

        assertThat(ledger.history(settled.getId()))
                .extracting(PaymentTransition::getToStatus)
                .containsExactly(PaymentStatus.RESERVED, PaymentStatus.SUBMITTING, PaymentStatus.SUBMITTED,
                        PaymentStatus.CONFIRMING, PaymentStatus.SETTLED);

        ArgumentCaptor<PaymentRecord> published = ArgumentCaptor.forClass(PaymentRecord.class);
        verify(notificationProducer).publishTerminal(published.capture());
        assertThat(published.getValue().getStatus()).isEqualTo(PaymentStatus.SETTLED);
        verify(resultCache).put(anyString(), any(SettlementResult.class));
    }

    @Test
    void scenarioB_concurrentSettlesSubmitExactlyOnce() throws Exception {
        PaymentAuthorization auth = authorization(1000, 500);
        int callers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<SettlementResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < callers; i++) {
                Callable<SettlementResult> call = () -> {
                    start.await();
                    return coordinator.settle(auth, requirement);
                };
                futures.add(pool.submit(call));
            }
            start.countDown();
            List<SettlementResult> results = new ArrayList<>();
            for (Future<SettlementResult> future : futures) {
                results.add(future.get(10, TimeUnit.SECONDS));
            }

            String paymentId = PaymentId.of(ChainFamily.EVM, auth);
            assertThat(chain.broadcastCalls()).isEqualTo(1);
            assertThat(chain.transactionsOnChain()).isEqualTo(1);
            assertThat(results).allSatisfy(r -> assertThat(r.getPaymentId()).isEqualTo(paymentId));
            assertThat(results).filteredOn(r -> !r.isDuplicate()).isNotEmpty();
            assertThat(ledger.size()).isEqualTo(1);
            assertThat(ledger.history(paymentId))
                    .filteredOn(t -> t.getToStatus() == PaymentStatus.SUBMITTED)
                    .hasSize(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void scenarioB_loserOfReservationRaceGetsDuplicateReferencingWinner() {
        PaymentAuthorization auth = authorization(1000, 500);
        String key = PaymentId.key(ChainFamily.EVM, auth.getPayer(), auth.getNetwork(), auth.getNonce());
        // winner has reserved but not yet written its record
        nonceStore.reserve(key, auth.getPayer(), auth.getNetwork(), auth.getNonce());

        SettlementResult result = coordinator.settle(auth, requirement);

        assertThat(result.getStatus()).isEqualTo(PaymentStatus.REJECTED);
        assertThat(result.getFailureReason()).isEqualTo(FailureReason.DUPLICATE_AUTHORIZATION);
        assertThat(result.getPaymentId()).isEqualTo(PaymentId.of(ChainFamily.EVM, auth));
        assertThat(result.getOriginalStatus()).isEqualTo(PaymentStatus.RESERVED);
        assertThat(chain.prepareCalls()).isZero();
    }

    @Test
    void scenarioC_insufficientAmountReservesNothing() {
        PaymentAuthorization auth = authorization(900, 500);

        VerificationResult verification = coordinator.verify(auth, requirement);
        SettlementResult settlement = coordinator.settle(auth, requirement);

        assertThat(verification.isValid()).isFalse();
        assertThat(verification.getReason()).isEqualTo(FailureReason.INSUFFICIENT_AMOUNT);
        assertThat(settlement.getStatus()).isEqualTo(PaymentStatus.REJECTED);
        assertThat(nonceStore.size()).isZero();
        assertThat(ledger.size()).isZero();
    }

    @Test
    void scenarioD_transientFailuresAreRetriedAndCounted() {
        chain.script(Outcome.UNAVAILABLE, Outcome.UNAVAILABLE, Outcome.UNAVAILABLE);
        PaymentAuthorization auth = authorization(1000, 500);

        SettlementResult result = coordinator.settle(auth, requirement);

        assertThat(result.getStatus()).isEqualTo(PaymentStatus.SUBMITTED);
        assertThat(result.getAttempts()).isEqualTo(4);
        assertThat(chain.broadcastCalls()).isEqualTo(4);
        assertThat(chain.transactionsOnChain()).isEqualTo(1);

        chain.confirm(result.getTransactionRef(), 3);
        coordinator.pollConfirmations();
        PaymentRecord record = ledger.find(result.getPaymentId()).orElseThrow();
        assertThat(record.getStatus()).isEqualTo(PaymentStatus.SETTLED);
        assertThat(record.getAttempts()).isEqualTo(4);
    }

    @Test
    void scenarioE_expiredAuthorizationIsRejectedWithoutReservation() {
        PaymentAuthorization auth = authorization(1000, -1);

        VerificationResult verification = coordinator.verify(auth, requirement);
        SettlementResult settlement = coordinator.settle(auth, requirement);

        assertThat(verification.getReason()).isEqualTo(FailureReason.AUTHORIZATION_EXPIRED);
        assertThat(settlement.getStatus()).isEqualTo(PaymentStatus.REJECTED);
        assertThat(settlement.getFailureReason()).isEqualTo(FailureReason.AUTHORIZATION_EXPIRED);
        assertThat(nonceStore.size()).isZero();
        assertThat(chain.prepareCalls()).isZero();
    }

    @Test
    void verifyIsPureAndReportsAuthorizationsAlreadyInSettlement() {
        PaymentAuthorization auth = authorization(1000, 500);

        VerificationResult first = coordinator.verify(auth, requirement);
        VerificationResult second = coordinator.verify(auth, requirement);
        assertThat(first).isEqualTo(second);
        assertThat(nonceStore.size()).isZero();
        assertThat(ledger.size()).isZero();

        coordinator.settle(auth, requirement);
        VerificationResult afterSettle = coordinator.verify(auth, requirement);
        assertThat(afterSettle.isValid()).isFalse();
        assertThat(afterSettle.getReason()).isEqualTo(FailureReason.DUPLICATE_AUTHORIZATION);
    }

    @Test
    void settleOnSettledRecordReturnsSameReferenceWithoutChainCalls() {
        PaymentAuthorization auth = authorization(1000, 500);
        SettlementResult first = coordinator.settle(auth, requirement);
        chain.confirm(first.getTransactionRef(), 2);
        coordinator.pollConfirmations();
        int prepares = chain.prepareCalls();
        int broadcasts = chain.broadcastCalls();

        SettlementResult again = coordinator.settle(auth, requirement);

        assertThat(again.getStatus()).isEqualTo(PaymentStatus.SETTLED);
        assertThat(again.getTransactionRef()).isEqualTo(first.getTransactionRef());
        assertThat(chain.prepareCalls()).isEqualTo(prepares);
        assertThat(chain.broadcastCalls()).isEqualTo(broadcasts);
    }

    @Test
    void differentAuthorizationReusingNonceIsDuplicate() {
        requirement = TestNetworks.evmRequirement(PaymentScheme.UPTO, 1000);
        PaymentAuthorization original = payer.sign(payer.authorizationFor(requirement, 500, NOW).build(), requirement.getAsset());
        coordinator.settle(original, requirement);

        PaymentAuthorization reuse = payer.sign(original.toBuilder().amount(BigInteger.valueOf(600)).signature(null).build(),
                requirement.getAsset());
        SettlementResult result = coordinator.settle(reuse, requirement);

        assertThat(result.getFailureReason()).isEqualTo(FailureReason.DUPLICATE_AUTHORIZATION);
        assertThat(result.getOriginalStatus()).isEqualTo(PaymentStatus.SUBMITTED);
        assertThat(chain.broadcastCalls()).isEqualTo(1);
    }

    @Test
    void nonceSpelledWithoutPrefixOrInUpperCaseIsTheSameAuthorization() {
        PaymentAuthorization auth = authorization(1000, 500);
        SettlementResult first = coordinator.settle(auth, requirement);
        PaymentAuthorization respelled = auth.toBuilder()
                .nonce(auth.getNonce().substring(2).toUpperCase(Locale.ROOT))
                .build();

        VerificationResult verification = coordinator.verify(respelled, requirement);
        SettlementResult second = coordinator.settle(respelled, requirement);

        assertThat(PaymentId.of(ChainFamily.EVM, respelled)).isEqualTo(first.getPaymentId());
        assertThat(verification.getReason()).isEqualTo(FailureReason.DUPLICATE_AUTHORIZATION);
        assertThat(second.getPaymentId()).isEqualTo(first.getPaymentId());
        assertThat(second.getTransactionRef()).isEqualTo(first.getTransactionRef());
        assertThat(chain.prepareCalls()).isEqualTo(1);
        assertThat(chain.broadcastCalls()).isEqualTo(1);
        assertThat(ledger.size()).isEqualTo(1);
        assertThat(nonceStore.size()).isEqualTo(1);
    }

    @Test
    void chainRejectionFailsSubmissionAndReleasesNonce() {
        chain.script(Outcome.REJECT);
        PaymentAuthorization auth = authorization(1000, 500);

        SettlementResult result = coordinator.settle(auth, requirement);

        assertThat(result.getStatus()).isEqualTo(PaymentStatus.SUBMISSION_FAILED);
        assertThat(result.getFailureReason()).isEqualTo(FailureReason.CHAIN_REJECTED);
        assertThat(nonceStore.size()).isZero();
        assertThat(chain.broadcastCalls()).isEqualTo(1);
        verify(notificationProducer).publishTerminal(any(PaymentRecord.class));
    }

    @Test
    void authorizationRejectedAtBroadcastCanBeSettledAgain() {
        chain.script(Outcome.REJECT);
        PaymentAuthorization auth = authorization(1000, 500);
        SettlementResult failed = coordinator.settle(auth, requirement);
        assertThat(failed.getStatus()).isEqualTo(PaymentStatus.SUBMISSION_FAILED);

        assertThat(coordinator.verify(auth, requirement).isValid()).isTrue();
        SettlementResult retried = coordinator.settle(auth, requirement);

        assertThat(retried.getPaymentId()).isEqualTo(failed.getPaymentId());
        assertThat(retried.getStatus()).isEqualTo(PaymentStatus.SUBMITTED);
        assertThat(chain.broadcastCalls()).isEqualTo(2);
        assertThat(nonceStore.size()).isEqualTo(1);
        assertThat(ledger.size()).isEqualTo(1);
        assertThat(ledger.history(retried.getPaymentId()))
                .extracting(PaymentTransition::getToStatus)
                .containsExactly(PaymentStatus.RESERVED, PaymentStatus.SUBMITTING, PaymentStatus.SUBMISSION_FAILED,
                        PaymentStatus.RESERVED, PaymentStatus.SUBMITTING, PaymentStatus.SUBMITTED);

        SettlementResult again = coordinator.settle(auth, requirement);
        assertThat(again.getStatus()).isEqualTo(PaymentStatus.SUBMITTED);
        assertThat(chain.broadcastCalls()).isEqualTo(2);
    }

    @Test
    void expiredReservationCanBeSettledAgainWithFreshDeadline() {
        chain.setPrepareUnavailable(true);
        PaymentAuthorization auth = authorization(1000, 5000);
        coordinator.settle(auth, requirement);
        clock.advance(Duration.ofSeconds(901));
        coordinator.sweepExpired();
        String paymentId = PaymentId.of(ChainFamily.EVM, auth);
        assertThat(ledger.find(paymentId).orElseThrow().getStatus()).isEqualTo(PaymentStatus.EXPIRED);
        chain.setPrepareUnavailable(false);

        SettlementResult retried = coordinator.settle(auth, requirement);

        PaymentRecord record = ledger.find(paymentId).orElseThrow();
        assertThat(retried.getStatus()).isEqualTo(PaymentStatus.SUBMITTED);
        assertThat(record.getDeadline()).isEqualTo(NOW.plusSeconds(901 + 900));
        assertThat(record.getFailureReason()).isNull();
        assertThat(nonceStore.size()).isEqualTo(1);
    }

    @Test
    void exhaustedRetriesTimeOutKeepNonceAndCanStillSettle() {
        chain.script(Outcome.UNAVAILABLE, Outcome.UNAVAILABLE, Outcome.UNAVAILABLE, Outcome.UNAVAILABLE, Outcome.UNAVAILABLE);
        PaymentAuthorization auth = authorization(1000, 500);

        SettlementResult result = coordinator.settle(auth, requirement);

        assertThat(result.getStatus()).isEqualTo(PaymentStatus.SETTLEMENT_TIMEOUT);
        assertThat(result.getFailureReason()).isEqualTo(FailureReason.RETRIES_EXHAUSTED);
        assertThat(result.getAttempts()).isEqualTo(TestChainGateways.MAX_ATTEMPTS);
        assertThat(nonceStore.size()).isEqualTo(1);

        // one of the "failed" broadcasts actually reached the node
        chain.confirm(result.getTransactionRef(), 2);
        coordinator.pollConfirmations();
        assertThat(ledger.find(result.getPaymentId()).orElseThrow().getStatus()).isEqualTo(PaymentStatus.SETTLED);
    }

    @Test
    void onChainFailureKeepsNonce() {
        PaymentAuthorization auth = authorization(1000, 500);
        SettlementResult result = coordinator.settle(auth, requirement);

        chain.fail(result.getTransactionRef(), "reverted");
        coordinator.pollConfirmations();

        PaymentRecord record = ledger.find(result.getPaymentId()).orElseThrow();
        assertThat(record.getStatus()).isEqualTo(PaymentStatus.SUBMISSION_FAILED);
        assertThat(record.getFailureReason()).isEqualTo(FailureReason.TRANSACTION_FAILED);
        assertThat(nonceStore.size()).isEqualTo(1);

        SettlementResult again = coordinator.settle(auth, requirement);
        assertThat(again.getStatus()).isEqualTo(PaymentStatus.SUBMISSION_FAILED);
        assertThat(chain.broadcastCalls()).isEqualTo(1);
    }

    @Test
    void unreachableChainLeavesReservationForSweepToExpire() {
        chain.setPrepareUnavailable(true);
        PaymentAuthorization auth = authorization(1000, 500);

        SettlementResult result = coordinator.settle(auth, requirement);
        assertThat(result.getStatus()).isEqualTo(PaymentStatus.RESERVED);
        assertThat(chain.broadcastCalls()).isZero();

        clock.advance(Duration.ofSeconds(901));
        assertThat(coordinator.sweepExpired()).isEqualTo(1);

        PaymentRecord record = ledger.find(result.getPaymentId()).orElseThrow();
        assertThat(record.getStatus()).isEqualTo(PaymentStatus.EXPIRED);
        assertThat(record.getFailureReason()).isEqualTo(FailureReason.RESERVATION_EXPIRED);
        assertThat(nonceStore.size()).isZero();
    }

    @Test
    void sweepTimesOutUnconfirmedAndLateConfirmationWins() {
        PaymentAuthorization auth = authorization(1000, 500);
        SettlementResult result = coordinator.settle(auth, requirement);

        clock.advance(Duration.ofSeconds(901));
        coordinator.sweepExpired();
        PaymentRecord timedOut = ledger.find(result.getPaymentId()).orElseThrow();
        assertThat(timedOut.getStatus()).isEqualTo(PaymentStatus.SETTLEMENT_TIMEOUT);
        assertThat(timedOut.getFailureReason()).isEqualTo(FailureReason.CONFIRMATION_TIMEOUT);
        assertThat(nonceStore.size()).isEqualTo(1);

        chain.confirm(result.getTransactionRef(), 2);
        coordinator.pollConfirmations();
        assertThat(ledger.find(result.getPaymentId()).orElseThrow().getStatus()).isEqualTo(PaymentStatus.SETTLED);
    }

    @Test
    void timedOutRecordIsWatchedOnlyWithinReconcileWindow() {
        PaymentAuthorization auth = authorization(1000, 500);
        PaymentRecord lost = submittingRecord(auth, "0xlost");
        clock.advance(Duration.ofSeconds(901));
        coordinator.sweepExpired();
        assertThat(ledger.find(lost.getId()).orElseThrow().getStatus()).isEqualTo(PaymentStatus.SETTLEMENT_TIMEOUT);

        coordinator.pollConfirmations();
        assertThat(chain.statusCalls()).isEqualTo(1);

        clock.advance(Duration.ofHours(1));
        coordinator.pollConfirmations();
        assertThat(chain.statusCalls()).isEqualTo(1);
        assertThat(ledger.find(lost.getId()).orElseThrow().getStatus()).isEqualTo(PaymentStatus.SETTLEMENT_TIMEOUT);
    }

    @Test
    void timedOutRecordFailedOnChainIsWrittenOnce() {
        PaymentAuthorization auth = authorization(1000, 500);
        SettlementResult result = coordinator.settle(auth, requirement);
        clock.advance(Duration.ofSeconds(901));
        coordinator.sweepExpired();
        chain.fail(result.getTransactionRef(), "reverted");

        coordinator.pollConfirmations();
        PaymentRecord annotated = ledger.find(result.getPaymentId()).orElseThrow();
        coordinator.pollConfirmations();
        coordinator.pollConfirmations();

        PaymentRecord latest = ledger.find(result.getPaymentId()).orElseThrow();
        assertThat(annotated.getFailureMessage()).isEqualTo("Failed on chain: reverted");
        assertThat(latest.getVersion()).isEqualTo(annotated.getVersion());
        assertThat(latest.getStatus()).isEqualTo(PaymentStatus.SETTLEMENT_TIMEOUT);
    }

    @Test
    void recoveryRebroadcastsStoredPayloadOnlyWhenChainHasNotSeenIt() {
        PaymentAuthorization seen = authorization(1000, 500);
        PaymentAuthorization unseen = authorization(1000, 500);
        PaymentRecord seenRecord = submittingRecord(seen, "0xseen");
        PaymentRecord unseenRecord = submittingRecord(unseen, "0xunseen");
        chain.land("0xseen");

        int recovered = coordinator.recoverInFlight();

        assertThat(recovered).isEqualTo(2);
        assertThat(chain.broadcastCalls()).isEqualTo(1);
        assertThat(chain.prepareCalls()).isZero();
        assertThat(ledger.find(seenRecord.getId()).orElseThrow().getStatus()).isEqualTo(PaymentStatus.SUBMITTED);
        PaymentRecord rebroadcast = ledger.find(unseenRecord.getId()).orElseThrow();
        assertThat(rebroadcast.getStatus()).isEqualTo(PaymentStatus.SUBMITTED);
        assertThat(rebroadcast.getTransactionRef()).isEqualTo("0xunseen");
        assertThat(rebroadcast.getAttempts()).isEqualTo(2);
    }

    @Test
    void recoverySubmitsReservedRecords() {
        PaymentAuthorization auth = authorization(1000, 500);
        chain.setPrepareUnavailable(true);
        coordinator.settle(auth, requirement);
        chain.setPrepareUnavailable(false);

        coordinator.recoverInFlight();

        PaymentRecord record = ledger.find(PaymentId.of(ChainFamily.EVM, auth)).orElseThrow();
        assertThat(record.getStatus()).isEqualTo(PaymentStatus.SUBMITTED);
        assertThat(chain.broadcastCalls()).isEqualTo(1);
    }

    @Test
    void ledgerFailureAbortsAndReleasesReservation() {
        InMemoryPaymentLedger failing = new InMemoryPaymentLedger(clock) {
            @Override
            public synchronized PaymentRecord create(PaymentRecord record) {
                throw new DataAccessResourceFailureException("database down");
            }
        };
        SettlementCoordinator withFailingLedger = coordinator(failing);
        PaymentAuthorization auth = authorization(1000, 500);

        assertThatThrownBy(() -> withFailingLedger.settle(auth, requirement))
                .isInstanceOf(SettlementAbortedException.class)
                .hasMessageContaining("database down");
        assertThat(nonceStore.size()).isZero();
        assertThat(chain.prepareCalls()).isZero();
        verify(notificationProducer, never()).publishTerminal(any());
    }

    @Test
    void unsupportedNetworkIsRejected() {
        PaymentAuthorization auth = authorization(1000, 500).toBuilder().network("unknown-chain").build();

        SettlementResult result = coordinator.settle(auth, requirement);

        assertThat(result.getStatus()).isEqualTo(PaymentStatus.REJECTED);
        assertThat(nonceStore.size()).isZero();
    }

    private PaymentRecord submittingRecord(PaymentAuthorization auth, String ref) {
        String key = PaymentId.key(ChainFamily.EVM, auth.getPayer(), auth.getNetwork(), auth.getNonce());
        nonceStore.reserve(key, auth.getPayer(), auth.getNetwork(), auth.getNonce());
        return ledger.put(PaymentRecord.builder()
                .id(PaymentId.of(ChainFamily.EVM, auth))
                .status(PaymentStatus.SUBMITTING)
                .requirement(requirement)
                .authorization(auth)
                .transactionRef(ref)
                .submissionPayload("signed:" + ref)
                .attempts(1)
                .deadline(NOW.plusSeconds(900))
                .build());
    }
}
