package com.payment.facilitator.nonce;

import com.payment.facilitator.domain.NonceReservation;
import com.payment.facilitator.persistence.entity.NonceRecordEntity;
import com.payment.facilitator.persistence.repository.NonceRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;

/**
 * Nonce store backed by the {@code nonce_records} table. The primary key does the
 * check-and-reserve: the insert runs in its own transaction, and a key violation means
 * someone else holds the reservation.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "facilitator.nonce.store", havingValue = "jpa", matchIfMissing = true)
public class JpaNonceStore implements NonceStore {

    private final NonceRecordRepository repository;
    private final TransactionTemplate requiresNew;
    private final Clock clock;

    public JpaNonceStore(NonceRecordRepository repository, PlatformTransactionManager transactionManager, Clock clock) {
        this.repository = repository;
        this.clock = clock;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    @Override
    public NonceReservation reserve(String reservationKey, String payer, String network, String nonce) {
        NonceRecordEntity entity = NonceRecordEntity.builder()
                .reservationKey(reservationKey)
                .payer(payer)
                .network(network)
                .nonce(nonce)
                .reservedAt(Instant.now(clock))
                .build();
        try {
            requiresNew.executeWithoutResult(status -> repository.saveAndFlush(entity));
            log.debug("Reserved nonce key={}", reservationKey);
            return NonceReservation.RESERVED;
        } catch (DataIntegrityViolationException e) {
            log.warn("Nonce already reserved key={}", reservationKey);
            return NonceReservation.ALREADY_RESERVED;
        }
    }

    @Override
    public boolean isReserved(String reservationKey) {
        return repository.existsById(reservationKey);
    }

    @Override
    public void expire(String reservationKey) {
        Integer deleted = requiresNew.execute(status -> repository.deleteByReservationKey(reservationKey));
        if (deleted != null && deleted > 0) {
            log.info("Released nonce reservation key={}", reservationKey);
        } else {
            log.debug("No nonce reservation to release for key={}", reservationKey);
        }
    }
}
