package com.payment.facilitator.nonce;

import com.payment.facilitator.domain.NonceReservation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Nonce store on Redis using {@code SET NX}. Keys never expire on their own; only
 * {@link #expire} removes them.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "facilitator.nonce.store", havingValue = "redis")
public class RedisNonceStore implements NonceStore {

    static final String KEY_PREFIX = "facilitator:nonce:";

    private final StringRedisTemplate redisTemplate;
    private final Clock clock;

    public RedisNonceStore(StringRedisTemplate redisTemplate, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.clock = clock;
    }

    @Override
    public NonceReservation reserve(String reservationKey, String payer, String network, String nonce) {
        Boolean set = redisTemplate.opsForValue().setIfAbsent(KEY_PREFIX + reservationKey, Instant.now(clock).toString());
        if (Boolean.TRUE.equals(set)) {
            log.debug("Reserved nonce key={}", reservationKey);
            return NonceReservation.RESERVED;
        }
        log.warn("Nonce already reserved key={}", reservationKey);
        return NonceReservation.ALREADY_RESERVED;
    }

    @Override
    public boolean isReserved(String reservationKey) {
        return Boolean.TRUE.equals(redisTemplate.hasKey(KEY_PREFIX + reservationKey));
    }

    @Override
    public void expire(String reservationKey) {
        redisTemplate.delete(KEY_PREFIX + reservationKey);
        log.info("Released nonce reservation key={}", reservationKey);
    }
}
