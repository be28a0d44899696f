package com.payment.facilitator.core;

import com.payment.facilitator.config.FacilitatorProperties;
import com.payment.facilitator.domain.PaymentStatus;
import com.payment.facilitator.domain.SettlementResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.SerializationException;
import org.springframework.stereotype.Service;
import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

/**
 * Fast path for repeated {@code settle} calls on finished payments. Only final results are
 * cached, and not those whose nonce was released. The ledger stays the source of truth,
 * so every cache failure is fail-open.
 * <p>
 * Keys include the signature, so a different authorization reusing the same nonce never
 * hits the cached result of the original.
 */
@Slf4j
@Service
public class SettlementResultCache {

    private final RedisTemplate<String, SettlementResult> redisTemplate;
    private final Duration ttl;
    private final String keyPrefix;

    public SettlementResultCache(RedisTemplate<String, SettlementResult> redisTemplate,
                                 FacilitatorProperties properties) {
        this.redisTemplate = redisTemplate;
        this.ttl = properties.getCache().getTtl();
        this.keyPrefix = properties.getCache().getKeyPrefix();
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalStateException("facilitator.cache.ttl must be positive, got " + ttl);
        }
    }

    public Optional<SettlementResult> get(String paymentId, String normalizedSignature) {
        String key = key(paymentId, normalizedSignature);
        try {
            SettlementResult cached = redisTemplate.opsForValue().get(key);
            if (cached != null) {
                log.debug("Settlement cache hit paymentId={} status={}", paymentId, cached.getStatus());
                return Optional.of(cached);
            }
        } catch (SerializationException e) {
            log.error("Settlement cache entry for paymentId={} cannot be read; falling back to ledger", paymentId, e);
        } catch (RuntimeException e) {
            log.warn("Settlement cache read failed for paymentId={} (Redis unavailable), falling back to ledger: {}",
                    paymentId, e.getMessage());
        }
        return Optional.empty();
    }

    public void put(String normalizedSignature, SettlementResult result) {
        if (result.getStatus() == null || !result.getStatus().isTerminal()
                || result.getStatus() == PaymentStatus.SETTLEMENT_TIMEOUT) {
            return;
        }
        if (result.getFailureReason() != null && result.getFailureReason().releasesNonce()) {
            // the payer may settle this authorization again
            return;
        }
        try {
            redisTemplate.opsForValue().set(key(result.getPaymentId(), normalizedSignature), result, ttl);
            log.debug("Cached settlement result paymentId={} status={}", result.getPaymentId(), result.getStatus());
        } catch (RuntimeException e) {
            log.warn("Failed to cache settlement result paymentId={}: {}", result.getPaymentId(), e.getMessage());
        }
    }

    private String key(String paymentId, String normalizedSignature) {
        byte[] digest = Hash.sha256(normalizedSignature.getBytes(StandardCharsets.UTF_8));
        return keyPrefix + paymentId + ":" + Numeric.toHexStringNoPrefix(digest).substring(0, 16);
    }
}
