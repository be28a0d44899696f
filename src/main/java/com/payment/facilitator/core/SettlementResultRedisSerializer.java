package com.payment.facilitator.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.payment.facilitator.domain.SettlementResult;
import org.springframework.data.redis.serializer.RedisSerializer;
import org.springframework.data.redis.serializer.SerializationException;

import java.io.IOException;

/**
 * Stores a {@link SettlementResult} as plain JSON without a type header. An entry that
 * parses but lacks the payment id or status is rejected, so the cache treats it as a miss.
 */
public class SettlementResultRedisSerializer implements RedisSerializer<SettlementResult> {

    private final ObjectMapper mapper;

    public SettlementResultRedisSerializer(ObjectMapper objectMapper) {
        // entries written by a newer build may carry fields this one does not know
        this.mapper = objectMapper.copy().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public byte[] serialize(SettlementResult value) throws SerializationException {
        if (value == null) {
            return null;
        }
        try {
            return mapper.writeValueAsBytes(value);
        } catch (IOException e) {
            throw new SerializationException("Could not write settlement result for paymentId=" + value.getPaymentId(), e);
        }
    }

    @Override
    public SettlementResult deserialize(byte[] bytes) throws SerializationException {
        if (bytes == null || bytes.length == 0) {
            return null;
        }
        SettlementResult result;
        try {
            result = mapper.readValue(bytes, SettlementResult.class);
        } catch (IOException e) {
            throw new SerializationException("Cached settlement result is not valid JSON", e);
        }
        if (result.getPaymentId() == null || result.getStatus() == null) {
            throw new SerializationException("Cached settlement result has no paymentId or status");
        }
        return result;
    }
}
