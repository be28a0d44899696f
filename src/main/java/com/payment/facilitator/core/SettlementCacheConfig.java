package com.payment.facilitator.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.payment.facilitator.domain.SettlementResult;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.RedisSerializer;

/**
 * Redis template behind {@link SettlementResultCache}. Values are written with a copy of
 * Boot's ObjectMapper, so dates and enums look the same as in REST responses.
 */
@Configuration
public class SettlementCacheConfig {

    @Bean
    public RedisTemplate<String, SettlementResult> settlementResultRedisTemplate(RedisConnectionFactory connectionFactory,
                                                                                ObjectMapper objectMapper) {
        RedisTemplate<String, SettlementResult> template = new RedisTemplate<>();
        template.setConnectionFactory(connectionFactory);
        template.setKeySerializer(RedisSerializer.string());
        template.setValueSerializer(new SettlementResultRedisSerializer(objectMapper));
        // the cache only uses plain GET/SET with expiry
        template.setEnableDefaultSerializer(false);
        template.afterPropertiesSet();
        return template;
    }
}
