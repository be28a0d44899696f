package com.payment.facilitator.config;

import com.payment.facilitator.verification.DynamicPricingService;
import com.payment.facilitator.verification.StaticPricingService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

/**
 * Core wiring: network properties, the verification clock, and the default
 * pricing collaborator for DYNAMIC requirements.
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties(FacilitatorProperties.class)
public class FacilitatorConfig {

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock facilitatorClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(DynamicPricingService.class)
    public DynamicPricingService dynamicPricingService() {
        return new StaticPricingService();
    }
}
