package com.payment.facilitator.messaging;

import com.payment.facilitator.domain.PaymentRecord;
import com.payment.facilitator.domain.PaymentStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes terminal settlement outcomes to Kafka. Delivery is best-effort; the ledger
 * remains authoritative, and consumers can always re-read a payment by id.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SettlementNotificationProducer {

    private final KafkaTemplate<String, SettlementNotification> kafkaTemplate;

    @Value("${facilitator.kafka.topic.settlement-notifications:settlement-notifications}")
    private String topic;

    public void publishTerminal(PaymentRecord record) {
        if (!record.getStatus().isTerminal()) {
            log.warn("Not publishing non-terminal status {} for paymentId={}", record.getStatus(), record.getId());
            return;
        }
        SettlementNotification event = SettlementNotification.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(eventType(record.getStatus()))
                .paymentId(record.getId())
                .status(record.getStatus())
                .network(record.getNetwork())
                .payer(record.getPayer())
                .payee(record.getAuthorization().getPayee())
                .asset(record.getRequirement().getAsset())
                .amount(record.getAuthorization().getAmount().toString())
                .resource(record.getRequirement().getResource())
                .transactionRef(record.getTransactionRef())
                .confirmations(record.getConfirmations())
                .failureReason(record.getFailureReason())
                .message(record.getFailureMessage())
                .createdAt(record.getCreatedAt())
                .completedAt(record.getUpdatedAt())
                .build();
        send(record.getId(), event);
    }

    private void send(String key, SettlementNotification event) {
        log.info("Publishing settlement notification: key={}, eventId={}, status={}, eventType={}",
                key, event.getEventId(), event.getStatus(), event.getEventType());
        CompletableFuture<SendResult<String, SettlementNotification>> future = kafkaTemplate.send(topic, key, event);
        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish settlement notification key={} eventId={}", key, event.getEventId(), ex);
            } else {
                log.debug("Published settlement notification: key={}, eventId={}, partition={}, offset={}",
                        key, event.getEventId(),
                        result != null ? result.getRecordMetadata().partition() : null,
                        result != null ? result.getRecordMetadata().offset() : null);
            }
        });
    }

    private static String eventType(PaymentStatus status) {
        switch (status) {
            case SETTLED:
                return "SETTLEMENT_COMPLETED";
            case SETTLEMENT_TIMEOUT:
                return "SETTLEMENT_TIMEOUT";
            default:
                return "SETTLEMENT_FAILED";
        }
    }
}
