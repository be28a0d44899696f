package com.payment.facilitator.persistence.repository;

import com.payment.facilitator.persistence.entity.PaymentTransitionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for payment record transitions (audit trail).
 */
@Repository
public interface PaymentTransitionRepository extends JpaRepository<PaymentTransitionEntity, String> {

    List<PaymentTransitionEntity> findByPaymentIdOrderByOccurredAtAsc(String paymentId);

    void deleteByPaymentId(String paymentId);
}
