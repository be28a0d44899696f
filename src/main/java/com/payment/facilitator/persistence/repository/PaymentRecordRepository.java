package com.payment.facilitator.persistence.repository;

import com.payment.facilitator.domain.PaymentStatus;
import com.payment.facilitator.persistence.entity.PaymentRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Repository for payment records.
 */
@Repository
public interface PaymentRecordRepository extends JpaRepository<PaymentRecordEntity, String> {

    List<PaymentRecordEntity> findByStatusInOrderByUpdatedAtAsc(Collection<PaymentStatus> statuses);

    List<PaymentRecordEntity> findByStatusInAndDeadlineAfterOrderByUpdatedAtAsc(Collection<PaymentStatus> statuses, Instant cutoff);

    @Query("SELECT r FROM PaymentRecordEntity r WHERE r.status IN :statuses AND r.deadline < :now ORDER BY r.deadline ASC")
    List<PaymentRecordEntity> findPastDeadline(@Param("statuses") Collection<PaymentStatus> statuses, @Param("now") Instant now);
}
