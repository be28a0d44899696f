package com.payment.facilitator.persistence.repository;

import com.payment.facilitator.persistence.entity.NonceRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface NonceRecordRepository extends JpaRepository<NonceRecordEntity, String> {

    /**
     * Bulk delete by key. {@code deleteById} can't be used: the entity always reports itself
     * as new, and Spring Data skips deleting new entities.
     */
    @Modifying
    @Query("DELETE FROM NonceRecordEntity n WHERE n.reservationKey = :reservationKey")
    int deleteByReservationKey(@Param("reservationKey") String reservationKey);
}
