package com.whothub.gameservice.infrastructure.persistence.repository;

import com.whothub.gameservice.infrastructure.persistence.entity.PaymentRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * 付费记录 Repository
 */
@Repository
public interface PaymentRecordRepository extends JpaRepository<PaymentRecord, String> {

    List<PaymentRecord> findByUserAddress(String userAddress);
}
