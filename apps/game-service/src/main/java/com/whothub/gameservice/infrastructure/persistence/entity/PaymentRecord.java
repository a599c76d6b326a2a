package com.whothub.gameservice.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.OffsetDateTime;

/**
 * 付费记录表实体（链上校验由外部服务完成，这里只落库）
 * 对应数据库表：payment_record
 */
@Entity
@Table(name = "payment_record", indexes = @Index(name = "idx_payment_record_user", columnList = "user_address"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentRecord {

    /**
     * 交易哈希，天然幂等键
     */
    @Id
    @Column(name = "tx_hash", length = 128, nullable = false, updatable = false)
    private String txHash;

    @Column(name = "user_address", length = 128, nullable = false)
    private String userAddress;

    /**
     * 金额按字符串原样保存，避免精度问题
     */
    @Column(name = "amount", length = 64)
    private String amount;

    /**
     * 付费类型，如 computer_retry
     */
    @Column(name = "type", length = 32)
    private String type;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;
}
