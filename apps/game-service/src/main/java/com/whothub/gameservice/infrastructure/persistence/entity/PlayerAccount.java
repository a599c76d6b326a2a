package com.whothub.gameservice.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.OffsetDateTime;

/**
 * 玩家战绩表实体
 * 对应数据库表：player_account
 */
@Entity
@Table(name = "player_account", indexes = @Index(name = "idx_player_account_xp", columnList = "xp"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlayerAccount {

    /**
     * 钱包地址（即客户端 storedId）
     */
    @Id
    @Column(name = "address", length = 128, nullable = false, updatable = false)
    private String address;

    @Column(name = "xp", nullable = false)
    @Builder.Default
    private int xp = 0;

    @Column(name = "games_played", nullable = false)
    @Builder.Default
    private int gamesPlayed = 0;

    @Column(name = "wins", nullable = false)
    @Builder.Default
    private int wins = 0;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_match_status", length = 16)
    private MatchStatus lastMatchStatus;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    /** 记一局结果：胜者加经验与胜场，败者只加场次 */
    public void applyResult(int xpDelta, boolean win) {
        this.xp += xpDelta;
        this.gamesPlayed += 1;
        if (win) {
            this.wins += 1;
        }
        this.lastMatchStatus = win ? MatchStatus.WON : MatchStatus.LOST;
    }
}
