package com.whothub.gameservice.application.stats;

import com.whothub.gameservice.infrastructure.persistence.entity.MatchStatus;

import java.util.List;
import java.util.Optional;

/**
 * 玩家战绩 / 经验值 / 付费记录的持久化协作方。
 */
public interface PlayerStatsService {

    Optional<PlayerStatsView> getUser(String address);

    PlayerStatsView createUserIfNotExists(String address);

    /**
     * 记一局结果。
     * @param xpDelta 经验增量（败者为 0）
     */
    void updateUserXP(String address, int xpDelta, boolean isWin);

    void updateUserMatchStatus(String address, MatchStatus status);

    List<PlayerStatsView> getLeaderboard(int limit);

    /**
     * 记录一笔已校验的付费（按 txHash 幂等）。
     * @return 首次记录返回 true，重复提交返回 false
     */
    boolean recordPayment(String txHash, String userAddress, String amount, String type);
}
