package com.whothub.gameservice.application.stats;

import com.whothub.gameservice.infrastructure.persistence.entity.MatchStatus;
import com.whothub.gameservice.infrastructure.persistence.entity.PlayerAccount;

/**
 * 玩家战绩视图（HTTP 接口与排行榜共用）。
 */
public record PlayerStatsView(String address, int xp, int wins, int gamesPlayed, MatchStatus lastMatchStatus) {

    public static PlayerStatsView of(PlayerAccount a) {
        return new PlayerStatsView(a.getAddress(), a.getXp(), a.getWins(), a.getGamesPlayed(), a.getLastMatchStatus());
    }
}
