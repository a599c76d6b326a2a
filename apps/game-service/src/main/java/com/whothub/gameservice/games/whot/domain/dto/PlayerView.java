package com.whothub.gameservice.games.whot.domain.dto;

import com.whothub.gameservice.games.whot.domain.model.TournamentEntrant;

/**
 * 对外公开的选手信息（不含连接 ID）。
 */
public record PlayerView(String name, String storedId) {

    public static PlayerView of(TournamentEntrant entrant) {
        return entrant == null ? null : new PlayerView(entrant.getName(), entrant.getStoredId());
    }
}
