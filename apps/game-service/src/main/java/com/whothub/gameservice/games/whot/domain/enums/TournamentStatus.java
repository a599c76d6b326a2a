package com.whothub.gameservice.games.whot.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 赛事状态：WAITING（报名中） -> ACTIVE（进行中） -> COMPLETED（已决出冠军）
 */
public enum TournamentStatus {
    WAITING,
    ACTIVE,
    COMPLETED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
