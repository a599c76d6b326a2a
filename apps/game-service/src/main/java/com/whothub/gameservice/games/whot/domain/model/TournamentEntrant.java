package com.whothub.gameservice.games.whot.domain.model;

import lombok.Getter;

/**
 * 赛事参赛者。参赛名单与各场次引用的是同一个实例，
 * 重连时改绑 connectionId 即对所有场次生效。
 */
@Getter
public class TournamentEntrant {

    private final String storedId;
    private String name;
    private String connectionId;

    public TournamentEntrant(String storedId, String name, String connectionId) {
        this.storedId = storedId;
        this.name = name;
        this.connectionId = connectionId;
    }

    public void rebind(String connectionId, String name) {
        this.connectionId = connectionId;
        if (name != null && !name.isBlank()) {
            this.name = name;
        }
    }
}
