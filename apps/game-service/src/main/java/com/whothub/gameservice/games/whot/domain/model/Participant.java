package com.whothub.gameservice.games.whot.domain.model;

import com.whothub.gameservice.games.whot.domain.enums.Seat;
import lombok.Getter;
import lombok.Setter;

/**
 * 对局内的参与者。
 * storedId 是客户端持久化的玩家标识；connectionId 每次重连都会重新绑定。
 * 参与者一旦入座就不会被移除，断线只把 online 置为 false。
 */
@Getter
public class Participant {

    private final String storedId;
    private final Seat seat;
    private final String displayName;
    private String connectionId;
    @Setter
    private boolean online;

    public Participant(String storedId, String connectionId, String displayName, Seat seat) {
        this.storedId = storedId;
        this.connectionId = connectionId;
        this.displayName = displayName;
        this.seat = seat;
        this.online = true;
    }

    /** 重新绑定连接（刷新页面/断线重连） */
    public void rebind(String connectionId) {
        this.connectionId = connectionId;
        this.online = true;
    }

    public boolean boundTo(String connectionId) {
        return connectionId != null && connectionId.equals(this.connectionId);
    }
}
