package com.whothub.gameservice.platform.transport;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 服务端 → 客户端的事件名（线上协议保持 snake_case）。
 */
public enum OutboundEvent {
    /** 初始或更新后的（按座位定向的）局面 */
    STATE_DISPATCH("state_dispatch"),
    /** 拒绝提示，给发起方连接的可读文案 */
    SESSION_ERROR("session_error"),
    /** 对手在线状态变化（true/false） */
    OPPONENT_PRESENCE_CHANGED("opponent_presence_changed"),
    CHAT_HISTORY("chat_history"),
    RECEIVE_MESSAGE("receive_message"),
    MESSAGES_READ("messages_read"),
    /** 公开的赛事对阵快照（不含连接 ID） */
    TOURNAMENT_UPDATE("tournament_update"),
    TOURNAMENTS_LIST("tournaments_list"),
    TOURNAMENT_JOINED("tournament_joined"),
    TOURNAMENT_MATCH_READY("tournament_match_ready"),
    MATCH_OVER("match_over");

    private final String wireName;

    OutboundEvent(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
