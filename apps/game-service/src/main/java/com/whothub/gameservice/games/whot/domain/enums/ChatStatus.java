package com.whothub.gameservice.games.whot.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** 聊天消息状态 */
public enum ChatStatus {
    SENT,
    READ;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
